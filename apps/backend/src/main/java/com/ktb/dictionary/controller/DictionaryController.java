package com.ktb.dictionary.controller;

import com.ktb.dictionary.automaton.InvalidWordException;
import com.ktb.dictionary.automaton.WordMatch;
import com.ktb.dictionary.dto.*;
import com.ktb.dictionary.service.DictionaryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashSet;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Tag(name = "사전 (Dictionary)", description = "Aho-Corasick 사전 API - 단어 조회, 부분 문자열 매칭, 접두사 검색")
@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/dictionary")
public class DictionaryController {

    private final DictionaryService dictionaryService;

    // =====================================================================
    // Health Check
    // =====================================================================
    @Operation(summary = "사전 서비스 헬스체크", description = "사전 로드 상태와 단어/노드 수를 확인합니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "서비스 정상", content = @Content(schema = @Schema(implementation = DictionaryStatusResponse.class))),
            @ApiResponse(responseCode = "503", description = "사전 미로드", content = @Content(schema = @Schema(implementation = DictionaryStatusResponse.class)))
    })
    @GetMapping("/health")
    public ResponseEntity<DictionaryStatusResponse> healthCheck() {
        DictionaryStatusResponse status = dictionaryService.getStatus();
        return ResponseEntity
                .status(status.isLoaded() ? 200 : 503)
                .cacheControl(CacheControl.noCache().mustRevalidate())
                .body(status);
    }

    // =====================================================================
    // 단어 존재 여부
    // =====================================================================
    @Operation(summary = "단어 조회", description = "단어가 사전에 정확히 존재하는지 확인합니다.")
    @GetMapping("/words/{word}")
    public ResponseEntity<?> lookupWord(
            @Parameter(description = "조회할 단어") @PathVariable String word) {
        try {
            boolean found = dictionaryService.foundWord(word);
            return ResponseEntity.ok(StandardResponse.success(WordLookupResponse.builder()
                    .word(word)
                    .found(found)
                    .build()));

        } catch (Exception e) {
            log.error("단어 조회 에러", e);
            return ResponseEntity.status(500)
                    .body(StandardResponse.error("단어 조회에 실패했습니다."));
        }
    }

    // =====================================================================
    // 전체 단어 목록
    // =====================================================================
    @Operation(summary = "전체 단어 목록", description = "사전에 들어 있는 모든 단어를 반환합니다.")
    @GetMapping("/words")
    public ResponseEntity<?> listWords() {
        try {
            return ResponseEntity.ok(StandardResponse.success(dictionaryService.getDictionary()));

        } catch (Exception e) {
            log.error("단어 목록 조회 에러", e);
            return ResponseEntity.status(500)
                    .body(new ErrorResponse(false, "단어 목록을 불러오는데 실패했습니다."));
        }
    }

    // =====================================================================
    // 단어 추가 (새 오토마톤으로 교체)
    // =====================================================================
    @Operation(summary = "단어 추가", description = "현재 사전에 단어를 더해 오토마톤을 새로 만듭니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "추가 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 단어 (null, 빈 문자열)"),
            @ApiResponse(responseCode = "500", description = "서버 내부 오류")
    })
    @PostMapping("/words")
    public ResponseEntity<?> addWords(@RequestBody AddWordsRequest request) {
        try {
            if (request.getWords() == null || request.getWords().isEmpty()) {
                return ResponseEntity.status(400).body(StandardResponse.error("추가할 단어 목록은 필수입니다."));
            }

            DictionaryStatusResponse status = dictionaryService.addWords(request.getWords());
            return ResponseEntity.ok(StandardResponse.success(status));

        } catch (InvalidWordException e) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(StandardResponse.error(e.getMessage()));
        } catch (Exception e) {
            log.error("단어 추가 에러", e);
            return ResponseEntity.status(500)
                    .body(StandardResponse.error("단어 추가에 실패했습니다."));
        }
    }

    // =====================================================================
    // 부분 문자열 매칭
    // =====================================================================
    @Operation(summary = "사전 단어 매칭", description = "입력 문자열 안에 등장하는 모든 사전 단어를 찾습니다. 겹치는 매칭과 중복을 포함합니다.")
    @PostMapping("/matches")
    public ResponseEntity<?> findMatches(@RequestBody MatchRequest request) {
        try {
            if (request.getText() == null) {
                return ResponseEntity.status(400).body(StandardResponse.error("매칭할 문자열은 필수입니다."));
            }

            String text = request.getText();
            List<WordMatch> positions = dictionaryService.getMatchPositions(text);
            List<String> matches = positions.stream()
                    .map(WordMatch::getWord)
                    .toList();

            return ResponseEntity.ok(StandardResponse.success(MatchResponse.builder()
                    .text(text)
                    .matches(matches)
                    .positions(positions)
                    .distinctMatches(new LinkedHashSet<>(matches))
                    .build()));

        } catch (Exception e) {
            log.error("매칭 에러", e);
            return ResponseEntity.status(500)
                    .body(StandardResponse.error("단어 매칭에 실패했습니다."));
        }
    }

    // =====================================================================
    // 접두사 검색
    // =====================================================================
    @Operation(summary = "접두사 검색", description = "주어진 접두사로 시작하는 모든 단어를 반환합니다. 빈 접두사는 전체 사전입니다.")
    @GetMapping("/prefixes")
    public ResponseEntity<?> findByPrefix(
            @Parameter(description = "접두사") @RequestParam(defaultValue = "") String prefix) {
        try {
            List<String> words = dictionaryService.getSimilarMatches(prefix);
            return ResponseEntity.ok(StandardResponse.success(PrefixResponse.builder()
                    .prefix(prefix)
                    .words(words)
                    .build()));

        } catch (Exception e) {
            log.error("접두사 검색 에러", e);
            return ResponseEntity.status(500)
                    .body(StandardResponse.error("접두사 검색에 실패했습니다."));
        }
    }

    // =====================================================================
    // 재로드
    // =====================================================================
    @Operation(summary = "사전 재로드", description = "설정된 단어 목록으로 오토마톤을 새로 만듭니다. 실패하면 기존 사전을 유지합니다.")
    @PostMapping("/reload")
    public ResponseEntity<?> reload() {
        try {
            return ResponseEntity.ok(StandardResponse.success(dictionaryService.reload()));

        } catch (Exception e) {
            log.error("사전 재로드 에러", e);
            return ResponseEntity.status(500)
                    .body(StandardResponse.error("사전 재로드에 실패했습니다."));
        }
    }
}
