package com.ktb.dictionary.dto;

import com.ktb.dictionary.automaton.WordMatch;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchResponse {

    private String text;

    /** 매칭 순서 그대로, 중복 포함 */
    private List<String> matches;

    private List<WordMatch> positions;

    /** 처음 등장한 순서를 유지한 중복 제거 결과 */
    private Set<String> distinctMatches;
}
