package com.ktb.dictionary.service;

import com.ktb.dictionary.automaton.AhoCorasickAutomaton;
import com.ktb.dictionary.automaton.WordMatch;
import com.ktb.dictionary.dto.DictionaryStatusResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.nio.charset.Charset;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 단어 목록 파일로 만든 오토마톤을 들고 조회를 위임하는 서비스.
 *
 * <p>조회는 현재 게시된 인스턴스를 그대로 읽는다. 재구성(reload, addWords)은 항상 새 인스턴스를
 * 끝까지 만든 뒤 교체하므로, 조회 도중 반쯤 연결된 구조를 보는 일은 없다.
 */
@Slf4j
public class DictionaryService {

    private final WordListLoader wordListLoader;
    private final MeterRegistry meterRegistry;
    private final String wordListLocation;
    private final Charset charset;

    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    // ===== Metrics cache =====
    private final ConcurrentMap<String, Timer> queryTimers = new ConcurrentHashMap<>();
    private final Counter rebuildErrors;

    public DictionaryService(WordListLoader wordListLoader,
                             MeterRegistry meterRegistry,
                             String wordListLocation,
                             Charset charset) {
        this.wordListLoader = wordListLoader;
        this.meterRegistry = meterRegistry;
        this.wordListLocation = wordListLocation;
        this.charset = charset;
        this.rebuildErrors = Counter.builder("dictionary.rebuild.errors")
                .description("Failed dictionary rebuilds")
                .register(meterRegistry);
    }

    /** 설정된 단어 목록으로 첫 오토마톤을 만든다. */
    public void init() {
        reload();
    }

    /**
     * 설정된 단어 목록을 다시 읽어 새 오토마톤으로 교체한다.
     * 실패하면 기존 인스턴스를 유지하고 예외를 그대로 던진다.
     * 재구성끼리는 직렬화된다. 조회는 잠금 없이 current 를 읽는다.
     */
    public synchronized DictionaryStatusResponse reload() {
        try {
            List<String> words = wordListLoader.load(wordListLocation, charset);
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(words);
            publish(automaton, wordListLocation);
            return getStatus();
        } catch (RuntimeException e) {
            rebuildErrors.increment();
            log.error("Dictionary reload failed - source: {}", wordListLocation, e);
            throw e;
        }
    }

    /**
     * 현재 사전에 단어를 더한 새 오토마톤으로 교체한다.
     */
    public synchronized DictionaryStatusResponse addWords(Collection<String> words) {
        Snapshot snapshot = requireSnapshot();
        try {
            AhoCorasickAutomaton merged = snapshot.automaton.mergedWith(new AhoCorasickAutomaton(words));
            publish(merged, snapshot.source);
            return getStatus();
        } catch (RuntimeException e) {
            rebuildErrors.increment();
            log.warn("Dictionary merge rejected: {}", e.getMessage());
            throw e;
        }
    }

    public boolean foundWord(String word) {
        return timed("contains", () -> automaton().containsExact(word));
    }

    public List<String> getAllMatches(String text) {
        return timed("match_all", () -> automaton().matchAll(text));
    }

    public List<WordMatch> getMatchPositions(String text) {
        return timed("find_matches", () -> automaton().findMatches(text));
    }

    public List<String> getSimilarMatches(String prefix) {
        return timed("prefix", () -> automaton().hasPrefix(prefix));
    }

    public List<String> getDictionary() {
        return timed("words", () -> automaton().words());
    }

    public boolean isLoaded() {
        return current.get() != null;
    }

    public DictionaryStatusResponse getStatus() {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            return DictionaryStatusResponse.builder()
                    .success(false)
                    .loaded(false)
                    .source(wordListLocation)
                    .build();
        }

        return DictionaryStatusResponse.builder()
                .success(true)
                .loaded(true)
                .wordCount(snapshot.automaton.size())
                .nodeCount(snapshot.automaton.nodeCount())
                .source(snapshot.source)
                .loadedAt(snapshot.loadedAt)
                .build();
    }

    private void publish(AhoCorasickAutomaton automaton, String source) {
        current.set(new Snapshot(automaton, source, Instant.now()));
        log.info("Dictionary published - words: {}, nodes: {}, source: {}",
                automaton.size(), automaton.nodeCount(), source);
    }

    private AhoCorasickAutomaton automaton() {
        return requireSnapshot().automaton;
    }

    private Snapshot requireSnapshot() {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            throw new IllegalStateException("사전이 아직 로드되지 않았습니다.");
        }
        return snapshot;
    }

    private <T> T timed(String operation, Supplier<T> query) {
        Timer timer = queryTimers.computeIfAbsent(operation, k -> Timer.builder("dictionary.query.time")
                .description("Dictionary query time")
                .tag("operation", operation)
                .register(meterRegistry));
        return timer.record(query);
    }

    private static final class Snapshot {
        private final AhoCorasickAutomaton automaton;
        private final String source;
        private final Instant loadedAt;

        private Snapshot(AhoCorasickAutomaton automaton, String source, Instant loadedAt) {
            this.automaton = automaton;
            this.source = source;
            this.loadedAt = loadedAt;
        }
    }
}
