package com.ktb.dictionary.automaton;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AhoCorasickAutomatonTest {

    private static final List<String> WORDS = List.of(
            "plan", "planned", "planning", "plane", "and", "andrew", "rew", "march", "march");

    @Nested
    class MatchAll {

        @Test
        void reportsMatchesInScanOrder() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("ACC", "ATC", "CAT", "GCG"));

            assertThat(automaton.matchAll("GCATCG")).containsExactly("CAT", "ATC");
        }

        @Test
        void followsSuffixLinksForNestedWords() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("ebullient", "bull", "b"));

            assertThat(automaton.matchAll("ebull")).containsExactly("b", "bull");
            assertThat(automaton.matchAll("ebullient")).containsExactly("b", "bull", "ebullient");
        }

        @Test
        void selfOverlappingDictionary() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(
                    List.of("a", "aa", "aaa", "aaaa", "aaaaa", "aaaaab"));

            List<String> matches = automaton.matchAll("caaaaab");

            assertThat(matches).hasSize(16);
            assertThat(matches).containsExactly(
                    "a",
                    "aa", "a",
                    "aaa", "aa", "a",
                    "aaaa", "aaa", "aa", "a",
                    "aaaaa", "aaaa", "aaa", "aa", "a",
                    "aaaaab");
        }

        @Test
        void recoversThroughFailureLinksAfterMismatch() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("andrew", "and", "rew"));

            assertThat(automaton.matchAll("andrewantes")).containsExactly("and", "andrew", "rew");
        }

        @Test
        void keepsDuplicatesAcrossPositions() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("ab"));

            assertThat(automaton.matchAll("abxabab")).containsExactly("ab", "ab", "ab");
        }

        @Test
        void emptyOrUnmatchedInputGivesNothing() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            assertThat(automaton.matchAll("")).isEmpty();
            assertThat(automaton.matchAll("xyz")).isEmpty();
        }

        @Test
        void isCaseSensitive() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("cat"));

            assertThat(automaton.matchAll("CAT cat")).containsExactly("cat");
        }

        @Test
        void findMatchesCarriesOffsets() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("ACC", "ATC", "CAT", "GCG"));

            assertThat(automaton.findMatches("GCATCG")).containsExactly(
                    new WordMatch("CAT", 1, 4),
                    new WordMatch("ATC", 2, 5));
        }

        @Test
        void rejectsNullInput() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            assertThatThrownBy(() -> automaton.matchAll(null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    class ContainsExact {

        @Test
        void everyInsertedWordIsFound() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            for (String word : WORDS) {
                assertThat(automaton.containsExact(word)).as(word).isTrue();
            }
        }

        @Test
        void prefixesThatAreNotWordsAreNotFound() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            assertThat(automaton.containsExact("pla")).isFalse();
            assertThat(automaton.containsExact("andre")).isFalse();
            assertThat(automaton.containsExact("plans")).isFalse();
            assertThat(automaton.containsExact("")).isFalse();
        }

        @Test
        void missingSymbolMidWordIsNotFound() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("ab", "b"));

            assertThat(automaton.containsExact("xb")).isFalse();
            assertThat(automaton.containsExact("axb")).isFalse();
            assertThat(automaton.containsExact("b")).isTrue();
        }
    }

    @Nested
    class HasPrefix {

        @Test
        void returnsWordsUnderPrefixBreadthFirst() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            assertThat(automaton.hasPrefix("plan")).containsExactly("plan", "plane", "planned", "planning");
        }

        @Test
        void emptyPrefixReturnsWholeDictionary() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            assertThat(automaton.hasPrefix("")).containsExactlyInAnyOrder(
                    "plan", "planned", "planning", "plane", "and", "andrew", "rew", "march");
        }

        @Test
        void unknownPrefixReturnsEmpty() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            assertThat(automaton.hasPrefix("plx")).isEmpty();
            assertThat(automaton.hasPrefix("zzz")).isEmpty();
        }

        @Test
        void duplicatesDoNotInflateResults() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("march", "march"));

            assertThat(automaton.hasPrefix("mar")).containsExactly("march");
            assertThat(automaton.size()).isEqualTo(1);
        }

        @Test
        void everyWordIsFoundUnderItself() {
            AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

            for (String word : WORDS) {
                assertThat(automaton.hasPrefix(word)).as(word).contains(word);
            }
        }
    }

    @Test
    void rootFailureLinkIsRoot() {
        AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(WORDS);

        assertThat(automaton.getRoot().getFailureLink()).isSameAs(automaton.getRoot());
        assertThat(automaton.getRoot().isTerminal()).isFalse();
    }

    @Test
    void countsWordsAndNodes() {
        AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("he", "she", "his", "hers"));

        assertThat(automaton.size()).isEqualTo(4);
        assertThat(automaton.nodeCount()).isEqualTo(10);
    }

    @Test
    void emptyDictionaryMatchesNothing() {
        AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of());

        assertThat(automaton.size()).isZero();
        assertThat(automaton.nodeCount()).isEqualTo(1);
        assertThat(automaton.matchAll("anything")).isEmpty();
        assertThat(automaton.hasPrefix("")).isEmpty();
    }

    @Test
    void wordsListsDictionaryDepthFirst() {
        AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(List.of("and", "andrew", "an", "rew"));

        assertThat(automaton.words()).containsExactly("an", "and", "andrew", "rew");
    }

    @Test
    void mergedWithBuildsNewInstance() {
        AhoCorasickAutomaton left = new AhoCorasickAutomaton(List.of("he", "she"));
        AhoCorasickAutomaton right = new AhoCorasickAutomaton(List.of("his", "he"));

        AhoCorasickAutomaton merged = left.mergedWith(right);

        assertThat(merged).isNotSameAs(left);
        assertThat(merged.size()).isEqualTo(3);
        assertThat(merged.matchAll("ushis")).containsExactly("his");
        assertThat(merged.matchAll("ushe")).containsExactly("she", "he");
        assertThat(left.containsExact("his")).isFalse();
        assertThat(right.containsExact("she")).isFalse();
    }

    @Test
    void rejectsInvalidWords() {
        assertThatThrownBy(() -> new AhoCorasickAutomaton(List.of("ok", "")))
                .isInstanceOf(InvalidWordException.class);
    }

    @Test
    void sharedInstanceAnswersConcurrentQueries() throws Exception {
        AhoCorasickAutomaton automaton = new AhoCorasickAutomaton(
                List.of("a", "aa", "aaa", "aaaa", "aaaaa", "aaaaab"));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                results.add(executor.submit(() -> automaton.matchAll("caaaaab").size()));
            }
            for (Future<Integer> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(16);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
