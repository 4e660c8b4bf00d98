package com.ktb.dictionary.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.function.Consumer;

/**
 * 고정된 사전에 대한 Aho-Corasick 오토마톤.
 *
 * <p>생성 시 트라이 → 실패 링크 → 사전 링크 순서로 한 번만 구성되고, 이후 모든 조회는 읽기 전용이다.
 * 따라서 완성된 인스턴스는 잠금 없이 여러 스레드에서 공유할 수 있다.
 * 사전을 바꾸려면 새 인스턴스를 만든다.
 */
public class AhoCorasickAutomaton {

    private final AutomatonNode root;
    private final int size;
    private final int nodeCount;

    /**
     * @throws InvalidWordException 목록이 null 이거나 null/빈 단어가 있을 때
     */
    public AhoCorasickAutomaton(Collection<String> words) {
        AutomatonNode built = TrieBuilder.build(words);

        // 순서 중요: 사전 링크는 실패 링크에 의존
        FailureLinkBuilder.link(built);
        SuffixLinkBuilder.link(built);

        this.root = built;

        int[] counts = new int[2];
        breadthFirst(built, node -> {
            counts[0]++;
            if (node.isTerminal()) {
                counts[1]++;
            }
        });
        this.nodeCount = counts[0];
        this.size = counts[1];
    }

    public AutomatonNode getRoot() {
        return root;
    }

    /** 서로 다른 단어 수 */
    public int size() {
        return size;
    }

    /** root 를 포함한 노드 수 */
    public int nodeCount() {
        return nodeCount;
    }

    /**
     * 단어가 사전에 정확히 있는지 검사한다. 자식 링크만 따라가며, 없는 문자를 만나면 바로 false.
     */
    public boolean containsExact(String word) {
        Objects.requireNonNull(word, "word must not be null");

        AutomatonNode node = root;
        for (int i = 0; i < word.length(); i++) {
            node = node.getChild(word.charAt(i));
            if (node == null) {
                return false;
            }
        }
        return node.isTerminal();
    }

    /**
     * 입력 안에 등장하는 모든 사전 단어. 겹치는 매칭과 위치가 다른 중복도 그대로 포함한다.
     * 순서는 매칭이 끝나는 위치 순, 같은 위치에서는 사전 링크 체인 순.
     */
    public List<String> matchAll(String input) {
        List<String> matches = new ArrayList<>();
        scan(input, (node, end) -> matches.add(node.getFullPath()));
        return matches;
    }

    /** {@link #matchAll(String)} 과 같은 순서로, 각 매칭의 위치까지 돌려준다. */
    public List<WordMatch> findMatches(String input) {
        List<WordMatch> matches = new ArrayList<>();
        scan(input, (node, end) -> matches.add(new WordMatch(node.getFullPath(), end - node.getDepth(), end)));
        return matches;
    }

    /**
     * prefix 로 시작하는 모든 단어 (BFS 순서). prefix 자체가 단어면 포함된다.
     * 빈 prefix 는 사전 전체.
     */
    public List<String> hasPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");

        AutomatonNode node = root;
        for (int i = 0; i < prefix.length(); i++) {
            node = node.getChild(prefix.charAt(i));
            if (node == null) {
                return List.of();
            }
        }

        List<String> result = new ArrayList<>();
        breadthFirst(node, n -> {
            if (n.isTerminal()) {
                result.add(n.getFullPath());
            }
        });
        return result;
    }

    /** 사전의 모든 단어 (DFS, 자식 삽입 순서). */
    public List<String> words() {
        List<String> result = new ArrayList<>(size);
        Deque<AutomatonNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            AutomatonNode node = stack.pop();
            if (node.isTerminal()) {
                result.add(node.getFullPath());
            }
            List<AutomatonNode> children = new ArrayList<>(node.getChildren());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * 두 사전의 합집합으로 새 오토마톤을 만든다. this 와 other 는 바뀌지 않는다.
     */
    public AhoCorasickAutomaton mergedWith(AhoCorasickAutomaton other) {
        Objects.requireNonNull(other, "other must not be null");
        List<String> union = new ArrayList<>(words());
        union.addAll(other.words());
        return new AhoCorasickAutomaton(union);
    }

    /**
     * 입력을 한 번만 훑는다. 노드에 대응하는 단어가 끝날 때마다 (노드, 끝 위치 exclusive) 를 넘긴다.
     */
    private void scan(String input, MatchListener listener) {
        Objects.requireNonNull(input, "input must not be null");

        AutomatonNode current = root;
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);

            while (!current.hasChild(ch) && !current.isRoot()) {
                current = current.getFailureLink();
            }
            if (current.hasChild(ch)) {
                current = current.getChild(ch);
            }

            if (current.isTerminal()) {
                listener.onMatch(current, i + 1);
            }

            // 현재 단어에 접미사로 포함된 단어들
            AutomatonNode output = current.getSuffixLink();
            while (output != null) {
                listener.onMatch(output, i + 1);
                output = output.getSuffixLink();
            }
        }
    }

    private static void breadthFirst(AutomatonNode start, Consumer<AutomatonNode> visitor) {
        Queue<AutomatonNode> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            AutomatonNode node = queue.poll();
            visitor.accept(node);
            queue.addAll(node.getChildren());
        }
    }

    @FunctionalInterface
    private interface MatchListener {
        void onMatch(AutomatonNode node, int end);
    }
}
