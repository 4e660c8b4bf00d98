package com.ktb.dictionary.automaton;

import java.util.ArrayDeque;
import java.util.Queue;
import lombok.experimental.UtilityClass;

/**
 * 3단계: 사전 링크 구성 (BFS). 실패 링크가 모두 채워진 뒤에만 호출한다.
 * 깊이 2 이상인 노드에서 실패 링크를 따라가다 처음 만나는 단어 노드를 가리킨다.
 */
@UtilityClass
public class SuffixLinkBuilder {

    public void link(AutomatonNode root) {
        Queue<AutomatonNode> queue = new ArrayDeque<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            AutomatonNode current = queue.poll();

            if (current.getDepth() >= 2) {
                AutomatonNode candidate = current.getFailureLink();
                while (!candidate.isTerminal() && !candidate.isRoot()) {
                    candidate = candidate.getFailureLink();
                }
                if (candidate.isTerminal()) {
                    current.setSuffixLink(candidate);
                }
            }

            queue.addAll(current.getChildren());
        }
    }
}
