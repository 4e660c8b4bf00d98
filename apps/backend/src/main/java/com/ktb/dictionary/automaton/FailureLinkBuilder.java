package com.ktb.dictionary.automaton;

import java.util.ArrayDeque;
import java.util.Queue;
import lombok.experimental.UtilityClass;

/**
 * 2단계: 실패 링크 구성 (BFS).
 * 부모의 실패 링크가 확정된 뒤에 자식을 처리해야 하므로 재귀 대신 큐를 쓴다.
 */
@UtilityClass
public class FailureLinkBuilder {

    public void link(AutomatonNode root) {
        if (!root.isRoot() || root.getFailureLink() != root) {
            throw new IllegalStateException("Failure links must start from a root linked to itself");
        }

        Queue<AutomatonNode> queue = new ArrayDeque<>();
        queue.add(root);

        while (!queue.isEmpty()) {
            AutomatonNode current = queue.poll();

            if (current.getFailureLink() == null) {
                char ch = current.getSymbol();
                AutomatonNode candidate = current.getParent().getFailureLink();

                while (!candidate.hasChild(ch) && !candidate.isRoot()) {
                    candidate = candidate.getFailureLink();
                }

                if (candidate.hasChild(ch)) {
                    current.setFailureLink(candidate.getChild(ch));
                } else {
                    current.setFailureLink(root);
                }
            }

            queue.addAll(current.getChildren());
        }
    }
}
