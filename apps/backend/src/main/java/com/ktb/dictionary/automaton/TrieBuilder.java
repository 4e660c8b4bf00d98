package com.ktb.dictionary.automaton;

import java.util.Collection;
import lombok.experimental.UtilityClass;

/**
 * 1단계: 단어 목록으로 트라이를 만든다.
 * 생성되는 root 의 실패 링크는 자기 자신이고, 깊이 1 노드의 실패 링크는 root 로 미리 채워진다.
 */
@UtilityClass
public class TrieBuilder {

    public AutomatonNode build(Collection<String> words) {
        if (words == null) {
            throw new InvalidWordException("Word list must not be null");
        }

        AutomatonNode root = AutomatonNode.newRoot();
        int index = 0;
        for (String word : words) {
            insert(root, word, index++);
        }
        return root;
    }

    /** 중복 단어는 같은 경로를 타고 terminal 만 다시 표시된다. */
    void insert(AutomatonNode root, String word, int index) {
        if (word == null) {
            throw new InvalidWordException(index, "Dictionary word must not be null");
        }
        if (word.isEmpty()) {
            throw new InvalidWordException(index, "Dictionary word must not be empty");
        }

        AutomatonNode node = root;
        for (int i = 0; i < word.length(); i++) {
            char ch = word.charAt(i);
            AutomatonNode child = node.getChild(ch);
            if (child == null) {
                child = node.addChild(ch);
                // 한 글자짜리 경로의 가장 긴 진접미사는 빈 문자열
                if (node.isRoot()) {
                    child.setFailureLink(root);
                }
            }
            node = child;
        }
        node.markTerminal();
    }
}
