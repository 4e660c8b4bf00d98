package com.ktb.dictionary.automaton;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * 오토마톤 트라이 노드.
 * children/parent 는 소유 관계, failureLink/suffixLink 는 더 얕은 노드를 가리키는 역방향 링크.
 */
@Getter
public class AutomatonNode {

    static final char ROOT_SYMBOL = '\0';

    private final char symbol;
    private final String fullPath;       // root 부터 이 노드까지의 문자열
    private final AutomatonNode parent;

    @Getter(AccessLevel.NONE)
    private final Map<Character, AutomatonNode> children = new LinkedHashMap<>();

    private boolean terminal;            // 사전 단어의 끝

    @Setter(AccessLevel.PACKAGE)
    private AutomatonNode failureLink;   // 실패 링크

    @Setter(AccessLevel.PACKAGE)
    private AutomatonNode suffixLink;    // 사전(출력) 링크

    private AutomatonNode(char symbol, String fullPath, AutomatonNode parent) {
        this.symbol = symbol;
        this.fullPath = fullPath;
        this.parent = parent;
    }

    static AutomatonNode newRoot() {
        AutomatonNode root = new AutomatonNode(ROOT_SYMBOL, "", null);
        root.failureLink = root;
        return root;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public int getDepth() {
        return fullPath.length();
    }

    public boolean hasChild(char symbol) {
        return children.containsKey(symbol);
    }

    /** @return 해당 문자의 자식, 없으면 {@code null} */
    public AutomatonNode getChild(char symbol) {
        return children.get(symbol);
    }

    public Collection<AutomatonNode> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    AutomatonNode addChild(char symbol) {
        AutomatonNode child = new AutomatonNode(symbol, fullPath + symbol, this);
        children.put(symbol, child);
        return child;
    }

    void markTerminal() {
        this.terminal = true;
    }

    @Override
    public String toString() {
        return isRoot() ? "AutomatonNode[root]" : "AutomatonNode[" + fullPath + (terminal ? "*" : "") + "]";
    }
}
