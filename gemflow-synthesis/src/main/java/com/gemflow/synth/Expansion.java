package com.gemflow.synth;

import com.gemflow.ast.AstNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * 一条规则对一个锚点声明的全部事实（不可变）
 */
public final class Expansion {
    private final SyntaxNode anchor;
    private final String rule;
    private final int priority;
    private final Map<SyntaxNode, SortedMap<Integer, ChildFact>> children;
    private final Map<SyntaxNode, LocationFact> locations;
    private final Map<SyntaxNode, List<SynthVariable>> variables;
    private final Set<AstNode> excluded;

    Expansion(SyntaxNode anchor, String rule, int priority,
              Map<SyntaxNode, SortedMap<Integer, ChildFact>> children,
              Map<SyntaxNode, LocationFact> locations,
              Map<SyntaxNode, List<SynthVariable>> variables,
              Set<AstNode> excluded) {
        this.anchor = anchor;
        this.rule = rule;
        this.priority = priority;
        this.children = children;
        this.locations = locations;
        this.variables = variables;
        this.excluded = excluded;
    }

    public SyntaxNode getAnchor() { return anchor; }
    public String getRule() { return rule; }
    public int getPriority() { return priority; }

    public boolean isEmpty() {
        return children.isEmpty() && locations.isEmpty() && variables.isEmpty() && excluded.isEmpty();
    }

    /** node 的子节点事实，按槽位排序 */
    public SortedMap<Integer, ChildFact> childFactsOf(SyntaxNode node) {
        SortedMap<Integer, ChildFact> facts = children.get(node);
        return facts != null ? facts : Collections.<Integer, ChildFact>emptySortedMap();
    }

    public ChildFact childFact(SyntaxNode node, int index) {
        return childFactsOf(node).get(index);
    }

    public LocationFact locationOf(SyntaxNode node) {
        return locations.get(node);
    }

    public List<SynthVariable> variablesOf(SyntaxNode node) {
        List<SynthVariable> vars = variables.get(node);
        return vars != null ? vars : Collections.<SynthVariable>emptyList();
    }

    public boolean excludes(AstNode node) {
        return excluded.contains(node);
    }

    @Override
    public String toString() {
        return "Expansion[" + rule + " @ " + anchor + "]";
    }
}
