package com.gemflow.synth;

import com.gemflow.ast.SourceLocation;

/**
 * 位置事实：固定位置，或“与另一节点位置相同”（查询时才解析）
 */
public final class LocationFact {
    private final SyntaxNode node;
    private final SourceLocation location;
    private final SyntaxNode sameAs;
    private final String rule;
    private final int priority;

    private LocationFact(SyntaxNode node, SourceLocation location, SyntaxNode sameAs, String rule, int priority) {
        this.node = node;
        this.location = location;
        this.sameAs = sameAs;
        this.rule = rule;
        this.priority = priority;
    }

    static LocationFact fixed(SyntaxNode node, SourceLocation location, String rule, int priority) {
        return new LocationFact(node, location, null, rule, priority);
    }

    static LocationFact sameAs(SyntaxNode node, SyntaxNode source, String rule, int priority) {
        return new LocationFact(node, null, source, rule, priority);
    }

    public SyntaxNode getNode() { return node; }
    /** 固定位置，“同位置于”事实返回 null */
    public SourceLocation getLocation() { return location; }
    /** “同位置于”的源节点，固定位置事实返回 null */
    public SyntaxNode getSameAs() { return sameAs; }
    public String getRule() { return rule; }
    public int getPriority() { return priority; }

    public boolean isLazy() {
        return sameAs != null;
    }

    /** 两条事实是否声明同一个位置（不解析“同位置于”） */
    public boolean sameTarget(LocationFact other) {
        if (isLazy()) return other.isLazy() && sameAs.equals(other.sameAs);
        return !other.isLazy() && location.equals(other.location);
    }

    @Override
    public String toString() {
        return node + " @ " + (isLazy() ? "same as " + sameAs : String.valueOf(location)) + " (" + rule + ")";
    }
}
