package com.gemflow.synth;

/**
 * 一条子节点事实：(parent, index) 处是 child，由 rule 声明
 */
public final class ChildFact {
    /** 解析产生的子节点使用的“规则名” */
    public static final String PARSED = "<parsed>";

    private final SyntaxNode parent;
    private final int index;
    private final Child child;
    private final String rule;
    private final int priority;     // 越小越优先：解析事实为 -1，其余为规则序号

    public ChildFact(SyntaxNode parent, int index, Child child, String rule, int priority) {
        this.parent = parent;
        this.index = index;
        this.child = child;
        this.rule = rule;
        this.priority = priority;
    }

    public SyntaxNode getParent() { return parent; }
    public int getIndex() { return index; }
    public Child getChild() { return child; }
    public String getRule() { return rule; }
    public int getPriority() { return priority; }

    /** 解析后的子节点 */
    public SyntaxNode resolve() {
        return child.resolve(parent, index);
    }

    @Override
    public String toString() {
        return parent + "[" + index + "] = " + child + " (" + rule + ")";
    }
}
