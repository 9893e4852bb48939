package com.gemflow.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST 节点基类
 *
 * <p>子节点按槽位编号寻址。槽位可以为空（例如没有显式接收者的方法调用，0 号槽位为空），
 * 因此 {@link #getChildCount()} 返回的是槽位数而不是非空子节点数。</p>
 *
 * <p>父节点在构造时通过 {@link #adopt(AstNode, int)} 认领子节点，构造完成后树不再变化。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;
    private AstNode parent;
    private int parentIndex = -1;

    protected AstNode(SourceLocation location) {
        if (location == null) {
            throw new IllegalArgumentException("location must not be null");
        }
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public AstNode getParent() {
        return parent;
    }

    /** 在父节点中的槽位编号，根节点为 -1 */
    public int getParentIndex() {
        return parentIndex;
    }

    /** 子节点槽位数 */
    public abstract int getChildCount();

    /** 指定槽位的子节点，空槽位或越界返回 null */
    public abstract AstNode getChild(int index);

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);

    /** 所有非空子节点（按槽位顺序） */
    public List<AstNode> getChildren() {
        int count = getChildCount();
        if (count == 0) return Collections.emptyList();
        List<AstNode> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            AstNode child = getChild(i);
            if (child != null) result.add(child);
        }
        return result;
    }

    /** 前序遍历的所有后代（含自身） */
    public List<AstNode> descendants() {
        List<AstNode> result = new ArrayList<>();
        collectDescendants(this, result);
        return result;
    }

    private static void collectDescendants(AstNode node, List<AstNode> result) {
        result.add(node);
        for (AstNode child : node.getChildren()) {
            collectDescendants(child, result);
        }
    }

    /** 是否为 ancestor 的（非严格）后代 */
    public boolean isDescendantOf(AstNode ancestor) {
        for (AstNode n = this; n != null; n = n.parent) {
            if (n == ancestor) return true;
        }
        return false;
    }

    protected final <T extends AstNode> T adopt(T child, int index) {
        if (child == null) return null;
        AstNode node = child;
        if (node.parent != null) {
            throw new IllegalStateException("node already has a parent: " + child);
        }
        node.parent = this;
        node.parentIndex = index;
        return child;
    }

    protected final <T extends AstNode> List<T> adoptAll(List<? extends T> children, int firstIndex) {
        if (children == null || children.isEmpty()) return Collections.emptyList();
        List<T> adopted = new ArrayList<T>(children);
        for (int i = 0; i < adopted.size(); i++) {
            adopt(adopted.get(i), firstIndex + i);
        }
        return Collections.unmodifiableList(adopted);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + location;
    }
}
