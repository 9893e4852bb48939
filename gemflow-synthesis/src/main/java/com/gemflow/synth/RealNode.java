package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 包装一个解析产生的 AST 节点，以被包装节点的身份比较
 */
public final class RealNode extends SyntaxNode {
    private final AstNode node;

    RealNode(AstNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        this.node = node;
    }

    @Override
    public boolean isSynthetic() {
        return false;
    }

    @Override
    public AstNode getAstNode() {
        return node;
    }

    @Override
    public SynthKind getKind() {
        return null;
    }

    @Override
    public RealNode getRealRoot() {
        return this;
    }

    @Override
    public int getSyntheticDepth() {
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RealNode && ((RealNode) o).node == node;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
