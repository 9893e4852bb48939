package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.synth.kind.SynthKind;

import java.util.Objects;

/**
 * 子节点事实的右侧：新合成一个节点，或引用一个已存在的节点
 *
 * <p>只有三种变体：{@link SynthChild}、{@link RealChildRef}、{@link SynthChildRef}。</p>
 */
public abstract class Child {

    private Child() {
    }

    public static Child synth(SynthKind kind) {
        return new SynthChild(kind);
    }

    public static Child real(AstNode node) {
        return new RealChildRef(node);
    }

    /** 按目标节点的变体选择引用方式 */
    public static Child ref(SyntaxNode node) {
        if (node.isSynthetic()) {
            return new SynthChildRef((SynthNode) node);
        }
        return new RealChildRef(node.getAstNode());
    }

    /** 解析出 (parent, index) 处的节点 */
    public abstract SyntaxNode resolve(SyntaxNode parent, int index);

    /** 新合成 */
    public static final class SynthChild extends Child {
        private final SynthKind kind;

        SynthChild(SynthKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public SynthKind getKind() {
            return kind;
        }

        @Override
        public SyntaxNode resolve(SyntaxNode parent, int index) {
            return new SynthNode(parent, index, kind);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SynthChild && ((SynthChild) o).kind.equals(kind);
        }

        @Override
        public int hashCode() {
            return kind.hashCode();
        }

        @Override
        public String toString() {
            return "synth " + kind;
        }
    }

    /** 引用真实节点 */
    public static final class RealChildRef extends Child {
        private final AstNode node;

        RealChildRef(AstNode node) {
            this.node = Objects.requireNonNull(node, "node");
        }

        public AstNode getNode() {
            return node;
        }

        @Override
        public SyntaxNode resolve(SyntaxNode parent, int index) {
            return SyntaxNode.of(node);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof RealChildRef && ((RealChildRef) o).node == node;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(node);
        }

        @Override
        public String toString() {
            return "ref " + node;
        }
    }

    /** 引用其它位置合成的节点 */
    public static final class SynthChildRef extends Child {
        private final SynthNode node;

        SynthChildRef(SynthNode node) {
            this.node = Objects.requireNonNull(node, "node");
        }

        public SynthNode getNode() {
            return node;
        }

        @Override
        public SyntaxNode resolve(SyntaxNode parent, int index) {
            return node;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SynthChildRef && ((SynthChildRef) o).node.equals(node);
        }

        @Override
        public int hashCode() {
            return node.hashCode();
        }

        @Override
        public String toString() {
            return "ref " + node;
        }
    }
}
