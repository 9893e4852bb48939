package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.synth.kind.SynthKind;

import java.util.Objects;

/**
 * 合成节点，由地址 (父节点, 槽位, 种类) 唯一确定
 *
 * <p>槽位 -1 表示父节点的脱糖形式，非负槽位是普通子节点。</p>
 */
public final class SynthNode extends SyntaxNode {
    /** 脱糖形式所在的槽位 */
    public static final int DESUGARED = -1;

    private final SyntaxNode parent;
    private final int index;
    private final SynthKind kind;
    private final int depth;
    private final int hash;

    public SynthNode(SyntaxNode parent, int index, SynthKind kind) {
        this.parent = Objects.requireNonNull(parent, "parent");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.index = index;
        this.depth = parent.getSyntheticDepth() + 1;
        this.hash = 31 * (31 * parent.hashCode() + index) + kind.hashCode();
    }

    public SyntaxNode getParent() {
        return parent;
    }

    public int getIndex() {
        return index;
    }

    public boolean isDesugaredForm() {
        return index == DESUGARED;
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public AstNode getAstNode() {
        return null;
    }

    @Override
    public SynthKind getKind() {
        return kind;
    }

    @Override
    public RealNode getRealRoot() {
        SyntaxNode n = parent;
        while (n.isSynthetic()) {
            n = ((SynthNode) n).parent;
        }
        return (RealNode) n;
    }

    @Override
    public int getSyntheticDepth() {
        return depth;
    }

    /** 是否为 ancestor 的（非严格）地址后代 */
    public boolean hasAddressPrefix(SyntaxNode ancestor) {
        SyntaxNode n = this;
        while (true) {
            if (n.equals(ancestor)) return true;
            if (!n.isSynthetic()) return false;
            n = ((SynthNode) n).parent;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SynthNode)) return false;
        SynthNode that = (SynthNode) o;
        return hash == that.hash
                && index == that.index
                && kind.equals(that.kind)
                && parent.equals(that.parent);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return parent + "/" + index + ":" + kind;
    }
}
