package com.gemflow.synth;

import com.gemflow.ast.scope.Variable;
import com.gemflow.ast.scope.VariableKind;
import com.gemflow.synth.kind.SynthKind;

import java.util.Objects;

/**
 * 脱糖引入的临时局部变量 __synth__&lt;slot&gt;
 *
 * <p>由引入它的节点与槽位确定，按值比较。</p>
 */
public final class SynthVariable extends Variable {
    public static final String NAME_PREFIX = "__synth__";

    private final SyntaxNode introducer;
    private final int slot;

    public SynthVariable(SyntaxNode introducer, int slot) {
        super(NAME_PREFIX + slot, VariableKind.LOCAL, null, null, null, isParameterNode(introducer));
        this.introducer = Objects.requireNonNull(introducer, "introducer");
        this.slot = slot;
    }

    private static boolean isParameterNode(SyntaxNode node) {
        return node != null && node.isSynthetic()
                && node.getKind().getTag() == SynthKind.Tag.SIMPLE_PARAMETER;
    }

    public SyntaxNode getIntroducer() {
        return introducer;
    }

    public int getSlot() {
        return slot;
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SynthVariable)) return false;
        SynthVariable that = (SynthVariable) o;
        return slot == that.slot && introducer.equals(that.introducer);
    }

    @Override
    public int hashCode() {
        return 31 * introducer.hashCode() + slot;
    }

    @Override
    public String toString() {
        return getName() + "@" + introducer;
    }
}
