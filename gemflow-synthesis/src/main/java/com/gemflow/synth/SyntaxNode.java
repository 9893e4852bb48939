package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 统一视图中的节点：真实节点（解析产生）或合成节点（脱糖产生）
 *
 * <p>只有 {@link RealNode} 与 {@link SynthNode} 两种变体。合成节点按地址
 * （父节点、槽位、种类）比较，同一地址在任意时刻、任意线程上得到的都是相等的值。</p>
 */
public abstract class SyntaxNode {

    SyntaxNode() {
    }

    public static RealNode of(AstNode node) {
        return new RealNode(node);
    }

    public abstract boolean isSynthetic();

    /** 真实节点返回被包装的 AST 节点，合成节点返回 null */
    public abstract AstNode getAstNode();

    /** 合成节点的种类，真实节点返回 null */
    public abstract SynthKind getKind();

    /**
     * 地址链上第一个真实节点：真实节点返回自身，合成节点沿地址父节点向上查找。
     */
    public abstract RealNode getRealRoot();

    /** 地址深度：真实节点为 0，合成节点为父节点深度 + 1 */
    public abstract int getSyntheticDepth();
}
