package com.gemflow.synth.rule;

import com.gemflow.ast.AstNode;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 规则共用的小工具
 */
final class RuleSupport {

    private RuleSupport() {
    }

    /** 节点是给定类型的真实节点时返回被包装的 AST 节点，否则返回 null */
    static <T extends AstNode> T real(SyntaxNode node, Class<T> type) {
        if (node == null || node.isSynthetic()) return null;
        AstNode ast = node.getAstNode();
        return type.isInstance(ast) ? type.cast(ast) : null;
    }

    /** 在 (parent, index) 处合成对合成变量的访问 */
    static SynthNode read(ExpansionBuilder b, SyntaxNode parent, int index, SynthVariable variable) {
        return b.synth(parent, index, SynthKind.localVariableAccess(variable));
    }
}
