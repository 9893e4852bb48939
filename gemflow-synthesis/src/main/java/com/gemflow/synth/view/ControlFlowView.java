package com.gemflow.synth.view;

import com.gemflow.synth.SynthesisEngine;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;
import com.gemflow.ast.expr.MethodCall;

import java.util.ArrayList;
import java.util.List;

/**
 * 控制流视角的统一树：已脱糖的节点由其脱糖形式代替，被排除的真实节点不出现
 *
 * <p>节点按求值前序列出。控制流图构建只需要这份视图，不需要区分语法糖。</p>
 */
public final class ControlFlowView {

    private final SynthesisEngine engine;

    public ControlFlowView(SynthesisEngine engine) {
        this.engine = engine;
    }

    /** 整棵树的控制流单元 */
    public List<SyntaxNode> units() {
        return units(engine.node(engine.getRoot()));
    }

    /** 以 root 为根的控制流单元，前序 */
    public List<SyntaxNode> units(SyntaxNode root) {
        List<SyntaxNode> result = new ArrayList<SyntaxNode>();
        collect(root, result);
        return result;
    }

    /** 依次被调用的方法名（setter 带 =） */
    public List<String> calledMethods() {
        List<String> names = new ArrayList<String>();
        for (SyntaxNode n : units()) {
            if (n.isSynthetic()) {
                SynthKind kind = n.getKind();
                if (kind.isMethodCall()) names.add(kind.getCalledMethodName());
            } else if (n.getAstNode() instanceof MethodCall) {
                names.add(((MethodCall) n.getAstNode()).getName());
            }
        }
        return names;
    }

    private void collect(SyntaxNode node, List<SyntaxNode> out) {
        if (engine.isExcludedFromControlFlow(node)) return;
        SyntaxNode desugared = engine.desugaredForm(node);
        if (desugared != null) {
            collect(desugared, out);
            return;
        }
        out.add(node);
        for (SyntaxNode child : engine.children(node)) {
            collect(child, out);
        }
    }
}
