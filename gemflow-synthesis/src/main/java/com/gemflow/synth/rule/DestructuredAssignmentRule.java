package com.gemflow.synth.rule;

import com.gemflow.ast.expr.DestructuredLhs;
import com.gemflow.ast.expr.SplatExpr;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 解构赋值
 *
 * <pre>
 *   a, *b, c = w
 * 脱糖为
 *   __synth__0 = *w
 *   a = __synth__0[0]
 *   b = __synth__0[1..-2]
 *   c = __synth__0[-1]
 * </pre>
 *
 * <p>剩余元素之前用正下标，之后用负下标；剩余元素本身取闭区间。
 * 元素赋值是合成的 ASSIGN，嵌套解构与 setter 目标会在其上再次脱糖。</p>
 */
public final class DestructuredAssignmentRule implements SynthesisRule {

    static final String INDEX_METHOD = "[]";

    @Override
    public String getName() {
        return "DestructuredAssignment";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        if (!context.isAssignment(anchor)) return;
        SyntaxNode left = context.leftOperand(anchor);
        DestructuredLhs lhs = RuleSupport.real(left, DestructuredLhs.class);
        if (lhs == null) return;

        int k = lhs.getElements().size();
        int rest = lhs.getRestIndex();
        SynthVariable tmp = builder.declareVariable(anchor, 0);

        SynthNode seq = builder.synth(anchor, SynthNode.DESUGARED, SynthKind.stmtSequence());

        SyntaxNode value = context.rightOperand(anchor);
        SynthNode save = builder.synth(seq, 0, SynthKind.assign());
        builder.locationOf(save, value);
        RuleSupport.read(builder, save, 0, tmp);
        SynthNode splat = builder.synth(save, 1, SynthKind.splat());
        builder.ref(splat, 0, value);

        for (int j = 0; j < k; j++) {
            SyntaxNode element = context.child(left, j);
            SyntaxNode target = element;
            if (j == rest) {
                SplatExpr restElement = RuleSupport.real(element, SplatExpr.class);
                target = restElement != null ? context.child(element, 0) : element;
                if (target == null) continue;   // 匿名剩余元素 *
            }

            SynthNode assign = builder.synth(seq, j + 1, SynthKind.assign());
            builder.locationOf(assign, element);
            builder.ref(assign, 0, target);

            SynthNode index = builder.synth(assign, 1, context.kinds().methodCall(INDEX_METHOD, false, 1));
            RuleSupport.read(builder, index, 0, tmp);
            if (j < rest) {
                builder.synth(index, 1, SynthKind.integerLiteral(j));
            } else if (j == rest) {
                SynthNode range = builder.synth(index, 1, SynthKind.rangeLiteral(true));
                builder.synth(range, 0, SynthKind.integerLiteral(j));
                builder.synth(range, 1, SynthKind.integerLiteral(j - k));
            } else {
                builder.synth(index, 1, SynthKind.integerLiteral(j - k));
            }
        }

        builder.exclude(left);
    }

    @Override
    public boolean requiresMethodCall(String name, boolean setter, int arity) {
        return INDEX_METHOD.equals(name) && !setter && arity == 1;
    }
}
