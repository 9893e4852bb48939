package com.gemflow.synth.rule;

import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 属性/下标赋值改写为 setter 调用
 *
 * <pre>
 *   recv.m(args) = value
 * 脱糖为
 *   recv.m=(args..., __synth__0 = value); __synth__0
 * </pre>
 *
 * <p>表达式的值是被赋的值而不是 setter 的返回值。</p>
 */
public final class SetterAssignmentRule implements SynthesisRule {

    @Override
    public String getName() {
        return "SetterAssignment";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        if (!context.isAssignment(anchor)) return;
        SyntaxNode left = context.leftOperand(anchor);
        if (!context.isMethodCall(left)) return;

        int argc = context.argumentCount(left);
        SynthVariable tmp = builder.declareVariable(anchor, 0);

        SynthNode seq = builder.synth(anchor, SynthNode.DESUGARED, SynthKind.stmtSequence());

        SynthNode setter = builder.synth(seq, 0,
                context.kinds().methodCall(context.methodName(left), true, argc + 1));
        builder.locationOf(setter, left);
        builder.ref(setter, 0, context.receiver(left));
        for (int i = 0; i < argc; i++) {
            builder.ref(setter, i + 1, context.argument(left, i));
        }
        SynthNode valueAssign = builder.synth(setter, argc + 1, SynthKind.assign());
        RuleSupport.read(builder, valueAssign, 0, tmp);
        builder.ref(valueAssign, 1, context.rightOperand(anchor));

        SynthNode result = RuleSupport.read(builder, seq, 1, tmp);
        builder.locationOf(result, left);

        if (!left.isSynthetic()) {
            builder.exclude(left);
        }
    }

    @Override
    public boolean requiresMethodCall(String name, boolean setter, int arity) {
        return setter && arity >= 1;
    }
}
