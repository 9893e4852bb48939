package com.gemflow.synth.rule;

import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.expr.AssignOperation;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 方法调用复合赋值，接收者和实参都只求值一次
 *
 * <pre>
 *   recv.m(a1, ..., an) OP= y
 * 脱糖为
 *   __synth__0 = recv
 *   __synth__1 = a1 ... __synth__n = an
 *   __synth__{n+1} = __synth__0.m(__synth__1, ..., __synth__n) OP y
 *   __synth__0.m=(__synth__1, ..., __synth__n, __synth__{n+1})
 *   __synth__{n+1}
 * </pre>
 */
public final class MethodCallAssignOperationRule implements SynthesisRule {

    @Override
    public String getName() {
        return "MethodCallAssignOperation";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        AssignOperation op = RuleSupport.real(anchor, AssignOperation.class);
        if (op == null) return;
        SyntaxNode left = context.leftOperand(anchor);
        if (!context.isMethodCall(left)) return;

        String name = context.methodName(left);
        int argc = context.argumentCount(left);
        int opIndex = argc + 1;
        SourceLocation operatorLocation = op.getOperatorLocation();

        SynthVariable[] tmp = new SynthVariable[argc + 2];
        for (int i = 0; i < tmp.length; i++) {
            tmp[i] = builder.declareVariable(anchor, i);
        }

        SynthNode seq = builder.synth(anchor, SynthNode.DESUGARED, SynthKind.stmtSequence());

        // 接收者与实参各求值一次
        for (int j = 0; j <= argc; j++) {
            SyntaxNode source = j == 0 ? context.receiver(left) : context.argument(left, j - 1);
            SynthNode save = builder.synth(seq, j, SynthKind.assign());
            builder.locationOf(save, source);
            RuleSupport.read(builder, save, 0, tmp[j]);
            builder.ref(save, 1, source);
        }

        // __synth__{n+1} = getter OP y
        SynthNode opAssign = builder.synth(seq, opIndex, SynthKind.assign());
        builder.location(opAssign, operatorLocation);
        RuleSupport.read(builder, opAssign, 0, tmp[opIndex]);
        SynthNode binary = builder.synth(opAssign, 1, SynthKind.binaryOperation(op.getOperator().getBinaryOp()));
        SynthNode getter = builder.synth(binary, 0, context.kinds().methodCall(name, false, argc));
        builder.locationOf(getter, left);
        copyOperands(context, builder, left, getter, tmp, argc);
        builder.ref(binary, 1, context.rightOperand(anchor));

        // setter
        SynthNode setter = builder.synth(seq, opIndex + 1, context.kinds().methodCall(name, true, argc + 1));
        builder.locationOf(setter, left);
        copyOperands(context, builder, left, setter, tmp, argc);
        SynthNode value = RuleSupport.read(builder, setter, argc + 1, tmp[opIndex]);
        builder.location(value, operatorLocation);

        SynthNode result = RuleSupport.read(builder, seq, opIndex + 2, tmp[opIndex]);
        builder.location(result, operatorLocation);

        if (!left.isSynthetic()) {
            builder.exclude(left);
        }
    }

    /** 用临时变量代替接收者与实参，位置沿用原节点 */
    private static void copyOperands(SynthesisContext context, ExpansionBuilder builder, SyntaxNode call,
                                     SynthNode target, SynthVariable[] tmp, int argc) {
        SynthNode recv = RuleSupport.read(builder, target, 0, tmp[0]);
        builder.locationOf(recv, context.receiver(call));
        for (int i = 1; i <= argc; i++) {
            SynthNode arg = RuleSupport.read(builder, target, i, tmp[i]);
            builder.locationOf(arg, context.argument(call, i - 1));
        }
    }

    @Override
    public boolean requiresMethodCall(String name, boolean setter, int arity) {
        return setter ? arity >= 1 : arity >= 0;
    }
}
