package com.gemflow.synth.rule;

import com.gemflow.ast.expr.AssignOperation;
import com.gemflow.ast.expr.VariableAccess;
import com.gemflow.ast.scope.Variable;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 变量复合赋值：x OP= y 脱糖为 x = x OP y
 */
public final class VariableAssignOperationRule implements SynthesisRule {

    @Override
    public String getName() {
        return "VariableAssignOperation";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        AssignOperation op = RuleSupport.real(anchor, AssignOperation.class);
        if (op == null) return;
        SyntaxNode left = context.leftOperand(anchor);
        if (RuleSupport.real(left, VariableAccess.class) == null) return;
        Variable variable = context.variableOf(left);
        if (variable == null) return;

        SynthNode assign = builder.synth(anchor, SynthNode.DESUGARED, SynthKind.assign());
        builder.ref(assign, 0, left);

        SynthNode binary = builder.synth(assign, 1, SynthKind.binaryOperation(op.getOperator().getBinaryOp()));
        builder.location(binary, op.getOperatorLocation());
        SynthNode copy = builder.synth(binary, 0, SynthKind.variableAccess(variable));
        builder.locationOf(copy, left);
        builder.ref(binary, 1, context.rightOperand(anchor));
    }
}
