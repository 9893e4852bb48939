package com.gemflow.synth.rule;

import com.gemflow.ast.expr.ArrayLiteral;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;

/**
 * 数组字面量：[a, b] 脱糖为 ::Array.[](a, b)
 */
public final class ArrayLiteralRule implements SynthesisRule {

    static final String ARRAY_CONSTANT = "::Array";

    @Override
    public String getName() {
        return "ArrayLiteral";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        ArrayLiteral array = RuleSupport.real(anchor, ArrayLiteral.class);
        if (array == null) return;

        int n = array.getElements().size();
        // 种类的参数个数把接收者也算在内
        SynthNode call = builder.synth(anchor, SynthNode.DESUGARED,
                context.kinds().methodCall(DestructuredAssignmentRule.INDEX_METHOD, false, n + 1));
        builder.synth(call, 0, context.kinds().constantRead(ARRAY_CONSTANT));
        for (int i = 0; i < n; i++) {
            builder.ref(call, i + 1, context.child(anchor, i));
        }
    }

    @Override
    public boolean requiresMethodCall(String name, boolean setter, int arity) {
        return DestructuredAssignmentRule.INDEX_METHOD.equals(name) && !setter && arity >= 1;
    }

    @Override
    public boolean requiresConstant(String name) {
        return ARRAY_CONSTANT.equals(name);
    }
}
