package com.gemflow.synth.rule;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.stmt.ForExpr;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthNode;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

import java.util.List;

/**
 * for 循环改写为 each 调用
 *
 * <pre>
 *   for x in xs
 *     body
 *   end
 * 脱糖为
 *   xs.each { |__synth__0| x = __synth__0; body }
 * </pre>
 *
 * <p>块参数是合成变量，属于合成块作用域；模式中的真实变量仍属于外层作用域。</p>
 */
public final class ForLoopRule implements SynthesisRule {

    static final String EACH = "each";

    @Override
    public String getName() {
        return "ForLoop";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        ForExpr loop = RuleSupport.real(anchor, ForExpr.class);
        if (loop == null) return;

        SynthNode call = builder.synth(anchor, SynthNode.DESUGARED, context.kinds().methodCall(EACH, false, 0));
        builder.ref(call, 0, context.child(anchor, 1));

        SynthNode block = builder.synth(call, 1, SynthKind.braceBlock());
        SynthNode param = builder.synth(block, 0, SynthKind.simpleParameter());
        SynthVariable variable = builder.declareVariable(param, 0);
        builder.synth(param, 0, SynthKind.localVariableAccess(variable));

        SynthNode bind = builder.synth(block, 1, SynthKind.assign());
        builder.ref(bind, 0, context.child(anchor, 0));
        RuleSupport.read(builder, bind, 1, variable);

        if (loop.getBody() != null) {
            List<AstNode> body = loop.getBody().getStatements();
            for (int i = 0; i < body.size(); i++) {
                builder.ref(block, i + 2, SyntaxNode.of(body.get(i)));
            }
            builder.exclude(SyntaxNode.of(loop.getBody()));
        }
    }

    @Override
    public boolean requiresMethodCall(String name, boolean setter, int arity) {
        return EACH.equals(name) && !setter && arity == 0;
    }
}
