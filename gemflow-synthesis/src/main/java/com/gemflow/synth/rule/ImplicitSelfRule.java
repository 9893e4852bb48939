package com.gemflow.synth.rule;

import com.gemflow.ast.expr.MethodCall;
import com.gemflow.ast.scope.Scope;
import com.gemflow.synth.ExpansionBuilder;
import com.gemflow.synth.SynthesisContext;
import com.gemflow.synth.SynthesisRule;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

/**
 * 隐式 self：foo(x) 的 0 号槽位补上 self
 *
 * <p>带作用域限定的调用（Foo::bar）不适用。</p>
 */
public final class ImplicitSelfRule implements SynthesisRule {

    @Override
    public String getName() {
        return "ImplicitSelf";
    }

    @Override
    public void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder) {
        MethodCall call = RuleSupport.real(anchor, MethodCall.class);
        if (call == null || call.hasExplicitReceiver()) return;

        Scope scope = context.scopeOf(anchor);
        builder.synth(anchor, 0, SynthKind.self(scope.getSelfVariable()));
    }
}
