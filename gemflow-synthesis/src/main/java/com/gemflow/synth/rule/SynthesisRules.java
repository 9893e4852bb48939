package com.gemflow.synth.rule;

import com.gemflow.synth.SynthesisRule;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 标准规则集
 *
 * <p>顺序即冲突时的优先级。</p>
 */
public final class SynthesisRules {

    private static final List<SynthesisRule> STANDARD = Collections.unmodifiableList(Arrays.<SynthesisRule>asList(
            new ImplicitSelfRule(),
            new SetterAssignmentRule(),
            new VariableAssignOperationRule(),
            new MethodCallAssignOperationRule(),
            new DestructuredAssignmentRule(),
            new ArrayLiteralRule(),
            new ForLoopRule()
    ));

    private SynthesisRules() {
    }

    public static List<SynthesisRule> standard() {
        return STANDARD;
    }
}
