package com.gemflow.synth.rule;

import com.gemflow.ast.expr.ArrayLiteral;
import com.gemflow.ast.expr.IntegerLiteral;
import com.gemflow.synth.AstFixture;
import com.gemflow.synth.SynthesisEngine;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gemflow.synth.AstFixture.n;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 数组字面量脱糖测试
 */
class ArrayLiteralRuleTest {

    private final AstFixture ast = new AstFixture();

    @Test
    @DisplayName("[1, 2] 脱糖为 ::Array.[](1, 2)")
    void testElements() {
        IntegerLiteral one = ast.lit(1);
        IntegerLiteral two = ast.lit(2);
        ArrayLiteral array = ast.array(one, two);
        SynthesisEngine engine = SynthesisEngine.create(ast.top(array));

        SyntaxNode call = engine.desugaredForm(n(array));
        assertEquals("[]", call.getKind().getCalledMethodName());
        assertEquals(3, call.getKind().getArity());
        assertFalse(call.getKind().isSetter());

        List<SyntaxNode> children = engine.children(call);
        assertEquals(3, children.size());
        assertEquals(SynthKind.Tag.CONSTANT_READ, children.get(0).getKind().getTag());
        assertEquals("::Array", children.get(0).getKind().getName());
        assertEquals(n(one), children.get(1));
        assertEquals(n(two), children.get(2));
    }

    @Test
    @DisplayName("空数组的种类参数个数为 1")
    void testEmpty() {
        ArrayLiteral array = ast.array();
        SynthesisEngine engine = SynthesisEngine.create(ast.top(array));

        SyntaxNode call = engine.desugaredForm(n(array));
        assertEquals(1, call.getKind().getArity());
        assertEquals(1, engine.children(call).size());
        assertEquals(array.getLocation(), engine.location(engine.child(call, 0)));
    }

    @Test
    @DisplayName("元素以合成调用为父节点，数组本身不被排除")
    void testParents() {
        IntegerLiteral one = ast.lit(1);
        ArrayLiteral array = ast.array(one);
        SynthesisEngine engine = SynthesisEngine.create(ast.top(array));

        assertEquals(engine.desugaredForm(n(array)), engine.parent(n(one)));
        assertFalse(engine.isExcludedFromControlFlow(n(array)));
        assertTrue(engine.isInDesugaredContext(n(one)));
        assertFalse(engine.isInDesugaredContext(n(array)));
    }

    @Test
    @DisplayName("需要 ::Array 常量")
    void testDemands() {
        ArrayLiteralRule rule = new ArrayLiteralRule();
        assertTrue(rule.requiresConstant("::Array"));
        assertFalse(rule.requiresConstant("Array"));
        assertTrue(rule.requiresMethodCall("[]", false, 1));
        assertFalse(rule.requiresMethodCall("[]", false, 0));
    }
}
