package com.gemflow.synth.rule;

import com.gemflow.ast.expr.AssignOperation;
import com.gemflow.ast.expr.AssignOperation.AssignOp;
import com.gemflow.ast.expr.BinaryOperation.BinaryOp;
import com.gemflow.ast.expr.IntegerLiteral;
import com.gemflow.ast.expr.LocalVariableAccess;
import com.gemflow.ast.expr.MethodCall;
import com.gemflow.synth.AstFixture;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SynthesisEngine;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.kind.SynthKind;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.gemflow.synth.AstFixture.n;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 方法调用复合赋值脱糖测试
 */
class MethodCallAssignOperationRuleTest {

    private final AstFixture ast = new AstFixture();

    @Nested
    @DisplayName("a.b(i) += 1")
    class OneArgumentTests {
        private final LocalVariableAccess recv = ast.local("a");
        private final LocalVariableAccess index = ast.local("i");
        private final MethodCall left = ast.call(recv, "b", index);
        private final IntegerLiteral one = ast.lit(1);
        private final AssignOperation op = ast.opAssign(left, AssignOp.ADD_ASSIGN, one);
        private final SynthesisEngine engine = SynthesisEngine.create(ast.top(op));

        private SynthVariable tmp(int slot) {
            return new SynthVariable(n(op), slot);
        }

        @Test
        @DisplayName("n + 4 条语句")
        void testStatementCount() {
            SyntaxNode seq = engine.desugaredForm(n(op));
            assertEquals(SynthKind.stmtSequence(), seq.getKind());
            assertEquals(5, engine.children(seq).size());
            assertEquals(Arrays.asList(tmp(0), tmp(1), tmp(2)), engine.declaredVariables(n(op)));
        }

        @Test
        @DisplayName("接收者与实参先存入临时变量")
        void testSaves() {
            SyntaxNode seq = engine.desugaredForm(n(op));
            SyntaxNode save0 = engine.child(seq, 0);
            assertEquals(tmp(0), engine.variableOf(engine.child(save0, 0)));
            assertEquals(n(recv), engine.child(save0, 1));
            assertEquals(recv.getLocation(), engine.location(save0));

            SyntaxNode save1 = engine.child(seq, 1);
            assertEquals(tmp(1), engine.variableOf(engine.child(save1, 0)));
            assertEquals(n(index), engine.child(save1, 1));
            assertEquals(index.getLocation(), engine.location(save1));
        }

        @Test
        @DisplayName("getter 结果与右值运算后存入 __synth__2")
        void testOperatorStatement() {
            SyntaxNode seq = engine.desugaredForm(n(op));
            SyntaxNode opAssign = engine.child(seq, 2);
            assertEquals(op.getOperatorLocation(), engine.location(opAssign));
            assertEquals(tmp(2), engine.variableOf(engine.child(opAssign, 0)));

            SyntaxNode binary = engine.child(opAssign, 1);
            assertEquals(BinaryOp.ADD, binary.getKind().getOperator());
            assertEquals(n(one), engine.child(binary, 1));

            SyntaxNode getter = engine.child(binary, 0);
            assertEquals("b", getter.getKind().getCalledMethodName());
            assertEquals(1, getter.getKind().getArity());
            assertEquals(left.getLocation(), engine.location(getter));

            List<SyntaxNode> operands = engine.children(getter);
            assertEquals(2, operands.size());
            assertEquals(tmp(0), engine.variableOf(operands.get(0)));
            assertEquals(recv.getLocation(), engine.location(operands.get(0)));
            assertEquals(tmp(1), engine.variableOf(operands.get(1)));
            assertEquals(index.getLocation(), engine.location(operands.get(1)));
        }

        @Test
        @DisplayName("setter 用临时变量回写，值参数位于运算符")
        void testSetter() {
            SyntaxNode seq = engine.desugaredForm(n(op));
            SyntaxNode setter = engine.child(seq, 3);
            assertEquals("b=", setter.getKind().getCalledMethodName());
            assertEquals(2, setter.getKind().getArity());
            assertEquals(left.getLocation(), engine.location(setter));

            List<SyntaxNode> operands = engine.children(setter);
            assertEquals(3, operands.size());
            assertEquals(tmp(0), engine.variableOf(operands.get(0)));
            assertEquals(tmp(1), engine.variableOf(operands.get(1)));
            assertEquals(tmp(2), engine.variableOf(operands.get(2)));
            assertEquals(recv.getLocation(), engine.location(operands.get(0)));
            assertEquals(op.getOperatorLocation(), engine.location(operands.get(2)));
        }

        @Test
        @DisplayName("最后一条语句读出结果")
        void testResult() {
            SyntaxNode seq = engine.desugaredForm(n(op));
            SyntaxNode result = engine.child(seq, 4);
            assertEquals(tmp(2), engine.variableOf(result));
            assertEquals(op.getOperatorLocation(), engine.location(result));
        }

        @Test
        @DisplayName("左侧调用被排除，接收者和实参只在保存语句中出现")
        void testExclusion() {
            assertTrue(engine.isExcludedFromControlFlow(n(left)));
            SyntaxNode seq = engine.desugaredForm(n(op));
            assertEquals(engine.child(seq, 0), engine.parent(n(recv)));
            assertEquals(engine.child(seq, 1), engine.parent(n(index)));
        }
    }

    @Test
    @DisplayName("无参数调用 a.b ||= 1 产生四条语句")
    void testZeroArguments() {
        MethodCall left = ast.call(ast.local("a"), "b");
        AssignOperation op = ast.opAssign(left, AssignOp.OR_ASSIGN, ast.lit(1));
        SynthesisEngine engine = SynthesisEngine.create(ast.top(op));

        SyntaxNode seq = engine.desugaredForm(n(op));
        List<SyntaxNode> stmts = engine.children(seq);
        assertEquals(4, stmts.size());
        SyntaxNode getter = engine.child(engine.child(stmts.get(1), 1), 0);
        assertEquals(0, getter.getKind().getArity());
        assertEquals(1, stmts.get(2).getKind().getArity());
        assertTrue(stmts.get(2).getKind().isSetter());
        assertEquals(2, engine.declaredVariables(n(op)).size());
    }

    @Test
    @DisplayName("隐式 self 接收者也只求值一次")
    void testImplicitReceiver() {
        MethodCall left = ast.bare("count", ast.lit(0));
        AssignOperation op = ast.opAssign(left, AssignOp.ADD_ASSIGN, ast.lit(1));
        SynthesisEngine engine = SynthesisEngine.create(ast.top(op));

        SyntaxNode save0 = engine.child(engine.desugaredForm(n(op)), 0);
        SyntaxNode saved = engine.child(save0, 1);
        assertEquals(SynthKind.Tag.SELF, saved.getKind().getTag());
        assertEquals(left.getLocation(), engine.location(save0));

        // 保存语句引用了合成的 self，父节点随之改变
        assertEquals(save0, engine.parent(saved));
        assertEquals(1, engine.desugarLevel(saved));
        assertEquals(engine.desugarLevel(engine.child(engine.child(engine.desugaredForm(n(op)), 1), 1)),
                engine.desugarLevel(saved));
    }

    @Test
    @DisplayName("临时变量按声明顺序占用槽位")
    void testTemporarySlots() {
        MethodCall left = ast.call(ast.local("a"), "b", ast.lit(0), ast.lit(1));
        AssignOperation op = ast.opAssign(left, AssignOp.ADD_ASSIGN, ast.lit(2));
        SynthesisEngine engine = SynthesisEngine.create(ast.top(op));

        List<SynthVariable> vars = engine.declaredVariables(n(op));
        assertEquals(4, vars.size());
        for (int i = 0; i < vars.size(); i++) {
            assertEquals(i, vars.get(i).getSlot());
            assertEquals("__synth__" + i, vars.get(i).getName());
        }
    }

    @Test
    @DisplayName("需要 getter 与 setter 两种种类")
    void testDemands() {
        MethodCallAssignOperationRule rule = new MethodCallAssignOperationRule();
        assertTrue(rule.requiresMethodCall("x", false, 0));
        assertTrue(rule.requiresMethodCall("x", true, 1));
        assertFalse(rule.requiresMethodCall("x", true, 0));
    }
}
