package com.gemflow.synth.kind;

import com.gemflow.ast.expr.BinaryOperation.BinaryOp;
import com.gemflow.ast.scope.Scope;
import com.gemflow.ast.scope.Variable;
import com.gemflow.ast.scope.VariableKind;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 合成节点种类测试
 */
class SynthKindTest {

    private final Scope top = new Scope(Scope.ScopeType.TOPLEVEL, null, null);

    private Variable var(String name, VariableKind kind) {
        return new Variable(name, kind, top, null, null, false);
    }

    @Nested
    @DisplayName("相等性")
    class EqualityTests {

        @Test
        @DisplayName("同标签同参数的种类相等")
        void testValueEquality() {
            assertEquals(SynthKind.binaryOperation(BinaryOp.ADD), SynthKind.binaryOperation(BinaryOp.ADD));
            assertEquals(SynthKind.binaryOperation(BinaryOp.ADD).hashCode(),
                    SynthKind.binaryOperation(BinaryOp.ADD).hashCode());
            assertNotEquals(SynthKind.binaryOperation(BinaryOp.ADD), SynthKind.binaryOperation(BinaryOp.SUB));
            assertEquals(SynthKind.integerLiteral(3), SynthKind.integerLiteral(3));
            assertNotEquals(SynthKind.rangeLiteral(true), SynthKind.rangeLiteral(false));
        }

        @Test
        @DisplayName("变量访问按变量区分")
        void testVariableAccess() {
            Variable x = var("x", VariableKind.LOCAL);
            Variable y = var("y", VariableKind.LOCAL);
            assertEquals(SynthKind.localVariableAccess(x), SynthKind.localVariableAccess(x));
            assertNotEquals(SynthKind.localVariableAccess(x), SynthKind.localVariableAccess(y));
            assertSame(x, SynthKind.localVariableAccess(x).getVariable());
        }

        @Test
        @DisplayName("方法调用种类区分 setter 与参数个数")
        void testMethodCall() {
            assertEquals(SynthKind.methodCall("foo", false, 1), SynthKind.methodCall("foo", false, 1));
            assertNotEquals(SynthKind.methodCall("foo", false, 1), SynthKind.methodCall("foo", true, 1));
            assertNotEquals(SynthKind.methodCall("foo", false, 1), SynthKind.methodCall("foo", false, 2));
            assertNotEquals(SynthKind.methodCall("foo", false, 0), SynthKind.constantRead("foo"));
        }
    }

    @Nested
    @DisplayName("访问器")
    class AccessorTests {

        @Test
        @DisplayName("setter 的调用名带 =")
        void testCalledMethodName() {
            assertEquals("name=", SynthKind.methodCall("name", true, 1).getCalledMethodName());
            assertEquals("name", SynthKind.methodCall("name", false, 0).getCalledMethodName());
            assertNull(SynthKind.assign().getCalledMethodName());
        }

        @Test
        @DisplayName("参数只对相应标签有意义")
        void testTagSpecific() {
            SynthKind call = SynthKind.methodCall("[]", false, 2);
            assertTrue(call.isMethodCall());
            assertEquals(2, call.getArity());
            assertEquals(0, SynthKind.integerLiteral(2).getArity());
            assertEquals(-7, SynthKind.integerLiteral(-7).getIntegerValue());
            assertTrue(SynthKind.rangeLiteral(true).isInclusive());
            assertFalse(SynthKind.rangeLiteral(false).isInclusive());
            assertTrue(SynthKind.assign().isAssign());
            assertEquals(BinaryOp.MUL, SynthKind.binaryOperation(BinaryOp.MUL).getOperator());
        }

        @Test
        @DisplayName("按变量种类选择访问种类")
        void testVariableAccessDispatch() {
            assertEquals(SynthKind.Tag.LOCAL_VARIABLE_ACCESS,
                    SynthKind.variableAccess(var("x", VariableKind.LOCAL)).getTag());
            assertEquals(SynthKind.Tag.INSTANCE_VARIABLE_ACCESS,
                    SynthKind.variableAccess(var("@x", VariableKind.INSTANCE)).getTag());
            assertEquals(SynthKind.Tag.CLASS_VARIABLE_ACCESS,
                    SynthKind.variableAccess(var("@@x", VariableKind.CLASS)).getTag());
            assertEquals(SynthKind.Tag.GLOBAL_VARIABLE_ACCESS,
                    SynthKind.variableAccess(var("$x", VariableKind.GLOBAL)).getTag());
            assertEquals(SynthKind.Tag.SELF, SynthKind.variableAccess(top.getSelfVariable()).getTag());
            assertTrue(SynthKind.Tag.SELF.isVariableAccess());
            assertFalse(SynthKind.Tag.METHOD_CALL.isVariableAccess());
        }
    }

    @Nested
    @DisplayName("取值范围")
    class RangeTests {

        @Test
        @DisplayName("整数字面量限定在 [-1000, 1000]")
        void testIntegerRange() {
            assertEquals(1000, SynthKind.integerLiteral(1000).getIntegerValue());
            assertEquals(-1000, SynthKind.integerLiteral(-1000).getIntegerValue());
            assertThrows(IllegalArgumentException.class, () -> SynthKind.integerLiteral(1001));
            assertThrows(IllegalArgumentException.class, () -> SynthKind.integerLiteral(-1001));
        }

        @Test
        @DisplayName("参数个数不能为负")
        void testNegativeArity() {
            assertThrows(IllegalArgumentException.class, () -> SynthKind.methodCall("x", false, -1));
        }

        @Test
        @DisplayName("缺少必需参数时拒绝构造")
        void testNulls() {
            assertThrows(NullPointerException.class, () -> SynthKind.binaryOperation(null));
            assertThrows(NullPointerException.class, () -> SynthKind.localVariableAccess(null));
            assertThrows(NullPointerException.class, () -> SynthKind.variableAccess(null));
        }
    }

    @Test
    @DisplayName("toString 便于阅读")
    void testToString() {
        assertEquals("MethodCall(name=, 1)", SynthKind.methodCall("name", true, 1).toString());
        assertEquals("BinaryOperation(+)", SynthKind.binaryOperation(BinaryOp.ADD).toString());
        assertEquals("RangeLiteral(..)", SynthKind.rangeLiteral(true).toString());
        assertEquals("ASSIGN", SynthKind.assign().toString());
    }
}
