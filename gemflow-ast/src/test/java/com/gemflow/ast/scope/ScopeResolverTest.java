package com.gemflow.ast.scope;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.decl.*;
import com.gemflow.ast.expr.*;
import com.gemflow.ast.stmt.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 作用域解析测试
 */
class ScopeResolverTest {

    private int line = 0;

    private SourceLocation nextLoc() {
        line++;
        return SourceLocation.of("scopes.rb", line, 1, line, 10);
    }

    private LocalVariableAccess local(String name) {
        return new LocalVariableAccess(nextLoc(), name);
    }

    private AssignExpr assign(Expression left, Expression right) {
        return new AssignExpr(nextLoc(), left, right);
    }

    private IntegerLiteral lit(int value) {
        return new IntegerLiteral(nextLoc(), value);
    }

    private Toplevel top(AstNode... stmts) {
        return new Toplevel(nextLoc(), Arrays.asList(stmts));
    }

    @Nested
    @DisplayName("局部变量")
    class LocalVariableTests {

        @Test
        @DisplayName("首次赋值声明变量，后续访问解析到同一变量")
        void testDeclareThenUse() {
            LocalVariableAccess x1 = local("x");
            LocalVariableAccess x2 = local("x");
            Toplevel root = top(assign(x1, lit(1)), x2);

            ScopeTable table = ScopeResolver.resolve(root);
            Variable v = table.getVariable(x1);
            assertNotNull(v);
            assertSame(v, table.getVariable(x2));
            assertSame(table.getToplevelScope(), v.getScope());
            assertSame(x1, v.getDeclaration());
        }

        @Test
        @DisplayName("块可以读到外层局部变量")
        void testBlockSeesOuter() {
            LocalVariableAccess outer = local("x");
            LocalVariableAccess inner = local("x");
            BlockExpr block = new BlockExpr(nextLoc(), null, Collections.singletonList(inner));
            MethodCall call = new MethodCall(nextLoc(), local("xs"), "each", null, block);
            Toplevel root = top(assign(outer, lit(1)), call);

            ScopeTable table = ScopeResolver.resolve(root);
            assertSame(table.getVariable(outer), table.getVariable(inner));
            assertSame(table.getScope(block), table.scopeOf(inner));
        }

        @Test
        @DisplayName("块内首次出现的变量不泄漏到外层")
        void testBlockLocalDoesNotLeak() {
            LocalVariableAccess inner = local("y");
            BlockExpr block = new BlockExpr(nextLoc(), null, Collections.singletonList(assign(inner, lit(1))));
            MethodCall call = new MethodCall(nextLoc(), local("xs"), "each", null, block);
            LocalVariableAccess after = local("y");
            Toplevel root = top(call, after);

            ScopeTable table = ScopeResolver.resolve(root);
            assertNotSame(table.getVariable(inner), table.getVariable(after));
            assertSame(table.getScope(block), table.getVariable(inner).getScope());
        }

        @Test
        @DisplayName("块参数遮蔽外层同名变量")
        void testBlockParameterShadows() {
            LocalVariableAccess outer = local("x");
            SimpleParameter param = new SimpleParameter(nextLoc(), "x");
            LocalVariableAccess inner = local("x");
            BlockExpr block = new BlockExpr(nextLoc(), Collections.singletonList(param),
                    Collections.singletonList(inner));
            Toplevel root = top(assign(outer, lit(1)),
                    new MethodCall(nextLoc(), local("xs"), "each", null, block));

            ScopeTable table = ScopeResolver.resolve(root);
            Variable p = table.getVariable(param);
            assertTrue(p.isParameter());
            assertSame(p, table.getVariable(inner));
            assertNotSame(table.getVariable(outer), p);
        }

        @Test
        @DisplayName("方法体不能看到外层局部变量")
        void testMethodIsolation() {
            LocalVariableAccess outer = local("x");
            LocalVariableAccess inner = local("x");
            MethodDef def = new MethodDef(nextLoc(), "m", null, Collections.singletonList(inner));
            Toplevel root = top(assign(outer, lit(1)), def);

            ScopeTable table = ScopeResolver.resolve(root);
            assertNotSame(table.getVariable(outer), table.getVariable(inner));
            assertSame(table.getScope(def), table.getVariable(inner).getScope());
        }

        @Test
        @DisplayName("for 循环变量属于外层作用域")
        void testForDoesNotIntroduceScope() {
            LocalVariableAccess pattern = local("x");
            LocalVariableAccess after = local("x");
            ForExpr loop = new ForExpr(nextLoc(), pattern, local("xs"),
                    new StmtSequence(nextLoc(), Collections.singletonList(local("x"))));
            Toplevel root = top(loop, after);

            ScopeTable table = ScopeResolver.resolve(root);
            assertFalse(table.introducesScope(loop));
            assertSame(table.getVariable(pattern), table.getVariable(after));
            assertSame(table.getToplevelScope(), table.scopeOf(pattern));
        }
    }

    @Nested
    @DisplayName("self 与非局部变量")
    class NonLocalTests {

        @Test
        @DisplayName("块内 self 是外层方法的 self")
        void testSelfInsideBlock() {
            SelfExpr self = new SelfExpr(nextLoc());
            BlockExpr block = new BlockExpr(nextLoc(), null, Collections.singletonList(self));
            MethodDef def = new MethodDef(nextLoc(), "m", null,
                    Collections.singletonList(new MethodCall(nextLoc(), local("xs"), "each", null, block)));
            Toplevel root = top(def);

            ScopeTable table = ScopeResolver.resolve(root);
            Variable selfVar = table.getVariable(self);
            assertEquals(VariableKind.SELF, selfVar.getKind());
            assertSame(table.getScope(def).getSelfVariable(), selfVar);
            assertSame(table.getScope(def), table.scopeOf(self).getEnclosingSelfScope());
        }

        @Test
        @DisplayName("实例变量归属类作用域")
        void testInstanceVariableOwner() {
            InstanceVariableAccess a = new InstanceVariableAccess(nextLoc(), "@a");
            InstanceVariableAccess b = new InstanceVariableAccess(nextLoc(), "@a");
            MethodDef m1 = new MethodDef(nextLoc(), "m1", null, Collections.singletonList(a));
            MethodDef m2 = new MethodDef(nextLoc(), "m2", null, Collections.singletonList(b));
            ClassDef cls = new ClassDef(nextLoc(), "C", Arrays.asList(m1, m2));
            Toplevel root = top(cls);

            ScopeTable table = ScopeResolver.resolve(root);
            assertSame(table.getVariable(a), table.getVariable(b));
            assertSame(table.getScope(cls), table.getVariable(a).getScope());
            assertEquals(1, table.getInstanceVariables(table.getScope(cls)).size());
        }

        @Test
        @DisplayName("全局变量跨作用域共享")
        void testGlobals() {
            GlobalVariableAccess g1 = new GlobalVariableAccess(nextLoc(), "$g");
            GlobalVariableAccess g2 = new GlobalVariableAccess(nextLoc(), "$g");
            MethodDef def = new MethodDef(nextLoc(), "m", null, Collections.singletonList(g2));
            Toplevel root = top(g1, def);

            ScopeTable table = ScopeResolver.resolve(root);
            assertSame(table.getVariable(g1), table.getVariable(g2));
            assertTrue(table.getGlobals().containsKey("$g"));
        }

        @Test
        @DisplayName("类变量归属最近的类作用域")
        void testClassVariableOwner() {
            ClassVariableAccess a = new ClassVariableAccess(nextLoc(), "@@count");
            ClassVariableAccess b = new ClassVariableAccess(nextLoc(), "@@count");
            MethodDef def = new MethodDef(nextLoc(), "m", null, Collections.singletonList(b));
            ClassDef cls = new ClassDef(nextLoc(), "C", Arrays.asList(a, def));
            Toplevel root = top(cls);

            ScopeTable table = ScopeResolver.resolve(root);
            Scope classScope = table.getScope(cls);
            assertSame(table.getVariable(a), table.getVariable(b));
            assertEquals(VariableKind.CLASS, table.getVariable(a).getKind());
            assertSame(table.getVariable(a), table.getClassVariables(classScope).get("@@count"));
            assertTrue(table.getClassVariables(table.getToplevelScope()).isEmpty());
        }
    }

    @Nested
    @DisplayName("作用域查询")
    class QueryTests {

        @Test
        @DisplayName("scopeOf 返回严格包含节点的作用域")
        void testScopeOfScopeNode() {
            BlockExpr block = new BlockExpr(nextLoc(), null, null);
            MethodCall call = new MethodCall(nextLoc(), local("xs"), "each", null, block);
            Toplevel root = top(call);

            ScopeTable table = ScopeResolver.resolve(root);
            assertSame(table.getToplevelScope(), table.scopeOf(block));
            assertNull(table.scopeOf(root));
            assertSame(table.getToplevelScope(), table.getScope(block).getParent());
            List<Scope> children = table.getToplevelScope().getChildren();
            assertEquals(1, children.size());
        }

        @Test
        @DisplayName("合成作用域不能声明变量")
        void testSyntheticScope() {
            Toplevel root = top(lit(1));
            ScopeTable table = ScopeResolver.resolve(root);
            Scope synthetic = Scope.synthetic(table.getToplevelScope());
            assertTrue(synthetic.isSynthetic());
            assertSame(table.getToplevelScope().getSelfVariable(), synthetic.getSelfVariable());
            assertThrows(IllegalStateException.class, () -> synthetic.define(
                    new Variable("x", VariableKind.LOCAL, synthetic, null, null, false)));
            assertTrue(table.getToplevelScope().getChildren().isEmpty());
        }

        @Test
        @DisplayName("resolveLocal 只查当前作用域，resolve 穿过块作用域")
        void testResolveLocalVersusResolve() {
            LocalVariableAccess outer = local("x");
            BlockExpr block = new BlockExpr(nextLoc(), null, Collections.singletonList(local("x")));
            MethodCall call = new MethodCall(nextLoc(), local("xs"), "each", null, block);
            Toplevel root = top(assign(outer, lit(1)), call);

            ScopeTable table = ScopeResolver.resolve(root);
            Scope blockScope = table.getScope(block);
            assertNull(blockScope.resolveLocal("x"));
            assertSame(table.getVariable(outer), blockScope.resolve("x"));
            assertSame(table.getVariable(outer), table.getToplevelScope().resolveLocal("x"));
        }

        @Test
        @DisplayName("encloses 判断自身及传递父作用域")
        void testEncloses() {
            BlockExpr block = new BlockExpr(nextLoc(), null, null);
            MethodDef def = new MethodDef(nextLoc(), "m", null,
                    Collections.singletonList(new MethodCall(nextLoc(), local("xs"), "each", null, block)));
            Toplevel root = top(def);

            ScopeTable table = ScopeResolver.resolve(root);
            Scope toplevel = table.getToplevelScope();
            Scope method = table.getScope(def);
            Scope blockScope = table.getScope(block);
            assertTrue(toplevel.encloses(blockScope));
            assertTrue(method.encloses(blockScope));
            assertTrue(blockScope.encloses(blockScope));
            assertFalse(blockScope.encloses(method));
        }
    }

    @Nested
    @DisplayName("变量相等性")
    class VariableEqualityTests {

        @Test
        @DisplayName("重复解析同一棵树得到相等的变量")
        void testResolveTwiceGivesEqualVariables() {
            LocalVariableAccess x1 = local("x");
            LocalVariableAccess x2 = local("x");
            SelfExpr self = new SelfExpr(nextLoc());
            InstanceVariableAccess ivar = new InstanceVariableAccess(nextLoc(), "@a");
            Toplevel root = top(assign(x1, lit(1)), x2, self, ivar);

            ScopeTable first = ScopeResolver.resolve(root);
            ScopeTable second = ScopeResolver.resolve(root);

            assertNotSame(first.getVariable(x2), second.getVariable(x2));
            assertEquals(first.getVariable(x2), second.getVariable(x2));
            assertEquals(first.getVariable(x2).hashCode(), second.getVariable(x2).hashCode());
            assertEquals(first.getVariable(self), second.getVariable(self));
            assertEquals(first.getVariable(self).hashCode(), second.getVariable(self).hashCode());
            assertEquals(first.getVariable(ivar), second.getVariable(ivar));
        }

        @Test
        @DisplayName("同名但声明不同的变量不相等")
        void testDifferentDeclarationsDiffer() {
            LocalVariableAccess outer = local("x");
            LocalVariableAccess inner = local("x");
            MethodDef def = new MethodDef(nextLoc(), "m", null, Collections.singletonList(inner));
            Toplevel root = top(assign(outer, lit(1)), def);

            ScopeTable table = ScopeResolver.resolve(root);
            assertNotEquals(table.getVariable(outer), table.getVariable(inner));
            assertNotEquals(table.getToplevelScope().getSelfVariable(), table.getScope(def).getSelfVariable());
        }

        @Test
        @DisplayName("没有声明节点的变量按引用比较")
        void testUndeclaredVariablesCompareByIdentity() {
            Toplevel root = top(lit(1));
            Scope scope = ScopeResolver.resolve(root).getToplevelScope();
            Variable a = new Variable("x", VariableKind.LOCAL, scope, null, null, false);
            Variable b = new Variable("x", VariableKind.LOCAL, scope, null, null, false);
            assertEquals(a, a);
            assertNotEquals(a, b);
        }
    }
}
