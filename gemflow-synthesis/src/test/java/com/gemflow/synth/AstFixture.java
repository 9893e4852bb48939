package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.decl.*;
import com.gemflow.ast.expr.*;
import com.gemflow.ast.expr.AssignOperation.AssignOp;
import com.gemflow.ast.stmt.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 手工构造 AST 的测试工具，每个节点占用一个独立的位置，便于断言位置来源
 */
public final class AstFixture {
    private final String file;
    private int line = 0;

    public AstFixture() {
        this("fixture.rb");
    }

    public AstFixture(String file) {
        this.file = file;
    }

    public SourceLocation next() {
        line++;
        return SourceLocation.of(file, line, 1, line, 20);
    }

    // ============ 变量与字面量 ============

    public LocalVariableAccess local(String name) {
        return new LocalVariableAccess(next(), name);
    }

    public InstanceVariableAccess ivar(String name) {
        return new InstanceVariableAccess(next(), name);
    }

    public ClassVariableAccess cvar(String name) {
        return new ClassVariableAccess(next(), name);
    }

    public GlobalVariableAccess gvar(String name) {
        return new GlobalVariableAccess(next(), name);
    }

    public SelfExpr self() {
        return new SelfExpr(next());
    }

    public IntegerLiteral lit(long value) {
        return new IntegerLiteral(next(), value);
    }

    public StringLiteral str(String value) {
        return new StringLiteral(next(), value);
    }

    public ConstantAccess constant(String name) {
        return new ConstantAccess(next(), name);
    }

    // ============ 调用 ============

    public MethodCall call(Expression receiver, String name, Expression... args) {
        return new MethodCall(next(), receiver, name, Arrays.asList(args), null);
    }

    /** 没有接收者的调用 foo(args) */
    public MethodCall bare(String name, Expression... args) {
        if (args.length == 0) {
            return MethodCall.identifier(next(), name);
        }
        return new MethodCall(next(), null, null, name, Arrays.asList(args), null, false);
    }

    /** 作用域限定调用 Foo::bar(args) */
    public MethodCall qualified(Expression qualifier, String name, Expression... args) {
        return new MethodCall(next(), null, qualifier, name, Arrays.asList(args), null, false);
    }

    public MethodCall callWithBlock(Expression receiver, String name, BlockExpr block) {
        return new MethodCall(next(), receiver, name, null, block);
    }

    public BlockExpr block(List<String> params, AstNode... body) {
        List<SimpleParameter> ps = new ArrayList<SimpleParameter>();
        for (String p : params) {
            ps.add(new SimpleParameter(next(), p));
        }
        return new BlockExpr(next(), ps, Arrays.asList(body));
    }

    // ============ 赋值 ============

    public AssignExpr assign(Expression left, Expression right) {
        return new AssignExpr(next(), left, right);
    }

    /** 复合赋值，运算符记号有自己的位置 */
    public AssignOperation opAssign(Expression left, AssignOp op, Expression right) {
        SourceLocation whole = next();
        SourceLocation operator = next();
        return new AssignOperation(whole, left, op, operator, right);
    }

    public DestructuredLhs lhs(Expression... elements) {
        return new DestructuredLhs(next(), Arrays.asList(elements));
    }

    public SplatExpr splat(Expression operand) {
        return new SplatExpr(next(), operand);
    }

    public ArrayLiteral array(Expression... elements) {
        return new ArrayLiteral(next(), Arrays.asList(elements));
    }

    public BinaryOperation binary(Expression left, BinaryOperation.BinaryOp op, Expression right) {
        return new BinaryOperation(next(), left, op, right);
    }

    // ============ 语句与声明 ============

    public ForExpr forLoop(Expression pattern, Expression iterable, AstNode... body) {
        StmtSequence seq = new StmtSequence(next(), Arrays.asList(body));
        return new ForExpr(next(), pattern, iterable, seq);
    }

    public MethodDef def(String name, AstNode... body) {
        return new MethodDef(next(), name, null, Arrays.asList(body));
    }

    public ClassDef cls(String name, AstNode... body) {
        return new ClassDef(next(), name, Arrays.asList(body));
    }

    public Toplevel top(AstNode... statements) {
        return new Toplevel(next(), Arrays.asList(statements));
    }

    public static RealNode n(AstNode node) {
        return SyntaxNode.of(node);
    }
}
