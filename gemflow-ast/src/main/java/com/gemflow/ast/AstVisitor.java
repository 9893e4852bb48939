package com.gemflow.ast;

import com.gemflow.ast.decl.*;
import com.gemflow.ast.expr.*;
import com.gemflow.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitToplevel(Toplevel node, C ctx) { return null; }

    default R visitClassDef(ClassDef node, C ctx) { return null; }

    default R visitMethodDef(MethodDef node, C ctx) { return null; }

    default R visitSimpleParameter(SimpleParameter node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitStmtSequence(StmtSequence node, C ctx) { return null; }

    default R visitForExpr(ForExpr node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitMethodCall(MethodCall node, C ctx) { return null; }

    default R visitBlockExpr(BlockExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitAssignOperation(AssignOperation node, C ctx) { return null; }

    default R visitBinaryOperation(BinaryOperation node, C ctx) { return null; }

    default R visitLocalVariableAccess(LocalVariableAccess node, C ctx) { return null; }

    default R visitInstanceVariableAccess(InstanceVariableAccess node, C ctx) { return null; }

    default R visitClassVariableAccess(ClassVariableAccess node, C ctx) { return null; }

    default R visitGlobalVariableAccess(GlobalVariableAccess node, C ctx) { return null; }

    default R visitSelfExpr(SelfExpr node, C ctx) { return null; }

    default R visitConstantAccess(ConstantAccess node, C ctx) { return null; }

    default R visitDestructuredLhs(DestructuredLhs node, C ctx) { return null; }

    default R visitSplatExpr(SplatExpr node, C ctx) { return null; }

    default R visitArrayLiteral(ArrayLiteral node, C ctx) { return null; }

    default R visitIntegerLiteral(IntegerLiteral node, C ctx) { return null; }

    default R visitStringLiteral(StringLiteral node, C ctx) { return null; }
}
