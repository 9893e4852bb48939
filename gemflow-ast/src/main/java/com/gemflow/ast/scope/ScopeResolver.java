package com.gemflow.ast.scope;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.decl.*;
import com.gemflow.ast.expr.*;
import com.gemflow.ast.stmt.*;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 作用域解析：遍历 AST，建立作用域树并把每个变量访问绑定到变量
 *
 * <ul>
 *   <li>顶层、类体、方法体各自拥有 self；块继承外层的局部变量与 self</li>
 *   <li>for 不引入作用域，循环变量属于外层作用域</li>
 *   <li>局部变量首次出现时在当前作用域声明</li>
 * </ul>
 */
public final class ScopeResolver implements AstVisitor<Void, Void> {

    private static final Logger LOG = Logger.getLogger(ScopeResolver.class.getName());

    private final ScopeTable table;
    private Scope currentScope;

    private ScopeResolver(Toplevel root) {
        this.table = new ScopeTable(root);
        this.currentScope = table.getToplevelScope();
    }

    /** 解析入口 */
    public static ScopeTable resolve(Toplevel root) {
        ScopeResolver resolver = new ScopeResolver(root);
        root.accept(resolver, null);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Resolved scopes for " + root.getLocation().getFile()
                    + ": " + resolver.table.getToplevelScope().getChildren().size() + " nested scope(s)");
        }
        return resolver.table;
    }

    // ============ 作用域管理 ============

    private Scope enterScope(Scope.ScopeType type, AstNode node) {
        Scope scope = new Scope(type, currentScope, node);
        table.registerScope(node, scope);
        currentScope = scope;
        return scope;
    }

    private void exitScope() {
        currentScope = currentScope.getParent();
    }

    /** 记录包含作用域后访问节点 */
    private void visit(AstNode node) {
        if (node == null) return;
        table.recordEnclosing(node, currentScope);
        node.accept(this, null);
    }

    private void visitChildren(AstNode node) {
        for (int i = 0; i < node.getChildCount(); i++) {
            visit(node.getChild(i));
        }
    }

    private void declareParameter(SimpleParameter param) {
        table.recordEnclosing(param, currentScope);
        Variable v = new Variable(param.getName(), VariableKind.LOCAL, currentScope,
                param.getLocation(), param, true);
        currentScope.define(v);
        table.bind(param, v);
    }

    // ============ 声明 ============

    @Override
    public Void visitToplevel(Toplevel node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitClassDef(ClassDef node, Void ctx) {
        enterScope(Scope.ScopeType.CLASS, node);
        visitChildren(node);
        exitScope();
        return null;
    }

    @Override
    public Void visitMethodDef(MethodDef node, Void ctx) {
        enterScope(Scope.ScopeType.METHOD, node);
        for (SimpleParameter p : node.getParams()) {
            declareParameter(p);
        }
        for (AstNode stmt : node.getBody()) {
            visit(stmt);
        }
        exitScope();
        return null;
    }

    // ============ 语句 ============

    @Override
    public Void visitStmtSequence(StmtSequence node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitForExpr(ForExpr node, Void ctx) {
        visitChildren(node);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitBlockExpr(BlockExpr node, Void ctx) {
        enterScope(Scope.ScopeType.BLOCK, node);
        for (SimpleParameter p : node.getParams()) {
            declareParameter(p);
        }
        for (AstNode stmt : node.getBody()) {
            visit(stmt);
        }
        exitScope();
        return null;
    }

    @Override
    public Void visitMethodCall(MethodCall node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitAssignOperation(AssignOperation node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitBinaryOperation(BinaryOperation node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitLocalVariableAccess(LocalVariableAccess node, Void ctx) {
        Variable v = currentScope.resolve(node.getName());
        if (v == null) {
            v = new Variable(node.getName(), VariableKind.LOCAL, currentScope, node.getLocation(), node, false);
            currentScope.define(v);
        }
        table.bind(node, v);
        return null;
    }

    @Override
    public Void visitInstanceVariableAccess(InstanceVariableAccess node, Void ctx) {
        Scope owner = currentScope.getEnclosingClassScope();
        table.bind(node, lookupOrDeclare(table.instanceVariablesOf(owner), node, owner));
        return null;
    }

    @Override
    public Void visitClassVariableAccess(ClassVariableAccess node, Void ctx) {
        Scope owner = currentScope.getEnclosingClassScope();
        table.bind(node, lookupOrDeclare(table.classVariablesOf(owner), node, owner));
        return null;
    }

    @Override
    public Void visitGlobalVariableAccess(GlobalVariableAccess node, Void ctx) {
        table.bind(node, lookupOrDeclare(table.globalsMap(), node, table.getToplevelScope()));
        return null;
    }

    private static Variable lookupOrDeclare(Map<String, Variable> vars, VariableAccess access, Scope owner) {
        Variable v = vars.get(access.getName());
        if (v == null) {
            v = new Variable(access.getName(), access.getVariableKind(), owner,
                    access.getLocation(), access, false);
            vars.put(access.getName(), v);
        }
        return v;
    }

    @Override
    public Void visitSelfExpr(SelfExpr node, Void ctx) {
        table.bind(node, currentScope.getSelfVariable());
        return null;
    }

    @Override
    public Void visitConstantAccess(ConstantAccess node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitDestructuredLhs(DestructuredLhs node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitSplatExpr(SplatExpr node, Void ctx) {
        visitChildren(node);
        return null;
    }

    @Override
    public Void visitArrayLiteral(ArrayLiteral node, Void ctx) {
        visitChildren(node);
        return null;
    }
}
