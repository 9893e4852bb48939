package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

/**
 * 简单赋值（槽位：0 = 左值，1 = 右值）
 *
 * <p>左值可以是变量访问、方法调用（属性/下标赋值）或解构左值。</p>
 */
public class AssignExpr extends Expression {
    private final Expression left;
    private final Expression right;

    public AssignExpr(SourceLocation location, Expression left, Expression right) {
        super(location);
        this.left = adopt(left, 0);
        this.right = adopt(right, 1);
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public int getChildCount() {
        return 2;
    }

    @Override
    public AstNode getChild(int index) {
        switch (index) {
            case 0: return left;
            case 1: return right;
            default: return null;
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
