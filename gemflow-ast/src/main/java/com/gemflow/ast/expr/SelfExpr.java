package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

/**
 * self 表达式
 */
public class SelfExpr extends Expression {

    public SelfExpr(SourceLocation location) {
        super(location);
    }

    @Override
    public int getChildCount() {
        return 0;
    }

    @Override
    public AstNode getChild(int index) {
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSelfExpr(this, context);
    }
}
