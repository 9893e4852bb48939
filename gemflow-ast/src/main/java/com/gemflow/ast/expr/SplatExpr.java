package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

/**
 * 展开表达式（*x），在解构左值中操作数可以缺省
 */
public class SplatExpr extends Expression {
    private final Expression operand;

    public SplatExpr(SourceLocation location, Expression operand) {
        super(location);
        this.operand = adopt(operand, 0);
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public int getChildCount() {
        return 1;
    }

    @Override
    public AstNode getChild(int index) {
        return index == 0 ? operand : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitSplatExpr(this, context);
    }
}
