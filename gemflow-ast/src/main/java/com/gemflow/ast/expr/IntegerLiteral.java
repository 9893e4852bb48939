package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

public class IntegerLiteral extends Expression {
    private final long value;

    public IntegerLiteral(SourceLocation location, long value) {
        super(location);
        this.value = value;
    }

    public long getValue() {
        return value;
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
        return visitor.visitIntegerLiteral(this, context);
    }
}
