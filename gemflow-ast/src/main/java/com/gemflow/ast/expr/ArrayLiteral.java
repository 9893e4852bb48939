package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 数组字面量 [a, b, c]
 */
public class ArrayLiteral extends Expression {
    private final List<Expression> elements;

    public ArrayLiteral(SourceLocation location, List<? extends Expression> elements) {
        super(location);
        this.elements = adoptAll(elements, 0);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public int getChildCount() {
        return elements.size();
    }

    @Override
    public AstNode getChild(int index) {
        return index >= 0 && index < elements.size() ? elements.get(index) : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitArrayLiteral(this, context);
    }
}
