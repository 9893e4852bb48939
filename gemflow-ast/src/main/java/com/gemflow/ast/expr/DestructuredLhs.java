package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 解构赋值的左值（a, *b, c = ...）
 *
 * <p>至多包含一个 {@link SplatExpr} 元素，元素可以嵌套解构。</p>
 */
public class DestructuredLhs extends Expression {
    private final List<Expression> elements;

    public DestructuredLhs(SourceLocation location, List<? extends Expression> elements) {
        super(location);
        int splats = 0;
        if (elements != null) {
            for (Expression e : elements) {
                if (e instanceof SplatExpr) splats++;
            }
        }
        if (splats > 1) {
            throw new IllegalArgumentException("destructuring allows at most one splat element");
        }
        this.elements = adoptAll(elements, 0);
    }

    public List<Expression> getElements() {
        return elements;
    }

    /** 剩余元素的位置：唯一 splat 元素的下标，没有 splat 时为元素个数 */
    public int getRestIndex() {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i) instanceof SplatExpr) return i;
        }
        return elements.size();
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
        return visitor.visitDestructuredLhs(this, context);
    }
}
