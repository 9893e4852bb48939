package com.gemflow.ast.decl;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

/**
 * 简单参数（方法或块参数）
 */
public class SimpleParameter extends AstNode {
    private final String name;

    public SimpleParameter(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
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
        return visitor.visitSimpleParameter(this, context);
    }
}
