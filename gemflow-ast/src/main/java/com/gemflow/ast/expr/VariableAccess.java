package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.scope.VariableKind;

/**
 * 变量访问基类（读或写由所在位置决定）
 */
public abstract class VariableAccess extends Expression {
    protected final String name;

    protected VariableAccess(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** 被访问变量的种类 */
    public abstract VariableKind getVariableKind();

    @Override
    public int getChildCount() {
        return 0;
    }

    @Override
    public AstNode getChild(int index) {
        return null;
    }
}
