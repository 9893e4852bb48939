package com.gemflow.ast.expr;

import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.scope.VariableKind;

/**
 * 类变量访问（@@x）
 */
public class ClassVariableAccess extends VariableAccess {

    public ClassVariableAccess(SourceLocation location, String name) {
        super(location, name);
    }

    @Override
    public VariableKind getVariableKind() {
        return VariableKind.CLASS;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassVariableAccess(this, context);
    }
}
