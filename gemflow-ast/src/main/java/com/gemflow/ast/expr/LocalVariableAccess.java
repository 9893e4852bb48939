package com.gemflow.ast.expr;

import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.scope.VariableKind;

/**
 * 局部变量访问（x）
 */
public class LocalVariableAccess extends VariableAccess {

    public LocalVariableAccess(SourceLocation location, String name) {
        super(location, name);
    }

    @Override
    public VariableKind getVariableKind() {
        return VariableKind.LOCAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLocalVariableAccess(this, context);
    }
}
