package com.gemflow.ast.expr;

import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.scope.VariableKind;

/**
 * 全局变量访问（$x）
 */
public class GlobalVariableAccess extends VariableAccess {

    public GlobalVariableAccess(SourceLocation location, String name) {
        super(location, name);
    }

    @Override
    public VariableKind getVariableKind() {
        return VariableKind.GLOBAL;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGlobalVariableAccess(this, context);
    }
}
