package com.gemflow.ast.expr;

import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.scope.VariableKind;

/**
 * 实例变量访问（@x），归属最近的类作用域
 */
public class InstanceVariableAccess extends VariableAccess {

    public InstanceVariableAccess(SourceLocation location, String name) {
        super(location, name);
    }

    @Override
    public VariableKind getVariableKind() {
        return VariableKind.INSTANCE;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitInstanceVariableAccess(this, context);
    }
}
