package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

/**
 * 常量访问（Foo、A::B、::Array）
 *
 * <p>槽位：0 = 作用域表达式（可为空）。</p>
 */
public class ConstantAccess extends Expression {
    private final String name;
    private final Expression scope;

    public ConstantAccess(SourceLocation location, String name) {
        this(location, name, null);
    }

    public ConstantAccess(SourceLocation location, String name, Expression scope) {
        super(location);
        this.name = name;
        this.scope = adopt(scope, 0);
    }

    public String getName() {
        return name;
    }

    public Expression getScope() {
        return scope;
    }

    @Override
    public int getChildCount() {
        return 1;
    }

    @Override
    public AstNode getChild(int index) {
        return index == 0 ? scope : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConstantAccess(this, context);
    }
}
