package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.decl.SimpleParameter;

import java.util.List;

/**
 * 块（{ |x| ... } 或 do |x| ... end）
 *
 * <p>槽位：先参数，后块体语句。块引入新的作用域，但继承外层的局部变量与 self。</p>
 */
public class BlockExpr extends Expression {
    private final List<SimpleParameter> params;
    private final List<AstNode> body;

    public BlockExpr(SourceLocation location, List<SimpleParameter> params, List<? extends AstNode> body) {
        super(location);
        this.params = adoptAll(params, 0);
        this.body = adoptAll(body, this.params.size());
    }

    public List<SimpleParameter> getParams() {
        return params;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public int getChildCount() {
        return params.size() + body.size();
    }

    @Override
    public AstNode getChild(int index) {
        if (index < 0) return null;
        if (index < params.size()) return params.get(index);
        int bodyIndex = index - params.size();
        return bodyIndex < body.size() ? body.get(bodyIndex) : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBlockExpr(this, context);
    }
}
