package com.gemflow.ast.decl;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 方法定义（def foo(a, b) ... end）
 *
 * <p>槽位：先参数，后方法体语句。</p>
 */
public class MethodDef extends AstNode {
    private final String name;
    private final List<SimpleParameter> params;
    private final List<AstNode> body;

    public MethodDef(SourceLocation location, String name,
                     List<SimpleParameter> params, List<? extends AstNode> body) {
        super(location);
        this.name = name;
        this.params = adoptAll(params, 0);
        this.body = adoptAll(body, this.params.size());
    }

    public String getName() {
        return name;
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
        return visitor.visitMethodDef(this, context);
    }
}
