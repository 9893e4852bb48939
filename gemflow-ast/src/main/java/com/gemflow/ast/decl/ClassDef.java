package com.gemflow.ast.decl;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 类定义（class Foo ... end）
 */
public class ClassDef extends AstNode {
    private final String name;
    private final List<AstNode> body;

    public ClassDef(SourceLocation location, String name, List<? extends AstNode> body) {
        super(location);
        this.name = name;
        this.body = adoptAll(body, 0);
    }

    public String getName() {
        return name;
    }

    public List<AstNode> getBody() {
        return body;
    }

    @Override
    public int getChildCount() {
        return body.size();
    }

    @Override
    public AstNode getChild(int index) {
        return index >= 0 && index < body.size() ? body.get(index) : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitClassDef(this, context);
    }
}
