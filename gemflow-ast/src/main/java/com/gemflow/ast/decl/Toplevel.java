package com.gemflow.ast.decl;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 顶层（编译单元）
 */
public class Toplevel extends AstNode {
    private final List<AstNode> statements;

    public Toplevel(SourceLocation location, List<? extends AstNode> statements) {
        super(location);
        this.statements = adoptAll(statements, 0);
    }

    public List<AstNode> getStatements() {
        return statements;
    }

    @Override
    public int getChildCount() {
        return statements.size();
    }

    @Override
    public AstNode getChild(int index) {
        return index >= 0 && index < statements.size() ? statements.get(index) : null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitToplevel(this, context);
    }
}
