package com.gemflow.ast.stmt;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 语句序列（如 do ... end 中的语句，或循环体）
 */
public class StmtSequence extends AstNode {
    private final List<AstNode> statements;

    public StmtSequence(SourceLocation location, List<? extends AstNode> statements) {
        super(location);
        this.statements = adoptAll(statements, 0);
    }

    public List<AstNode> getStatements() {
        return statements;
    }

    public AstNode getStatement(int index) {
        return getChild(index);
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
        return visitor.visitStmtSequence(this, context);
    }
}
