package com.gemflow.ast.stmt;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.expr.Expression;

/**
 * For 循环（for x in xs ... end）
 *
 * <p>槽位：0 = 模式，1 = 被迭代的值，2 = 循环体。for 不引入新的作用域。</p>
 */
public class ForExpr extends Expression {
    private final Expression pattern;   // 变量访问或解构左值
    private final Expression iterable;
    private final StmtSequence body;

    public ForExpr(SourceLocation location, Expression pattern, Expression iterable, StmtSequence body) {
        super(location);
        this.pattern = adopt(pattern, 0);
        this.iterable = adopt(iterable, 1);
        this.body = adopt(body, 2);
    }

    public Expression getPattern() {
        return pattern;
    }

    public Expression getIterable() {
        return iterable;
    }

    public StmtSequence getBody() {
        return body;
    }

    @Override
    public int getChildCount() {
        return 3;
    }

    @Override
    public AstNode getChild(int index) {
        switch (index) {
            case 0: return pattern;
            case 1: return iterable;
            case 2: return body;
            default: return null;
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForExpr(this, context);
    }
}
