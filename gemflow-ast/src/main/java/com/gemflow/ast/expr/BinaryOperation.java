package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

/**
 * 二元运算（槽位：0 = 左操作数，1 = 右操作数）
 */
public class BinaryOperation extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryOperation(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = adopt(left, 0);
        this.operator = operator;
        this.right = adopt(right, 1);
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public int getChildCount() {
        return 2;
    }

    @Override
    public AstNode getChild(int index) {
        switch (index) {
            case 0: return left;
            case 1: return right;
            default: return null;
        }
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryOperation(this, context);
    }

    /**
     * 二元运算符
     */
    public enum BinaryOp {
        // 算术
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        POW("**"),

        // 位运算
        LSHIFT("<<"),
        RSHIFT(">>"),
        BIT_AND("&"),
        BIT_OR("|"),
        BIT_XOR("^"),

        // 逻辑
        AND("&&"),
        OR("||");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
