package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.expr.BinaryOperation.BinaryOp;

/**
 * 复合赋值（如 x += 1、a[i] ||= v）
 */
public class AssignOperation extends Expression {
    private final Expression left;
    private final AssignOp operator;
    private final Expression right;
    /** 运算符记号本身的位置（不含左右操作数） */
    private final SourceLocation operatorLocation;

    public AssignOperation(SourceLocation location, Expression left, AssignOp operator,
                           SourceLocation operatorLocation, Expression right) {
        super(location);
        this.left = adopt(left, 0);
        this.operator = operator;
        this.operatorLocation = operatorLocation != null ? operatorLocation : location;
        this.right = adopt(right, 1);
    }

    public Expression getLeft() {
        return left;
    }

    public AssignOp getOperator() {
        return operator;
    }

    public SourceLocation getOperatorLocation() {
        return operatorLocation;
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
        return visitor.visitAssignOperation(this, context);
    }

    /**
     * 复合赋值运算符
     */
    public enum AssignOp {
        ADD_ASSIGN("+=", BinaryOp.ADD),
        SUB_ASSIGN("-=", BinaryOp.SUB),
        MUL_ASSIGN("*=", BinaryOp.MUL),
        DIV_ASSIGN("/=", BinaryOp.DIV),
        MOD_ASSIGN("%=", BinaryOp.MOD),
        POW_ASSIGN("**=", BinaryOp.POW),
        AND_ASSIGN("&&=", BinaryOp.AND),
        OR_ASSIGN("||=", BinaryOp.OR),
        LSHIFT_ASSIGN("<<=", BinaryOp.LSHIFT),
        RSHIFT_ASSIGN(">>=", BinaryOp.RSHIFT),
        BIT_AND_ASSIGN("&=", BinaryOp.BIT_AND),
        BIT_OR_ASSIGN("|=", BinaryOp.BIT_OR),
        BIT_XOR_ASSIGN("^=", BinaryOp.BIT_XOR);

        private final String source;
        private final BinaryOp binaryOp;

        AssignOp(String source, BinaryOp binaryOp) {
            this.source = source;
            this.binaryOp = binaryOp;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }

        /** 展开后使用的二元运算符 */
        public BinaryOp getBinaryOp() {
            return binaryOp;
        }
    }
}
