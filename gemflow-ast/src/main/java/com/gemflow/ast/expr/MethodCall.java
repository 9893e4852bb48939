package com.gemflow.ast.expr;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.AstVisitor;
import com.gemflow.ast.SourceLocation;

import java.util.List;

/**
 * 方法调用（recv.foo(a, b) { ... }、Foo::bar()、foo）
 *
 * <p>槽位：0 = 接收者或作用域限定（两者都缺省时为空），1..n = 实参，n+1 = 块。</p>
 */
public class MethodCall extends Expression {
    private final Expression receiver;
    private final Expression scopeQualifier;
    private final String name;
    private final List<Expression> args;
    private final BlockExpr block;
    private final boolean identifierCall;  // 形如 foo 的裸标识符调用

    public MethodCall(SourceLocation location, Expression receiver, String name,
                      List<? extends Expression> args, BlockExpr block) {
        this(location, receiver, null, name, args, block, false);
    }

    public MethodCall(SourceLocation location, Expression receiver, Expression scopeQualifier,
                      String name, List<? extends Expression> args, BlockExpr block,
                      boolean identifierCall) {
        super(location);
        if (receiver != null && scopeQualifier != null) {
            throw new IllegalArgumentException("method call cannot have both receiver and scope qualifier");
        }
        this.receiver = adopt(receiver, 0);
        this.scopeQualifier = adopt(scopeQualifier, 0);
        this.name = name;
        this.args = adoptAll(args, 1);
        this.block = adopt(block, this.args.size() + 1);
        this.identifierCall = identifierCall;
    }

    /** 裸标识符调用：foo */
    public static MethodCall identifier(SourceLocation location, String name) {
        return new MethodCall(location, null, null, name, null, null, true);
    }

    public Expression getReceiver() {
        return receiver;
    }

    public Expression getScopeQualifier() {
        return scopeQualifier;
    }

    public boolean hasExplicitReceiver() {
        return receiver != null || scopeQualifier != null;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Expression getArg(int index) {
        return index >= 0 && index < args.size() ? args.get(index) : null;
    }

    public BlockExpr getBlock() {
        return block;
    }

    public boolean isIdentifierCall() {
        return identifierCall;
    }

    @Override
    public int getChildCount() {
        return args.size() + 2;
    }

    @Override
    public AstNode getChild(int index) {
        if (index == 0) return receiver != null ? receiver : scopeQualifier;
        if (index >= 1 && index <= args.size()) return args.get(index - 1);
        if (index == args.size() + 1) return block;
        return null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCall(this, context);
    }
}
