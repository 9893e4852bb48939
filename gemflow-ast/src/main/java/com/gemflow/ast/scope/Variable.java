package com.gemflow.ast.scope;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;

/**
 * 变量
 *
 * <p>解析器产生的变量由 (种类, 名字, 首次出现的节点) 确定，对同一棵 AST 重复做作用域解析
 * 得到相等的变量；self 的首次出现节点是拥有它的作用域节点。没有声明节点的变量按对象身份比较。
 * 合成变量（由脱糖引入的临时变量）覆盖 {@code equals}/{@code hashCode}。</p>
 */
public class Variable {
    private final String name;
    private final VariableKind kind;
    private final Scope scope;              // 声明所在作用域，合成变量为 null
    private final SourceLocation location;  // 首次出现位置
    private final AstNode declaration;      // 首次出现的节点
    private final boolean parameter;

    public Variable(String name, VariableKind kind, Scope scope,
                    SourceLocation location, AstNode declaration, boolean parameter) {
        this.name = name;
        this.kind = kind;
        this.scope = scope;
        this.location = location;
        this.declaration = declaration;
        this.parameter = parameter;
    }

    public String getName() { return name; }
    public VariableKind getKind() { return kind; }
    public Scope getScope() { return scope; }
    public SourceLocation getLocation() { return location; }
    public AstNode getDeclaration() { return declaration; }
    public boolean isParameter() { return parameter; }

    /** 是否由脱糖合成 */
    public boolean isSynthetic() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable that = (Variable) o;
        if (declaration == null || isSynthetic() || that.isSynthetic()) return false;
        return kind == that.kind
                && declaration == that.declaration
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        if (declaration == null) return System.identityHashCode(this);
        return 31 * (31 * kind.hashCode() + name.hashCode()) + System.identityHashCode(declaration);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " " + name;
    }
}
