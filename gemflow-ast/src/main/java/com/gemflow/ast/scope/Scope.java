package com.gemflow.ast.scope;

import com.gemflow.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        TOPLEVEL,   // 顶层
        CLASS,      // class body
        METHOD,     // def body
        BLOCK;      // { |x| ... } / do ... end

        /** 是否拥有自己的 self */
        public boolean isSelfScope() {
            return this != BLOCK;
        }
    }

    private final ScopeType type;
    private final Scope parent;
    private final AstNode node;
    private final boolean synthetic;
    private final Map<String, Variable> variables = new LinkedHashMap<String, Variable>();
    private final List<Scope> children = new ArrayList<Scope>();
    private final Variable selfVariable;

    public Scope(ScopeType type, Scope parent, AstNode node) {
        this(type, parent, node, false);
    }

    private Scope(ScopeType type, Scope parent, AstNode node, boolean synthetic) {
        if (type != ScopeType.TOPLEVEL && parent == null) {
            throw new IllegalArgumentException(type + " scope requires a parent");
        }
        this.type = type;
        this.parent = parent;
        this.node = node;
        this.synthetic = synthetic;
        this.selfVariable = type.isSelfScope()
                ? new Variable("self", VariableKind.SELF, this, node != null ? node.getLocation() : null, node, false)
                : null;
    }

    /**
     * 创建合成块作用域：不对应任何真实节点，不登记到父作用域，也不持有真实变量。
     */
    public static Scope synthetic(Scope parent) {
        return new Scope(ScopeType.BLOCK, parent, null, true);
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }
    public AstNode getNode() { return node; }
    public boolean isSynthetic() { return synthetic; }
    public List<Scope> getChildren() { return Collections.unmodifiableList(children); }
    public Map<String, Variable> getVariables() { return Collections.unmodifiableMap(variables); }

    void addChild(Scope child) { children.add(child); }

    /** 注册变量到当前作用域 */
    public void define(Variable variable) {
        if (synthetic) {
            throw new IllegalStateException("synthetic scope cannot hold variables");
        }
        variables.put(variable.getName(), variable);
    }

    /** 仅查找当前作用域 */
    public Variable resolveLocal(String name) {
        return variables.get(name);
    }

    /**
     * 查找局部变量：穿过块作用域向上查找，直到（含）第一个非块作用域。
     */
    public Variable resolve(String name) {
        Variable v = variables.get(name);
        if (v != null) return v;
        if (type == ScopeType.BLOCK && parent != null) return parent.resolve(name);
        return null;
    }

    /** 最近的拥有 self 的作用域（自身或祖先） */
    public Scope getEnclosingSelfScope() {
        Scope s = this;
        while (!s.type.isSelfScope()) {
            s = s.parent;
        }
        return s;
    }

    /** 当前作用域可见的 self 变量 */
    public Variable getSelfVariable() {
        return getEnclosingSelfScope().selfVariable;
    }

    /** 最近的类作用域，没有时返回顶层作用域 */
    public Scope getEnclosingClassScope() {
        Scope s = this;
        while (s.type != ScopeType.CLASS && s.parent != null) {
            s = s.parent;
        }
        return s;
    }

    /** 是否为 other 本身或其（传递）父作用域 */
    public boolean encloses(Scope other) {
        for (Scope s = other; s != null; s = s.parent) {
            if (s == this) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        String where = node != null ? String.valueOf(node.getLocation()) : (synthetic ? "synthetic" : "?");
        return type + "@" + where;
    }
}
