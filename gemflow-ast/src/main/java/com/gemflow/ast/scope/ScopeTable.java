package com.gemflow.ast.scope;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.decl.Toplevel;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域表：一棵 {@link Toplevel} 的作用域树与节点索引
 *
 * <p>由 {@link ScopeResolver} 一次性构建，构建完成后只读，可被多个线程并发查询。</p>
 */
public final class ScopeTable {
    private final Toplevel root;
    private final Scope toplevelScope;
    // 引入作用域的节点 -> 其作用域
    private final Map<AstNode, Scope> nodeToScope = new IdentityHashMap<AstNode, Scope>();
    // 任意节点 -> 严格包含它的最内层作用域
    private final Map<AstNode, Scope> enclosingScope = new IdentityHashMap<AstNode, Scope>();
    // 变量访问 / 参数 / self -> 变量
    private final Map<AstNode, Variable> nodeToVariable = new IdentityHashMap<AstNode, Variable>();
    // 实例变量与类变量按所属类作用域分组
    private final Map<Scope, Map<String, Variable>> instanceVariables = new IdentityHashMap<Scope, Map<String, Variable>>();
    private final Map<Scope, Map<String, Variable>> classVariables = new IdentityHashMap<Scope, Map<String, Variable>>();
    private final Map<String, Variable> globals = new LinkedHashMap<String, Variable>();

    ScopeTable(Toplevel root) {
        this.root = root;
        this.toplevelScope = new Scope(Scope.ScopeType.TOPLEVEL, null, root);
        nodeToScope.put(root, toplevelScope);
    }

    public Toplevel getRoot() { return root; }
    public Scope getToplevelScope() { return toplevelScope; }
    public Map<String, Variable> getGlobals() { return Collections.unmodifiableMap(globals); }

    /**
     * 严格包含 node 的最内层作用域。
     *
     * @return 不属于本表的节点返回 null
     */
    public Scope scopeOf(AstNode node) {
        return enclosingScope.get(node);
    }

    /** 由 scopeNode 引入的作用域，scopeNode 不引入作用域时返回 null */
    public Scope getScope(AstNode scopeNode) {
        return nodeToScope.get(scopeNode);
    }

    public boolean introducesScope(AstNode node) {
        return nodeToScope.containsKey(node);
    }

    /** 变量访问、参数或 self 对应的变量 */
    public Variable getVariable(AstNode node) {
        return nodeToVariable.get(node);
    }

    /** 类（或顶层）作用域中的实例变量 */
    public Map<String, Variable> getInstanceVariables(Scope classScope) {
        Map<String, Variable> vars = instanceVariables.get(classScope);
        return vars != null ? Collections.unmodifiableMap(vars) : Collections.<String, Variable>emptyMap();
    }

    /** 类（或顶层）作用域中的类变量 */
    public Map<String, Variable> getClassVariables(Scope classScope) {
        Map<String, Variable> vars = classVariables.get(classScope);
        return vars != null ? Collections.unmodifiableMap(vars) : Collections.<String, Variable>emptyMap();
    }

    // ============ 构建（仅供 ScopeResolver） ============

    void registerScope(AstNode node, Scope scope) {
        nodeToScope.put(node, scope);
        if (scope.getParent() != null) {
            scope.getParent().addChild(scope);
        }
    }

    void recordEnclosing(AstNode node, Scope scope) {
        enclosingScope.put(node, scope);
    }

    void bind(AstNode node, Variable variable) {
        nodeToVariable.put(node, variable);
    }

    Map<String, Variable> instanceVariablesOf(Scope classScope) {
        return instanceVariables.computeIfAbsent(classScope, k -> new LinkedHashMap<String, Variable>());
    }

    Map<String, Variable> classVariablesOf(Scope classScope) {
        return classVariables.computeIfAbsent(classScope, k -> new LinkedHashMap<String, Variable>());
    }

    Map<String, Variable> globalsMap() {
        return globals;
    }
}
