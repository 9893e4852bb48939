package com.gemflow.synth;

import com.gemflow.ast.scope.Scope;
import com.gemflow.ast.scope.ScopeTable;
import com.gemflow.ast.scope.Variable;
import com.gemflow.synth.kind.KindRegistry;

/**
 * 规则展开时可用的统一视图查询
 *
 * <p>所有子节点查询都包含其它规则合成的结构（例如隐式 self 接收者），
 * 但不包含正在展开的锚点自身的展开结果。</p>
 */
public interface SynthesisContext {

    /** 统一视图中的子节点，不存在时返回 null */
    SyntaxNode child(SyntaxNode node, int index);

    /** 赋值、复合赋值或二元运算的左操作数 */
    default SyntaxNode leftOperand(SyntaxNode node) {
        return child(node, 0);
    }

    /** 赋值、复合赋值或二元运算的右操作数 */
    default SyntaxNode rightOperand(SyntaxNode node) {
        return child(node, 1);
    }

    /** 方法调用的接收者（可能是合成的 self） */
    default SyntaxNode receiver(SyntaxNode call) {
        return child(call, 0);
    }

    /** 方法调用的实参个数（不含块） */
    int argumentCount(SyntaxNode call);

    /** 第 i 个实参 */
    default SyntaxNode argument(SyntaxNode call, int i) {
        return child(call, i + 1);
    }

    /** 方法调用的方法名（setter 不含末尾的 =） */
    String methodName(SyntaxNode call);

    /** 真实的简单赋值或合成的 ASSIGN */
    boolean isAssignment(SyntaxNode node);

    /** 真实或合成的方法调用 */
    boolean isMethodCall(SyntaxNode node);

    /** 变量访问或 self 对应的变量 */
    Variable variableOf(SyntaxNode node);

    /** 节点所在作用域 */
    Scope scopeOf(SyntaxNode node);

    KindRegistry kinds();

    ScopeTable scopes();
}
