package com.gemflow.synth;

/**
 * 脱糖规则
 *
 * <p>规则是无状态的单例。{@link #expand} 对一个锚点声明本规则贡献的全部事实：
 * 子节点、显式位置、合成变量槽位以及控制流排除。规则之间不通过可变状态通信，
 * 只能经 {@link SynthesisContext} 查询其它节点的统一视图结构。</p>
 */
public interface SynthesisRule {

    /** 规则名，出现在冲突报告中 */
    String getName();

    /**
     * 为锚点声明事实。锚点不适用本规则时什么也不做。
     *
     * @param anchor  被展开的节点（真实或合成）
     * @param context 查询其它节点的结构；本锚点自身的展开结果对规则不可见
     * @param builder 事实收集器
     */
    void expand(SyntaxNode anchor, SynthesisContext context, ExpansionBuilder builder);

    /** 本规则是否会合成指定的方法调用种类 */
    default boolean requiresMethodCall(String name, boolean setter, int arity) {
        return false;
    }

    /** 本规则是否会合成指定的常量读取种类 */
    default boolean requiresConstant(String name) {
        return false;
    }
}
