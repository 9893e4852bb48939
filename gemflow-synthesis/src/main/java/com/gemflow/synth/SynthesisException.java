package com.gemflow.synth;

import com.gemflow.ast.SourceLocation;

/**
 * 合成异常：规则集或查询违反了合成树的一致性约束
 */
public class SynthesisException extends RuntimeException {

    /**
     * 缺陷类别
     */
    public enum Defect {
        RULE_CONFLICT,          // 同一槽位有多个不同的事实
        DANGLING_REFERENCE,     // 引用了不存在的节点
        UNRESOLVABLE_LOCATION,  // 位置无法解析（循环的“同位置于”事实）
        MISSING_SCOPE,          // 节点没有可用的作用域
        UNDECLARED_KIND,        // 使用了没有规则声明需要的节点种类
        CYCLIC_EXPANSION        // 同一线程重入某个锚点的展开
    }

    private final Defect defect;
    private final SourceLocation location;

    public SynthesisException(Defect defect, String message) {
        this(defect, message, null);
    }

    public SynthesisException(Defect defect, String message, SourceLocation location) {
        super(message);
        this.defect = defect;
        this.location = location;
    }

    public Defect getDefect() {
        return defect;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(defect).append("] ").append(super.getMessage());
        if (location != null) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
