package com.gemflow.synth.kind;

import com.gemflow.ast.expr.BinaryOperation.BinaryOp;
import com.gemflow.ast.scope.Variable;

import java.util.Objects;

/**
 * 合成节点种类：标签加参数的不可变值
 *
 * <p>方法调用与常量读取的种类必须经 {@link KindRegistry} 获取，其余种类可直接构造。</p>
 */
public final class SynthKind {

    public enum Tag {
        BINARY_OPERATION,
        ASSIGN,
        BRACE_BLOCK,
        STMT_SEQUENCE,
        SIMPLE_PARAMETER,
        SPLAT,
        LOCAL_VARIABLE_ACCESS,
        INSTANCE_VARIABLE_ACCESS,
        CLASS_VARIABLE_ACCESS,
        GLOBAL_VARIABLE_ACCESS,
        SELF,
        INTEGER_LITERAL,
        RANGE_LITERAL,
        METHOD_CALL,
        CONSTANT_READ;

        public boolean isVariableAccess() {
            switch (this) {
                case LOCAL_VARIABLE_ACCESS:
                case INSTANCE_VARIABLE_ACCESS:
                case CLASS_VARIABLE_ACCESS:
                case GLOBAL_VARIABLE_ACCESS:
                case SELF:
                    return true;
                default:
                    return false;
            }
        }
    }

    /** 合成整数字面量的取值范围 */
    public static final int MIN_INTEGER = -1000;
    public static final int MAX_INTEGER = 1000;

    private static final SynthKind ASSIGN = new SynthKind(Tag.ASSIGN, null, null, false, 0, null);
    private static final SynthKind BRACE_BLOCK = new SynthKind(Tag.BRACE_BLOCK, null, null, false, 0, null);
    private static final SynthKind STMT_SEQUENCE = new SynthKind(Tag.STMT_SEQUENCE, null, null, false, 0, null);
    private static final SynthKind SIMPLE_PARAMETER = new SynthKind(Tag.SIMPLE_PARAMETER, null, null, false, 0, null);
    private static final SynthKind SPLAT = new SynthKind(Tag.SPLAT, null, null, false, 0, null);

    private final Tag tag;
    private final BinaryOp operator;
    private final String name;
    private final boolean flag;     // 方法调用：是否 setter；范围：是否闭区间
    private final int number;       // 方法调用：参数个数；整数字面量：值
    private final Variable variable;
    private final int hash;

    private SynthKind(Tag tag, BinaryOp operator, String name, boolean flag, int number, Variable variable) {
        this.tag = tag;
        this.operator = operator;
        this.name = name;
        this.flag = flag;
        this.number = number;
        this.variable = variable;
        this.hash = Objects.hash(tag, operator, name, flag, number, variable);
    }

    // ============ 工厂方法 ============

    public static SynthKind binaryOperation(BinaryOp operator) {
        return new SynthKind(Tag.BINARY_OPERATION, Objects.requireNonNull(operator, "operator"), null, false, 0, null);
    }

    public static SynthKind assign() { return ASSIGN; }
    public static SynthKind braceBlock() { return BRACE_BLOCK; }
    public static SynthKind stmtSequence() { return STMT_SEQUENCE; }
    public static SynthKind simpleParameter() { return SIMPLE_PARAMETER; }
    public static SynthKind splat() { return SPLAT; }

    public static SynthKind localVariableAccess(Variable variable) {
        return access(Tag.LOCAL_VARIABLE_ACCESS, variable);
    }

    public static SynthKind instanceVariableAccess(Variable variable) {
        return access(Tag.INSTANCE_VARIABLE_ACCESS, variable);
    }

    public static SynthKind classVariableAccess(Variable variable) {
        return access(Tag.CLASS_VARIABLE_ACCESS, variable);
    }

    public static SynthKind globalVariableAccess(Variable variable) {
        return access(Tag.GLOBAL_VARIABLE_ACCESS, variable);
    }

    public static SynthKind self(Variable selfVariable) {
        return access(Tag.SELF, selfVariable);
    }

    /** 按变量种类选择对应的访问种类 */
    public static SynthKind variableAccess(Variable variable) {
        Objects.requireNonNull(variable, "variable");
        switch (variable.getKind()) {
            case LOCAL: return localVariableAccess(variable);
            case INSTANCE: return instanceVariableAccess(variable);
            case CLASS: return classVariableAccess(variable);
            case GLOBAL: return globalVariableAccess(variable);
            case SELF: return self(variable);
            default: throw new IllegalArgumentException("Unknown variable kind: " + variable.getKind());
        }
    }

    private static SynthKind access(Tag tag, Variable variable) {
        return new SynthKind(tag, null, null, false, 0, Objects.requireNonNull(variable, "variable"));
    }

    /**
     * @throws IllegalArgumentException 值超出 [{@value #MIN_INTEGER}, {@value #MAX_INTEGER}]
     */
    public static SynthKind integerLiteral(int value) {
        if (value < MIN_INTEGER || value > MAX_INTEGER) {
            throw new IllegalArgumentException("synthesized integer literal out of range: " + value);
        }
        return new SynthKind(Tag.INTEGER_LITERAL, null, null, false, value, null);
    }

    public static SynthKind rangeLiteral(boolean inclusive) {
        return new SynthKind(Tag.RANGE_LITERAL, null, null, inclusive, 0, null);
    }

    static SynthKind methodCall(String name, boolean setter, int arity) {
        if (arity < 0) {
            throw new IllegalArgumentException("arity must not be negative: " + arity);
        }
        return new SynthKind(Tag.METHOD_CALL, null, Objects.requireNonNull(name, "name"), setter, arity, null);
    }

    static SynthKind constantRead(String name) {
        return new SynthKind(Tag.CONSTANT_READ, null, Objects.requireNonNull(name, "name"), false, 0, null);
    }

    // ============ 访问器 ============

    public Tag getTag() { return tag; }
    public BinaryOp getOperator() { return operator; }

    /** 方法名（setter 不含末尾的 =）或常量名 */
    public String getName() { return name; }

    public boolean isSetter() { return tag == Tag.METHOD_CALL && flag; }
    public int getArity() { return tag == Tag.METHOD_CALL ? number : 0; }
    public int getIntegerValue() { return tag == Tag.INTEGER_LITERAL ? number : 0; }
    public boolean isInclusive() { return tag == Tag.RANGE_LITERAL && flag; }
    public Variable getVariable() { return variable; }

    /** 实际调用的方法名：setter 为 name + "=" */
    public String getCalledMethodName() {
        if (tag != Tag.METHOD_CALL) return null;
        return flag ? name + "=" : name;
    }

    public boolean isMethodCall() { return tag == Tag.METHOD_CALL; }
    public boolean isAssign() { return tag == Tag.ASSIGN; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SynthKind)) return false;
        SynthKind that = (SynthKind) o;
        return hash == that.hash
                && tag == that.tag
                && operator == that.operator
                && flag == that.flag
                && number == that.number
                && Objects.equals(name, that.name)
                && Objects.equals(variable, that.variable);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        switch (tag) {
            case BINARY_OPERATION: return "BinaryOperation(" + operator.toSourceString() + ")";
            case METHOD_CALL: return "MethodCall(" + getCalledMethodName() + ", " + number + ")";
            case CONSTANT_READ: return "ConstantRead(" + name + ")";
            case INTEGER_LITERAL: return "IntegerLiteral(" + number + ")";
            case RANGE_LITERAL: return flag ? "RangeLiteral(..)" : "RangeLiteral(...)";
            case LOCAL_VARIABLE_ACCESS:
            case INSTANCE_VARIABLE_ACCESS:
            case CLASS_VARIABLE_ACCESS:
            case GLOBAL_VARIABLE_ACCESS:
            case SELF:
                return tag + "(" + variable.getName() + ")";
            default:
                return tag.name();
        }
    }
}
