package com.gemflow.synth.kind;

import com.gemflow.synth.SynthesisException;
import com.gemflow.synth.SynthesisRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 方法调用与常量读取种类的登记处
 *
 * <p>只有被某条规则声明需要的参数组合才能得到种类值，每个组合只有一个实例。</p>
 */
public final class KindRegistry {
    private final List<SynthesisRule> rules;
    private final ConcurrentMap<SynthKind, SynthKind> interned = new ConcurrentHashMap<SynthKind, SynthKind>();

    public KindRegistry(List<? extends SynthesisRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<SynthesisRule>(rules));
    }

    public List<SynthesisRule> getRules() {
        return rules;
    }

    /**
     * @param name   方法名，setter 不含末尾的 =
     * @param setter 是否为 setter 调用
     * @param arity  参数个数（setter 含被赋的值）
     * @throws SynthesisException UNDECLARED_KIND：没有规则需要这个组合
     */
    public SynthKind methodCall(String name, boolean setter, int arity) {
        if (!isMethodCallDeclared(name, setter, arity)) {
            throw new SynthesisException(SynthesisException.Defect.UNDECLARED_KIND,
                    "no rule declares method call kind " + name + (setter ? "=" : "") + "/" + arity);
        }
        return intern(SynthKind.methodCall(name, setter, arity));
    }

    /**
     * @throws SynthesisException UNDECLARED_KIND：没有规则需要这个常量
     */
    public SynthKind constantRead(String name) {
        if (!isConstantDeclared(name)) {
            throw new SynthesisException(SynthesisException.Defect.UNDECLARED_KIND,
                    "no rule declares constant kind " + name);
        }
        return intern(SynthKind.constantRead(name));
    }

    public boolean isMethodCallDeclared(String name, boolean setter, int arity) {
        for (SynthesisRule rule : rules) {
            if (rule.requiresMethodCall(name, setter, arity)) return true;
        }
        return false;
    }

    public boolean isConstantDeclared(String name) {
        for (SynthesisRule rule : rules) {
            if (rule.requiresConstant(name)) return true;
        }
        return false;
    }

    private SynthKind intern(SynthKind kind) {
        SynthKind existing = interned.putIfAbsent(kind, kind);
        return existing != null ? existing : kind;
    }

    /** 已登记的种类数 */
    public int size() {
        return interned.size();
    }
}
