package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;
import com.gemflow.synth.SynthesisException.Defect;
import com.gemflow.synth.kind.SynthKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 收集一条规则对一个锚点声明的事实
 *
 * <p>事实只能落在锚点或锚点的合成后代上。同一规则在同一槽位声明两次不同的子节点
 * 视为规则冲突。</p>
 */
public final class ExpansionBuilder {
    private final SyntaxNode anchor;
    private final String rule;
    private final int priority;
    private final Map<SyntaxNode, SortedMap<Integer, ChildFact>> children =
            new LinkedHashMap<SyntaxNode, SortedMap<Integer, ChildFact>>();
    private final Map<SyntaxNode, LocationFact> locations = new LinkedHashMap<SyntaxNode, LocationFact>();
    private final Map<SyntaxNode, List<SynthVariable>> variables = new LinkedHashMap<SyntaxNode, List<SynthVariable>>();
    private final Set<AstNode> excluded = Collections.newSetFromMap(new IdentityHashMap<AstNode, Boolean>());

    public ExpansionBuilder(SyntaxNode anchor, String rule, int priority) {
        this.anchor = anchor;
        this.rule = rule;
        this.priority = priority;
    }

    public SyntaxNode getAnchor() {
        return anchor;
    }

    /**
     * 在 (parent, index) 处合成一个新节点
     *
     * @return 新节点的地址
     */
    public SynthNode synth(SyntaxNode parent, int index, SynthKind kind) {
        addChild(parent, index, Child.synth(kind));
        return new SynthNode(parent, index, kind);
    }

    /**
     * 在 (parent, index) 处引用一个已存在的节点
     *
     * @throws SynthesisException DANGLING_REFERENCE：目标为 null
     */
    public void ref(SyntaxNode parent, int index, SyntaxNode target) {
        if (target == null) {
            throw new SynthesisException(Defect.DANGLING_REFERENCE,
                    rule + " references a missing node at " + parent + "[" + index + "]", realLocation(parent));
        }
        addChild(parent, index, Child.ref(target));
    }

    /** 为节点指定固定位置 */
    public void location(SyntaxNode node, SourceLocation location) {
        if (location == null) {
            throw new SynthesisException(Defect.UNRESOLVABLE_LOCATION,
                    rule + " declares a null location for " + node, realLocation(node));
        }
        addLocation(LocationFact.fixed(checkOwned(node), location, rule, priority));
    }

    /** 节点的位置与 source 相同，查询时解析 */
    public void locationOf(SyntaxNode node, SyntaxNode source) {
        if (source == null) {
            throw new SynthesisException(Defect.DANGLING_REFERENCE,
                    rule + " takes the location of a missing node for " + node, realLocation(node));
        }
        addLocation(LocationFact.sameAs(checkOwned(node), source, rule, priority));
    }

    /** 在节点上声明合成变量槽位 */
    public SynthVariable declareVariable(SyntaxNode node, int slot) {
        SynthVariable variable = new SynthVariable(checkOwned(node), slot);
        List<SynthVariable> vars = variables.get(node);
        if (vars == null) {
            vars = new ArrayList<SynthVariable>();
            variables.put(node, vars);
        }
        if (!vars.contains(variable)) {
            vars.add(variable);
        }
        return variable;
    }

    /** 把真实节点排除出控制流 */
    public void exclude(SyntaxNode node) {
        if (node == null || node.isSynthetic()) {
            throw new IllegalArgumentException("only real nodes can be excluded from control flow: " + node);
        }
        excluded.add(node.getAstNode());
    }

    public Expansion build() {
        Map<SyntaxNode, SortedMap<Integer, ChildFact>> frozenChildren =
                new LinkedHashMap<SyntaxNode, SortedMap<Integer, ChildFact>>();
        for (Map.Entry<SyntaxNode, SortedMap<Integer, ChildFact>> e : children.entrySet()) {
            frozenChildren.put(e.getKey(), Collections.unmodifiableSortedMap(e.getValue()));
        }
        Map<SyntaxNode, List<SynthVariable>> frozenVariables = new LinkedHashMap<SyntaxNode, List<SynthVariable>>();
        for (Map.Entry<SyntaxNode, List<SynthVariable>> e : variables.entrySet()) {
            frozenVariables.put(e.getKey(), Collections.unmodifiableList(new ArrayList<SynthVariable>(e.getValue())));
        }
        Set<AstNode> frozenExcluded = Collections.newSetFromMap(new IdentityHashMap<AstNode, Boolean>());
        frozenExcluded.addAll(excluded);
        return new Expansion(anchor, rule, priority,
                Collections.unmodifiableMap(frozenChildren),
                Collections.unmodifiableMap(new LinkedHashMap<SyntaxNode, LocationFact>(locations)),
                Collections.unmodifiableMap(frozenVariables),
                Collections.unmodifiableSet(frozenExcluded));
    }

    // ============ 内部 ============

    private void addChild(SyntaxNode parent, int index, Child child) {
        checkOwned(parent);
        SortedMap<Integer, ChildFact> facts = children.get(parent);
        if (facts == null) {
            facts = new TreeMap<Integer, ChildFact>();
            children.put(parent, facts);
        }
        ChildFact existing = facts.get(index);
        if (existing != null) {
            if (existing.getChild().equals(child)) return;
            throw new SynthesisException(Defect.RULE_CONFLICT,
                    rule + " declares two children at " + parent + "[" + index + "]: "
                            + existing.getChild() + " and " + child, realLocation(parent));
        }
        facts.put(index, new ChildFact(parent, index, child, rule, priority));
    }

    private void addLocation(LocationFact fact) {
        LocationFact existing = locations.get(fact.getNode());
        if (existing != null && !existing.sameTarget(fact)) {
            throw new SynthesisException(Defect.RULE_CONFLICT,
                    rule + " declares two locations for " + fact.getNode(), realLocation(fact.getNode()));
        }
        locations.put(fact.getNode(), fact);
    }

    /** 事实只能落在锚点或其合成后代上 */
    private SyntaxNode checkOwned(SyntaxNode node) {
        if (node == null) {
            throw new IllegalArgumentException("node must not be null");
        }
        if (node.equals(anchor)) return node;
        if (node.isSynthetic() && ((SynthNode) node).hasAddressPrefix(anchor)) return node;
        throw new IllegalArgumentException(rule + " cannot declare facts on " + node
                + " while expanding " + anchor);
    }

    private static SourceLocation realLocation(SyntaxNode node) {
        return node != null ? node.getRealRoot().getAstNode().getLocation() : null;
    }
}
