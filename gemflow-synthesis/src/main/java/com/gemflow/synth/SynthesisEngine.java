package com.gemflow.synth;

import com.gemflow.ast.AstNode;
import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.decl.Toplevel;
import com.gemflow.ast.expr.AssignExpr;
import com.gemflow.ast.expr.MethodCall;
import com.gemflow.ast.scope.Scope;
import com.gemflow.ast.scope.ScopeResolver;
import com.gemflow.ast.scope.ScopeTable;
import com.gemflow.ast.scope.Variable;
import com.gemflow.synth.SynthesisException.Defect;
import com.gemflow.synth.cache.BoundedCache;
import com.gemflow.synth.cache.CacheStats;
import com.gemflow.synth.cache.CaffeineCache;
import com.gemflow.synth.kind.KindRegistry;
import com.gemflow.synth.kind.SynthKind;
import com.gemflow.synth.rule.SynthesisRules;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 合成引擎：在真实 AST 之上按规则惰性构造统一视图
 *
 * <p>节点 P 的事实是其地址链（P、P 的合成父节点……直到第一个真实节点）上
 * 每个锚点展开结果的并集；真实节点另外带有解析产生的子节点。
 * 展开结果按锚点缓存，所有查询线程安全。</p>
 */
public final class SynthesisEngine {

    private static final Logger LOG = Logger.getLogger(SynthesisEngine.class.getName());

    private static final Comparator<ChildFact> CHILD_ORDER = new Comparator<ChildFact>() {
        @Override
        public int compare(ChildFact a, ChildFact b) {
            return Integer.compare(a.getPriority(), b.getPriority());
        }
    };

    private static final Comparator<LocationFact> LOCATION_ORDER = new Comparator<LocationFact>() {
        @Override
        public int compare(LocationFact a, LocationFact b) {
            return Integer.compare(a.getPriority(), b.getPriority());
        }
    };

    private final Toplevel root;
    private final ScopeTable scopes;
    private final List<SynthesisRule> rules;
    private final KindRegistry kinds;
    private final SynthesisConfig config;

    private final BoundedCache<SyntaxNode, List<Expansion>> expansionCache;
    // 真实祖先 -> 其合成子树中的引用索引
    private final BoundedCache<SyntaxNode, ReferenceIndex> referenceCache;
    private final ConcurrentMap<SynthNode, Scope> syntheticScopes = new ConcurrentHashMap<SynthNode, Scope>();
    private final Set<String> reportedConflicts = ConcurrentHashMap.newKeySet();
    private final ThreadLocal<Set<SyntaxNode>> inProgress = ThreadLocal.withInitial(HashSet::new);

    public SynthesisEngine(Toplevel root, ScopeTable scopes, List<? extends SynthesisRule> rules,
                           SynthesisConfig config) {
        if (root == null || scopes == null || rules == null || config == null) {
            throw new IllegalArgumentException("root, scopes, rules and config are required");
        }
        this.root = root;
        this.scopes = scopes;
        this.rules = Collections.unmodifiableList(new ArrayList<SynthesisRule>(rules));
        this.kinds = new KindRegistry(this.rules);
        this.config = config;
        if (config.isCacheEnabled()) {
            this.expansionCache = new CaffeineCache<SyntaxNode, List<Expansion>>(config.getCacheMaximumSize());
            this.referenceCache = new CaffeineCache<SyntaxNode, ReferenceIndex>(config.getCacheMaximumSize());
        } else {
            this.expansionCache = BoundedCache.disabled();
            this.referenceCache = BoundedCache.disabled();
        }
    }

    /** 使用标准规则集与默认配置 */
    public static SynthesisEngine create(Toplevel root) {
        return create(root, SynthesisConfig.defaults());
    }

    public static SynthesisEngine create(Toplevel root, SynthesisConfig config) {
        return new SynthesisEngine(root, ScopeResolver.resolve(root), SynthesisRules.standard(), config);
    }

    public Toplevel getRoot() { return root; }
    public ScopeTable getScopeTable() { return scopes; }
    public List<SynthesisRule> getRules() { return rules; }
    public KindRegistry getKinds() { return kinds; }
    public SynthesisConfig getConfig() { return config; }

    public RealNode node(AstNode node) {
        return SyntaxNode.of(node);
    }

    // ============ 子节点 ============

    /** 非负槽位上的子节点，按槽位升序 */
    public List<SyntaxNode> children(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<SyntaxNode>();
        for (Map.Entry<Integer, List<ChildFact>> e : allChildFacts(node, null).entrySet()) {
            if (e.getKey() < 0) continue;
            result.add(pick(node, e.getKey(), e.getValue()).resolve());
        }
        return result;
    }

    /** 指定槽位的子节点，不存在时返回 null */
    public SyntaxNode child(SyntaxNode node, int index) {
        ChildFact fact = pick(node, index, collectChildFacts(node, index, null));
        return fact != null ? fact.resolve() : null;
    }

    /** 指定槽位上的全部事实（含冲突），按优先级排序 */
    public List<ChildFact> childFacts(SyntaxNode node, int index) {
        return Collections.unmodifiableList(collectChildFacts(node, index, null));
    }

    /** 节点所有槽位（含 -1）上的全部事实 */
    public SortedMap<Integer, List<ChildFact>> allChildFacts(SyntaxNode node) {
        return Collections.unmodifiableSortedMap(allChildFacts(node, null));
    }

    /** 脱糖形式（槽位 -1 的子节点），没有时返回 null */
    public SyntaxNode desugaredForm(SyntaxNode node) {
        return child(node, SynthNode.DESUGARED);
    }

    // ============ 父节点与脱糖层级 ============

    /**
     * 统一视图中的父节点：被其他合成节点引用的节点（真实或合成）取引用它的合成节点，
     * 否则合成节点为地址父节点，真实节点为 AST 父节点。根节点返回 null。
     */
    public SyntaxNode parent(SyntaxNode node) {
        if (node.isSynthetic()) {
            SynthNode synth = (SynthNode) node;
            SynthNode referencing = referencingNode(synth);
            return referencing != null ? referencing : synth.getParent();
        }
        AstNode ast = node.getAstNode();
        SynthNode referencing = referencingNode(ast);
        if (referencing != null) return referencing;
        return ast.getParent() != null ? SyntaxNode.of(ast.getParent()) : null;
    }

    /** 到根路径上脱糖形式根节点的个数（含自身） */
    public int desugarLevel(SyntaxNode node) {
        int level = 0;
        for (SyntaxNode n = node; n != null; n = parent(n)) {
            if (n.isSynthetic() && ((SynthNode) n).isDesugaredForm()) level++;
        }
        return level;
    }

    public boolean isInDesugaredContext(SyntaxNode node) {
        return desugarLevel(node) > 0;
    }

    /** 引用真实节点的合成节点：在其真实祖先的合成子树中由近及远查找 */
    private SynthNode referencingNode(AstNode node) {
        for (AstNode a = node.getParent(); a != null; a = a.getParent()) {
            SynthNode s = referenceIndex(a).real.get(node);
            if (s != null) return s;
        }
        return null;
    }

    /** 引用合成节点的合成节点：从其真实根节点（含）向上查找 */
    private SynthNode referencingNode(SynthNode node) {
        for (AstNode a = node.getRealRoot().getAstNode(); a != null; a = a.getParent()) {
            SynthNode s = referenceIndex(a).synthetic.get(node);
            if (s != null) return s;
        }
        return null;
    }

    private ReferenceIndex referenceIndex(AstNode ancestor) {
        return referenceCache.getOrLoad(SyntaxNode.of(ancestor), this::buildReferenceIndex);
    }

    private ReferenceIndex buildReferenceIndex(SyntaxNode ancestor) {
        Map<AstNode, SynthNode> index = new IdentityHashMap<AstNode, SynthNode>();
        Map<SynthNode, SynthNode> synthetic = new HashMap<SynthNode, SynthNode>();
        Deque<SynthNode> queue = new ArrayDeque<SynthNode>();
        for (Map.Entry<Integer, List<ChildFact>> e : allChildFacts(ancestor, null).entrySet()) {
            ChildFact fact = pick(ancestor, e.getKey(), e.getValue());
            if (fact.getChild() instanceof Child.SynthChild) {
                queue.add((SynthNode) fact.resolve());
            }
        }
        while (!queue.isEmpty()) {
            SynthNode s = queue.poll();
            for (Map.Entry<Integer, List<ChildFact>> e : allChildFacts(s, null).entrySet()) {
                ChildFact fact = pick(s, e.getKey(), e.getValue());
                Child c = fact.getChild();
                if (c instanceof Child.RealChildRef) {
                    AstNode target = ((Child.RealChildRef) c).getNode();
                    if (!index.containsKey(target)) index.put(target, s);
                } else if (c instanceof Child.SynthChildRef) {
                    SynthNode target = ((Child.SynthChildRef) c).getNode();
                    // 指向自身地址祖先的引用不改变父节点，否则父链成环
                    if (!synthetic.containsKey(target) && !isAddressAncestor(target, s)) {
                        synthetic.put(target, s);
                    }
                } else if (c instanceof Child.SynthChild) {
                    queue.add((SynthNode) fact.resolve());
                }
            }
        }
        return new ReferenceIndex(index, synthetic);
    }

    private static boolean isAddressAncestor(SynthNode candidate, SynthNode node) {
        for (SyntaxNode n = node; n.isSynthetic(); n = ((SynthNode) n).getParent()) {
            if (n.equals(candidate)) return true;
        }
        return false;
    }

    /** 某个真实祖先合成子树中的引用：被引用节点 -> 最先引用它的合成节点 */
    private static final class ReferenceIndex {
        final Map<AstNode, SynthNode> real;
        final Map<SynthNode, SynthNode> synthetic;

        ReferenceIndex(Map<AstNode, SynthNode> real, Map<SynthNode, SynthNode> synthetic) {
            this.real = Collections.unmodifiableMap(real);
            this.synthetic = Collections.unmodifiableMap(synthetic);
        }
    }

    // ============ 位置 ============

    /**
     * 节点位置：显式位置事实优先；真实节点其次取解析位置；合成节点继承父节点位置。
     *
     * @throws SynthesisException UNRESOLVABLE_LOCATION：“同位置于”事实形成环
     */
    public SourceLocation location(SyntaxNode node) {
        return location(node, new HashSet<SyntaxNode>());
    }

    private SourceLocation location(SyntaxNode node, Set<SyntaxNode> visiting) {
        if (!visiting.add(node)) {
            throw new SynthesisException(Defect.UNRESOLVABLE_LOCATION,
                    "cyclic location for " + node, node.getRealRoot().getAstNode().getLocation());
        }
        LocationFact fact = pickLocation(node, locationFacts(node));
        if (fact != null) {
            return fact.isLazy() ? location(fact.getSameAs(), visiting) : fact.getLocation();
        }
        if (!node.isSynthetic()) {
            return node.getAstNode().getLocation();
        }
        return location(((SynthNode) node).getParent(), visiting);
    }

    /** 节点上的全部显式位置事实，按优先级排序 */
    public List<LocationFact> locationFacts(SyntaxNode node) {
        List<LocationFact> facts = new ArrayList<LocationFact>();
        for (SyntaxNode anchor : chain(node)) {
            for (Expansion e : expansionsOf(anchor)) {
                LocationFact f = e.locationOf(node);
                if (f != null) facts.add(f);
            }
        }
        Collections.sort(facts, LOCATION_ORDER);
        return facts;
    }

    // ============ 控制流 ============

    /** 真实节点是否被某个展开排除出控制流；合成节点从不被排除 */
    public boolean isExcludedFromControlFlow(SyntaxNode node) {
        if (node.isSynthetic()) return false;
        AstNode ast = node.getAstNode();
        if (ast.getParent() != null && excludedBy(SyntaxNode.of(ast.getParent()), ast)) {
            return true;
        }
        SynthNode referencing = referencingNode(ast);
        if (referencing != null) {
            for (SyntaxNode anchor : chain(referencing)) {
                if (excludedBy(anchor, ast)) return true;
            }
        }
        return false;
    }

    private boolean excludedBy(SyntaxNode anchor, AstNode node) {
        for (Expansion e : expansionsOf(anchor)) {
            if (e.excludes(node)) return true;
        }
        return false;
    }

    // ============ 变量与作用域 ============

    /** 节点上声明的合成变量，按规则顺序、槽位声明顺序 */
    public List<SynthVariable> declaredVariables(SyntaxNode node) {
        Set<SynthVariable> result = new LinkedHashSet<SynthVariable>();
        for (SyntaxNode anchor : chain(node)) {
            for (Expansion e : expansionsOf(anchor)) {
                result.addAll(e.variablesOf(node));
            }
        }
        return new ArrayList<SynthVariable>(result);
    }

    /** 变量访问或 self 对应的变量，其它节点返回 null */
    public Variable variableOf(SyntaxNode node) {
        if (!node.isSynthetic()) {
            return scopes.getVariable(node.getAstNode());
        }
        SynthKind kind = node.getKind();
        return kind.getTag().isVariableAccess() ? kind.getVariable() : null;
    }

    /**
     * 节点所在作用域
     *
     * @throws SynthesisException MISSING_SCOPE：真实节点不属于本引擎的 AST
     */
    public Scope scopeOf(SyntaxNode node) {
        if (!node.isSynthetic()) {
            AstNode ast = node.getAstNode();
            if (ast == root) return scopes.getToplevelScope();
            Scope scope = scopes.scopeOf(ast);
            if (scope == null) {
                throw new SynthesisException(Defect.MISSING_SCOPE, "no scope for " + ast, ast.getLocation());
            }
            return scope;
        }
        SynthNode synth = (SynthNode) node;
        SyntaxNode parent = synth.getParent();
        if (parent.isSynthetic()) {
            if (parent.getKind().getTag() == SynthKind.Tag.BRACE_BLOCK) {
                return syntheticBlockScope((SynthNode) parent);
            }
            return scopeOf(parent);
        }
        Scope own = scopes.getScope(parent.getAstNode());
        return own != null ? own : scopeOf(parent);
    }

    /** 合成变量的声明作用域：引入它的节点所在的作用域 */
    public Scope declaringScope(SynthVariable variable) {
        return scopeOf(variable.getIntroducer());
    }

    private Scope syntheticBlockScope(SynthNode block) {
        Scope existing = syntheticScopes.get(block);
        if (existing != null) return existing;
        Scope created = Scope.synthetic(scopeOf(block));
        Scope previous = syntheticScopes.putIfAbsent(block, created);
        return previous != null ? previous : created;
    }

    // ============ 缓存 ============

    public CacheStats getCacheStats() {
        return expansionCache.getStats().plus(referenceCache.getStats());
    }

    /** 清空展开缓存（合成作用域保持不变，以维持其身份） */
    public void clearCaches() {
        expansionCache.clear();
        referenceCache.clear();
    }

    // ============ 展开 ============

    /** 锚点上各规则的非空展开结果，按规则顺序 */
    public List<Expansion> expansionsOf(SyntaxNode anchor) {
        return expansionCache.getOrLoad(anchor, this::expand);
    }

    private List<Expansion> expand(SyntaxNode anchor) {
        Set<SyntaxNode> active = inProgress.get();
        if (!active.add(anchor)) {
            throw new SynthesisException(Defect.CYCLIC_EXPANSION,
                    "re-entered expansion of " + anchor, anchor.getRealRoot().getAstNode().getLocation());
        }
        try {
            ExpansionContext context = new ExpansionContext(anchor);
            List<Expansion> result = new ArrayList<Expansion>();
            for (int i = 0; i < rules.size(); i++) {
                SynthesisRule rule = rules.get(i);
                ExpansionBuilder builder = new ExpansionBuilder(anchor, rule.getName(), i);
                rule.expand(anchor, context, builder);
                Expansion expansion = builder.build();
                if (!expansion.isEmpty()) {
                    result.add(expansion);
                }
            }
            if (LOG.isLoggable(Level.FINE) && !result.isEmpty()) {
                LOG.fine("Expanded " + anchor + " with " + result.size() + " rule(s)");
            }
            return Collections.unmodifiableList(result);
        } finally {
            active.remove(anchor);
        }
    }

    /** 地址链：节点自身、合成父节点……直到（含）第一个真实节点 */
    private static List<SyntaxNode> chain(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<SyntaxNode>(node.getSyntheticDepth() + 1);
        SyntaxNode n = node;
        result.add(n);
        while (n.isSynthetic()) {
            n = ((SynthNode) n).getParent();
            result.add(n);
        }
        return result;
    }

    private List<ChildFact> collectChildFacts(SyntaxNode node, int index, SyntaxNode skip) {
        List<ChildFact> facts = new ArrayList<ChildFact>();
        if (!node.isSynthetic()) {
            AstNode parsed = index >= 0 ? node.getAstNode().getChild(index) : null;
            if (parsed != null) {
                facts.add(new ChildFact(node, index, Child.real(parsed), ChildFact.PARSED, -1));
            }
        }
        for (SyntaxNode anchor : chain(node)) {
            if (anchor.equals(skip)) continue;
            for (Expansion e : expansionsOf(anchor)) {
                ChildFact f = e.childFact(node, index);
                if (f != null) facts.add(f);
            }
        }
        Collections.sort(facts, CHILD_ORDER);
        return facts;
    }

    private SortedMap<Integer, List<ChildFact>> allChildFacts(SyntaxNode node, SyntaxNode skip) {
        SortedMap<Integer, List<ChildFact>> result = new TreeMap<Integer, List<ChildFact>>();
        if (!node.isSynthetic()) {
            AstNode ast = node.getAstNode();
            for (int i = 0; i < ast.getChildCount(); i++) {
                AstNode parsed = ast.getChild(i);
                if (parsed != null) {
                    factList(result, i).add(new ChildFact(node, i, Child.real(parsed), ChildFact.PARSED, -1));
                }
            }
        }
        for (SyntaxNode anchor : chain(node)) {
            if (anchor.equals(skip)) continue;
            for (Expansion e : expansionsOf(anchor)) {
                for (ChildFact f : e.childFactsOf(node).values()) {
                    factList(result, f.getIndex()).add(f);
                }
            }
        }
        for (List<ChildFact> facts : result.values()) {
            Collections.sort(facts, CHILD_ORDER);
        }
        return result;
    }

    private static List<ChildFact> factList(Map<Integer, List<ChildFact>> map, int index) {
        List<ChildFact> list = map.get(index);
        if (list == null) {
            list = new ArrayList<ChildFact>();
            map.put(index, list);
        }
        return list;
    }

    /** 冲突时按优先级取第一条事实 */
    private ChildFact pick(SyntaxNode node, int index, List<ChildFact> facts) {
        if (facts.isEmpty()) return null;
        ChildFact first = facts.get(0);
        for (int i = 1; i < facts.size(); i++) {
            ChildFact other = facts.get(i);
            if (!other.getChild().equals(first.getChild())) {
                conflict(node, "child " + index, first.getRule(), other.getRule());
                break;
            }
        }
        return first;
    }

    private LocationFact pickLocation(SyntaxNode node, List<LocationFact> facts) {
        if (facts.isEmpty()) return null;
        LocationFact first = facts.get(0);
        for (int i = 1; i < facts.size(); i++) {
            LocationFact other = facts.get(i);
            if (!other.sameTarget(first)) {
                conflict(node, "location", first.getRule(), other.getRule());
                break;
            }
        }
        return first;
    }

    private void conflict(SyntaxNode node, String what, String chosenRule, String otherRule) {
        String message = "conflicting " + what + " of " + node + " declared by " + chosenRule + " and " + otherRule;
        if (config.isFailOnConflict()) {
            throw new SynthesisException(Defect.RULE_CONFLICT, message, node.getRealRoot().getAstNode().getLocation());
        }
        if (reportedConflicts.add(node + "#" + what)) {
            LOG.log(Level.WARNING, message + "; using " + chosenRule);
        }
    }

    // ============ 规则视角的查询 ============

    /**
     * 展开某个锚点时交给规则的上下文：该锚点自身的展开结果不可见
     */
    private final class ExpansionContext implements SynthesisContext {
        private final SyntaxNode anchor;

        ExpansionContext(SyntaxNode anchor) {
            this.anchor = anchor;
        }

        @Override
        public SyntaxNode child(SyntaxNode node, int index) {
            ChildFact fact = pick(node, index, collectChildFacts(node, index, anchor));
            return fact != null ? fact.resolve() : null;
        }

        @Override
        public int argumentCount(SyntaxNode call) {
            if (!call.isSynthetic()) {
                AstNode ast = call.getAstNode();
                if (ast instanceof MethodCall) return ((MethodCall) ast).getArgs().size();
            } else if (call.getKind().isMethodCall()) {
                return call.getKind().getArity();
            }
            throw new IllegalArgumentException("not a method call: " + call);
        }

        @Override
        public String methodName(SyntaxNode call) {
            if (!call.isSynthetic()) {
                AstNode ast = call.getAstNode();
                if (ast instanceof MethodCall) return ((MethodCall) ast).getName();
            } else if (call.getKind().isMethodCall()) {
                return call.getKind().getName();
            }
            throw new IllegalArgumentException("not a method call: " + call);
        }

        @Override
        public boolean isAssignment(SyntaxNode node) {
            if (node == null) return false;
            return node.isSynthetic() ? node.getKind().isAssign() : node.getAstNode() instanceof AssignExpr;
        }

        @Override
        public boolean isMethodCall(SyntaxNode node) {
            if (node == null) return false;
            return node.isSynthetic() ? node.getKind().isMethodCall() : node.getAstNode() instanceof MethodCall;
        }

        @Override
        public Variable variableOf(SyntaxNode node) {
            return SynthesisEngine.this.variableOf(node);
        }

        @Override
        public Scope scopeOf(SyntaxNode node) {
            return SynthesisEngine.this.scopeOf(node);
        }

        @Override
        public KindRegistry kinds() {
            return kinds;
        }

        @Override
        public ScopeTable scopes() {
            return scopes;
        }
    }
}
