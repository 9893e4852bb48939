package com.gemflow.synth.validate;

import com.gemflow.ast.SourceLocation;
import com.gemflow.ast.scope.Scope;
import com.gemflow.synth.Child;
import com.gemflow.synth.ChildFact;
import com.gemflow.synth.LocationFact;
import com.gemflow.synth.SynthVariable;
import com.gemflow.synth.SynthesisEngine;
import com.gemflow.synth.SynthesisException;
import com.gemflow.synth.SynthesisException.Defect;
import com.gemflow.synth.SyntaxNode;
import com.gemflow.synth.validate.SynthesisDiagnostic.Severity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 规则集一致性校验
 *
 * <p>遍历所有真实节点与可达的合成节点，报告：</p>
 * <ul>
 *   <li>同一槽位的子节点冲突、位置冲突（两条事实的规则都会写出）</li>
 *   <li>无法解析的位置、悬空引用、未声明的种类</li>
 *   <li>声明了合成变量却没有作用域的节点</li>
 * </ul>
 * <p>能报告的缺陷都不会抛出。</p>
 */
public final class SynthesisValidator {

    private static final Logger LOG = Logger.getLogger(SynthesisValidator.class.getName());

    private SynthesisValidator() {
    }

    public static ValidationReport validate(SynthesisEngine engine) {
        return validate(engine, engine.node(engine.getRoot()));
    }

    public static ValidationReport validate(SynthesisEngine engine, SyntaxNode root) {
        List<SynthesisDiagnostic> diagnostics = new ArrayList<SynthesisDiagnostic>();
        Set<SyntaxNode> visited = new HashSet<SyntaxNode>();
        Deque<SyntaxNode> work = new ArrayDeque<SyntaxNode>();
        int real = 0;
        int synthetic = 0;

        work.push(root);
        while (!work.isEmpty()) {
            SyntaxNode node = work.pop();
            if (!visited.add(node)) continue;
            if (node.isSynthetic()) synthetic++; else real++;

            checkChildren(engine, node, work, diagnostics);
            checkLocation(engine, node, diagnostics);
            checkVariables(engine, node, diagnostics);
        }

        ValidationReport report = new ValidationReport(diagnostics, real, synthetic);
        for (SynthesisDiagnostic d : diagnostics) {
            LOG.log(Level.WARNING, d.toString());
        }
        LOG.info("Synthesis validation: " + report);
        return report;
    }

    // ============ 各项检查 ============

    private static void checkChildren(SynthesisEngine engine, SyntaxNode node, Deque<SyntaxNode> work,
                                      List<SynthesisDiagnostic> out) {
        Map<Integer, List<ChildFact>> facts;
        try {
            facts = engine.allChildFacts(node);
        } catch (SynthesisException e) {
            out.add(fromException(node, e));
            return;
        }
        for (Map.Entry<Integer, List<ChildFact>> e : facts.entrySet()) {
            List<ChildFact> slot = e.getValue();
            ChildFact first = slot.get(0);
            List<Child> seen = new ArrayList<Child>();
            for (ChildFact f : slot) {
                if (seen.contains(f.getChild())) continue;
                seen.add(f.getChild());
                if (seen.size() > 1) {
                    out.add(error(Defect.RULE_CONFLICT, node,
                            "child " + e.getKey() + " of " + node + " is declared by " + first.getRule()
                                    + " as " + first.getChild() + " and by " + f.getRule() + " as " + f.getChild()));
                }
                work.push(f.resolve());
            }
        }
    }

    private static void checkLocation(SynthesisEngine engine, SyntaxNode node, List<SynthesisDiagnostic> out) {
        try {
            List<LocationFact> facts = engine.locationFacts(node);
            for (int i = 1; i < facts.size(); i++) {
                if (!facts.get(i).sameTarget(facts.get(0))) {
                    out.add(error(Defect.RULE_CONFLICT, node, "location of " + node + " is declared by "
                            + facts.get(0).getRule() + " and by " + facts.get(i).getRule()));
                    return;
                }
            }
            if (engine.location(node) == null) {
                out.add(error(Defect.UNRESOLVABLE_LOCATION, node, "no location for " + node));
            }
        } catch (SynthesisException e) {
            out.add(fromException(node, e));
        }
    }

    private static void checkVariables(SynthesisEngine engine, SyntaxNode node, List<SynthesisDiagnostic> out) {
        try {
            for (SynthVariable v : engine.declaredVariables(node)) {
                Scope scope = engine.declaringScope(v);
                if (scope == null) {
                    out.add(error(Defect.MISSING_SCOPE, node, v.getName() + " declared on " + node + " has no scope"));
                }
            }
        } catch (SynthesisException e) {
            out.add(fromException(node, e));
        }
    }

    // ============ 诊断构造 ============

    private static SynthesisDiagnostic error(Defect defect, SyntaxNode node, String message) {
        return new SynthesisDiagnostic(Severity.ERROR, defect, message, node, realLocation(node));
    }

    private static SynthesisDiagnostic fromException(SyntaxNode node, SynthesisException e) {
        SourceLocation location = e.getLocation() != null ? e.getLocation() : realLocation(node);
        return new SynthesisDiagnostic(Severity.ERROR, e.getDefect(), e.getMessage(), node, location);
    }

    private static SourceLocation realLocation(SyntaxNode node) {
        return node.getRealRoot().getAstNode().getLocation();
    }
}
