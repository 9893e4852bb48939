package com.gemflow.synth.validate;

import com.gemflow.synth.SynthesisException.Defect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果
 */
public final class ValidationReport {
    private final List<SynthesisDiagnostic> diagnostics;
    private final int realNodeCount;
    private final int syntheticNodeCount;

    public ValidationReport(List<SynthesisDiagnostic> diagnostics, int realNodeCount, int syntheticNodeCount) {
        this.diagnostics = Collections.unmodifiableList(new ArrayList<SynthesisDiagnostic>(diagnostics));
        this.realNodeCount = realNodeCount;
        this.syntheticNodeCount = syntheticNodeCount;
    }

    public List<SynthesisDiagnostic> getDiagnostics() { return diagnostics; }
    public int getRealNodeCount() { return realNodeCount; }
    public int getSyntheticNodeCount() { return syntheticNodeCount; }

    public boolean isValid() {
        for (SynthesisDiagnostic d : diagnostics) {
            if (d.getSeverity() == SynthesisDiagnostic.Severity.ERROR) return false;
        }
        return true;
    }

    /** 指定类别的诊断 */
    public List<SynthesisDiagnostic> getDiagnostics(Defect defect) {
        List<SynthesisDiagnostic> result = new ArrayList<SynthesisDiagnostic>();
        for (SynthesisDiagnostic d : diagnostics) {
            if (d.getDefect() == defect) result.add(d);
        }
        return result;
    }

    @Override
    public String toString() {
        return "ValidationReport[" + realNodeCount + " real, " + syntheticNodeCount + " synthetic, "
                + diagnostics.size() + " diagnostic(s)]";
    }
}
