package com.gemflow.synth.validate;

import com.gemflow.ast.SourceLocation;
import com.gemflow.synth.SynthesisException.Defect;
import com.gemflow.synth.SyntaxNode;

/**
 * 合成诊断条目
 */
public final class SynthesisDiagnostic {

    public enum Severity {
        ERROR, WARNING, INFO
    }

    private final Severity severity;
    private final Defect defect;
    private final String message;
    private final SyntaxNode node;
    private final SourceLocation location;

    public SynthesisDiagnostic(Severity severity, Defect defect, String message,
                               SyntaxNode node, SourceLocation location) {
        this.severity = severity;
        this.defect = defect;
        this.message = message;
        this.node = node;
        this.location = location;
    }

    public Severity getSeverity() { return severity; }
    public Defect getDefect() { return defect; }
    public String getMessage() { return message; }
    public SyntaxNode getNode() { return node; }
    public SourceLocation getLocation() { return location; }

    @Override
    public String toString() {
        return severity + " " + defect + ": " + message + (location != null ? " at " + location : "");
    }
}
