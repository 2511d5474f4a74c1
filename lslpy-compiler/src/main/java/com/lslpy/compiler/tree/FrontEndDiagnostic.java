package com.lslpy.compiler.tree;

import com.lslpy.compiler.ast.SourceLocation;

/**
 * 前端（词法/语法/语义检查）报告的诊断条目
 */
public final class FrontEndDiagnostic {

    public enum Severity {
        ERROR, WARNING, INFO
    }

    private final Severity severity;
    private final String message;
    private final SourceLocation location;

    public FrontEndDiagnostic(Severity severity, String message, SourceLocation location) {
        this.severity = severity;
        this.message = message;
        this.location = location;
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity.name() + " " + location.getLine() + ":" + location.getColumn() + " " + message;
    }
}
