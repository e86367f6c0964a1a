package com.loxlang.compiler.diagnostics;

/**
 * 诊断来源阶段
 */
public enum DiagnosticKind {
    SCANNING("Scanning"),
    PARSING("Parsing"),
    RUNTIME("Runtime");

    private final String displayName;

    DiagnosticKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
