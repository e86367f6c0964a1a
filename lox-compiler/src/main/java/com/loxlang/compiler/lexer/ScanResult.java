package com.loxlang.compiler.lexer;

import com.loxlang.compiler.diagnostics.DiagnosticLog;

import java.util.List;

/**
 * 词法分析结果：token 序列（以 EOF 结尾）和词法错误
 */
public final class ScanResult {
    private final List<Token> tokens;
    private final DiagnosticLog diagnostics;

    public ScanResult(List<Token> tokens, DiagnosticLog diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public DiagnosticLog getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
