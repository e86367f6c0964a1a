package com.loxlang.compiler.parser;

import com.loxlang.compiler.ast.stmt.Statement;
import com.loxlang.compiler.diagnostics.DiagnosticLog;

import java.util.List;

/**
 * 容错解析的结果：成功解析的语句和收集到的语法错误
 */
public final class ParseResult {
    private final List<Statement> statements;
    private final DiagnosticLog diagnostics;

    public ParseResult(List<Statement> statements, DiagnosticLog diagnostics) {
        this.statements = statements;
        this.diagnostics = diagnostics;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public DiagnosticLog getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
