package lox.runtime.interpreter;

import com.loxlang.compiler.diagnostics.DiagnosticLog;
import lox.runtime.LoxException;

/**
 * 源码未能通过词法或语法分析，携带完整的诊断日志
 */
public class LoxSyntaxException extends LoxException {

    private final DiagnosticLog diagnostics;

    public LoxSyntaxException(DiagnosticLog diagnostics) {
        super(diagnostics.size() + " error(s) in source");
        this.diagnostics = diagnostics;
    }

    public DiagnosticLog getDiagnostics() {
        return diagnostics;
    }
}
