package lox.runtime.interpreter;

import com.loxlang.compiler.diagnostics.Diagnostic;
import com.loxlang.compiler.source.SourceSpan;
import lox.runtime.LoxException;

/**
 * Lox 运行时异常
 *
 * 携带出错节点的源码区间，可转换为 Runtime 诊断。
 */
public class LoxRuntimeException extends LoxException {

    private final String subject;
    private final SourceSpan location;

    public LoxRuntimeException(String message, SourceSpan location) {
        this(message, null, location);
    }

    public LoxRuntimeException(String message, String subject, SourceSpan location) {
        super(message);
        this.subject = subject;
        this.location = location;
    }

    /** 出错对象的文本（如未定义的变量名），可能为 null */
    public String getSubject() {
        return subject;
    }

    public SourceSpan getLocation() {
        return location;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.runtime(subject, location, getMessage());
    }
}
