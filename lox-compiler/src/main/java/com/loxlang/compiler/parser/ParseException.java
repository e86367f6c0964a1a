package com.loxlang.compiler.parser;

import com.loxlang.compiler.diagnostics.Diagnostic;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 解析异常
 *
 * <p>在语法规则内部抛出，由 {@link Parser} 在声明层捕获、记入诊断日志并同步到下一条语句。</p>
 */
public class ParseException extends RuntimeException {
    private final SourceSpan location;

    public ParseException(String message, SourceSpan location) {
        super(message);
        this.location = location;
    }

    /** 出错区间（到达文件末尾时为 null） */
    public SourceSpan getLocation() {
        return location;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.parsing(location, getMessage());
    }
}
