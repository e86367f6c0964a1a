package com.loxlang.compiler.diagnostics;

import com.loxlang.compiler.source.SourceSpan;

/**
 * 面向用户的错误诊断
 *
 * <p>显示格式：</p>
 * <pre>
 * [line: 3, col: 7] Scanning Error (Unexpected character): @
 * Runtime Error (Undefined variable): x
 * </pre>
 * 没有位置时省略方括号部分，没有 subject 时省略冒号部分。
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final String subject;
    private final SourceSpan location;
    private final String message;

    public Diagnostic(DiagnosticKind kind, String subject, SourceSpan location, String message) {
        if (kind == null || message == null) {
            throw new IllegalArgumentException("kind and message are required");
        }
        this.kind = kind;
        this.subject = subject;
        this.location = location;
        this.message = message;
    }

    public static Diagnostic scanning(String subject, SourceSpan location, String message) {
        return new Diagnostic(DiagnosticKind.SCANNING, subject, location, message);
    }

    public static Diagnostic parsing(SourceSpan location, String message) {
        return new Diagnostic(DiagnosticKind.PARSING, null, location, message);
    }

    public static Diagnostic runtime(String subject, SourceSpan location, String message) {
        return new Diagnostic(DiagnosticKind.RUNTIME, subject, location, message);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    /** 出错的源码片段（可空） */
    public String getSubject() {
        return subject;
    }

    /** 出错区间（可空） */
    public SourceSpan getLocation() {
        return location;
    }

    public String getMessage() {
        return message;
    }

    public boolean hasLocation() {
        return location != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (location != null) {
            sb.append("[line: ").append(location.getStart().getLine())
              .append(", col: ").append(location.getStart().getColumn())
              .append("] ");
        }
        sb.append(kind.getDisplayName()).append(" Error (").append(message).append(')');
        if (subject != null) {
            sb.append(": ").append(subject);
        }
        return sb.toString();
    }
}
