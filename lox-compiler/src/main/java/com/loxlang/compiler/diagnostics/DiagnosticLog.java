package com.loxlang.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 按发现顺序追加的诊断列表
 *
 * <p>由当前阶段独占并写入；阶段返回前调用 {@link #freeze()}，之后只读。</p>
 */
public final class DiagnosticLog implements Iterable<Diagnostic> {
    private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    private boolean frozen;

    public DiagnosticLog() {
    }

    /** 只含一条诊断的日志（运行时错误只报告第一条） */
    public static DiagnosticLog of(Diagnostic diagnostic) {
        DiagnosticLog log = new DiagnosticLog();
        log.add(diagnostic);
        return log.freeze();
    }

    public void add(Diagnostic diagnostic) {
        if (frozen) {
            throw new IllegalStateException("Diagnostic log is read-only once its stage has returned");
        }
        diagnostics.add(diagnostic);
    }

    public DiagnosticLog freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    public Diagnostic get(int index) {
        return diagnostics.get(index);
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return getDiagnostics().iterator();
    }

    /**
     * 每条诊断一行
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Diagnostic d : diagnostics) {
            sb.append(d).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
