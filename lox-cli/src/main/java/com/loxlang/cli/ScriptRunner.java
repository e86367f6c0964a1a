package com.loxlang.cli;

import com.loxlang.compiler.ast.AstPrinter;
import com.loxlang.compiler.diagnostics.Diagnostic;
import com.loxlang.compiler.diagnostics.DiagnosticLog;
import com.loxlang.compiler.lexer.Lexer;
import com.loxlang.compiler.lexer.ScanResult;
import com.loxlang.compiler.lexer.Token;
import com.loxlang.compiler.parser.ParseResult;
import com.loxlang.compiler.parser.Parser;
import lox.runtime.interpreter.Interpreter;
import lox.runtime.interpreter.LoxPolicy;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 脚本和表达式执行器
 *
 * <p>所有方法返回进程退出码（见 {@link ExitCodes}），由 {@link Main} 负责退出。</p>
 */
public class ScriptRunner {
    private static final Logger LOG = Logger.getLogger(ScriptRunner.class.getName());

    /** 执行方式 */
    public enum Mode {
        /** 扫描、解析并执行 */
        RUN,
        /** 只输出 token 列表 */
        TOKENS,
        /** 只输出 AST */
        AST
    }

    private final LoxPolicy policy;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(LoxPolicy policy, PrintStream out, PrintStream err) {
        this.policy = policy;
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件（UTF-8）
     */
    public int runScript(String filePath, Mode mode) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("File not found: " + filePath);
            return ExitCodes.NO_INPUT;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Failed to read " + filePath, e);
            err.println("Could not read file " + filePath + ": " + e.getMessage());
            return ExitCodes.IO_ERROR;
        }
        LOG.fine("Running " + path.toAbsolutePath());
        return runSource(source, mode);
    }

    /**
     * 执行一段源码
     */
    public int runSource(String source, Mode mode) {
        try {
            ScanResult scan = new Lexer(source).scan();
            if (mode == Mode.TOKENS) {
                for (Token token : scan.getTokens()) {
                    out.println(token);
                }
                printDiagnostics(scan.getDiagnostics());
                return scan.hasErrors() ? ExitCodes.DATA_ERROR : ExitCodes.OK;
            }

            ParseResult parse = new Parser(scan.getTokens(), policy.getMaxNestingDepth()).parse();
            if (mode == Mode.AST) {
                out.print(new AstPrinter().print(parse.getStatements()));
            }

            // 词法和语法错误都报告，有任何一个就不执行
            printDiagnostics(scan.getDiagnostics());
            printDiagnostics(parse.getDiagnostics());
            if (scan.hasErrors() || parse.hasErrors()) {
                return ExitCodes.DATA_ERROR;
            }
            if (mode == Mode.AST) {
                return ExitCodes.OK;
            }

            DiagnosticLog runtime = new Interpreter(policy, out).interpret(parse.getStatements());
            printDiagnostics(runtime);
            return runtime.hasErrors() ? ExitCodes.SOFTWARE : ExitCodes.OK;
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Internal interpreter error", e);
            err.println("Internal error: " + e);
            return ExitCodes.INTERNAL_ERROR;
        } finally {
            out.flush();
        }
    }

    private void printDiagnostics(DiagnosticLog log) {
        for (Diagnostic diagnostic : log) {
            err.println(diagnostic);
        }
    }
}
