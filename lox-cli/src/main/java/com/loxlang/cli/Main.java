package com.loxlang.cli;

import lox.runtime.interpreter.LoxPolicy;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lox CLI 入口点（picocli）
 */
@Command(name = "lox", version = "Lox v" + Main.VERSION,
         mixinStandardHelpOptions = true,
         exitCodeOnInvalidInput = ExitCodes.USAGE,
         exitCodeOnExecutionException = ExitCodes.INTERNAL_ERROR,
         description = "Runs a Lox script, a single source string, or an interactive REPL.")
public class Main implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    @Option(names = "-e", paramLabel = "SOURCE", description = "执行一段源码")
    String expression;

    @Option(names = "--tokens", description = "只输出词法分析结果")
    boolean tokens;

    @Option(names = "--ast", description = "只输出语法树")
    boolean ast;

    @Option(names = "--max-depth", paramLabel = "N", description = "括号 / 一元运算最大嵌套深度（默认 256）")
    Integer maxDepth;

    @Option(names = "--eager-ternary", description = "三元表达式两个分支都求值")
    boolean eagerTernary;

    @Option(names = "--verbose", description = "输出 FINE 级别日志")
    boolean verbose;

    @Parameters(arity = "0..1", paramLabel = "SCRIPT", description = "脚本文件")
    String script;

    private final PrintStream out;
    private final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        if (expression != null && script != null) {
            err.println("Cannot combine -e with a script file");
            return ExitCodes.USAGE;
        }
        if (tokens && ast) {
            err.println("--tokens and --ast are mutually exclusive");
            return ExitCodes.USAGE;
        }
        if (maxDepth != null && maxDepth < 0) {
            err.println("--max-depth must not be negative");
            return ExitCodes.USAGE;
        }

        LoxPolicy policy = resolvePolicy();
        ScriptRunner.Mode mode = tokens ? ScriptRunner.Mode.TOKENS
                : ast ? ScriptRunner.Mode.AST
                : ScriptRunner.Mode.RUN;

        if (expression != null) {
            return new ScriptRunner(policy, out, err).runSource(expression, mode);
        }
        if (script != null) {
            return new ScriptRunner(policy, out, err).runScript(script, mode);
        }
        if (mode != ScriptRunner.Mode.RUN) {
            err.println("--tokens and --ast need a script or -e SOURCE");
            return ExitCodes.USAGE;
        }
        new ReplRunner(policy, out, err).run();
        return ExitCodes.OK;
    }

    LoxPolicy resolvePolicy() {
        LoxPolicy.Builder builder = LoxPolicy.custom();
        if (maxDepth != null) {
            builder.maxNestingDepth(maxDepth);
        }
        if (eagerTernary) {
            builder.ternaryMode(LoxPolicy.TernaryMode.EAGER);
        }
        return builder.build();
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    public static void main(String[] args) {
        Charset console = consoleCharset();
        PrintStream out = new PrintStream(System.out, true, console);
        PrintStream err = new PrintStream(System.err, true, console);

        CommandLine cmd = new CommandLine(new Main(out, err));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        System.exit(cmd.execute(args));
    }

    /** Windows 控制台可能不是 UTF-8：优先 native.encoding */
    private static Charset consoleCharset() {
        String name = System.getProperty("native.encoding");
        return name != null && Charset.isSupported(name) ? Charset.forName(name) : Charset.defaultCharset();
    }
}
