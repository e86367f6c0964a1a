package com.loxlang.cli;

import com.loxlang.compiler.diagnostics.Diagnostic;
import lox.runtime.LoxValue;
import lox.runtime.interpreter.Interpreter;
import lox.runtime.interpreter.LoxPolicy;
import lox.runtime.interpreter.LoxRuntimeException;
import lox.runtime.interpreter.LoxSyntaxException;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * jline REPL 交互模式
 */
public class ReplRunner {
    private static final Logger LOG = Logger.getLogger(ReplRunner.class.getName());

    static final String PROMPT = "lox> ";
    static final String CONTINUATION_PROMPT = "...  ";

    private final LoxPolicy policy;
    private final PrintStream out;
    private final PrintStream err;
    private final Interpreter interpreter;

    public ReplRunner(LoxPolicy policy, PrintStream out, PrintStream err) {
        this.policy = policy;
        this.out = out;
        this.err = err;
        this.interpreter = new Interpreter(policy, out);
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("Lox " + Main.VERSION + " (" + policy + ")");
        out.println("Type :help for help, :quit to exit");

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Terminal initialization failed", e);
            // 回退到简单模式
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }
    }

    /**
     * jline 主循环
     */
    private void runLoop(LineReader reader) {
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                String line = reader.readLine(buffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT);
                if (line == null) break;
                if (!accept(line, buffer)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                buffer.setLength(0);
            } catch (EndOfFileException e) {
                // Ctrl+D: 退出
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败或没有终端时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        StringBuilder buffer = new StringBuilder();

        while (true) {
            try {
                out.print(buffer.length() > 0 ? CONTINUATION_PROMPT : PROMPT);
                out.flush();

                String line = reader.readLine();
                if (line == null) break;
                if (!accept(line, buffer)) break;
            } catch (IOException e) {
                err.println("Error reading input: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 处理一行输入
     *
     * @return false 表示退出
     */
    private boolean accept(String line, StringBuilder buffer) {
        if (buffer.length() == 0 && line.startsWith(":")) {
            return handleReplCommand(line.trim());
        }

        buffer.append(line).append('\n');
        // 括号未闭合时继续读下一行
        if (hasUnclosedParens(buffer.toString())) {
            return true;
        }

        String source = buffer.toString();
        buffer.setLength(0);
        if (!source.trim().isEmpty()) {
            evaluateAndPrint(source);
        }
        return true;
    }

    /**
     * 检查是否有未闭合的括号或字符串
     */
    static boolean hasUnclosedParens(String text) {
        int parens = 0;
        boolean inString = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) continue;
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                // 注释到行尾
                while (i < text.length() && text.charAt(i) != '\n') i++;
                continue;
            }
            if (c == '(') parens++;
            else if (c == ')') parens--;
        }

        return inString || parens > 0;
    }

    /**
     * 处理 REPL 命令
     *
     * @return true 继续循环，false 退出
     */
    boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }

        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }

        if (":reset".equals(command)) {
            interpreter.reset();
            out.println("Environment reset");
            return true;
        }

        if (":env".equals(command)) {
            Map<String, LoxValue> values = interpreter.getGlobals().getValues();
            if (values.isEmpty()) {
                out.println("(no variables)");
            }
            for (Map.Entry<String, LoxValue> entry : values.entrySet()) {
                out.println(entry.getKey() + " = " + entry.getValue().toDebugString());
            }
            return true;
        }

        out.println("Unknown command: " + command);
        out.println("Type :help for help");
        return true;
    }

    /**
     * 求值并打印结果。出错时打印诊断，会话继续。
     */
    void evaluateAndPrint(String source) {
        try {
            LoxValue result = interpreter.evalRepl(source);
            if (result != null) {
                out.println(result.isString() ? "\"" + result + "\"" : result.toString());
            }
        } catch (LoxSyntaxException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                err.println(diagnostic);
            }
        } catch (LoxRuntimeException e) {
            err.println(e.toDiagnostic());
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, "Internal interpreter error", e);
            err.println("Internal error: " + e);
        }
    }

    private void printReplHelp() {
        out.println("REPL commands:");
        out.println("  :help, :h        show this help");
        out.println("  :quit, :q, :exit leave the REPL");
        out.println("  :reset           discard all variables");
        out.println("  :env             list defined variables");
        out.println();
        out.println("Examples:");
        out.println("  var x = 42;");
        out.println("  print x * 2;");
        out.println("  x > 40 ? \"big\" : \"small\";");
    }
}
