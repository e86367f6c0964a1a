package com.loxlang.cli;

import lox.runtime.interpreter.LoxPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ScriptRunner 测试：输出和退出码
 */
class ScriptRunnerTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private ScriptRunner runner;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new ScriptRunner(LoxPolicy.defaults(),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String stderr() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("执行源码")
    class RunSourceTests {

        @Test
        @DisplayName("成功返回 0")
        void testOk() {
            assertEquals(ExitCodes.OK, runner.runSource("print 1 + 2;", ScriptRunner.Mode.RUN));
            assertThat(stdout()).isEqualToIgnoringNewLines("Number(3.0)");
            assertThat(stderr()).isEmpty();
        }

        @Test
        @DisplayName("语法错误返回 65 且不执行")
        void testParseError() {
            assertEquals(ExitCodes.DATA_ERROR, runner.runSource("print 1; 1 +;\n2 *;", ScriptRunner.Mode.RUN));
            assertThat(stdout()).isEmpty();
            assertThat(stderr().split("\\R")).containsExactly(
                    "[line: 1, col: 13] Parsing Error (Expected value or expression, found ';')",
                    "[line: 2, col: 4] Parsing Error (Expected value or expression, found ';')");
        }

        @Test
        @DisplayName("词法错误返回 65")
        void testScanError() {
            assertEquals(ExitCodes.DATA_ERROR, runner.runSource("print \"open", ScriptRunner.Mode.RUN));
            assertThat(stderr()).contains("Scanning Error (Unterminated String)");
        }

        @Test
        @DisplayName("运行时错误返回 70")
        void testRuntimeError() {
            assertEquals(ExitCodes.SOFTWARE, runner.runSource("print 1; 1 + true;", ScriptRunner.Mode.RUN));
            assertThat(stdout()).isEqualToIgnoringNewLines("Number(1.0)");
            assertThat(stderr()).contains("Runtime Error (Illegal operand for binary '+' expression");
        }

        @Test
        @DisplayName("--tokens 输出 token 列表")
        void testTokens() {
            assertEquals(ExitCodes.OK, runner.runSource("1;", ScriptRunner.Mode.TOKENS));
            assertThat(stdout()).contains("NUMBER(1, 1.0)").contains("SEMICOLON(;)").contains("EOF");
        }

        @Test
        @DisplayName("--ast 输出语法树但不执行")
        void testAst() {
            assertEquals(ExitCodes.OK, runner.runSource("print 1 + 2 * 3;", ScriptRunner.Mode.AST));
            assertThat(stdout()).isEqualToIgnoringNewLines("Print Statement: (+ 1 (* 2 3))");
        }

        @Test
        @DisplayName("嵌套深度来自策略")
        void testNestingFromPolicy() {
            ScriptRunner shallow = new ScriptRunner(LoxPolicy.custom().maxNestingDepth(2).build(),
                    new PrintStream(out, true, StandardCharsets.UTF_8),
                    new PrintStream(err, true, StandardCharsets.UTF_8));
            assertEquals(ExitCodes.DATA_ERROR, shallow.runSource("print ((((1))));", ScriptRunner.Mode.RUN));
            assertThat(stderr()).contains("Maximum nesting depth of 2 exceeded");
        }
    }

    @Nested
    @DisplayName("执行脚本文件")
    class RunScriptTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("读取 UTF-8 脚本")
        void testScript() throws IOException {
            Path script = dir.resolve("hello.lox");
            Files.write(script, "var greeting = \"你好\";\nprint greeting;\n".getBytes(StandardCharsets.UTF_8));

            assertEquals(ExitCodes.OK, runner.runScript(script.toString(), ScriptRunner.Mode.RUN));
            assertThat(stdout()).isEqualToIgnoringNewLines("String(\"你好\")");
        }

        @Test
        @DisplayName("文件不存在返回 66")
        void testMissingFile() {
            String missing = dir.resolve("missing.lox").toString();
            assertEquals(ExitCodes.NO_INPUT, runner.runScript(missing, ScriptRunner.Mode.RUN));
            assertThat(stderr()).contains("File not found");
        }

        @Test
        @DisplayName("读取目录失败返回 74")
        void testIoError() {
            assertEquals(ExitCodes.IO_ERROR, runner.runScript(dir.toString(), ScriptRunner.Mode.RUN));
        }
    }
}
