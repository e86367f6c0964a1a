package lox.runtime.interpreter;

import com.loxlang.compiler.ast.stmt.Statement;
import com.loxlang.compiler.diagnostics.DiagnosticLog;
import com.loxlang.compiler.lexer.Lexer;
import com.loxlang.compiler.parser.ParseResult;
import com.loxlang.compiler.parser.Parser;
import lox.runtime.LoxNumber;
import lox.runtime.LoxString;
import lox.runtime.LoxValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 解释器测试：源码 → 输出 / 诊断
 */
class InterpreterTest {

    private ByteArrayOutputStream buffer;
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = newInterpreter(LoxPolicy.defaults());
    }

    private Interpreter newInterpreter(LoxPolicy policy) {
        buffer = new ByteArrayOutputStream();
        return new Interpreter(policy, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private static List<Statement> parse(String source) {
        ParseResult result = new Parser(new Lexer(source).scan().getTokens()).parse();
        assertFalse(result.hasErrors(), () -> "Unexpected errors: " + result.getDiagnostics().render());
        return result.getStatements();
    }

    /** 执行源码，返回运行时诊断 */
    private DiagnosticLog run(String source) {
        return interpreter.interpret(parse(source));
    }

    /** print 输出的各行 */
    private List<String> output() {
        String text = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        if (text.isEmpty()) return Arrays.asList();
        return Arrays.asList(text.split("\\R"));
    }

    /** 执行并断言成功，返回输出各行 */
    private List<String> printed(String source) {
        DiagnosticLog log = run(source);
        assertTrue(log.isEmpty(), () -> "Unexpected runtime error: " + log.render());
        return output();
    }

    /** 执行并断言失败，返回唯一的运行时诊断 */
    private String runtimeError(String source) {
        DiagnosticLog log = run(source);
        assertEquals(1, log.size());
        return log.get(0).toString();
    }

    // ============ 算术 ============

    @Nested
    @DisplayName("算术运算")
    class ArithmeticTests {

        @Test
        @DisplayName("四则运算和优先级")
        void testBasic() {
            assertThat(printed("print 1 + 2 * 3; print (1 + 2) * 3; print 10 - 4 / 2;"))
                    .containsExactly("Number(7.0)", "Number(9.0)", "Number(8.0)");
        }

        @Test
        @DisplayName("一元负号")
        void testNegate() {
            assertThat(printed("print -3; print --3;")).containsExactly("Number(-3.0)", "Number(3.0)");
        }

        @Test
        @DisplayName("除以零遵循 IEEE")
        void testDivisionByZero() {
            assertThat(printed("print 1 / 0; print -1 / 0; print 0 / 0;"))
                    .containsExactly("Number(inf)", "Number(-inf)", "Number(NaN)");
        }

        @Test
        @DisplayName("跨行字符串打印为一行")
        void testMultilineString() {
            assertThat(printed("print \"a\nb\";")).containsExactly("String(\"a\\nb\")");
        }

        @Test
        @DisplayName("比较运算")
        void testComparison() {
            assertThat(printed("print 1 < 2; print 2 <= 2; print 3 > 4; print 4 >= 5;"))
                    .containsExactly("Boolean(true)", "Boolean(true)", "Boolean(false)", "Boolean(false)");
        }

        @Test
        @DisplayName("加法只接受数字")
        void testAddRequiresNumbers() {
            assertEquals("[line: 1, col: 3] Runtime Error (Illegal operand for binary '+' expression: "
                    + "Number(1.0) + Boolean(true))", runtimeError("1 + true;"));
        }

        @Test
        @DisplayName("字符串不能相加")
        void testNoConcatenation() {
            assertThat(runtimeError("\"a\" + \"b\";"))
                    .contains("Illegal operand for binary '+' expression: String(\"a\") + String(\"b\")");
        }

        @Test
        @DisplayName("比较只接受数字")
        void testCompareRequiresNumbers() {
            assertThat(runtimeError("nil < 1;"))
                    .contains("Illegal operand for binary '<' expression: Nil < Number(1.0)");
        }

        @Test
        @DisplayName("负号只接受数字")
        void testNegateRequiresNumber() {
            assertEquals("[line: 1, col: 1] Runtime Error (Illegal operand for unary '-' expression: "
                    + "String(\"x\"))", runtimeError("-\"x\";"));
        }
    }

    // ============ 逻辑和相等 ============

    @Nested
    @DisplayName("逻辑非和相等性")
    class LogicTests {

        @Test
        @DisplayName("! 只接受 Boolean 和 Nil")
        void testNot() {
            assertThat(printed("print !true; print !false; print !nil;"))
                    .containsExactly("Boolean(false)", "Boolean(true)", "Boolean(true)");
            assertThat(runtimeError("!0;")).contains("Illegal operand for unary '!' expression: Number(0.0)");
            assertThat(runtimeError("!\"\";")).contains("Illegal operand for unary '!' expression: String(\"\")");
        }

        @Test
        @DisplayName("同类型相等")
        void testEquality() {
            assertThat(printed("print 1 == 1; print \"a\" == \"a\"; print nil == nil; print true != false;"))
                    .containsExactly("Boolean(true)", "Boolean(true)", "Boolean(true)", "Boolean(true)");
        }

        @Test
        @DisplayName("不同类型永不相等")
        void testCrossVariantEquality() {
            assertThat(printed("print 1 == \"1\"; print nil == false; print 0 != nil;"))
                    .containsExactly("Boolean(false)", "Boolean(false)", "Boolean(true)");
        }

        @Test
        @DisplayName("NaN 不等于自身")
        void testNaN() {
            assertThat(printed("print 0 / 0 == 0 / 0;")).containsExactly("Boolean(false)");
        }
    }

    // ============ 三元表达式 ============

    @Nested
    @DisplayName("三元表达式")
    class TernaryTests {

        @Test
        @DisplayName("按条件选择分支")
        void testSelect() {
            assertThat(printed("print true ? 1 : 2; print false ? 1 : 2; print 1 < 2 ? \"y\" : \"n\";"))
                    .containsExactly("Number(1.0)", "Number(2.0)", "String(\"y\")");
        }

        @Test
        @DisplayName("条件必须是 Boolean")
        void testNonBooleanCondition() {
            assertEquals("[line: 1, col: 3] Runtime Error (Non boolean type used as condition in ternary: "
                    + "Number(1.0))", runtimeError("1 ? 2 : 3;"));
            assertThat(runtimeError("nil ? 2 : 3;")).contains("ternary: Nil");
        }

        @Test
        @DisplayName("默认只求值选中的分支")
        void testShortCircuit() {
            assertThat(printed("print true ? 1 : -\"x\"; print false ? -nil : 2;"))
                    .containsExactly("Number(1.0)", "Number(2.0)");
        }

        @Test
        @DisplayName("EAGER 模式两个分支都求值")
        void testEager() {
            interpreter = newInterpreter(LoxPolicy.custom().ternaryMode(LoxPolicy.TernaryMode.EAGER).build());
            assertThat(runtimeError("print true ? 1 : -\"x\";"))
                    .contains("Illegal operand for unary '-' expression: String(\"x\")");
            assertThat(output()).isEmpty();
        }

        @Test
        @DisplayName("EAGER 模式结果与短路模式相同")
        void testEagerResult() {
            interpreter = newInterpreter(LoxPolicy.custom().ternaryMode(LoxPolicy.TernaryMode.EAGER).build());
            assertThat(printed("print false ? 1 : 2;")).containsExactly("Number(2.0)");
        }
    }

    // ============ 变量 ============

    @Nested
    @DisplayName("变量")
    class VariableTests {

        @Test
        @DisplayName("定义、读取和赋值")
        void testDefineAndAssign() {
            assertThat(printed("var a = 1; a = a + 1; print a;")).containsExactly("Number(2.0)");
        }

        @Test
        @DisplayName("没有初始化器时为 nil")
        void testDefaultNil() {
            assertThat(printed("var c; print c;")).containsExactly("Nil");
        }

        @Test
        @DisplayName("允许重新定义")
        void testRedefine() {
            assertThat(printed("var a = 1; var a = \"two\"; print a;")).containsExactly("String(\"two\")");
        }

        @Test
        @DisplayName("赋值表达式的值是所赋的值")
        void testAssignmentValue() {
            assertThat(printed("var a; var b; print a = b = 3; print a;"))
                    .containsExactly("Number(3.0)", "Number(3.0)");
        }

        @Test
        @DisplayName("读取未定义变量")
        void testUndefinedRead() {
            assertEquals("[line: 1, col: 7] Runtime Error (Undefined variable): b", runtimeError("print b;"));
        }

        @Test
        @DisplayName("给未定义变量赋值")
        void testUndefinedAssign() {
            assertThat(runtimeError("x = 1;")).endsWith("Runtime Error (Undefined variable): x");
            assertFalse(interpreter.getGlobals().isDefined("x"));
        }
    }

    // ============ 执行流程 ============

    @Nested
    @DisplayName("执行流程")
    class ExecutionTests {

        @Test
        @DisplayName("第一个运行时错误后停止")
        void testFailFast() {
            DiagnosticLog log = run("print 1; print -nil; print 2;");
            assertEquals(1, log.size());
            assertThat(output()).containsExactly("Number(1.0)");
        }

        @Test
        @DisplayName("成功时返回空的只读日志")
        void testEmptyLog() {
            DiagnosticLog log = run("1;");
            assertTrue(log.isEmpty());
            assertTrue(log.isFrozen());
        }

        @Test
        @DisplayName("execute 以异常抛出运行时错误")
        void testExecuteThrows() {
            LoxRuntimeException e = assertThrows(LoxRuntimeException.class,
                    () -> interpreter.execute(parse("-true;")));
            assertEquals("Illegal operand for unary '-' expression: Boolean(true)", e.getMessage());
            assertEquals(1, e.getLocation().getStart().getColumn());
        }

        @Test
        @DisplayName("多次执行共享全局变量")
        void testGlobalsPersist() {
            run("var total = 5;");
            assertThat(printed("print total * 2;")).containsExactly("Number(10.0)");
        }

        @Test
        @DisplayName("reset 丢弃全局变量")
        void testReset() {
            run("var a = 1;");
            interpreter.reset();
            assertFalse(interpreter.getGlobals().isDefined("a"));
        }
    }

    // ============ REPL ============

    @Nested
    @DisplayName("REPL 求值")
    class ReplTests {

        @Test
        @DisplayName("返回最后一条表达式语句的值")
        void testReturnsValue() {
            assertNull(interpreter.evalRepl("var x = 2;"));
            LoxValue value = interpreter.evalRepl("x * 3;");
            assertEquals(LoxNumber.of(6), value);
        }

        @Test
        @DisplayName("最后一条是 print 语句时返回 null")
        void testPrintReturnsNull() {
            assertNull(interpreter.evalRepl("\"s\"; print 1;"));
            assertThat(output()).containsExactly("Number(1.0)");
        }

        @Test
        @DisplayName("语法错误抛出 LoxSyntaxException 且不执行")
        void testSyntaxError() {
            LoxSyntaxException e = assertThrows(LoxSyntaxException.class,
                    () -> interpreter.evalRepl("print 1; print @;"));
            assertThat(e.getDiagnostics().getDiagnostics()).isNotEmpty();
            assertEquals("[line: 1, col: 16] Scanning Error (Unexpected character): @",
                    e.getDiagnostics().get(0).toString());
            assertThat(output()).isEmpty();
        }

        @Test
        @DisplayName("运行时错误抛出 LoxRuntimeException")
        void testRuntimeError() {
            assertThrows(LoxRuntimeException.class, () -> interpreter.evalRepl("nil + 1;"));
        }

        @Test
        @DisplayName("超长的运算链是语法错误而不是栈溢出")
        void testLongChain() {
            StringBuilder source = new StringBuilder("print 1");
            for (int i = 0; i < 100_000; i++) source.append("+1");
            LoxSyntaxException e = assertThrows(LoxSyntaxException.class,
                    () -> interpreter.evalRepl(source.append(";").toString()));
            assertEquals("Maximum nesting depth of " + LoxPolicy.DEFAULT_MAX_NESTING_DEPTH + " exceeded",
                    e.getDiagnostics().get(0).getMessage());
            assertThat(output()).isEmpty();
        }

        @Test
        @DisplayName("深度限制以内的运算链正常求值")
        void testChainWithinLimit() {
            StringBuilder source = new StringBuilder("1");
            for (int i = 0; i < 200; i++) source.append("+1");
            assertEquals(LoxNumber.of(201), interpreter.evalRepl(source.append(";").toString()));
        }

        @Test
        @DisplayName("字符串值")
        void testStringValue() {
            assertEquals(LoxString.of("hi"), interpreter.evalRepl("\"hi\";"));
        }
    }
}
