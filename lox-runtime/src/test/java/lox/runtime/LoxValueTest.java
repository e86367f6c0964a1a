package lox.runtime;

import com.loxlang.compiler.ast.expr.Literal;
import com.loxlang.compiler.source.SourceSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 运行时值模型测试
 */
class LoxValueTest {

    @Nested
    @DisplayName("调试表示")
    class DebugStringTests {

        @Test
        @DisplayName("每种值的调试表示")
        void testDebugStrings() {
            assertEquals("Number(3.0)", LoxNumber.of(3).toDebugString());
            assertEquals("Number(-0.5)", LoxNumber.of(-0.5).toDebugString());
            assertEquals("String(\"abc\")", LoxString.of("abc").toDebugString());
            assertEquals("Boolean(true)", LoxBoolean.TRUE.toDebugString());
            assertEquals("Nil", LoxNil.NIL.toDebugString());
        }

        @Test
        @DisplayName("字符串中的引号和反斜杠被转义")
        void testStringEscapes() {
            assertEquals("String(\"a\\\"b\\\\c\")", LoxString.of("a\"b\\c").toDebugString());
        }

        @Test
        @DisplayName("控制字符被转义，输出保持单行")
        void testControlCharacterEscapes() {
            assertEquals("String(\"a\\nb\")", LoxString.of("a\nb").toDebugString());
            assertEquals("String(\"\\t\\r\\0\\u{1b}\")", LoxString.of("\t\r\0\u001b").toDebugString());
            assertEquals("String(\"é\")", LoxString.of("é").toDebugString());
        }

        @Test
        @DisplayName("非有限数")
        void testNonFinite() {
            assertEquals("Number(inf)", LoxNumber.of(1.0 / 0).toDebugString());
            assertEquals("Number(-inf)", LoxNumber.of(-1.0 / 0).toDebugString());
            assertEquals("Number(NaN)", LoxNumber.of(Double.NaN).toDebugString());
        }

        @Test
        @DisplayName("大数和小数的调试形式")
        void testMagnitudes() {
            assertEquals("10000000.0", LoxNumber.formatDebug(1e7));
            assertEquals("0.0001", LoxNumber.formatDebug(1e-4));
            assertEquals("1e16", LoxNumber.formatDebug(1e16));
            assertEquals("-1.5e20", LoxNumber.formatDebug(-1.5e20));
            assertEquals("1e-5", LoxNumber.formatDebug(1e-5));
            assertEquals("-0.0", LoxNumber.formatDebug(-0.0));
        }
    }

    @Nested
    @DisplayName("文本表示")
    class PlainStringTests {

        @Test
        @DisplayName("整数值不带小数部分")
        void testNumbers() {
            assertEquals("3", LoxNumber.of(3).toString());
            assertEquals("3.5", LoxNumber.of(3.5).toString());
        }

        @Test
        @DisplayName("其他值")
        void testOthers() {
            assertEquals("abc", LoxString.of("abc").toString());
            assertEquals("false", LoxBoolean.FALSE.toString());
            assertEquals("nil", LoxNil.NIL.toString());
        }
    }

    @Nested
    @DisplayName("相等性")
    class EqualityTests {

        @Test
        @DisplayName("同类型按值比较")
        void testSameVariant() {
            assertTrue(LoxNumber.of(2).equals(LoxNumber.of(2)));
            assertTrue(LoxString.of("x").equals(LoxString.of("x")));
            assertTrue(LoxNil.NIL.equals(LoxNil.NIL));
            assertFalse(LoxBoolean.TRUE.equals(LoxBoolean.FALSE));
        }

        @Test
        @DisplayName("不同类型永不相等")
        void testCrossVariant() {
            assertFalse(LoxNumber.of(1).equals(LoxString.of("1")));
            assertFalse(LoxNil.NIL.equals(LoxBoolean.FALSE));
            assertFalse(LoxNumber.of(0).equals(LoxNil.NIL));
        }

        @Test
        @DisplayName("NaN 与自身不相等")
        void testNaN() {
            LoxNumber nan = LoxNumber.of(Double.NaN);
            assertFalse(nan.equals((LoxValue) nan));
        }

        @Test
        @DisplayName("0 与 -0 相等且哈希一致")
        void testSignedZero() {
            LoxNumber zero = LoxNumber.of(0.0);
            LoxNumber negativeZero = LoxNumber.of(-0.0);
            assertEquals(zero, negativeZero);
            assertEquals(zero.hashCode(), negativeZero.hashCode());
            assertEquals(1, new HashSet<LoxValue>(Arrays.asList(zero, negativeZero)).size());
        }

        @Test
        @DisplayName("布尔值复用常量")
        void testBooleanConstants() {
            assertSame(LoxBoolean.TRUE, LoxBoolean.of(true));
            assertSame(LoxBoolean.FALSE, LoxBoolean.of(false));
        }
    }

    @Test
    @DisplayName("字面量转换为运行时值")
    void testFromLiteral() {
        SourceSpan loc = SourceSpan.EMPTY;
        assertEquals(LoxNumber.of(4), LoxValue.fromLiteral(Literal.number(loc, 4)));
        assertEquals(LoxString.of("s"), LoxValue.fromLiteral(Literal.string(loc, "s")));
        assertSame(LoxBoolean.TRUE, LoxValue.fromLiteral(Literal.bool(loc, true)));
        assertSame(LoxNil.NIL, LoxValue.fromLiteral(Literal.nil(loc)));
        assertEquals("Number", LoxValue.fromLiteral(Literal.number(loc, 4)).getTypeName());
    }
}
