package com.loxlang.compiler.ast.expr;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 字面量表达式
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceSpan location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal number(SourceSpan location, double value) {
        return new Literal(location, value, LiteralKind.NUMBER);
    }

    public static Literal string(SourceSpan location, String value) {
        return new Literal(location, value, LiteralKind.STRING);
    }

    public static Literal bool(SourceSpan location, boolean value) {
        return new Literal(location, value, LiteralKind.BOOLEAN);
    }

    public static Literal nil(SourceSpan location) {
        return new Literal(location, null, LiteralKind.NIL);
    }

    /**
     * 数字的源码写法：整数值不带小数部分（3 而不是 3.0）
     */
    public static String formatNumber(double value) {
        if (!Double.isInfinite(value) && !Double.isNaN(value)
                && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }

    /** NUMBER → Double，STRING → String，BOOLEAN → Boolean，NIL → null */
    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        NUMBER,
        STRING,
        BOOLEAN,
        NIL
    }
}
