package com.loxlang.compiler.lexer;

import com.loxlang.compiler.source.SourceSpan;

/**
 * 词法单元及其源码区间
 *
 * <p>literal 按类型携带：NUMBER → Double，STRING → 去掉引号的内容，IDENTIFIER / COMMENT → 原文，
 * WHITESPACE → {@link WhitespaceKind}，其余为 null。</p>
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final SourceSpan span;

    public Token(TokenType type, String lexeme, Object literal, SourceSpan span) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.span = span;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public int getLine() {
        return span.getStart().getLine();
    }

    public int getColumn() {
        return span.getStart().getColumn();
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    public boolean isOneOf(TokenType... types) {
        for (TokenType t : types) {
            if (this.type == t) {
                return true;
            }
        }
        return false;
    }

    /** 错误消息中的写法 */
    public String describe() {
        return lexeme.isEmpty() ? type.getSymbol() : lexeme;
    }

    @Override
    public String toString() {
        if (literal != null) {
            return String.format("%s(%s, %s) at %d:%d",
                    type, lexeme, literal, getLine(), getColumn());
        }
        return String.format("%s(%s) at %d:%d",
                type, lexeme, getLine(), getColumn());
    }
}
