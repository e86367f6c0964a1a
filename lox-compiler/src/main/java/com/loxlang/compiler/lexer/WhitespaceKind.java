package com.loxlang.compiler.lexer;

/**
 * WHITESPACE token 的具体种类
 */
public enum WhitespaceKind {
    SPACE(" "),
    TAB("\t"),
    CARRIAGE_RETURN("\r"),
    NEWLINE("\n"),
    CRLF("\r\n");       // "\r\n" 是单个字素簇

    private final String text;

    WhitespaceKind(String text) {
        this.text = text;
    }

    /** 字素簇对应的空白种类，不是空白返回 null */
    public static WhitespaceKind of(String grapheme) {
        for (WhitespaceKind kind : values()) {
            if (kind.text.equals(grapheme)) {
                return kind;
            }
        }
        return null;
    }
}
