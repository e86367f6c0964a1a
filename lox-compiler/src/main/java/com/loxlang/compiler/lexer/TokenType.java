package com.loxlang.compiler.lexer;

/**
 * Lox 词法单元类型
 *
 * <p>只表示种类，不携带值：比较两个 token 是否"同一种"时直接比较 TokenType。</p>
 */
public enum TokenType {
    // === 单字符 ===
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    COMMA(","),
    DOT("."),
    MINUS("-"),
    PLUS("+"),
    SEMICOLON(";"),
    SLASH("/"),
    STAR("*"),
    QUESTION("?"),
    COLON(":"),

    // === 一或两个字符 ===
    BANG("!"),
    BANG_EQUAL("!="),
    EQUAL("="),
    EQUAL_EQUAL("=="),
    GREATER(">"),
    GREATER_EQUAL(">="),
    LESS("<"),
    LESS_EQUAL("<="),

    // === 字面量 ===
    IDENTIFIER("identifier"),
    STRING("string"),
    NUMBER("number"),

    // === 关键词 ===
    AND("and"),
    CLASS("class"),
    ELSE("else"),
    FALSE("false"),
    FUN("fun"),
    FOR("for"),
    IF("if"),
    NIL("nil"),
    OR("or"),
    PRINT("print"),
    RETURN("return"),
    SUPER("super"),
    THIS("this"),
    TRUE("true"),
    VAR("var"),
    WHILE("while"),

    // === 元 token ===
    COMMENT("comment"),
    WHITESPACE("whitespace"),
    EOF("end of file");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /** 错误消息里使用的名字 */
    public String getSymbol() {
        return symbol;
    }

    public boolean isKeyword() {
        return ordinal() >= AND.ordinal() && ordinal() <= WHILE.ordinal();
    }

    /** 语法分析器会过滤掉的 token */
    public boolean isTrivia() {
        return this == WHITESPACE;
    }

    /**
     * 错误恢复时可作为新语句起点的关键词
     */
    public boolean isStatementStart() {
        switch (this) {
            case CLASS:
            case FOR:
            case FUN:
            case IF:
            case PRINT:
            case RETURN:
            case VAR:
            case WHILE:
                return true;
            default:
                return false;
        }
    }
}
