package com.loxlang.compiler.lexer;

import com.loxlang.compiler.diagnostics.Diagnostic;
import com.loxlang.compiler.diagnostics.DiagnosticLog;
import com.loxlang.compiler.source.Graphemes;
import com.loxlang.compiler.source.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Lox 词法分析器
 *
 * <p>以字素簇为单位扫描。空白和注释也产出 token，由语法分析器决定是否丢弃；
 * 词法错误记入诊断日志后继续扫描。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final List<String> graphemes;
    private final List<Token> tokens = new ArrayList<Token>();
    private final DiagnosticLog diagnostics = new DiagnosticLog();

    /** 下一个待读取的字素簇下标 */
    private int current = 0;
    /** 当前 token 的区间游标 */
    private SourceSpan span = SourceSpan.EMPTY;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();
        map.put("and", TokenType.AND);
        map.put("class", TokenType.CLASS);
        map.put("else", TokenType.ELSE);
        map.put("false", TokenType.FALSE);
        map.put("fun", TokenType.FUN);
        map.put("for", TokenType.FOR);
        map.put("if", TokenType.IF);
        map.put("nil", TokenType.NIL);
        map.put("or", TokenType.OR);
        map.put("print", TokenType.PRINT);
        map.put("return", TokenType.RETURN);
        map.put("super", TokenType.SUPER);
        map.put("this", TokenType.THIS);
        map.put("true", TokenType.TRUE);
        map.put("var", TokenType.VAR);
        map.put("while", TokenType.WHILE);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.graphemes = Graphemes.split(source);
    }

    /**
     * 执行词法分析。返回的 token 列表总以 EOF 结尾。
     */
    public ScanResult scan() {
        while (!isAtEnd()) {
            scanToken();
            span = span.close();
        }

        tokens.add(new Token(TokenType.EOF, "", null, span));
        LOG.fine("Scanned " + tokens.size() + " tokens, " + diagnostics.size() + " errors");
        return new ScanResult(Collections.unmodifiableList(tokens), diagnostics.freeze());
    }

    private void scanToken() {
        String c = advance();
        switch (c) {
            // 单字符 Token
            case "(": addToken(TokenType.LEFT_PAREN); break;
            case ")": addToken(TokenType.RIGHT_PAREN); break;
            case "{": addToken(TokenType.LEFT_BRACE); break;
            case "}": addToken(TokenType.RIGHT_BRACE); break;
            case ",": addToken(TokenType.COMMA); break;
            case ".": addToken(TokenType.DOT); break;
            case "-": addToken(TokenType.MINUS); break;
            case "+": addToken(TokenType.PLUS); break;
            case ";": addToken(TokenType.SEMICOLON); break;
            case "*": addToken(TokenType.STAR); break;
            case "?": addToken(TokenType.QUESTION); break;
            case ":": addToken(TokenType.COLON); break;

            // 可能带 '=' 的操作符
            case "!":
                addToken(match("=") ? TokenType.BANG_EQUAL : TokenType.BANG);
                break;
            case "=":
                addToken(match("=") ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
                break;
            case "<":
                addToken(match("=") ? TokenType.LESS_EQUAL : TokenType.LESS);
                break;
            case ">":
                addToken(match("=") ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                break;

            case "/":
                if (match("/")) {
                    lineComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case "\"":
                string();
                break;

            default:
                WhitespaceKind whitespace = WhitespaceKind.of(c);
                if (whitespace != null) {
                    addToken(TokenType.WHITESPACE, whitespace);
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.add(Diagnostic.scanning(c, span, "Unexpected character"));
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= graphemes.size();
    }

    private String advance() {
        String g = graphemes.get(current++);
        span = span.extend(g);
        return g;
    }

    private boolean match(String expected) {
        if (isAtEnd()) return false;
        if (!graphemes.get(current).equals(expected)) return false;
        advance();
        return true;
    }

    private String peek() {
        if (isAtEnd()) return "";
        return graphemes.get(current);
    }

    private String peekNext() {
        if (current + 1 >= graphemes.size()) return "";
        return graphemes.get(current + 1);
    }

    private static boolean isDigit(String g) {
        return g.length() == 1 && g.charAt(0) >= '0' && g.charAt(0) <= '9';
    }

    private static boolean isAlpha(String g) {
        if (g.isEmpty()) return false;
        int cp = g.codePointAt(0);
        return cp == '_' || Character.isAlphabetic(cp);
    }

    private static boolean isAlphaNumeric(String g) {
        if (g.isEmpty()) return false;
        int cp = g.codePointAt(0);
        return cp == '_' || Character.isAlphabetic(cp) || Character.isDigit(cp);
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, lexeme(), literal, span));
    }

    private String lexeme() {
        return Graphemes.slice(graphemes, span);
    }

    // === 复杂 Token 扫描 ===

    private void lineComment() {
        while (!isAtEnd() && !Graphemes.isNewline(peek())) advance();
        String text = lexeme();
        addToken(TokenType.COMMENT, text);
    }

    private void string() {
        while (!isAtEnd() && !"\"".equals(peek())) {
            advance();
        }

        if (isAtEnd()) {
            // 已到输入末尾，扫描随之结束
            diagnostics.add(Diagnostic.scanning(null, span, "Unterminated String"));
            return;
        }

        advance(); // 闭合的 "
        String text = lexeme();
        addToken(TokenType.STRING, text.substring(1, text.length() - 1));
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分：'.' 后必须紧跟数字，否则 '.' 留给 DOT
        if (".".equals(peek()) && isDigit(peekNext())) {
            advance(); // 消费 .
            while (isDigit(peek())) advance();
        }

        String text = lexeme();
        double value;
        try {
            value = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Digit sequence failed to parse as a number: " + text, e);
        }
        addToken(TokenType.NUMBER, value);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = lexeme();
        TokenType type = KEYWORDS.get(text);
        if (type == null) {
            addToken(TokenType.IDENTIFIER, text);
        } else {
            addToken(type);
        }
    }
}
