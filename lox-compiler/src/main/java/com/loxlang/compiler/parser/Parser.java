package com.loxlang.compiler.parser;

import com.loxlang.compiler.ast.stmt.Statement;
import com.loxlang.compiler.diagnostics.DiagnosticLog;
import com.loxlang.compiler.lexer.Token;
import com.loxlang.compiler.lexer.TokenType;
import com.loxlang.compiler.source.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static com.loxlang.compiler.lexer.TokenType.*;

/**
 * Lox 语法分析器（递归下降）
 *
 * <p>输入是词法分析器产出的 token 列表，必须以 EOF 结尾。单条语句出错不会中止解析：
 * 错误记入诊断日志，跳到下一条语句边界后继续。</p>
 */
public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    /** 表达式树的默认最大嵌套深度 */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private int index = 0;
    private final DiagnosticLog diagnostics = new DiagnosticLog();

    private final int maxNestingDepth;
    private int nestingDepth = 0;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth 最大嵌套深度，&lt;= 0 使用默认值
     */
    public Parser(List<Token> tokens, int maxNestingDepth) {
        // 空白 token 在这里丢弃；注释 token 保留，它们不匹配任何语法规则
        List<Token> significant = new ArrayList<Token>(tokens.size());
        for (Token token : tokens) {
            if (!token.getType().isTrivia()) {
                significant.add(token);
            }
        }
        this.tokens = significant;
        this.maxNestingDepth = maxNestingDepth > 0 ? maxNestingDepth : DEFAULT_MAX_NESTING_DEPTH;
    }

    // ============ 基础方法 ============

    private Token tokenAt(int i) {
        if (i >= tokens.size()) {
            throw new IllegalStateException("Consumed all tokens without encountering EOF");
        }
        return tokens.get(i);
    }

    /**
     * 查看当前 token（不消费）。位于 EOF 时返回 null。
     */
    Token peek() {
        Token token = tokenAt(index);
        return token.is(EOF) ? null : token;
    }

    /**
     * 返回当前 token 并前进；位于 EOF 时返回 null 且不再前进
     */
    Token advance() {
        Token token = tokenAt(index);
        if (token.is(EOF)) {
            return null;
        }
        index++;
        return token;
    }

    Token previous() {
        if (index == 0) {
            throw new IllegalStateException("Attempted to read previous token while at index 0");
        }
        return tokens.get(index - 1);
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        Token token = peek();
        return token != null && token.is(type);
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        Token token = peek();
        return token != null && token.isOneOf(types);
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 消费一个 token 并要求其类型为 expected（只比较种类，不比较值）。
     * 类型不符时该 token 也已被消费。
     *
     * @param after 错误消息中 "after ..." 的内容
     */
    Token consume(TokenType expected, String after) {
        Token next = advance();
        if (next == null) {
            throw new ParseException("Reached end of file while expecting '" + expected.getSymbol() + "'", null);
        }
        if (!next.is(expected)) {
            throw new ParseException("Expected '" + expected.getSymbol() + "' after " + after
                    + ", instead found '" + next.describe() + "'", next.getSpan());
        }
        return next;
    }

    /** 当前 token 的区间，位于 EOF 时取 EOF 的零宽区间 */
    SourceSpan location() {
        return tokenAt(index).getSpan();
    }

    /** 记录一个不需要同步的错误，解析继续 */
    void report(ParseException e) {
        diagnostics.add(e.toDiagnostic());
    }

    /** 进入一层嵌套：括号、一元运算、赋值或一次左折叠 */
    void enterNesting(Token token) {
        if (++nestingDepth > maxNestingDepth) {
            throw new ParseException("Maximum nesting depth of " + maxNestingDepth + " exceeded", token.getSpan());
        }
    }

    void exitNesting() {
        nestingDepth--;
    }

    void exitNesting(int levels) {
        nestingDepth -= levels;
    }

    // ============ 程序解析 ============

    /**
     * 解析整个程序。总是返回已解析的语句和错误列表，由调用方决定有错误时是否执行。
     */
    public ParseResult parse() {
        List<Statement> statements = new ArrayList<Statement>();
        while (peek() != null) {
            int start = index;
            nestingDepth = 0;
            try {
                statements.add(stmtParser.parseDeclaration());
            } catch (ParseException e) {
                diagnostics.add(e.toDiagnostic());
                synchronize();
                if (index == start) {
                    advance();
                }
            }
        }
        LOG.fine("Parsed " + statements.size() + " statements, " + diagnostics.size() + " errors");
        return new ParseResult(Collections.unmodifiableList(statements), diagnostics.freeze());
    }

    /**
     * 错误恢复：跳过 token，直到刚消费了 ';' 或下一个 token 是语句起始关键词。
     */
    private void synchronize() {
        while (peek() != null) {
            if (index > 0 && previous().is(SEMICOLON)) return;
            if (peek().getType().isStatementStart()) return;
            advance();
        }
    }
}
