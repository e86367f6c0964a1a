package com.loxlang.compiler.parser;

import com.loxlang.compiler.ast.expr.Expression;
import com.loxlang.compiler.ast.stmt.*;
import com.loxlang.compiler.lexer.Token;
import com.loxlang.compiler.source.SourceSpan;

import static com.loxlang.compiler.lexer.TokenType.*;

/**
 * 声明和语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    // declaration -> "var" IDENTIFIER ( "=" expression )? ";" | statement
    Statement parseDeclaration() {
        if (parser.match(VAR)) {
            return parseVarDeclaration(parser.previous());
        }
        return parseStatement();
    }

    private Statement parseVarDeclaration(Token keyword) {
        Token name = parser.consume(IDENTIFIER, "'var'");
        Expression initializer = null;
        if (parser.match(EQUAL)) {
            initializer = parser.exprParser.parseExpression();
        }
        parser.consume(SEMICOLON, "variable declaration");
        return new VarStmt(keyword.getSpan(), name.getLexeme(), initializer);
    }

    // statement -> "print" expression ";" | expression ";"
    Statement parseStatement() {
        if (parser.match(PRINT)) {
            SourceSpan loc = parser.previous().getSpan();
            Expression expression = parser.exprParser.parseExpression();
            parser.consume(SEMICOLON, "expression");
            return new PrintStmt(loc, expression);
        }
        SourceSpan loc = parser.location();
        Expression expression = parser.exprParser.parseExpression();
        parser.consume(SEMICOLON, "expression");
        return new ExpressionStmt(loc, expression);
    }
}
