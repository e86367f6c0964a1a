package com.loxlang.compiler.parser;

import com.loxlang.compiler.ast.expr.*;
import com.loxlang.compiler.lexer.Token;
import com.loxlang.compiler.lexer.TokenType;

import static com.loxlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 *
 * <p>每个优先级一个方法：先解析更高优先级的操作数，再循环吸收本级运算符并左折叠。
 * 每次折叠、每层括号、一元运算和赋值都计入同一个嵌套深度，树的深度因此不超过上限。</p>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseAssignExpr();
    }

    // 赋值（最低优先级，右结合）
    private Expression parseAssignExpr() {
        Expression left = parseTernaryExpr();

        if (parser.check(EQUAL)) {
            Token equals = parser.advance();
            parser.enterNesting(equals);
            Expression value = parseAssignExpr();
            parser.exitNesting();
            if (left instanceof Identifier) {
                return new AssignExpr(equals.getSpan(), ((Identifier) left).getName(), value);
            }
            // 不同步：右侧已完整解析
            parser.report(new ParseException("Invalid assignment target", equals.getSpan()));
        }

        return left;
    }

    // 三元 condition ? a : b，分支只接受 equality 级表达式
    private Expression parseTernaryExpr() {
        Expression expr = parseEqualityExpr();
        int folds = 0;

        while (parser.check(QUESTION)) {
            Token question = parser.advance();
            parser.enterNesting(question);
            folds++;
            Expression thenExpr = parseEqualityExpr();
            parser.consume(COLON, "ternary condition");
            Expression elseExpr = parseEqualityExpr();
            expr = new ConditionalExpr(question.getSpan(), expr, thenExpr, elseExpr);
        }

        parser.exitNesting(folds);
        return expr;
    }

    // 相等性 == !=
    private Expression parseEqualityExpr() {
        Expression left = parseComparisonExpr();
        int folds = 0;

        while (parser.checkAny(BANG_EQUAL, EQUAL_EQUAL)) {
            Token op = parser.advance();
            parser.enterNesting(op);
            folds++;
            Expression right = parseComparisonExpr();
            left = new BinaryExpr(op.getSpan(), left, binaryOp(op.getType()), right);
        }

        parser.exitNesting(folds);
        return left;
    }

    // 比较 > >= < <=
    private Expression parseComparisonExpr() {
        Expression left = parseTermExpr();
        int folds = 0;

        while (parser.checkAny(GREATER, GREATER_EQUAL, LESS, LESS_EQUAL)) {
            Token op = parser.advance();
            parser.enterNesting(op);
            folds++;
            Expression right = parseTermExpr();
            left = new BinaryExpr(op.getSpan(), left, binaryOp(op.getType()), right);
        }

        parser.exitNesting(folds);
        return left;
    }

    // 加减
    private Expression parseTermExpr() {
        Expression left = parseFactorExpr();
        int folds = 0;

        while (parser.checkAny(MINUS, PLUS)) {
            Token op = parser.advance();
            parser.enterNesting(op);
            folds++;
            Expression right = parseFactorExpr();
            left = new BinaryExpr(op.getSpan(), left, binaryOp(op.getType()), right);
        }

        parser.exitNesting(folds);
        return left;
    }

    // 乘除
    private Expression parseFactorExpr() {
        Expression left = parseUnaryExpr();
        int folds = 0;

        while (parser.checkAny(SLASH, STAR)) {
            Token op = parser.advance();
            parser.enterNesting(op);
            folds++;
            Expression right = parseUnaryExpr();
            left = new BinaryExpr(op.getSpan(), left, binaryOp(op.getType()), right);
        }

        parser.exitNesting(folds);
        return left;
    }

    // 前缀 ! -
    private Expression parseUnaryExpr() {
        if (parser.checkAny(BANG, MINUS)) {
            Token op = parser.advance();
            parser.enterNesting(op);
            Expression operand = parseUnaryExpr();
            parser.exitNesting();
            UnaryExpr.UnaryOp unaryOp = op.is(BANG) ? UnaryExpr.UnaryOp.NOT : UnaryExpr.UnaryOp.NEG;
            return new UnaryExpr(op.getSpan(), unaryOp, operand);
        }

        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token token = parser.advance();
        if (token == null) {
            throw new ParseException("Ran out of tokens while satisfying expression rule",
                    parser.previous().getSpan());
        }

        switch (token.getType()) {
            case FALSE:
                return Literal.bool(token.getSpan(), false);
            case TRUE:
                return Literal.bool(token.getSpan(), true);
            case NIL:
                return Literal.nil(token.getSpan());
            case NUMBER:
                return Literal.number(token.getSpan(), (Double) token.getLiteral());
            case STRING:
                return Literal.string(token.getSpan(), (String) token.getLiteral());
            case IDENTIFIER:
                return new Identifier(token.getSpan(), token.getLexeme());
            case LEFT_PAREN: {
                parser.enterNesting(token);
                Expression inner = parseExpression();
                parser.consume(RIGHT_PAREN, "expression");
                parser.exitNesting();
                return new GroupingExpr(token.getSpan(), inner);
            }
            default:
                throw new ParseException("Expected value or expression, found '" + token.describe() + "'",
                        token.getSpan());
        }
    }

    private static BinaryExpr.BinaryOp binaryOp(TokenType type) {
        switch (type) {
            case PLUS:          return BinaryExpr.BinaryOp.ADD;
            case MINUS:         return BinaryExpr.BinaryOp.SUB;
            case STAR:          return BinaryExpr.BinaryOp.MUL;
            case SLASH:         return BinaryExpr.BinaryOp.DIV;
            case GREATER:       return BinaryExpr.BinaryOp.GT;
            case GREATER_EQUAL: return BinaryExpr.BinaryOp.GE;
            case LESS:          return BinaryExpr.BinaryOp.LT;
            case LESS_EQUAL:    return BinaryExpr.BinaryOp.LE;
            case EQUAL_EQUAL:   return BinaryExpr.BinaryOp.EQ;
            case BANG_EQUAL:    return BinaryExpr.BinaryOp.NE;
            default:
                throw new IllegalStateException("Not a binary operator: " + type);
        }
    }
}
