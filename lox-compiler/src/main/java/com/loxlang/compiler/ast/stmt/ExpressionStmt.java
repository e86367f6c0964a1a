package com.loxlang.compiler.ast.stmt;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.ast.expr.Expression;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 表达式语句
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceSpan location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
