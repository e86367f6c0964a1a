package com.loxlang.compiler.ast.expr;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 括号表达式
 */
public class GroupingExpr extends Expression {
    private final Expression expression;

    public GroupingExpr(SourceSpan location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitGroupingExpr(this, context);
    }
}
