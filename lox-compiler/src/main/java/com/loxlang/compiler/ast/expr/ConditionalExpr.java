package com.loxlang.compiler.ast.expr;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 条件表达式（三元运算 condition ? thenExpr : elseExpr）
 */
public class ConditionalExpr extends Expression {

    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public ConditionalExpr(SourceSpan location,
                           Expression condition, Expression thenExpr, Expression elseExpr) {
        super(location);
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expression getCondition() { return condition; }
    public Expression getThenExpr() { return thenExpr; }
    public Expression getElseExpr() { return elseExpr; }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitConditionalExpr(this, context);
    }
}
