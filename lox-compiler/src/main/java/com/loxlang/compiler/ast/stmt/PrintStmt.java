package com.loxlang.compiler.ast.stmt;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.ast.expr.Expression;
import com.loxlang.compiler.source.SourceSpan;

/**
 * print 语句
 */
public class PrintStmt extends Statement {
    private final Expression expression;

    public PrintStmt(SourceSpan location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPrintStmt(this, context);
    }
}
