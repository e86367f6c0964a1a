package com.loxlang.compiler.ast.expr;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 赋值表达式 name = value，值为赋入的值
 */
public class AssignExpr extends Expression {
    private final String name;
    private final Expression value;

    public AssignExpr(SourceSpan location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignExpr(this, context);
    }
}
