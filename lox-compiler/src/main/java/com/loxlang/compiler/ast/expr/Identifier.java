package com.loxlang.compiler.ast.expr;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 变量引用
 */
public class Identifier extends Expression {
    private final String name;

    public Identifier(SourceSpan location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }
}
