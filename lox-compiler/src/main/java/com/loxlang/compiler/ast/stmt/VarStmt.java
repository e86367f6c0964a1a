package com.loxlang.compiler.ast.stmt;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.ast.expr.Expression;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 变量声明 var name [= initializer];
 */
public class VarStmt extends Statement {
    private final String name;
    private final Expression initializer;

    public VarStmt(SourceSpan location, String name, Expression initializer) {
        super(location);
        this.name = name;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    /** 没有初始化器时为 null */
    public Expression getInitializer() {
        return initializer;
    }

    public boolean hasInitializer() {
        return initializer != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarStmt(this, context);
    }
}
