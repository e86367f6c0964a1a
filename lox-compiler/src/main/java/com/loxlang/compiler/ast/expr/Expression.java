package com.loxlang.compiler.ast.expr;

import com.loxlang.compiler.ast.AstNode;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceSpan location) {
        super(location);
    }
}
