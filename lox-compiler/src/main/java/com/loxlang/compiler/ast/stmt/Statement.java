package com.loxlang.compiler.ast.stmt;

import com.loxlang.compiler.ast.AstNode;
import com.loxlang.compiler.source.SourceSpan;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceSpan location) {
        super(location);
    }
}
