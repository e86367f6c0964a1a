package com.loxlang.compiler.ast;

import com.loxlang.compiler.source.SourceSpan;

/**
 * AST 节点基类
 *
 * <p>节点构造后不可变，子节点由父节点独占。location 是定义该节点的 token 的区间
 * （运算符、字面量或关键词），供运行时错误定位。</p>
 */
public abstract class AstNode {
    protected final SourceSpan location;

    protected AstNode(SourceSpan location) {
        this.location = location;
    }

    public SourceSpan getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
