package com.loxlang.compiler.ast;

import com.loxlang.compiler.ast.expr.*;
import com.loxlang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每种节点一个抽象方法，新增节点类型时所有实现都必须跟着补上。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 语句 ============

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitPrintStmt(PrintStmt node, C ctx);

    R visitVarStmt(VarStmt node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitGroupingExpr(GroupingExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitConditionalExpr(ConditionalExpr node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitAssignExpr(AssignExpr node, C ctx);
}
