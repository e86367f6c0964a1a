package com.loxlang.compiler.ast;

import com.loxlang.compiler.ast.expr.*;
import com.loxlang.compiler.ast.stmt.*;

import java.util.List;

/**
 * 调试用的 AST 文本表示
 *
 * <pre>
 * 1 + 2 * 3;        →  Expression Statement: (+ 1 (* 2 3))
 * print -(4);       →  Print Statement: (- (group 4))
 * var a = b ? 1 : 2; → Variable Statement: a = (b ? 1 : 2)
 * </pre>
 */
public final class AstPrinter implements AstVisitor<String, Void> {

    public String print(AstNode node) {
        return node.accept(this, null);
    }

    /** 每条语句一行 */
    public String print(List<? extends Statement> statements) {
        StringBuilder sb = new StringBuilder();
        for (Statement stmt : statements) {
            sb.append(print(stmt)).append('\n');
        }
        return sb.toString();
    }

    // ============ 语句 ============

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return "Expression Statement: " + print(node.getExpression());
    }

    @Override
    public String visitPrintStmt(PrintStmt node, Void ctx) {
        return "Print Statement: " + print(node.getExpression());
    }

    @Override
    public String visitVarStmt(VarStmt node, Void ctx) {
        String init = node.hasInitializer() ? " = " + print(node.getInitializer()) : "";
        return "Variable Statement: " + node.getName() + init;
    }

    // ============ 表达式 ============

    @Override
    public String visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case NUMBER:  return Literal.formatNumber((Double) node.getValue());
            case STRING:  return (String) node.getValue();
            case BOOLEAN: return String.valueOf(node.getValue());
            case NIL:     return "nil";
            default:      throw new IllegalStateException("Unknown literal kind: " + node.getKind());
        }
    }

    @Override
    public String visitGroupingExpr(GroupingExpr node, Void ctx) {
        return "(group " + print(node.getExpression()) + ")";
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Void ctx) {
        return "(" + node.getOperator().toSourceString() + " " + print(node.getOperand()) + ")";
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return "(" + node.getOperator().toSourceString() + " "
                + print(node.getLeft()) + " " + print(node.getRight()) + ")";
    }

    @Override
    public String visitConditionalExpr(ConditionalExpr node, Void ctx) {
        return "(" + print(node.getCondition()) + " ? " + print(node.getThenExpr())
                + " : " + print(node.getElseExpr()) + ")";
    }

    @Override
    public String visitIdentifier(Identifier node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitAssignExpr(AssignExpr node, Void ctx) {
        return "(= " + node.getName() + " " + print(node.getValue()) + ")";
    }
}
