package lox.runtime.interpreter;

import com.loxlang.compiler.ast.AstVisitor;
import com.loxlang.compiler.ast.expr.*;
import com.loxlang.compiler.ast.stmt.*;
import com.loxlang.compiler.diagnostics.Diagnostic;
import com.loxlang.compiler.diagnostics.DiagnosticLog;
import com.loxlang.compiler.lexer.Lexer;
import com.loxlang.compiler.lexer.ScanResult;
import com.loxlang.compiler.parser.ParseResult;
import com.loxlang.compiler.parser.Parser;
import lox.runtime.*;

import java.io.PrintStream;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lox 树遍历解释器
 *
 * <p>按顺序执行语句，遇到第一个运行时错误立即停止。变量绑定保存在全局 {@link Environment} 中，
 * 同一个解释器实例多次执行共享这些绑定（REPL 依赖这一点）。</p>
 *
 * <p>非线程安全。</p>
 */
public class Interpreter implements AstVisitor<LoxValue, Environment> {
    private static final Logger LOG = Logger.getLogger(Interpreter.class.getName());

    /** 策略 */
    private final LoxPolicy policy;

    /** 标准输出流，print 语句写入此处 */
    private PrintStream stdout;

    /** 全局环境 */
    private Environment globals = new Environment();

    /** 最近一条表达式语句的值（REPL 回显用） */
    private LoxValue lastValue;

    public Interpreter() {
        this(LoxPolicy.defaults(), System.out);
    }

    public Interpreter(LoxPolicy policy, PrintStream stdout) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (stdout == null) {
            throw new IllegalArgumentException("stdout must not be null");
        }
        this.policy = policy;
        this.stdout = stdout;
    }

    public LoxPolicy getPolicy() { return policy; }

    public PrintStream getStdout() { return stdout; }

    public void setStdout(PrintStream stdout) { this.stdout = stdout; }

    public Environment getGlobals() { return globals; }

    /** 丢弃所有全局变量 */
    public void reset() {
        globals = new Environment();
        lastValue = null;
    }

    // ============ 入口 ============

    /**
     * 执行语句列表
     *
     * @return 成功时为空日志，否则只含第一个运行时错误
     */
    public DiagnosticLog interpret(List<Statement> statements) {
        try {
            execute(statements);
            return new DiagnosticLog().freeze();
        } catch (LoxRuntimeException e) {
            LOG.log(Level.FINE, "Runtime error: " + e.getMessage(), e);
            return DiagnosticLog.of(e.toDiagnostic());
        }
    }

    /**
     * 执行语句列表，运行时错误以异常抛出
     *
     * @throws LoxRuntimeException 第一个运行时错误
     */
    public void execute(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this, globals);
        }
        LOG.fine("Executed " + statements.size() + " statements");
    }

    /**
     * REPL 模式执行：完整走一遍词法、语法分析和执行，变量在多次调用间保留。
     *
     * @return 最后一条语句是表达式语句时返回其值，否则返回 null
     * @throws LoxSyntaxException  源码有词法或语法错误（此时不执行任何语句）
     * @throws LoxRuntimeException 运行时错误
     */
    public LoxValue evalRepl(String source) {
        ScanResult scan = new Lexer(source).scan();
        ParseResult parse = new Parser(scan.getTokens(), policy.getMaxNestingDepth()).parse();

        DiagnosticLog errors = new DiagnosticLog();
        for (Diagnostic d : scan.getDiagnostics()) errors.add(d);
        for (Diagnostic d : parse.getDiagnostics()) errors.add(d);
        if (errors.hasErrors()) {
            throw new LoxSyntaxException(errors.freeze());
        }

        List<Statement> statements = parse.getStatements();
        lastValue = null;
        execute(statements);
        if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof ExpressionStmt) {
            return lastValue;
        }
        return null;
    }

    LoxValue evaluate(Expression expr, Environment env) {
        return expr.accept(this, env);
    }

    // ============ 语句 ============

    @Override
    public LoxValue visitExpressionStmt(ExpressionStmt node, Environment env) {
        lastValue = evaluate(node.getExpression(), env);
        return null;
    }

    @Override
    public LoxValue visitPrintStmt(PrintStmt node, Environment env) {
        LoxValue value = evaluate(node.getExpression(), env);
        stdout.println(value.toDebugString());
        return null;
    }

    @Override
    public LoxValue visitVarStmt(VarStmt node, Environment env) {
        LoxValue value = node.hasInitializer() ? evaluate(node.getInitializer(), env) : LoxNil.NIL;
        env.define(node.getName(), value);
        return null;
    }

    // ============ 表达式 ============

    @Override
    public LoxValue visitLiteral(Literal node, Environment env) {
        return LoxValue.fromLiteral(node);
    }

    @Override
    public LoxValue visitGroupingExpr(GroupingExpr node, Environment env) {
        return evaluate(node.getExpression(), env);
    }

    @Override
    public LoxValue visitUnaryExpr(UnaryExpr node, Environment env) {
        LoxValue operand = evaluate(node.getOperand(), env);
        switch (node.getOperator()) {
            case NEG:
                if (operand instanceof LoxNumber) {
                    return LoxNumber.of(-((LoxNumber) operand).getValue());
                }
                break;
            case NOT:
                // 只接受 Boolean 和 Nil
                if (operand instanceof LoxBoolean || operand instanceof LoxNil) {
                    return LoxBoolean.of(!isTruthy(operand));
                }
                break;
            default:
                throw new IllegalStateException("Unknown unary operator: " + node.getOperator());
        }
        throw new LoxRuntimeException("Illegal operand for unary '" + node.getOperator().toSourceString()
                + "' expression: " + operand.toDebugString(), node.getLocation());
    }

    @Override
    public LoxValue visitBinaryExpr(BinaryExpr node, Environment env) {
        LoxValue left = evaluate(node.getLeft(), env);
        LoxValue right = evaluate(node.getRight(), env);
        BinaryExpr.BinaryOp op = node.getOperator();

        switch (op) {
            case EQ: return LoxBoolean.of(left.equals(right));
            case NE: return LoxBoolean.of(!left.equals(right));
            default: break;
        }

        if (!(left instanceof LoxNumber) || !(right instanceof LoxNumber)) {
            String symbol = op.toSourceString();
            throw new LoxRuntimeException("Illegal operand for binary '" + symbol + "' expression: "
                    + left.toDebugString() + " " + symbol + " " + right.toDebugString(), node.getLocation());
        }
        double l = ((LoxNumber) left).getValue();
        double r = ((LoxNumber) right).getValue();

        switch (op) {
            case ADD: return LoxNumber.of(l + r);
            case SUB: return LoxNumber.of(l - r);
            case MUL: return LoxNumber.of(l * r);
            case DIV: return LoxNumber.of(l / r);
            case GT:  return LoxBoolean.of(l > r);
            case GE:  return LoxBoolean.of(l >= r);
            case LT:  return LoxBoolean.of(l < r);
            case LE:  return LoxBoolean.of(l <= r);
            default:
                throw new IllegalStateException("Unknown binary operator: " + op);
        }
    }

    @Override
    public LoxValue visitConditionalExpr(ConditionalExpr node, Environment env) {
        LoxValue condition = evaluate(node.getCondition(), env);
        if (!(condition instanceof LoxBoolean)) {
            throw new LoxRuntimeException("Non boolean type used as condition in ternary: "
                    + condition.toDebugString(), node.getLocation());
        }
        boolean chosen = ((LoxBoolean) condition).getValue();

        if (policy.isEagerTernary()) {
            LoxValue thenValue = evaluate(node.getThenExpr(), env);
            LoxValue elseValue = evaluate(node.getElseExpr(), env);
            return chosen ? thenValue : elseValue;
        }
        return chosen ? evaluate(node.getThenExpr(), env) : evaluate(node.getElseExpr(), env);
    }

    @Override
    public LoxValue visitIdentifier(Identifier node, Environment env) {
        return env.get(node.getName(), node.getLocation());
    }

    @Override
    public LoxValue visitAssignExpr(AssignExpr node, Environment env) {
        LoxValue value = evaluate(node.getValue(), env);
        env.assign(node.getName(), value, node.getLocation());
        return value;
    }

    // ============ 辅助 ============

    /** Boolean 取其值，Nil 为 false，其余值为 true */
    static boolean isTruthy(LoxValue value) {
        if (value instanceof LoxBoolean) return ((LoxBoolean) value).getValue();
        return !(value instanceof LoxNil);
    }
}
