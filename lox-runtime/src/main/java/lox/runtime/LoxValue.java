package lox.runtime;

import com.loxlang.compiler.ast.expr.Literal;

/**
 * Lox 运行时值的基类
 *
 * <p>值是不可变的；相等性按结构比较，不同类型的值永不相等。</p>
 */
public abstract class LoxValue {

    /**
     * 将字面量节点转换为运行时值
     */
    public static LoxValue fromLiteral(Literal literal) {
        switch (literal.getKind()) {
            case NUMBER:
                return LoxNumber.of((Double) literal.getValue());
            case STRING:
                return LoxString.of((String) literal.getValue());
            case BOOLEAN:
                return LoxBoolean.of((Boolean) literal.getValue());
            case NIL:
                return LoxNil.NIL;
            default:
                throw new IllegalStateException("Unknown literal kind: " + literal.getKind());
        }
    }

    /**
     * 获取值的类型名称
     */
    public abstract String getTypeName();

    /**
     * 调试表示，如 {@code Number(3.0)}、{@code String("abc")}。print 语句输出此形式。
     */
    public abstract String toDebugString();

    /**
     * 结构相等
     */
    public abstract boolean equals(LoxValue other);

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LoxValue)) return false;
        return equals((LoxValue) obj);
    }

    @Override
    public abstract int hashCode();

    /** REPL 回显时字符串加引号 */
    public boolean isString() {
        return false;
    }
}
