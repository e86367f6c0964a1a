package lox.runtime;

import com.loxlang.compiler.ast.expr.Literal;

import java.math.BigDecimal;

/**
 * Lox 数值（IEEE-754 双精度）
 */
public final class LoxNumber extends LoxValue {

    private final double value;

    private LoxNumber(double value) {
        this.value = value;
    }

    public static LoxNumber of(double value) {
        return new LoxNumber(value);
    }

    public double getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Number";
    }

    @Override
    public String toDebugString() {
        return "Number(" + formatDebug(value) + ")";
    }

    /**
     * 调试形式的数字文本：总带小数部分（{@code 3.0}），非有限数为 {@code inf}、{@code -inf}、{@code NaN}，
     * 绝对值不在 [1e-4, 1e16) 内时用指数形式（{@code 1e16}、{@code 2.5e-7}）
     */
    static String formatDebug(double value) {
        if (Double.isNaN(value)) return "NaN";
        if (Double.isInfinite(value)) return value > 0 ? "inf" : "-inf";

        double abs = Math.abs(value);
        if (abs == 0) {
            return Double.toString(value);    // 保留 -0.0 的符号
        }
        if (abs >= 1e-4 && abs < 1e16) {
            String plain = new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }

        // Double.toString 此时形如 1.5E20 / 1.0E-5
        String text = Double.toString(value);
        int e = text.indexOf('E');
        String mantissa = text.substring(0, e);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return mantissa + "e" + text.substring(e + 1);
    }

    @Override
    public String toString() {
        return Literal.formatNumber(value);
    }

    // NaN 与自身不相等，遵循 IEEE 比较
    @Override
    public boolean equals(LoxValue other) {
        if (other instanceof LoxNumber) {
            return this.value == ((LoxNumber) other).value;
        }
        return false;
    }

    // -0.0 == 0.0，哈希也必须一致
    @Override
    public int hashCode() {
        return Double.hashCode(value == 0 ? 0.0 : value);
    }
}
