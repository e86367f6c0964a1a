package lox.runtime;

/**
 * Lox Boolean 值
 */
public final class LoxBoolean extends LoxValue {

    /** true 常量 */
    public static final LoxBoolean TRUE = new LoxBoolean(true);

    /** false 常量 */
    public static final LoxBoolean FALSE = new LoxBoolean(false);

    private final boolean value;

    private LoxBoolean(boolean value) {
        this.value = value;
    }

    /**
     * 获取布尔值实例
     */
    public static LoxBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "Boolean";
    }

    @Override
    public String toDebugString() {
        return "Boolean(" + value + ")";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(LoxValue other) {
        if (other instanceof LoxBoolean) {
            return this.value == ((LoxBoolean) other).value;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }
}
