package lox.runtime;

/**
 * Lox nil 值
 */
public final class LoxNil extends LoxValue {

    /** 唯一的 nil 实例 */
    public static final LoxNil NIL = new LoxNil();

    private LoxNil() {
    }

    @Override
    public String getTypeName() {
        return "Nil";
    }

    @Override
    public String toDebugString() {
        return "Nil";
    }

    @Override
    public String toString() {
        return "nil";
    }

    @Override
    public boolean equals(LoxValue other) {
        return other instanceof LoxNil;
    }

    @Override
    public int hashCode() {
        return 0;
    }
}
