package lox.runtime;

/**
 * Lox 字符串值
 */
public final class LoxString extends LoxValue {

    private final String value;

    private LoxString(String value) {
        this.value = value;
    }

    public static LoxString of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value must not be null");
        }
        return new LoxString(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public String getTypeName() {
        return "String";
    }

    @Override
    public boolean isString() {
        return true;
    }

    /** 转义后的内容总在一行内 */
    @Override
    public String toDebugString() {
        StringBuilder sb = new StringBuilder(value.length() + 10).append("String(\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"':  sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\0': sb.append("\\0"); break;
                default:
                    if (Character.isISOControl(c)) {
                        sb.append("\\u{").append(Integer.toHexString(c)).append('}');
                    } else {
                        sb.append(c);
                    }
                    break;
            }
        }
        return sb.append("\")").toString();
    }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(LoxValue other) {
        if (other instanceof LoxString) {
            return this.value.equals(((LoxString) other).value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }
}
