package lox.runtime;

/**
 * Lox 基础运行时异常（无源位置信息）。
 *
 * <p>{@code lox.runtime.interpreter.LoxRuntimeException} 继承此类，
 * 并添加源码区间和诊断转换。</p>
 */
public class LoxException extends RuntimeException {

    public LoxException(String message) {
        super(message);
    }

    public LoxException(String message, Throwable cause) {
        super(message, cause);
    }
}
