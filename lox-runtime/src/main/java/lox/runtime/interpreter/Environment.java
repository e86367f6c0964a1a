package lox.runtime.interpreter;

import com.loxlang.compiler.source.SourceSpan;
import lox.runtime.LoxValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 运行时环境（作用域）
 *
 * <p>管理变量绑定，支持嵌套作用域：查找和赋值沿外层链向上，定义只作用于当前层。</p>
 */
public final class Environment {

    private final Environment enclosing;
    private final Map<String, LoxValue> values = new LinkedHashMap<String, LoxValue>();

    /**
     * 创建全局环境
     */
    public Environment() {
        this(null);
    }

    /**
     * 创建子环境
     */
    public Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    public Environment getEnclosing() {
        return enclosing;
    }

    /**
     * 定义变量。同名变量允许重新定义，新值覆盖旧值。
     */
    public void define(String name, LoxValue value) {
        values.put(name, value);
    }

    public boolean isDefined(String name) {
        if (values.containsKey(name)) return true;
        return enclosing != null && enclosing.isDefined(name);
    }

    /**
     * 读取变量
     *
     * @param location 引用处的区间，用于错误报告
     * @throws LoxRuntimeException 变量未定义
     */
    public LoxValue get(String name, SourceSpan location) {
        LoxValue value = values.get(name);
        if (value != null) return value;
        if (enclosing != null) return enclosing.get(name, location);
        throw new LoxRuntimeException("Undefined variable", name, location);
    }

    /**
     * 给已定义的变量赋值
     *
     * @throws LoxRuntimeException 变量未定义
     */
    public void assign(String name, LoxValue value, SourceSpan location) {
        if (values.containsKey(name)) {
            values.put(name, value);
            return;
        }
        if (enclosing != null) {
            enclosing.assign(name, value, location);
            return;
        }
        throw new LoxRuntimeException("Undefined variable", name, location);
    }

    /** 当前层的绑定（按定义顺序，只读） */
    public Map<String, LoxValue> getValues() {
        return Collections.unmodifiableMap(values);
    }
}
