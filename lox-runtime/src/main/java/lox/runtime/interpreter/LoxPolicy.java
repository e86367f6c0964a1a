package lox.runtime.interpreter;

import com.loxlang.compiler.parser.Parser;

/**
 * 解释器策略配置
 *
 * <p>使用示例：</p>
 * <pre>
 * Interpreter interp = new Interpreter(LoxPolicy.defaults(), System.out);
 *
 * LoxPolicy policy = LoxPolicy.custom()
 *     .maxNestingDepth(64)
 *     .ternaryMode(LoxPolicy.TernaryMode.EAGER)
 *     .build();
 * </pre>
 */
public final class LoxPolicy {

    /** 三元表达式的求值方式 */
    public enum TernaryMode {
        /** 只求值被选中的分支 */
        SHORT_CIRCUIT,
        /** 两个分支都求值，再按条件选择 */
        EAGER
    }

    /** 默认最大嵌套深度，与语法分析器一致 */
    public static final int DEFAULT_MAX_NESTING_DEPTH = Parser.DEFAULT_MAX_NESTING_DEPTH;

    private final int maxNestingDepth;
    private final TernaryMode ternaryMode;

    private LoxPolicy(Builder builder) {
        this.maxNestingDepth = builder.maxNestingDepth;
        this.ternaryMode = builder.ternaryMode;
    }

    // ============ 预定义工厂方法 ============

    /** 默认策略：嵌套深度 256，三元短路求值 */
    public static LoxPolicy defaults() {
        return custom().build();
    }

    /** 自定义策略 Builder */
    public static Builder custom() {
        return new Builder();
    }

    // ============ 查询方法 ============

    /** 括号 / 一元运算的最大嵌套深度，0 表示使用语法分析器默认值 */
    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public TernaryMode getTernaryMode() {
        return ternaryMode;
    }

    public boolean isEagerTernary() {
        return ternaryMode == TernaryMode.EAGER;
    }

    @Override
    public String toString() {
        return "LoxPolicy{maxNestingDepth=" + maxNestingDepth + ", ternaryMode=" + ternaryMode + "}";
    }

    // ============ Builder ============

    public static final class Builder {
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private TernaryMode ternaryMode = TernaryMode.SHORT_CIRCUIT;

        Builder() {
        }

        public Builder maxNestingDepth(int depth) {
            if (depth < 0) {
                throw new IllegalArgumentException("maxNestingDepth must be >= 0: " + depth);
            }
            this.maxNestingDepth = depth;
            return this;
        }

        public Builder ternaryMode(TernaryMode mode) {
            if (mode == null) {
                throw new IllegalArgumentException("ternaryMode must not be null");
            }
            this.ternaryMode = mode;
            return this;
        }

        public LoxPolicy build() {
            return new LoxPolicy(this);
        }
    }
}
