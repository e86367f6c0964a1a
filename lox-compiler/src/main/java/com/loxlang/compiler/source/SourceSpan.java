package com.loxlang.compiler.source;

/**
 * 源码区间 [start, end)
 *
 * <p>词法分析器把当前 token 的区间作为游标持有：每吃掉一个字素簇调用 {@link #extend}，
 * token 生成后调用 {@link #close()} 从当前位置开始下一个零宽区间。</p>
 */
public final class SourceSpan {

    /** 源码开头的零宽区间 */
    public static final SourceSpan EMPTY = new SourceSpan(SourceLocation.START, SourceLocation.START);

    private final SourceLocation start;
    private final SourceLocation end;

    public SourceSpan(SourceLocation start, SourceLocation end) {
        this.start = start;
        this.end = end;
    }

    public SourceLocation getStart() {
        return start;
    }

    public SourceLocation getEnd() {
        return end;
    }

    /** 区间覆盖的字素簇数 */
    public int length() {
        return end.getIndex() - start.getIndex();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    /** 结束位置越过一个字素簇 */
    public SourceSpan extend(String grapheme) {
        return new SourceSpan(start, end.advance(grapheme));
    }

    /** 收拢为 {end, end} */
    public SourceSpan close() {
        return new SourceSpan(end, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
