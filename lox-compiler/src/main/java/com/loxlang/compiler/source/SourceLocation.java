package com.loxlang.compiler.source;

/**
 * 源码中的单个位置
 *
 * <p>行、列从 1 开始；index 是按字素簇（grapheme cluster）计数的绝对下标，从 0 开始。</p>
 */
public final class SourceLocation {

    /** 源码起点 */
    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    private final int line;
    private final int column;
    private final int index;

    public SourceLocation(int line, int column, int index) {
        this.line = line;
        this.column = column;
        this.index = index;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getIndex() {
        return index;
    }

    /**
     * 越过一个字素簇后的位置：换行时行号加一、列归 1，否则列加一。index 总是加一。
     */
    public SourceLocation advance(String grapheme) {
        if (Graphemes.isNewline(grapheme)) {
            return new SourceLocation(line + 1, 1, index + 1);
        }
        return new SourceLocation(line, column + 1, index + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * line + column) + index;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
