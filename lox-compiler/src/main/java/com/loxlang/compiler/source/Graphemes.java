package com.loxlang.compiler.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 字素簇工具
 *
 * <p>用户感知的一个字符可能由多个码点组成（如 e + 组合重音、带肤色修饰的 emoji），
 * 词法分析和列号都以字素簇为单位。</p>
 */
public final class Graphemes {

    private static final Pattern CLUSTER = Pattern.compile("\\X");

    private Graphemes() {}

    /**
     * 将源码切分为扩展字素簇序列
     */
    public static List<String> split(String text) {
        if (text.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<String>(text.length());
        Matcher m = CLUSTER.matcher(text);
        while (m.find()) {
            result.add(m.group());
        }
        return result;
    }

    /** "\n" 和单个字素簇 "\r\n" 都算换行 */
    public static boolean isNewline(String grapheme) {
        return "\n".equals(grapheme) || "\r\n".equals(grapheme);
    }

    /**
     * 取出区间对应的原始文本
     */
    public static String slice(List<String> graphemes, SourceSpan span) {
        int from = Math.max(0, span.getStart().getIndex());
        int to = Math.min(graphemes.size(), span.getEnd().getIndex());
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            sb.append(graphemes.get(i));
        }
        return sb.toString();
    }
}
