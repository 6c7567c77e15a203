package com.pgmgen.compiler.formatter;

import java.util.Arrays;

/**
 * 源码渲染配置。Python 源码只用空格缩进，因此这里只有缩进宽度
 */
public class FormatConfig {
    public static final int DEFAULT_INDENT_SIZE = 4;

    private int indentSize = DEFAULT_INDENT_SIZE;

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
        }
        this.indentSize = indentSize;
    }

    /**
     * 第 level 层缩进对应的前缀
     */
    public String indentFor(int level) {
        char[] spaces = new char[Math.max(0, level) * indentSize];
        Arrays.fill(spaces, ' ');
        return new String(spaces);
    }
}
