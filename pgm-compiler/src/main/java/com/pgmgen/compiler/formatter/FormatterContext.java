package com.pgmgen.compiler.formatter;

/**
 * 格式化上下文，跟踪输出缓冲区和缩进层级
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public FormatterContext(FormatConfig config) {
        this.config = config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            output.append(config.indentFor(indentLevel));
            atLineStart = false;
        }
        output.append(text);
    }

    /**
     * 换行
     */
    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 追加空行，不产生连续多个空行
     */
    public void blankLine() {
        int length = output.length();
        if (length >= 2 && output.charAt(length - 1) == '\n' && output.charAt(length - 2) == '\n') {
            return;
        }
        if (length > 0 && output.charAt(length - 1) != '\n') {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
    }

    /**
     * 获取当前输出
     */
    public String getOutput() {
        return output.toString();
    }
}
