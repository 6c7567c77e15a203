package com.pgmgen.compiler.ast;

/**
 * 源码位置。行号与列号从 1 开始，0 表示未知
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;

    public SourceLocation(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        String name = file == null ? "<input>" : file;
        return column > 0 ? name + ":" + line + ":" + column : name + ":" + line;
    }
}
