package com.pgmgen.ir.pgm;

/**
 * 循环迭代范围，端点为字面量或变量引用来源
 */
public final class IterationRange {
    private final SourceDescriptor start;
    private final SourceDescriptor end;

    public IterationRange(SourceDescriptor start, SourceDescriptor end) {
        this.start = start;
        this.end = end;
    }

    public SourceDescriptor getStart() {
        return start;
    }

    public SourceDescriptor getEnd() {
        return end;
    }
}
