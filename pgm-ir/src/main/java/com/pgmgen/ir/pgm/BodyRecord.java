package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * 体记录（数据流图的边）。
 *
 * <p>普通记录以 name 引用文档内的函数；外部调用记录（无结果的调用语句）以 function 引用
 * 被调函数名，不要求在文档内定义。output 为 null 表示无输出。</p>
 */
public final class BodyRecord {
    private final String name;
    private final VariableReference output;
    private final List<BodyInput> input;
    private final boolean external;

    private BodyRecord(String name, VariableReference output, List<BodyInput> input, boolean external) {
        this.name = name;
        this.output = output;
        this.input = Collections.unmodifiableList(input);
        this.external = external;
    }

    public static BodyRecord of(String name, VariableReference output, List<BodyInput> input) {
        return new BodyRecord(name, output, input, false);
    }

    public static BodyRecord externalCall(String function, List<BodyInput> input) {
        return new BodyRecord(function, null, input, true);
    }

    public String getName() {
        return name;
    }

    public VariableReference getOutput() {
        return output;
    }

    public boolean hasOutput() {
        return output != null;
    }

    public List<BodyInput> getInput() {
        return input;
    }

    public boolean isExternal() {
        return external;
    }

    @Override
    public String toString() {
        return (external ? "call " : "") + name + input + (output != null ? " -> " + output : "");
    }
}
