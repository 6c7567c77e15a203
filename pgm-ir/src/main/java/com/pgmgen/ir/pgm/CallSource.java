package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * 调用来源。每个实参对应一个来源列表（一个实参可能展开为多个来源）。
 */
public final class CallSource extends SourceDescriptor {
    private final String function;
    private final List<List<SourceDescriptor>> inputs;

    public CallSource(String function, List<List<SourceDescriptor>> inputs) {
        this.function = function;
        this.inputs = Collections.unmodifiableList(inputs);
    }

    public String getFunction() {
        return function;
    }

    public List<List<SourceDescriptor>> getInputs() {
        return inputs;
    }

    @Override
    public String toString() {
        return "Call(" + function + ", " + inputs + ")";
    }
}
