package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * 嵌套调用输入 {@code {call: {function, input}}}
 */
public final class CallInput extends BodyInput {
    private final String function;
    private final List<BodyInput> input;

    public CallInput(String function, List<BodyInput> input) {
        this.function = function;
        this.input = Collections.unmodifiableList(input);
    }

    public String getFunction() {
        return function;
    }

    public List<BodyInput> getInput() {
        return input;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallInput)) return false;
        CallInput that = (CallInput) o;
        return function.equals(that.function) && input.equals(that.input);
    }

    @Override
    public int hashCode() {
        return 31 * function.hashCode() + input.hashCode();
    }

    @Override
    public String toString() {
        return function + input;
    }
}
