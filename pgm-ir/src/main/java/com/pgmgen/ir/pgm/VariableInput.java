package com.pgmgen.ir.pgm;

/**
 * 变量版本输入
 */
public final class VariableInput extends BodyInput {
    private final VariableReference reference;

    public VariableInput(VariableReference reference) {
        this.reference = reference;
    }

    public VariableReference getReference() {
        return reference;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableInput && reference.equals(((VariableInput) o).reference);
    }

    @Override
    public int hashCode() {
        return reference.hashCode();
    }

    @Override
    public String toString() {
        return reference.toString();
    }
}
