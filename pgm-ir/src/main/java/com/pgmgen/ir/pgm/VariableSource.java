package com.pgmgen.ir.pgm;

/**
 * 变量引用来源
 */
public final class VariableSource extends SourceDescriptor {
    private final VariableReference reference;

    public VariableSource(VariableReference reference) {
        this.reference = reference;
    }

    public VariableReference getReference() {
        return reference;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableSource && reference.equals(((VariableSource) o).reference);
    }

    @Override
    public int hashCode() {
        return reference.hashCode();
    }

    @Override
    public String toString() {
        return "Var(" + reference + ")";
    }
}
