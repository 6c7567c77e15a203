package com.pgmgen.ir.pgm;

/**
 * 带版本的变量引用。变量名与版本都相同即为同一个值。
 */
public final class VariableReference {
    private final String variable;
    private final int index;

    public VariableReference(String variable, int index) {
        this.variable = variable;
        this.index = index;
    }

    public String getVariable() {
        return variable;
    }

    public int getIndex() {
        return index;
    }

    /** {@code x_2} 形式，用于合并节点的来源名 */
    public String getVersionedName() {
        return variable + "_" + index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableReference)) return false;
        VariableReference that = (VariableReference) o;
        return index == that.index && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return 31 * variable.hashCode() + index;
    }

    @Override
    public String toString() {
        return variable + "@" + index;
    }
}
