package com.pgmgen.ir.pgm;

import com.pgmgen.compiler.formatter.PyLiterals;

/**
 * 字面量来源。值为 Long、Double、String 或 Boolean。
 */
public final class LiteralSource extends SourceDescriptor {
    private final Domain domain;
    private final Object value;

    public LiteralSource(Domain domain, Object value) {
        this.domain = domain;
        this.value = value;
    }

    public Domain getDomain() {
        return domain;
    }

    public Object getValue() {
        return value;
    }

    /** 字面量载荷中使用的文本形式 */
    public String getText() {
        return PyLiterals.str(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LiteralSource)) return false;
        LiteralSource that = (LiteralSource) o;
        return domain == that.domain && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return 31 * domain.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return "Literal(" + domain + ", " + getText() + ")";
    }
}
