package com.pgmgen.ir.pgm;

/**
 * 常量赋值的字面量载荷
 */
public final class LiteralBody extends FunctionBody {
    private final Domain dtype;
    private final String value;

    public LiteralBody(Domain dtype, String value) {
        this.dtype = dtype;
        this.value = value;
    }

    public Domain getDtype() {
        return dtype;
    }

    public String getValue() {
        return value;
    }
}
