package com.pgmgen.ir.pgm;

/**
 * 指向已发出 lambda 的函数体，reference 为原始源码行号
 */
public final class LambdaBody extends FunctionBody {
    private final String name;
    private final int reference;

    public LambdaBody(String name, int reference) {
        this.name = name;
        this.reference = reference;
    }

    public String getName() {
        return name;
    }

    public int getReference() {
        return reference;
    }
}
