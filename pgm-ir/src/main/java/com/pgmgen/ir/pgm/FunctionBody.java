package com.pgmgen.ir.pgm;

/**
 * assign 函数体：lambda 引用或字面量载荷
 */
public abstract class FunctionBody {
}
