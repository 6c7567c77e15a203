package com.pgmgen.ir.pgm;

/**
 * 表达式降级产生的来源描述：字面量、变量引用或调用
 */
public abstract class SourceDescriptor {
}
