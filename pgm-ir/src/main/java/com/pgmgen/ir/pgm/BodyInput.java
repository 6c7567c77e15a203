package com.pgmgen.ir.pgm;

/**
 * 体记录的输入项：变量版本或嵌套调用
 */
public abstract class BodyInput {
}
