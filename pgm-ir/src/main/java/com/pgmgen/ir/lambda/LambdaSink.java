package com.pgmgen.ir.lambda;

/**
 * lambda 源码输出通道，只追加，保持发出顺序
 */
public interface LambdaSink {

    /**
     * 追加一个已渲染的 lambda
     *
     * @param name   唯一名称
     * @param source 完整源码文本（含结尾空行）
     */
    void append(String name, String source);
}
