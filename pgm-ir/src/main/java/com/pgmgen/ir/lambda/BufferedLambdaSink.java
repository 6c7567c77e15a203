package com.pgmgen.ir.lambda;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 缓存在内存中的 lambda 输出，翻译成功后再一次性写出
 */
public class BufferedLambdaSink implements LambdaSink {

    private final StringBuilder content = new StringBuilder();
    private final Map<String, String> lambdas = new LinkedHashMap<>();

    @Override
    public void append(String name, String source) {
        if (lambdas.containsKey(name)) {
            throw new IllegalStateException("Lambda already emitted: " + name);
        }
        lambdas.put(name, source);
        content.append(source);
    }

    /** 全部 lambda 源码，按发出顺序拼接 */
    public String getContent() {
        return content.toString();
    }

    public List<String> getNames() {
        return Collections.unmodifiableList(new ArrayList<>(lambdas.keySet()));
    }

    /** 单个 lambda 的源码，不存在返回 null */
    public String getSource(String name) {
        return lambdas.get(name);
    }

    public int size() {
        return lambdas.size();
    }
}
