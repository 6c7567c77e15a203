package com.pgmgen.ir.lowering;

import java.util.HashMap;
import java.util.Map;

/**
 * 唯一名称登记表。
 *
 * <p>{@code basename} 每取一次名称，计数加一：{@code f__assign__x_0}、{@code f__assign__x_1}…
 * 一次翻译共用一个实例，不同翻译之间互不干扰。</p>
 */
public class FunctionNameRegistry {

    private final Map<String, Integer> counters = new HashMap<>();
    private final Map<String, Integer> conditionCounters = new HashMap<>();

    /**
     * 取下一个唯一名称 {@code basename_N}
     */
    public String next(String basename) {
        int id = counters.getOrDefault(basename, 0);
        counters.put(basename, id + 1);
        return basename + "_" + id;
    }

    /**
     * 取函数内下一个条件变量名 {@code IF_N}，从 1 开始
     */
    public String nextConditionName(String functionName) {
        String key = String.valueOf(functionName);
        int id = conditionCounters.getOrDefault(key, 1);
        conditionCounters.put(key, id + 1);
        return "IF_" + id;
    }

    /**
     * 已登记的基名数量
     */
    int size() {
        return counters.size();
    }
}
