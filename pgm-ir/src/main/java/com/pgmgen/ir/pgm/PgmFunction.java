package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * PGM 函数（数据流图节点）。名称在整个文档内唯一。
 */
public abstract class PgmFunction {
    protected final String name;

    protected PgmFunction(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public abstract FunctionKind getKind();

    /**
     * 嵌套的体记录（容器与循环板有，其余为空）
     */
    public List<BodyRecord> getNestedBody() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return getKind().getJsonName() + " " + name;
    }
}
