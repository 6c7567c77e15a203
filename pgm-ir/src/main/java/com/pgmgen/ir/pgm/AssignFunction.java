package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * assign 函数：计算目标变量的一个新版本（也用于 if 条件变量）
 */
public final class AssignFunction extends PgmFunction {
    private final String target;
    private final List<FunctionSource> sources;
    private final FunctionBody body;

    public AssignFunction(String name, String target, List<FunctionSource> sources, FunctionBody body) {
        super(name);
        this.target = target;
        this.sources = Collections.unmodifiableList(sources);
        this.body = body;
    }

    public String getTarget() {
        return target;
    }

    public List<FunctionSource> getSources() {
        return sources;
    }

    public FunctionBody getBody() {
        return body;
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.ASSIGN;
    }
}
