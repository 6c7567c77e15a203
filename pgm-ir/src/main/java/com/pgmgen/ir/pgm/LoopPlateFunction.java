package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * 循环板：一个静态循环体模板，由索引变量与迭代范围参数化
 */
public final class LoopPlateFunction extends PgmFunction {
    private final List<String> input;
    private final String indexVariable;
    private final IterationRange range;
    private final List<BodyRecord> body;

    public LoopPlateFunction(String name, List<String> input, String indexVariable,
                             IterationRange range, List<BodyRecord> body) {
        super(name);
        this.input = Collections.unmodifiableList(input);
        this.indexVariable = indexVariable;
        this.range = range;
        this.body = Collections.unmodifiableList(body);
    }

    public List<String> getInput() {
        return input;
    }

    public String getIndexVariable() {
        return indexVariable;
    }

    public IterationRange getRange() {
        return range;
    }

    public List<BodyRecord> getBody() {
        return body;
    }

    @Override
    public List<BodyRecord> getNestedBody() {
        return body;
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.LOOP_PLATE;
    }
}
