package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * 条件出口处的合并节点。第一个输入总是条件变量，其后为一个或两个候选版本。
 */
public final class DecisionFunction extends PgmFunction {
    private final String target;
    private final List<VariableReference> inputs;

    public DecisionFunction(String name, String target, List<VariableReference> inputs) {
        super(name);
        this.target = target;
        this.inputs = Collections.unmodifiableList(inputs);
    }

    public String getTarget() {
        return target;
    }

    public List<VariableReference> getInputs() {
        return inputs;
    }

    public VariableReference getCondition() {
        return inputs.get(0);
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.DECISION;
    }
}
