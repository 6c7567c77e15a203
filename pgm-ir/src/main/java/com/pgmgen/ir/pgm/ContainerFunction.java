package com.pgmgen.ir.pgm;

import java.util.Collections;
import java.util.List;

/**
 * 函数定义对应的容器
 */
public final class ContainerFunction extends PgmFunction {
    private final List<TypedVariable> input;
    private final List<TypedVariable> variables;
    private final List<BodyRecord> body;

    public ContainerFunction(String name, List<TypedVariable> input, List<TypedVariable> variables,
                             List<BodyRecord> body) {
        super(name);
        this.input = Collections.unmodifiableList(input);
        this.variables = Collections.unmodifiableList(variables);
        this.body = Collections.unmodifiableList(body);
    }

    public List<TypedVariable> getInput() {
        return input;
    }

    public List<TypedVariable> getVariables() {
        return variables;
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
        return FunctionKind.CONTAINER;
    }
}
