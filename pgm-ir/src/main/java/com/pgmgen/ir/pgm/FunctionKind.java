package com.pgmgen.ir.pgm;

/**
 * PGM 函数种类
 */
public enum FunctionKind {
    ASSIGN("assign"),
    CONTAINER("container"),
    LOOP_PLATE("loop_plate"),
    DECISION("decision");

    private final String jsonName;

    FunctionKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }
}
