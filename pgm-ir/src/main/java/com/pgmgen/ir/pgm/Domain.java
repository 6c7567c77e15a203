package com.pgmgen.ir.pgm;

import com.pgmgen.compiler.ast.expr.Literal.LiteralKind;

/**
 * 变量取值域
 */
public enum Domain {
    INTEGER("integer"),
    REAL("real"),
    STRING("string"),
    BOOLEAN("boolean");

    private final String jsonName;

    Domain(String jsonName) {
        this.jsonName = jsonName;
    }

    public String getJsonName() {
        return jsonName;
    }

    /**
     * 标量类型名（int / float / str / bool）对应的取值域，未知返回 null
     */
    public static Domain fromTypeName(String typeName) {
        switch (typeName) {
            case "int": return INTEGER;
            case "float": return REAL;
            case "str": return STRING;
            case "bool": return BOOLEAN;
            default: return null;
        }
    }

    /**
     * 字面量种类对应的取值域，None 返回 null
     */
    public static Domain fromLiteralKind(LiteralKind kind) {
        switch (kind) {
            case INT: return INTEGER;
            case FLOAT: return REAL;
            case STRING: return STRING;
            case BOOLEAN: return BOOLEAN;
            default: return null;
        }
    }

    @Override
    public String toString() {
        return jsonName;
    }
}
