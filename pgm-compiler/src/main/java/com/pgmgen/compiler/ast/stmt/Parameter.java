package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.expr.Expression;

/**
 * 函数参数
 */
public class Parameter {
    private final SourceLocation location;
    private final String name;
    private final Expression annotation;  // 可选

    public Parameter(SourceLocation location, String name, Expression annotation) {
        this.location = location;
        this.name = name;
        this.annotation = annotation;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }
}
