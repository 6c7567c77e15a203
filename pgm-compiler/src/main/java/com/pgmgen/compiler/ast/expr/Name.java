package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 变量名引用
 */
public class Name extends Expression {
    private final String id;

    public Name(SourceLocation location, String id) {
        super(location);
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Override
    public String getKindName() {
        return "Name";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitName(this, context);
    }
}
