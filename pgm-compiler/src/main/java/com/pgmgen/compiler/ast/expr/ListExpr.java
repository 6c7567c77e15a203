package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 列表字面量 {@code [a, b, c]}
 */
public class ListExpr extends Expression {
    private final List<Expression> elements;

    public ListExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public String getKindName() {
        return "List";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitListExpr(this, context);
    }
}
