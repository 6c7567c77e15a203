package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 元组 {@code (a, b)} 或无括号的逗号列表
 */
public class TupleExpr extends Expression {
    private final List<Expression> elements;
    private final boolean parenthesized;

    public TupleExpr(SourceLocation location, List<Expression> elements, boolean parenthesized) {
        super(location);
        this.elements = Collections.unmodifiableList(elements);
        this.parenthesized = parenthesized;
    }

    public List<Expression> getElements() {
        return elements;
    }

    public boolean isParenthesized() {
        return parenthesized;
    }

    @Override
    public String getKindName() {
        return "Tuple";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitTupleExpr(this, context);
    }
}
