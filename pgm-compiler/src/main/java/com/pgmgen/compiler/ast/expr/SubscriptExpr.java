package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 下标访问 {@code value[index]}
 */
public class SubscriptExpr extends Expression {
    private final Expression value;
    private final Expression index;

    public SubscriptExpr(SourceLocation location, Expression value, Expression index) {
        super(location);
        this.value = value;
        this.index = index;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public String getKindName() {
        return "Subscript";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitSubscriptExpr(this, context);
    }
}
