package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class CallExpr extends Expression {
    private final Expression callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, Expression callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(args);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public String getKindName() {
        return "Call";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
