package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.Expression;

/**
 * 表达式语句
 */
public class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public String getKindName() {
        return "Expr";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
