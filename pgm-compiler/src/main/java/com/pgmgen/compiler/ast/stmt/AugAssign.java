package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.expr.Expression;

/**
 * 复合赋值 {@code target op= value}
 */
public class AugAssign extends Statement {
    private final Expression target;
    private final BinaryOp operator;
    private final Expression value;

    public AugAssign(SourceLocation location, Expression target, BinaryOp operator, Expression value) {
        super(location);
        this.target = target;
        this.operator = operator;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String getKindName() {
        return "AugAssign";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAugAssign(this, context);
    }
}
