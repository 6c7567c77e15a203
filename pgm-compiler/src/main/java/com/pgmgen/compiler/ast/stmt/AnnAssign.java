package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.Expression;

/**
 * 带类型注解的赋值 {@code target: annotation [= value]}
 */
public class AnnAssign extends Statement {
    private final Expression target;
    private final Expression annotation;
    private final Expression value;  // 可选

    public AnnAssign(SourceLocation location, Expression target, Expression annotation, Expression value) {
        super(location);
        this.target = target;
        this.annotation = annotation;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    @Override
    public String getKindName() {
        return "AnnAssign";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAnnAssign(this, context);
    }
}
