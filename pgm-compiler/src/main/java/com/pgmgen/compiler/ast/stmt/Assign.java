package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 赋值语句，链式赋值 {@code a = b = value} 有多个目标
 */
public class Assign extends Statement {
    private final List<Expression> targets;
    private final Expression value;

    public Assign(SourceLocation location, List<Expression> targets, Expression value) {
        super(location);
        this.targets = Collections.unmodifiableList(targets);
        this.value = value;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String getKindName() {
        return "Assign";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
