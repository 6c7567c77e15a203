package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * For 语句 {@code for target in iter: body [else: orElse]}
 */
public class ForStmt extends Statement {
    private final Expression target;
    private final Expression iter;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public ForStmt(SourceLocation location, Expression target, Expression iter,
                   List<Statement> body, List<Statement> orElse) {
        super(location);
        this.target = target;
        this.iter = iter;
        this.body = Collections.unmodifiableList(body);
        this.orElse = Collections.unmodifiableList(orElse);
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrElse() {
        return orElse;
    }

    public boolean hasElse() {
        return !orElse.isEmpty();
    }

    @Override
    public String getKindName() {
        return "For";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
