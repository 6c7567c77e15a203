package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * If 语句。elif 链解析为 else 分支中嵌套的 IfStmt。
 */
public class IfStmt extends Statement {
    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orElse;  // 无 else 时为空列表

    public IfStmt(SourceLocation location, Expression test, List<Statement> body, List<Statement> orElse) {
        super(location);
        this.test = test;
        this.body = Collections.unmodifiableList(body);
        this.orElse = Collections.unmodifiableList(orElse);
    }

    public Expression getTest() {
        return test;
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
        return "If";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
