package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;

/**
 * 语法上可识别、但不在支持子集内的语句（while、return、pass、class、try 等）。
 * 复合语句的子块在解析时已被消费，这里只保留种类名。
 */
public class UnsupportedStmt extends Statement {
    private final String kind;

    public UnsupportedStmt(SourceLocation location, String kind) {
        super(location);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }

    @Override
    public String getKindName() {
        return kind;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitUnsupportedStmt(this, context);
    }
}
