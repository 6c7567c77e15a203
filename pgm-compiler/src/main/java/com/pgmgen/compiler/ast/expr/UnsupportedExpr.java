package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 语法上可识别、但不在支持子集内的表达式（字典、lambda、切片、关键字参数等）。
 * 只保留种类名和原始源码片段，由降级阶段统一报告。
 */
public class UnsupportedExpr extends Expression {
    private final String kind;
    private final String sourceText;

    public UnsupportedExpr(SourceLocation location, String kind, String sourceText) {
        super(location);
        this.kind = kind;
        this.sourceText = sourceText;
    }

    public String getKind() {
        return kind;
    }

    public String getSourceText() {
        return sourceText;
    }

    @Override
    public String getKindName() {
        return kind;
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitUnsupportedExpr(this, context);
    }
}
