package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.AstNode;
import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(ExprVisitor<R, C> visitor, C context);
}
