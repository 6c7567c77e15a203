package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.AstNode;
import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StmtVisitor<R, C> visitor, C context);
}
