package com.pgmgen.compiler.ast;

import com.pgmgen.compiler.ast.stmt.*;

/**
 * 语句访问者接口
 *
 * <p>与 {@link ExprVisitor} 一样不提供默认实现，保证每种语句都被显式处理。</p>
 */
public interface StmtVisitor<R, C> {

    R visitFunctionDef(FunctionDef node, C ctx);

    R visitAssign(Assign node, C ctx);

    R visitAnnAssign(AnnAssign node, C ctx);

    R visitAugAssign(AugAssign node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitForStmt(ForStmt node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);

    R visitImportStmt(ImportStmt node, C ctx);

    R visitUnsupportedStmt(UnsupportedStmt node, C ctx);
}
