package com.pgmgen.compiler.ast;

import com.pgmgen.compiler.ast.expr.*;

/**
 * 表达式访问者接口
 *
 * <p>每种表达式节点对应一个抽象方法，没有默认实现：新增节点种类时，
 * 所有访问者必须在编译期补齐处理分支。</p>
 */
public interface ExprVisitor<R, C> {

    R visitName(Name node, C ctx);

    R visitLiteral(Literal node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitUnaryExpr(UnaryExpr node, C ctx);

    R visitBoolOpExpr(BoolOpExpr node, C ctx);

    R visitCompareExpr(CompareExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    R visitAttributeExpr(AttributeExpr node, C ctx);

    R visitSubscriptExpr(SubscriptExpr node, C ctx);

    R visitListExpr(ListExpr node, C ctx);

    R visitTupleExpr(TupleExpr node, C ctx);

    R visitUnsupportedExpr(UnsupportedExpr node, C ctx);
}
