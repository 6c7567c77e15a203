package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.compiler.ast.stmt.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 收集函数内出现的全部标识符（参数、读写的变量、被调用的名称）。
 * 生成的条件变量名要避开这些名称。
 */
final class NameCollector implements ExprVisitor<Void, Set<String>>, StmtVisitor<Void, Set<String>> {

    private static final NameCollector INSTANCE = new NameCollector();

    private NameCollector() {
    }

    static Set<String> namesOf(FunctionDef function) {
        Set<String> names = new LinkedHashSet<>();
        INSTANCE.visitFunctionDef(function, names);
        return names;
    }

    private void block(List<Statement> body, Set<String> names) {
        for (Statement stmt : body) {
            stmt.accept(this, names);
        }
    }

    private void expr(Expression expression, Set<String> names) {
        if (expression != null) {
            expression.accept(this, names);
        }
    }

    private void exprs(List<Expression> expressions, Set<String> names) {
        for (Expression expression : expressions) {
            expr(expression, names);
        }
    }

    // ============ 语句 ============

    @Override
    public Void visitFunctionDef(FunctionDef node, Set<String> names) {
        for (Parameter param : node.getParams()) {
            names.add(param.getName());
        }
        block(node.getBody(), names);
        return null;
    }

    @Override
    public Void visitAssign(Assign node, Set<String> names) {
        exprs(node.getTargets(), names);
        expr(node.getValue(), names);
        return null;
    }

    @Override
    public Void visitAnnAssign(AnnAssign node, Set<String> names) {
        expr(node.getTarget(), names);
        expr(node.getValue(), names);
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign node, Set<String> names) {
        expr(node.getTarget(), names);
        expr(node.getValue(), names);
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Set<String> names) {
        expr(node.getTest(), names);
        block(node.getBody(), names);
        block(node.getOrElse(), names);
        return null;
    }

    @Override
    public Void visitForStmt(ForStmt node, Set<String> names) {
        expr(node.getTarget(), names);
        expr(node.getIter(), names);
        block(node.getBody(), names);
        block(node.getOrElse(), names);
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Set<String> names) {
        expr(node.getExpression(), names);
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, Set<String> names) {
        return null;
    }

    @Override
    public Void visitUnsupportedStmt(UnsupportedStmt node, Set<String> names) {
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitName(Name node, Set<String> names) {
        names.add(node.getId());
        return null;
    }

    @Override
    public Void visitLiteral(Literal node, Set<String> names) {
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Set<String> names) {
        expr(node.getLeft(), names);
        expr(node.getRight(), names);
        return null;
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Set<String> names) {
        expr(node.getOperand(), names);
        return null;
    }

    @Override
    public Void visitBoolOpExpr(BoolOpExpr node, Set<String> names) {
        exprs(node.getValues(), names);
        return null;
    }

    @Override
    public Void visitCompareExpr(CompareExpr node, Set<String> names) {
        expr(node.getLeft(), names);
        exprs(node.getComparators(), names);
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Set<String> names) {
        expr(node.getCallee(), names);
        exprs(node.getArgs(), names);
        return null;
    }

    @Override
    public Void visitAttributeExpr(AttributeExpr node, Set<String> names) {
        expr(node.getValue(), names);
        return null;
    }

    @Override
    public Void visitSubscriptExpr(SubscriptExpr node, Set<String> names) {
        expr(node.getValue(), names);
        expr(node.getIndex(), names);
        return null;
    }

    @Override
    public Void visitListExpr(ListExpr node, Set<String> names) {
        exprs(node.getElements(), names);
        return null;
    }

    @Override
    public Void visitTupleExpr(TupleExpr node, Set<String> names) {
        exprs(node.getElements(), names);
        return null;
    }

    @Override
    public Void visitUnsupportedExpr(UnsupportedExpr node, Set<String> names) {
        return null;
    }
}
