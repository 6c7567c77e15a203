package com.pgmgen.compiler.formatter;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法树转储：{@code Kind(field=value, ...)}，列表逐项换行缩进
 */
public class AstDumper implements StmtVisitor<String, Integer>, ExprVisitor<String, Integer> {

    private final String indent;

    public AstDumper() {
        this("  ");
    }

    public AstDumper(String indent) {
        this.indent = indent;
    }

    public String dump(Module module) {
        return "Module(body=" + statements(module.getBody(), 0) + ")";
    }

    public String dump(Statement stmt) {
        return stmt.accept(this, 0);
    }

    public String dump(Expression expr) {
        return expr.accept(this, 0);
    }

    // ============ 语句 ============

    @Override
    public String visitFunctionDef(FunctionDef node, Integer level) {
        List<String> params = new ArrayList<String>();
        for (Parameter param : node.getParams()) {
            params.add("arg(arg=" + quote(param.getName()) + ", annotation="
                    + optional(param.getAnnotation(), level + 2) + ")");
        }
        return node("FunctionDef",
                "name=" + quote(node.getName()),
                "args=" + list(params, level),
                "body=" + statements(node.getBody(), level),
                "returns=" + optional(node.getReturns(), level));
    }

    @Override
    public String visitAssign(Assign node, Integer level) {
        return node("Assign",
                "targets=" + expressions(node.getTargets(), level),
                "value=" + node.getValue().accept(this, level));
    }

    @Override
    public String visitAnnAssign(AnnAssign node, Integer level) {
        return node("AnnAssign",
                "target=" + node.getTarget().accept(this, level),
                "annotation=" + node.getAnnotation().accept(this, level),
                "value=" + optional(node.getValue(), level));
    }

    @Override
    public String visitAugAssign(AugAssign node, Integer level) {
        return node("AugAssign",
                "target=" + node.getTarget().accept(this, level),
                "op=" + operator(node.getOperator().name()),
                "value=" + node.getValue().accept(this, level));
    }

    @Override
    public String visitIfStmt(IfStmt node, Integer level) {
        return node("If",
                "test=" + node.getTest().accept(this, level),
                "body=" + statements(node.getBody(), level),
                "orelse=" + statements(node.getOrElse(), level));
    }

    @Override
    public String visitForStmt(ForStmt node, Integer level) {
        return node("For",
                "target=" + node.getTarget().accept(this, level),
                "iter=" + node.getIter().accept(this, level),
                "body=" + statements(node.getBody(), level),
                "orelse=" + statements(node.getOrElse(), level));
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Integer level) {
        return node("Expr", "value=" + node.getExpression().accept(this, level));
    }

    @Override
    public String visitImportStmt(ImportStmt node, Integer level) {
        List<String> names = new ArrayList<String>();
        for (String name : node.getNames()) {
            names.add("alias(name=" + quote(name) + ")");
        }
        if (node.isFromImport()) {
            return node("ImportFrom", "module=" + quote(node.getModule()), "names=" + list(names, level));
        }
        return node("Import", "names=" + list(names, level));
    }

    @Override
    public String visitUnsupportedStmt(UnsupportedStmt node, Integer level) {
        return node(node.getKind());
    }

    // ============ 表达式 ============

    @Override
    public String visitName(Name node, Integer level) {
        return node("Name", "id=" + quote(node.getId()));
    }

    @Override
    public String visitLiteral(Literal node, Integer level) {
        switch (node.getKind()) {
            case INT:
            case FLOAT:
                return node("Num", "n=" + PyLiterals.repr(node));
            case STRING:
                return node("Str", "s=" + PyLiterals.repr(node));
            default:
                return node("NameConstant", "value=" + PyLiterals.repr(node));
        }
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Integer level) {
        return node("BinOp",
                "left=" + node.getLeft().accept(this, level),
                "op=" + operator(node.getOperator().name()),
                "right=" + node.getRight().accept(this, level));
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Integer level) {
        return node("UnaryOp",
                "op=" + operator(node.getOperator().name()),
                "operand=" + node.getOperand().accept(this, level));
    }

    @Override
    public String visitBoolOpExpr(BoolOpExpr node, Integer level) {
        return node("BoolOp",
                "op=" + operator(node.getOperator().name()),
                "values=" + expressions(node.getValues(), level));
    }

    @Override
    public String visitCompareExpr(CompareExpr node, Integer level) {
        List<String> ops = new ArrayList<String>();
        for (CompareExpr.CompareOp op : node.getOperators()) {
            ops.add(operator(op.name()));
        }
        return node("Compare",
                "left=" + node.getLeft().accept(this, level),
                "ops=" + list(ops, level),
                "comparators=" + expressions(node.getComparators(), level));
    }

    @Override
    public String visitCallExpr(CallExpr node, Integer level) {
        return node("Call",
                "func=" + node.getCallee().accept(this, level),
                "args=" + expressions(node.getArgs(), level));
    }

    @Override
    public String visitAttributeExpr(AttributeExpr node, Integer level) {
        return node("Attribute",
                "value=" + node.getValue().accept(this, level),
                "attr=" + quote(node.getAttr()));
    }

    @Override
    public String visitSubscriptExpr(SubscriptExpr node, Integer level) {
        return node("Subscript",
                "value=" + node.getValue().accept(this, level),
                "slice=" + node.getIndex().accept(this, level));
    }

    @Override
    public String visitListExpr(ListExpr node, Integer level) {
        return node("List", "elts=" + expressions(node.getElements(), level));
    }

    @Override
    public String visitTupleExpr(TupleExpr node, Integer level) {
        return node("Tuple", "elts=" + expressions(node.getElements(), level));
    }

    @Override
    public String visitUnsupportedExpr(UnsupportedExpr node, Integer level) {
        return node(node.getKind(), "source=" + quote(node.getSourceText()));
    }

    // ============ 辅助方法 ============

    private String statements(List<Statement> stmts, int level) {
        List<String> items = new ArrayList<String>();
        for (Statement stmt : stmts) {
            items.add(stmt.accept(this, level + 2));
        }
        return list(items, level);
    }

    private String expressions(List<Expression> exprs, int level) {
        List<String> items = new ArrayList<String>();
        for (Expression expr : exprs) {
            items.add(expr.accept(this, level + 2));
        }
        return list(items, level);
    }

    private String optional(Expression expr, int level) {
        return expr != null ? expr.accept(this, level) : "None";
    }

    private String list(List<String> items, int level) {
        if (items.isEmpty()) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        for (String item : items) {
            sb.append('\n').append(repeat(level + 2)).append(item).append(',');
        }
        sb.append('\n').append(repeat(level + 1)).append(']');
        return sb.toString();
    }

    private String repeat(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(indent);
        }
        return sb.toString();
    }

    private static String node(String kind, String... fields) {
        return kind + "(" + String.join(", ", fields) + ")";
    }

    private static String quote(String text) {
        return text == null ? "None" : PyLiterals.reprString(text);
    }

    /** ADD -> Add()，NOT_IN -> NotIn() */
    private static String operator(String enumName) {
        StringBuilder sb = new StringBuilder();
        for (String part : enumName.split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.append("()").toString();
    }
}
