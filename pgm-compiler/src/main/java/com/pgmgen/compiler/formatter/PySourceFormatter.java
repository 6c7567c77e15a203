package com.pgmgen.compiler.formatter;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.stmt.*;

import java.util.List;

/**
 * 语法树源码渲染器
 *
 * <p>语句写入 {@link FormatterContext}；表达式直接返回文本，访问上下文为外层要求的最低优先级，
 * 据此只在必要处加括号。</p>
 */
public class PySourceFormatter implements StmtVisitor<Void, FormatterContext>, ExprVisitor<String, Integer> {

    // 优先级，数值越大结合越紧
    private static final int PREC_TUPLE = 0;
    private static final int PREC_TEST = 1;
    private static final int PREC_OR = 2;
    private static final int PREC_AND = 3;
    private static final int PREC_NOT = 4;
    private static final int PREC_COMPARE = 5;
    private static final int PREC_ARITH = 10;
    private static final int PREC_TERM = 11;
    private static final int PREC_UNARY = 12;
    private static final int PREC_POWER = 13;
    private static final int PREC_ATOM = 14;

    /**
     * 渲染整个源文件
     */
    public String format(Module module, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config);
        List<Statement> body = module.getBody();
        for (int i = 0; i < body.size(); i++) {
            Statement stmt = body.get(i);
            if (stmt instanceof FunctionDef && i > 0) {
                ctx.blankLine();
            }
            stmt.accept(this, ctx);
        }
        return ctx.getOutput();
    }

    /**
     * 使用默认配置渲染
     */
    public String format(Module module) {
        return format(module, new FormatConfig());
    }

    /**
     * 在 ctx 的当前缩进层级渲染一条语句（以换行结束）
     */
    public void formatStatement(Statement stmt, FormatterContext ctx) {
        stmt.accept(this, ctx);
    }

    /**
     * 渲染表达式
     */
    public String formatExpression(Expression expr) {
        return expr.accept(this, PREC_TUPLE);
    }

    // ============ 语句 ============

    @Override
    public Void visitFunctionDef(FunctionDef node, FormatterContext ctx) {
        StringBuilder sb = new StringBuilder("def ");
        sb.append(node.getName()).append('(');
        List<Parameter> params = node.getParams();
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            Parameter param = params.get(i);
            sb.append(param.getName());
            if (param.hasAnnotation()) {
                sb.append(": ").append(param.getAnnotation().accept(this, PREC_TEST));
            }
        }
        sb.append(')');
        if (node.getReturns() != null) {
            sb.append(" -> ").append(node.getReturns().accept(this, PREC_TEST));
        }
        sb.append(':');
        ctx.append(sb.toString());
        ctx.newLine();
        formatBlock(node.getBody(), ctx);
        return null;
    }

    @Override
    public Void visitAssign(Assign node, FormatterContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (Expression target : node.getTargets()) {
            sb.append(formatExpression(target)).append(" = ");
        }
        sb.append(formatExpression(node.getValue()));
        ctx.append(sb.toString());
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitAnnAssign(AnnAssign node, FormatterContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append(node.getTarget().accept(this, PREC_TEST));
        sb.append(": ").append(node.getAnnotation().accept(this, PREC_TEST));
        if (node.hasValue()) {
            sb.append(" = ").append(formatExpression(node.getValue()));
        }
        ctx.append(sb.toString());
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitAugAssign(AugAssign node, FormatterContext ctx) {
        ctx.append(formatExpression(node.getTarget()) + " " + node.getOperator().toSourceString() + "= "
                + formatExpression(node.getValue()));
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, FormatterContext ctx) {
        formatIf(node, "if ", ctx);
        return null;
    }

    private void formatIf(IfStmt node, String keyword, FormatterContext ctx) {
        ctx.append(keyword + node.getTest().accept(this, PREC_TEST) + ":");
        ctx.newLine();
        formatBlock(node.getBody(), ctx);
        List<Statement> orElse = node.getOrElse();
        if (orElse.size() == 1 && orElse.get(0) instanceof IfStmt) {
            formatIf((IfStmt) orElse.get(0), "elif ", ctx);
        } else if (!orElse.isEmpty()) {
            ctx.append("else:");
            ctx.newLine();
            formatBlock(orElse, ctx);
        }
    }

    @Override
    public Void visitForStmt(ForStmt node, FormatterContext ctx) {
        ctx.append("for " + formatExpression(node.getTarget()) + " in " + formatExpression(node.getIter()) + ":");
        ctx.newLine();
        formatBlock(node.getBody(), ctx);
        if (node.hasElse()) {
            ctx.append("else:");
            ctx.newLine();
            formatBlock(node.getOrElse(), ctx);
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, FormatterContext ctx) {
        ctx.append(formatExpression(node.getExpression()));
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitImportStmt(ImportStmt node, FormatterContext ctx) {
        String names = String.join(", ", node.getNames());
        if (node.isFromImport()) {
            ctx.append("from " + node.getModule() + " import " + names);
        } else {
            ctx.append("import " + names);
        }
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitUnsupportedStmt(UnsupportedStmt node, FormatterContext ctx) {
        ctx.append("# " + node.getKind());
        ctx.newLine();
        return null;
    }

    private void formatBlock(List<Statement> body, FormatterContext ctx) {
        ctx.indent();
        if (body.isEmpty()) {
            ctx.append("pass");
            ctx.newLine();
        }
        for (Statement stmt : body) {
            stmt.accept(this, ctx);
        }
        ctx.dedent();
    }

    // ============ 表达式 ============

    @Override
    public String visitName(Name node, Integer required) {
        return node.getId();
    }

    @Override
    public String visitLiteral(Literal node, Integer required) {
        String text = PyLiterals.repr(node);
        // 负数字面量在幂运算左侧等位置需要括号
        if (text.startsWith("-")) {
            return wrap(text, PREC_UNARY, required);
        }
        return text;
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Integer required) {
        int prec = precedence(node.getOperator());
        String left;
        String right;
        if (node.getOperator() == BinaryOp.POW) {
            // 右结合
            left = node.getLeft().accept(this, prec + 1);
            right = node.getRight().accept(this, PREC_UNARY);
        } else {
            left = node.getLeft().accept(this, prec);
            right = node.getRight().accept(this, prec + 1);
        }
        return wrap(left + " " + node.getOperator().toSourceString() + " " + right, prec, required);
    }

    @Override
    public String visitUnaryExpr(UnaryExpr node, Integer required) {
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            return wrap("not " + node.getOperand().accept(this, PREC_NOT), PREC_NOT, required);
        }
        return wrap(node.getOperator().toSourceString() + node.getOperand().accept(this, PREC_UNARY),
                PREC_UNARY, required);
    }

    @Override
    public String visitBoolOpExpr(BoolOpExpr node, Integer required) {
        int prec = node.getOperator() == BoolOpExpr.BoolOp.AND ? PREC_AND : PREC_OR;
        StringBuilder sb = new StringBuilder();
        List<Expression> values = node.getValues();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(' ').append(node.getOperator().toSourceString()).append(' ');
            }
            sb.append(values.get(i).accept(this, prec + 1));
        }
        return wrap(sb.toString(), prec, required);
    }

    @Override
    public String visitCompareExpr(CompareExpr node, Integer required) {
        StringBuilder sb = new StringBuilder(node.getLeft().accept(this, PREC_COMPARE + 1));
        for (int i = 0; i < node.getOperators().size(); i++) {
            sb.append(' ').append(node.getOperators().get(i).toSourceString()).append(' ');
            sb.append(node.getComparators().get(i).accept(this, PREC_COMPARE + 1));
        }
        return wrap(sb.toString(), PREC_COMPARE, required);
    }

    @Override
    public String visitCallExpr(CallExpr node, Integer required) {
        StringBuilder sb = new StringBuilder(node.getCallee().accept(this, PREC_ATOM));
        sb.append('(');
        appendJoined(sb, node.getArgs(), PREC_TEST);
        sb.append(')');
        return sb.toString();
    }

    @Override
    public String visitAttributeExpr(AttributeExpr node, Integer required) {
        return node.getValue().accept(this, PREC_ATOM) + "." + node.getAttr();
    }

    @Override
    public String visitSubscriptExpr(SubscriptExpr node, Integer required) {
        Expression index = node.getIndex();
        String indexText = index instanceof TupleExpr && !((TupleExpr) index).isParenthesized()
                ? joinElements(((TupleExpr) index).getElements())
                : formatExpression(index);
        return node.getValue().accept(this, PREC_ATOM) + "[" + indexText + "]";
    }

    @Override
    public String visitListExpr(ListExpr node, Integer required) {
        return "[" + joinElements(node.getElements()) + "]";
    }

    @Override
    public String visitTupleExpr(TupleExpr node, Integer required) {
        List<Expression> elements = node.getElements();
        String inner = joinElements(elements);
        if (elements.size() == 1) {
            inner = inner + ",";
        }
        if (node.isParenthesized() || elements.isEmpty() || required > PREC_TUPLE) {
            return "(" + inner + ")";
        }
        return inner;
    }

    @Override
    public String visitUnsupportedExpr(UnsupportedExpr node, Integer required) {
        return wrap(node.getSourceText(), PREC_TUPLE, required);
    }

    // ============ 辅助方法 ============

    private String joinElements(List<Expression> elements) {
        StringBuilder sb = new StringBuilder();
        appendJoined(sb, elements, PREC_TEST);
        return sb.toString();
    }

    private void appendJoined(StringBuilder sb, List<Expression> elements, int prec) {
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(elements.get(i).accept(this, prec));
        }
    }

    private static String wrap(String text, int prec, int required) {
        return prec < required ? "(" + text + ")" : text;
    }

    private static int precedence(BinaryOp op) {
        switch (op) {
            case ADD:
            case SUB:
                return PREC_ARITH;
            case POW:
                return PREC_POWER;
            default:
                return PREC_TERM;
        }
    }
}
