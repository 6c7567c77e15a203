package com.pgmgen.ir.lambda;

import com.pgmgen.compiler.ast.expr.Expression;
import com.pgmgen.compiler.ast.stmt.Statement;
import com.pgmgen.compiler.formatter.FormatConfig;
import com.pgmgen.compiler.formatter.FormatterContext;
import com.pgmgen.compiler.formatter.PySourceFormatter;

import java.util.List;

/**
 * 把原始语句或表达式重新渲染为独立可调用的函数源码：
 *
 * <pre>
 * def name(a, b):
 *     y = a + b
 *     return y
 * </pre>
 */
public class LambdaEmitter {

    private final PySourceFormatter formatter = new PySourceFormatter();
    private final FormatConfig config;

    public LambdaEmitter(FormatConfig config) {
        this.config = config;
    }

    public LambdaEmitter() {
        this(new FormatConfig());
    }

    /**
     * 赋值类 lambda：执行原语句后返回目标变量
     */
    public void emitStatement(LambdaSink sink, String name, Statement stmt, List<String> inputs, String target) {
        FormatterContext ctx = header(name, inputs);
        formatter.formatStatement(stmt, ctx);
        ctx.append("return " + target);
        finish(sink, name, ctx);
    }

    /**
     * 条件 lambda：返回表达式的值
     */
    public void emitExpression(LambdaSink sink, String name, Expression expr, List<String> inputs) {
        FormatterContext ctx = header(name, inputs);
        ctx.append("return " + formatter.formatExpression(expr));
        finish(sink, name, ctx);
    }

    private FormatterContext header(String name, List<String> inputs) {
        FormatterContext ctx = new FormatterContext(config);
        ctx.append("def " + name + "(" + String.join(", ", inputs) + "):");
        ctx.newLine();
        ctx.indent();
        return ctx;
    }

    private void finish(LambdaSink sink, String name, FormatterContext ctx) {
        ctx.newLine();
        ctx.dedent();
        ctx.newLine();
        sink.append(name, ctx.getOutput());
    }
}
