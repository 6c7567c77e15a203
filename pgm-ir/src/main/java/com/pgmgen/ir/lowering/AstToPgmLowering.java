package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.ast.expr.CallExpr;
import com.pgmgen.compiler.ast.stmt.ExpressionStmt;
import com.pgmgen.compiler.ast.stmt.FunctionDef;
import com.pgmgen.compiler.ast.stmt.IfStmt;
import com.pgmgen.compiler.ast.stmt.Statement;
import com.pgmgen.ir.lambda.LambdaEmitter;
import com.pgmgen.ir.lambda.LambdaSink;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 顶层降级：遍历一个或多个源文件的模块级语句。
 *
 * <p>函数定义交给 {@link StatementLowering}；模块级调用语句只用来确定入口（第一个为准）；
 * 模块级 {@code if} 的 then 块按同样规则扫描；其余顶层语句忽略。
 * 一个实例对应一次翻译：所有文件共用同一个名称登记表与 lambda 输出。</p>
 */
public class AstToPgmLowering {

    private static final Logger LOG = Logger.getLogger(AstToPgmLowering.class.getName());

    private final StatementLowering statements;
    private final FunctionNameRegistry registry = new FunctionNameRegistry();
    private final LambdaSink lambdaSink;
    private String start = "";

    public AstToPgmLowering(LambdaSink lambdaSink, LambdaEmitter emitter, boolean strictRangeBounds) {
        this.lambdaSink = lambdaSink;
        this.statements = new StatementLowering(emitter, strictRangeBounds);
    }

    public AstToPgmLowering(LambdaSink lambdaSink) {
        this(lambdaSink, new LambdaEmitter(), false);
    }

    public Fragment lower(Module module) {
        return lower(Collections.singletonList(module));
    }

    /**
     * 降级整个源文件集合
     */
    public Fragment lower(List<Module> modules) {
        Fragment result = Fragment.empty();
        for (Module module : modules) {
            LOG.fine(() -> "Lowering module " + module.getFileName());
            TraversalContext root = TraversalContext.root(registry, lambdaSink);
            result.append(lowerTopLevel(module.getBody(), root));
        }
        return result;
    }

    private Fragment lowerTopLevel(List<Statement> body, TraversalContext root) {
        Fragment result = Fragment.empty();
        for (Statement stmt : body) {
            if (stmt instanceof FunctionDef) {
                result.append(stmt.accept(statements, root));
            } else if (stmt instanceof ExpressionStmt
                    && ((ExpressionStmt) stmt).getExpression() instanceof CallExpr) {
                recordStart((CallExpr) ((ExpressionStmt) stmt).getExpression());
            } else if (stmt instanceof IfStmt) {
                // if __name__ == "__main__": 之类的入口保护
                result.append(lowerTopLevel(((IfStmt) stmt).getBody(), root));
            } else {
                LOG.fine(() -> "Skipping top-level " + stmt.getKindName() + " at line " + stmt.getLine());
            }
        }
        return result;
    }

    private void recordStart(CallExpr call) {
        String name = ExpressionLowering.calleeName(call);
        if (start.isEmpty()) {
            start = name;
        } else {
            LOG.warning("Ignoring additional start candidate '" + name + "', already using '" + start + "'");
        }
    }

    /**
     * 入口调用名；没有顶层调用时为空串
     */
    public String getStart() {
        return start;
    }

    public FunctionNameRegistry getRegistry() {
        return registry;
    }
}
