package com.pgmgen.compiler.ast.stmt;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * 函数定义
 */
public class FunctionDef extends Statement {
    private final String name;
    private final List<Parameter> params;
    private final Expression returns;  // 可选
    private final List<Statement> body;

    public FunctionDef(SourceLocation location, String name, List<Parameter> params,
                       Expression returns, List<Statement> body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.returns = returns;
        this.body = Collections.unmodifiableList(body);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public Expression getReturns() {
        return returns;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String getKindName() {
        return "FunctionDef";
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDef(this, context);
    }
}
