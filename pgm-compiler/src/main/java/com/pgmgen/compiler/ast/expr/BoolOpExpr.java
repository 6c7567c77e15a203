package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 短路布尔表达式（and / or），同一运算符的连续操作数合并为一个节点
 */
public class BoolOpExpr extends Expression {
    private final BoolOp operator;
    private final List<Expression> values;

    public BoolOpExpr(SourceLocation location, BoolOp operator, List<Expression> values) {
        super(location);
        this.operator = operator;
        this.values = Collections.unmodifiableList(values);
    }

    public BoolOp getOperator() {
        return operator;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public String getKindName() {
        return "BoolOp";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitBoolOpExpr(this, context);
    }

    public enum BoolOp {
        AND("and"),
        OR("or");

        private final String source;

        BoolOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
