package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 比较表达式，支持链式比较 {@code a < b <= c}
 *
 * <p>{@code operators.size() == comparators.size()}，第 i 个运算符连接前一个操作数与第 i 个比较数。</p>
 */
public class CompareExpr extends Expression {
    private final Expression left;
    private final List<CompareOp> operators;
    private final List<Expression> comparators;

    public CompareExpr(SourceLocation location, Expression left,
                       List<CompareOp> operators, List<Expression> comparators) {
        super(location);
        this.left = left;
        this.operators = Collections.unmodifiableList(operators);
        this.comparators = Collections.unmodifiableList(comparators);
    }

    public Expression getLeft() {
        return left;
    }

    public List<CompareOp> getOperators() {
        return operators;
    }

    public List<Expression> getComparators() {
        return comparators;
    }

    @Override
    public String getKindName() {
        return "Compare";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitCompareExpr(this, context);
    }

    public enum CompareOp {
        EQ("=="),
        NE("!="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">="),
        IN("in"),
        NOT_IN("not in"),
        IS("is"),
        IS_NOT("is not");

        private final String source;

        CompareOp(String source) {
            this.source = source;
        }

        public String toSourceString() {
            return source;
        }
    }
}
