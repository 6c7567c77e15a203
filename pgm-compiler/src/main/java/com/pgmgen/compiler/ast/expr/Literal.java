package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 字面量表达式
 *
 * <p>值的 Java 类型由 {@link LiteralKind} 决定：INT 为 {@link Long}，FLOAT 为 {@link Double}，
 * STRING 为 {@link String}，BOOLEAN 为 {@link Boolean}，NONE 为 null。</p>
 */
public class Literal extends Expression {
    private final Object value;
    private final LiteralKind kind;

    public Literal(SourceLocation location, Object value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public Object getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    @Override
    public String getKindName() {
        switch (kind) {
            case INT:
            case FLOAT:
                return "Num";
            case STRING:
                return "Str";
            default:
                return "NameConstant";
        }
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        INT,
        FLOAT,
        STRING,
        BOOLEAN,
        NONE;

        /** 是否为数值字面量类型 */
        public boolean isNumeric() {
            return this == INT || this == FLOAT;
        }
    }
}
