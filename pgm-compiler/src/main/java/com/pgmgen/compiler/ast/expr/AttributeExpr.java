package com.pgmgen.compiler.ast.expr;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.SourceLocation;

/**
 * 属性访问 {@code value.attr}
 */
public class AttributeExpr extends Expression {
    private final Expression value;
    private final String attr;

    public AttributeExpr(SourceLocation location, Expression value, String attr) {
        super(location);
        this.value = value;
        this.attr = attr;
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }

    /**
     * 如果接收者是由名字组成的点分链（如 {@code sys.stdout.write}），返回完整限定名，否则返回 null
     */
    public String getQualifiedName() {
        if (value instanceof Name) {
            return ((Name) value).getId() + "." + attr;
        }
        if (value instanceof AttributeExpr) {
            String prefix = ((AttributeExpr) value).getQualifiedName();
            return prefix != null ? prefix + "." + attr : null;
        }
        return null;
    }

    @Override
    public String getKindName() {
        return "Attribute";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitAttributeExpr(this, context);
    }
}
