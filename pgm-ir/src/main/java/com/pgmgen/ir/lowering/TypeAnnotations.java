package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.expr.AttributeExpr;
import com.pgmgen.compiler.ast.expr.Expression;
import com.pgmgen.compiler.ast.expr.Literal;
import com.pgmgen.compiler.ast.expr.Name;
import com.pgmgen.compiler.ast.expr.SubscriptExpr;
import com.pgmgen.ir.pgm.Domain;

/**
 * 类型注解解析：{@code int}、{@code float}、{@code str}、{@code bool}
 * 及其列表形式 {@code List[float]}（元素类型即变量的取值域）
 */
public final class TypeAnnotations {

    private TypeAnnotations() {
    }

    /**
     * 解析注解，无法识别时返回 null
     */
    public static Domain resolve(Expression annotation) {
        if (annotation == null) {
            return null;
        }
        if (annotation instanceof Name) {
            return Domain.fromTypeName(((Name) annotation).getId());
        }
        if (annotation instanceof Literal && ((Literal) annotation).getKind() == Literal.LiteralKind.STRING) {
            // 前向引用写法 x: "int"
            return Domain.fromTypeName((String) ((Literal) annotation).getValue());
        }
        if (annotation instanceof SubscriptExpr) {
            SubscriptExpr subscript = (SubscriptExpr) annotation;
            if (isListType(subscript.getValue())) {
                return resolve(subscript.getIndex());
            }
        }
        return null;
    }

    /**
     * 解析注解，无法识别时抛出 UNSUPPORTED_TYPE
     */
    public static Domain require(Expression annotation, String variable, SourceLocation location) {
        Domain domain = resolve(annotation);
        if (domain != null) {
            return domain;
        }
        if (annotation == null) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_TYPE,
                    "Missing type annotation for '" + variable + "'", "arg", location);
        }
        throw new LoweringException(LoweringException.Kind.UNSUPPORTED_TYPE,
                "Unrecognized type annotation for '" + variable + "'", annotation);
    }

    private static boolean isListType(Expression expr) {
        if (expr instanceof Name) {
            String id = ((Name) expr).getId();
            return "List".equals(id) || "list".equals(id);
        }
        if (expr instanceof AttributeExpr) {
            return "typing.List".equals(((AttributeExpr) expr).getQualifiedName());
        }
        return false;
    }
}
