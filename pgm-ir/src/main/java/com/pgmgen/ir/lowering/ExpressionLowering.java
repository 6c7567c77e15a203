package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.ExprVisitor;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.ir.pgm.CallSource;
import com.pgmgen.ir.pgm.Domain;
import com.pgmgen.ir.pgm.LiteralSource;
import com.pgmgen.ir.pgm.SourceDescriptor;
import com.pgmgen.ir.pgm.VariableSource;

import java.util.ArrayList;
import java.util.List;

/**
 * 表达式降级：把表达式子树转换为有序的来源描述列表。
 *
 * <p>所有名称引用都按读取处理；写入目标由 {@link StatementLowering} 负责。
 * 没有处理器的节点种类一律抛出 {@link LoweringException}。</p>
 */
public class ExpressionLowering implements ExprVisitor<List<SourceDescriptor>, TraversalContext> {

    public List<SourceDescriptor> lower(Expression expr, TraversalContext ctx) {
        return expr.accept(this, ctx);
    }

    @Override
    public List<SourceDescriptor> visitName(Name node, TraversalContext ctx) {
        return single(new VariableSource(ctx.read(node.getId())));
    }

    @Override
    public List<SourceDescriptor> visitLiteral(Literal node, TraversalContext ctx) {
        Domain domain = Domain.fromLiteralKind(node.getKind());
        if (domain == null) {
            throw LoweringException.unsupported(node);
        }
        return single(new LiteralSource(domain, node.getValue()));
    }

    @Override
    public List<SourceDescriptor> visitBinaryExpr(BinaryExpr node, TraversalContext ctx) {
        List<SourceDescriptor> left = lower(node.getLeft(), ctx);
        List<SourceDescriptor> right = lower(node.getRight(), ctx);
        if (isScalar(node.getLeft()) && isScalar(node.getRight())
                && isSingleLiteral(left) && isSingleLiteral(right)) {
            LiteralSource folded = ConstantFolder.foldBinary(node.getOperator(),
                    (LiteralSource) left.get(0), (LiteralSource) right.get(0));
            if (folded != null) {
                return single(folded);
            }
        }
        return concat(left, right);
    }

    @Override
    public List<SourceDescriptor> visitUnaryExpr(UnaryExpr node, TraversalContext ctx) {
        List<SourceDescriptor> operand = lower(node.getOperand(), ctx);
        if (isScalar(node.getOperand()) && isSingleLiteral(operand)) {
            LiteralSource folded = ConstantFolder.foldUnary(node.getOperator(), (LiteralSource) operand.get(0));
            if (folded != null) {
                return single(folded);
            }
        }
        return operand;
    }

    @Override
    public List<SourceDescriptor> visitBoolOpExpr(BoolOpExpr node, TraversalContext ctx) {
        List<SourceDescriptor> result = new ArrayList<>();
        for (Expression value : node.getValues()) {
            result.addAll(lower(value, ctx));
        }
        return result;
    }

    @Override
    public List<SourceDescriptor> visitCompareExpr(CompareExpr node, TraversalContext ctx) {
        List<SourceDescriptor> left = lower(node.getLeft(), ctx);
        List<List<SourceDescriptor>> comparators = new ArrayList<>();
        for (Expression comparator : node.getComparators()) {
            comparators.add(lower(comparator, ctx));
        }
        if (node.getOperators().size() == 1 && isScalar(node.getLeft())
                && isScalar(node.getComparators().get(0))
                && isSingleLiteral(left) && isSingleLiteral(comparators.get(0))) {
            LiteralSource folded = ConstantFolder.foldCompare(node.getOperators().get(0),
                    (LiteralSource) left.get(0), (LiteralSource) comparators.get(0).get(0));
            if (folded != null) {
                return single(folded);
            }
        }
        List<SourceDescriptor> result = new ArrayList<>(left);
        for (List<SourceDescriptor> comparator : comparators) {
            result.addAll(comparator);
        }
        return result;
    }

    @Override
    public List<SourceDescriptor> visitCallExpr(CallExpr node, TraversalContext ctx) {
        String function = calleeName(node);
        List<List<SourceDescriptor>> inputs = new ArrayList<>();
        for (Expression arg : node.getArgs()) {
            inputs.add(lower(arg, ctx));
        }
        return single(new CallSource(function, inputs));
    }

    @Override
    public List<SourceDescriptor> visitAttributeExpr(AttributeExpr node, TraversalContext ctx) {
        throw LoweringException.unsupported(node);
    }

    @Override
    public List<SourceDescriptor> visitSubscriptExpr(SubscriptExpr node, TraversalContext ctx) {
        requireConstantIndex(node);
        return lower(node.getValue(), ctx);
    }

    @Override
    public List<SourceDescriptor> visitListExpr(ListExpr node, TraversalContext ctx) {
        return lowerAll(node.getElements(), ctx);
    }

    @Override
    public List<SourceDescriptor> visitTupleExpr(TupleExpr node, TraversalContext ctx) {
        return lowerAll(node.getElements(), ctx);
    }

    @Override
    public List<SourceDescriptor> visitUnsupportedExpr(UnsupportedExpr node, TraversalContext ctx) {
        throw LoweringException.unsupported(node);
    }

    // ============ 辅助方法 ============

    /**
     * 被调函数名：普通名称或 {@code module.function} 形式的属性链
     */
    public static String calleeName(CallExpr call) {
        Expression callee = call.getCallee();
        if (callee instanceof Name) {
            return ((Name) callee).getId();
        }
        if (callee instanceof AttributeExpr) {
            String qualified = ((AttributeExpr) callee).getQualifiedName();
            if (qualified != null) {
                return qualified;
            }
        }
        throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                "Unsupported callee", callee);
    }

    /**
     * 下标必须是整数字面量，整个数组共用一个版本计数
     */
    static void requireConstantIndex(SubscriptExpr node) {
        Expression index = node.getIndex();
        if (!(index instanceof Literal) || ((Literal) index).getKind() != Literal.LiteralKind.INT) {
            throw new LoweringException(LoweringException.Kind.ARRAY_INDEXING_UNSUPPORTED,
                    "Only constant integer indices are supported", index);
        }
    }

    private List<SourceDescriptor> lowerAll(List<Expression> elements, TraversalContext ctx) {
        List<SourceDescriptor> result = new ArrayList<>();
        for (Expression element : elements) {
            result.addAll(lower(element, ctx));
        }
        return result;
    }

    /** 列表、元组不是标量，不参与折叠 */
    private static boolean isScalar(Expression expr) {
        return !(expr instanceof ListExpr) && !(expr instanceof TupleExpr);
    }

    private static boolean isSingleLiteral(List<SourceDescriptor> sources) {
        return sources.size() == 1 && sources.get(0) instanceof LiteralSource;
    }

    private static List<SourceDescriptor> single(SourceDescriptor descriptor) {
        List<SourceDescriptor> result = new ArrayList<>(1);
        result.add(descriptor);
        return result;
    }

    private static List<SourceDescriptor> concat(List<SourceDescriptor> a, List<SourceDescriptor> b) {
        if (b.isEmpty()) return a;
        if (a.isEmpty()) return b;
        List<SourceDescriptor> result = new ArrayList<>(a.size() + b.size());
        result.addAll(a);
        result.addAll(b);
        return result;
    }
}
