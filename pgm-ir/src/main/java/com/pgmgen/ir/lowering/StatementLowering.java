package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.StmtVisitor;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.compiler.ast.stmt.*;
import com.pgmgen.compiler.formatter.PySourceFormatter;
import com.pgmgen.ir.lambda.LambdaEmitter;
import com.pgmgen.ir.pgm.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 语句降级：把函数体内的语句转换为 PGM 片段（函数 + 体记录）。
 *
 * <p>每条语句在传入的 {@link TraversalContext} 上读写版本；分支与循环使用子上下文，
 * 结束后在这里显式合并回外层。</p>
 */
public class StatementLowering implements StmtVisitor<Fragment, TraversalContext> {

    private static final Logger LOG = Logger.getLogger(StatementLowering.class.getName());

    private final ExpressionLowering expressions = new ExpressionLowering();
    private final PySourceFormatter formatter = new PySourceFormatter();
    private final LambdaEmitter emitter;
    private final boolean strictRangeBounds;

    public StatementLowering(LambdaEmitter emitter, boolean strictRangeBounds) {
        this.emitter = emitter;
        this.strictRangeBounds = strictRangeBounds;
    }

    public StatementLowering() {
        this(new LambdaEmitter(), false);
    }

    /**
     * 按顺序降级语句序列，片段依次拼接
     */
    public Fragment lowerBlock(List<Statement> body, TraversalContext ctx) {
        Fragment result = Fragment.empty();
        for (Statement stmt : body) {
            result.append(stmt.accept(this, ctx));
        }
        return result;
    }

    // ============ 函数定义 ============

    @Override
    public Fragment visitFunctionDef(FunctionDef node, TraversalContext ctx) {
        String name = node.getName();
        LOG.fine(() -> "Lowering function " + name + " (line " + node.getLine() + ")");
        TraversalContext fnCtx = ctx.forFunction(name, NameCollector.namesOf(node));

        List<TypedVariable> inputs = new ArrayList<>();
        for (Parameter param : node.getParams()) {
            Domain domain = TypeAnnotations.require(param.getAnnotation(), param.getName(), param.getLocation());
            fnCtx.setType(param.getName(), domain);
            fnCtx.readVersion(param.getName());
            inputs.add(new TypedVariable(param.getName(), domain));
        }

        Fragment body = lowerBlock(node.getBody(), fnCtx);

        List<TypedVariable> variables = new ArrayList<>();
        for (String variable : fnCtx.getLastDefs().keySet()) {
            variables.add(new TypedVariable(variable, fnCtx.getType(variable)));
        }

        Fragment result = Fragment.empty();
        for (PgmFunction function : body.getFunctions()) {
            result.addFunction(function);
        }
        result.addFunction(new ContainerFunction(name, inputs, variables, body.getBody()));
        return result;
    }

    // ============ 赋值 ============

    @Override
    public Fragment visitAssign(Assign node, TraversalContext ctx) {
        requireFunction(node, ctx);
        List<SourceDescriptor> sources = expressions.lower(node.getValue(), ctx);
        Fragment result = Fragment.empty();
        for (Expression target : node.getTargets()) {
            result.append(lowerAssignment(node, target, sources, ctx));
        }
        return result;
    }

    @Override
    public Fragment visitAnnAssign(AnnAssign node, TraversalContext ctx) {
        requireFunction(node, ctx);
        Domain domain = TypeAnnotations.resolve(node.getAnnotation());
        if (domain == null) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_TYPE,
                    "Unrecognized annotation '" + formatter.formatExpression(node.getAnnotation()) + "'",
                    node.getAnnotation());
        }
        TargetInfo target = resolveTarget(node.getTarget());
        ctx.setType(target.variable, domain);
        if (!node.hasValue() || node.getValue() instanceof ListExpr) {
            // 仅声明类型
            return Fragment.empty();
        }
        List<SourceDescriptor> sources = expressions.lower(node.getValue(), ctx);
        return lowerAssignment(node, node.getTarget(), sources, ctx);
    }

    @Override
    public Fragment visitAugAssign(AugAssign node, TraversalContext ctx) {
        requireFunction(node, ctx);
        TargetInfo target = resolveTarget(node.getTarget());
        List<SourceDescriptor> sources = new ArrayList<>();
        sources.add(new VariableSource(ctx.read(target.variable)));
        sources.addAll(expressions.lower(node.getValue(), ctx));
        // 目标已作为来源读取，按普通写入处理
        return emitAssign(node, target.variable, false, sources, ctx);
    }

    private Fragment lowerAssignment(Statement stmt, Expression targetExpr,
                                     List<SourceDescriptor> sources, TraversalContext ctx) {
        TargetInfo target = resolveTarget(targetExpr);
        return emitAssign(stmt, target.variable, target.arrayWrite, sources, ctx);
    }

    private Fragment emitAssign(Statement stmt, String variable, boolean arrayWrite,
                                List<SourceDescriptor> sources, TraversalContext ctx) {
        String fn = ctx.getCurrentFunctionName();
        List<FunctionSource> functionSources = SourceLists.functionSources(sources);
        List<BodyInput> bodyInputs = SourceLists.bodyInputs(sources);
        List<String> lambdaInputs = SourceLists.variableNames(sources);

        if (arrayWrite) {
            // 整个数组共用一个版本计数，新版本依赖旧版本
            VariableReference previous = ctx.read(variable);
            addDistinct(functionSources, FunctionSource.variable(variable));
            addDistinct(bodyInputs, new VariableInput(previous));
            addDistinct(lambdaInputs, variable);
        }
        VariableReference output = ctx.write(variable);
        String functionName = ctx.getRegistry().next(fn + "__assign__" + variable);

        FunctionBody body;
        if (!arrayWrite && sources.size() == 1 && sources.get(0) instanceof LiteralSource) {
            LiteralSource literal = (LiteralSource) sources.get(0);
            body = new LiteralBody(literal.getDomain(), literal.getText());
            ctx.inferType(variable, literal.getDomain());
        } else {
            String lambdaName = ctx.getRegistry().next(fn + "__lambda__" + variable);
            emitter.emitStatement(ctx.getLambdaSink(), lambdaName, stmt, lambdaInputs, variable);
            body = new LambdaBody(lambdaName, stmt.getLine());
        }

        return Fragment.empty()
                .addFunction(new AssignFunction(functionName, variable, functionSources, body))
                .addBody(BodyRecord.of(functionName, output, bodyInputs));
    }

    /**
     * 写入目标：名称或常量下标的数组元素
     */
    private TargetInfo resolveTarget(Expression target) {
        if (target instanceof Name) {
            return new TargetInfo(((Name) target).getId(), false);
        }
        if (target instanceof SubscriptExpr) {
            Expression current = target;
            while (current instanceof SubscriptExpr) {
                SubscriptExpr subscript = (SubscriptExpr) current;
                ExpressionLowering.requireConstantIndex(subscript);
                current = subscript.getValue();
            }
            if (current instanceof Name) {
                return new TargetInfo(((Name) current).getId(), true);
            }
            throw LoweringException.unsupported(current);
        }
        throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                "Unsupported assignment target", target);
    }

    private static final class TargetInfo {
        final String variable;
        final boolean arrayWrite;

        TargetInfo(String variable, boolean arrayWrite) {
            this.variable = variable;
            this.arrayWrite = arrayWrite;
        }
    }

    // ============ 条件 ============

    @Override
    public Fragment visitIfStmt(IfStmt node, TraversalContext ctx) {
        requireFunction(node, ctx);
        String fn = ctx.getCurrentFunctionName();
        Fragment result = Fragment.empty();

        // 条件变量
        List<SourceDescriptor> testSources = expressions.lower(node.getTest(), ctx);
        String conditionName = ctx.nextConditionName();
        VariableReference condition = ctx.write(conditionName);
        ctx.setType(conditionName, Domain.BOOLEAN);
        ctx.markCondition(conditionName);

        String lambdaName = ctx.getRegistry().next(fn + "__lambda__" + conditionName);
        emitter.emitExpression(ctx.getLambdaSink(), lambdaName, node.getTest(),
                SourceLists.variableNames(testSources));
        String conditionFunction = ctx.getRegistry().next(fn + "__condition__" + conditionName);
        result.addFunction(new AssignFunction(conditionFunction, conditionName,
                SourceLists.functionSources(testSources), new LambdaBody(lambdaName, node.getLine())));
        result.addBody(BodyRecord.of(conditionFunction, condition, SourceLists.bodyInputs(testSources)));

        Map<String, Integer> start = new LinkedHashMap<>(ctx.getLastDefs());

        TraversalContext thenCtx = ctx.forBranch();
        Fragment thenFragment = lowerBlock(node.getBody(), thenCtx);

        TraversalContext elseCtx = ctx.forBranch();
        elseCtx.adoptNextDefs(thenCtx);
        Fragment elseFragment = lowerBlock(node.getOrElse(), elseCtx);

        ctx.adoptNextDefs(elseCtx);
        ctx.mergeTypesFrom(thenCtx);
        ctx.mergeTypesFrom(elseCtx);
        ctx.mergeConditionsFrom(thenCtx);
        ctx.mergeConditionsFrom(elseCtx);

        result.append(thenFragment);
        result.append(elseFragment);
        result.append(mergeBranches(condition, start, thenCtx, elseCtx, ctx));
        return result;
    }

    /**
     * 为两个分支中版本不同的每个变量生成一个 decision 函数
     */
    private Fragment mergeBranches(VariableReference condition, Map<String, Integer> start,
                                   TraversalContext thenCtx, TraversalContext elseCtx, TraversalContext ctx) {
        String fn = ctx.getCurrentFunctionName();
        Map<String, Integer> thenDefs = thenCtx.getLastDefs();
        Map<String, Integer> elseDefs = elseCtx.getLastDefs();

        Set<String> keys = new LinkedHashSet<>(start.keySet());
        keys.addAll(thenDefs.keySet());
        keys.addAll(elseDefs.keySet());

        Fragment result = Fragment.empty();
        for (String key : keys) {
            if (ctx.isConditionVariable(key)) {
                // 嵌套条件变量在外层可见
                if (!start.containsKey(key)) {
                    Integer nested = elseDefs.containsKey(key) ? elseDefs.get(key) : thenDefs.get(key);
                    ctx.defineVersion(key, nested);
                }
                continue;
            }
            boolean defined = start.containsKey(key);
            int base = defined ? start.get(key) : ctx.getBaselineVersion();
            int thenVersion = thenDefs.getOrDefault(key, base);
            int elseVersion = elseDefs.getOrDefault(key, base);
            boolean thenChanged = thenVersion != base;
            boolean elseChanged = elseVersion != base;
            if (!thenChanged && !elseChanged) {
                if (!defined) {
                    ctx.defineVersion(key, base);
                }
                continue;
            }

            List<VariableReference> inputs = new ArrayList<>();
            inputs.add(condition);
            if (thenChanged && elseChanged) {
                inputs.add(new VariableReference(key, thenVersion));
                inputs.add(new VariableReference(key, elseVersion));
            } else if (thenChanged) {
                inputs.add(new VariableReference(key, thenVersion));
                inputs.add(new VariableReference(key, base));
            } else {
                inputs.add(new VariableReference(key, elseVersion));
                inputs.add(new VariableReference(key, base));
            }

            VariableReference output = ctx.write(key);
            String name = ctx.getRegistry().next(fn + "__decision__" + key);
            List<BodyInput> bodyInputs = new ArrayList<>();
            for (VariableReference input : inputs) {
                bodyInputs.add(new VariableInput(input));
            }
            result.addFunction(new DecisionFunction(name, key, inputs));
            result.addBody(BodyRecord.of(name, output, bodyInputs));
        }
        return result;
    }

    // ============ 循环 ============

    @Override
    public Fragment visitForStmt(ForStmt node, TraversalContext ctx) {
        requireFunction(node, ctx);
        if (node.hasElse()) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                    "for/else is not supported", node);
        }
        String index = loopIndex(node.getTarget());
        IterationRange range = iterationRange(node.getIter(), ctx);

        TraversalContext loopCtx = ctx.forLoop();
        Fragment body = lowerBlock(node.getBody(), loopCtx);
        ctx.mergeTypesFrom(loopCtx);

        List<String> inputs = new ArrayList<>();
        for (String variable : loopCtx.getLastDefs().keySet()) {
            if (!variable.equals(index) && !loopCtx.isConditionVariable(variable)) {
                inputs.add(variable);
            }
        }

        String name = ctx.getRegistry().next(ctx.getCurrentFunctionName() + "__loop_plate__" + index);
        List<BodyInput> callInputs = new ArrayList<>();
        for (String variable : inputs) {
            // 只在循环内出现的变量在外层没有版本可传；已知变量也不在外层登记新版本
            if (ctx.isDefined(variable)) {
                callInputs.add(new VariableInput(new VariableReference(variable, ctx.peekVersion(variable))));
            }
        }

        Fragment result = Fragment.empty();
        for (PgmFunction function : body.getFunctions()) {
            result.addFunction(function);
        }
        result.addFunction(new LoopPlateFunction(name, inputs, index, range, body.getBody()));
        result.addBody(BodyRecord.of(name, null, callInputs));
        return result;
    }

    private static String loopIndex(Expression target) {
        if (target instanceof Name) {
            return ((Name) target).getId();
        }
        if (target instanceof TupleExpr || target instanceof ListExpr) {
            throw new LoweringException(LoweringException.Kind.MULTIPLE_LOOP_INDICES,
                    "Only a single loop index is supported", target);
        }
        throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                "Unsupported loop target", target);
    }

    /**
     * 迭代对象必须是 {@code range(start, end)}，端点为单个字面量或变量
     */
    private IterationRange iterationRange(Expression iter, TraversalContext ctx) {
        if (!(iter instanceof CallExpr) || !(((CallExpr) iter).getCallee() instanceof Name)
                || !"range".equals(((Name) ((CallExpr) iter).getCallee()).getId())) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                    "Loop must iterate over range(...)", iter);
        }
        List<Expression> args = ((CallExpr) iter).getArgs();
        if (args.size() != 2) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_RANGE,
                    "range() needs exactly a start and an end, got " + args.size() + " argument(s)", iter);
        }
        return new IterationRange(rangeBound(args.get(0), ctx), rangeBound(args.get(1), ctx));
    }

    private SourceDescriptor rangeBound(Expression bound, TraversalContext ctx) {
        List<SourceDescriptor> sources = expressions.lower(bound, ctx);
        if (sources.size() != 1) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_RANGE,
                    "Range bound must be a single literal or variable", bound);
        }
        SourceDescriptor source = sources.get(0);
        if (source instanceof LiteralSource) {
            if (strictRangeBounds) {
                throw new LoweringException(LoweringException.Kind.UNSUPPORTED_RANGE,
                        "Literal range bounds are disabled", bound);
            }
            return source;
        }
        if (source instanceof VariableSource) {
            return source;
        }
        throw new LoweringException(LoweringException.Kind.UNSUPPORTED_RANGE,
                "Range bound must be a single literal or variable", bound);
    }

    // ============ 表达式语句 ============

    @Override
    public Fragment visitExpressionStmt(ExpressionStmt node, TraversalContext ctx) {
        Expression expr = node.getExpression();
        if (expr instanceof Literal && ((Literal) expr).getKind() == Literal.LiteralKind.STRING) {
            // 文档字符串
            return Fragment.empty();
        }
        if (!(expr instanceof CallExpr)) {
            throw LoweringException.unsupported(node);
        }
        requireFunction(node, ctx);
        CallExpr call = (CallExpr) expr;
        String function = ExpressionLowering.calleeName(call);
        List<BodyInput> inputs = new ArrayList<>();
        for (Expression arg : call.getArgs()) {
            List<SourceDescriptor> sources = expressions.lower(arg, ctx);
            if (sources.size() > 1) {
                throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                        "Call statement arguments must be a single reference", arg);
            }
            if (sources.isEmpty()) {
                continue;
            }
            BodyInput input = SourceLists.toBodyInput(sources.get(0));
            if (input != null) {
                inputs.add(input);
            }
        }
        return Fragment.empty().addBody(BodyRecord.externalCall(function, inputs));
    }

    // ============ 不支持 ============

    @Override
    public Fragment visitImportStmt(ImportStmt node, TraversalContext ctx) {
        throw LoweringException.unsupported(node);
    }

    @Override
    public Fragment visitUnsupportedStmt(UnsupportedStmt node, TraversalContext ctx) {
        throw LoweringException.unsupported(node);
    }

    // ============ 辅助方法 ============

    private static void requireFunction(Statement stmt, TraversalContext ctx) {
        if (!ctx.isInsideFunction()) {
            throw new LoweringException(LoweringException.Kind.UNSUPPORTED_CONSTRUCT,
                    "Statement outside of a function", stmt);
        }
    }

    private static <T> void addDistinct(List<T> list, T item) {
        if (!list.contains(item)) {
            list.add(item);
        }
    }
}
