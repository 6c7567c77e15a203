package com.pgmgen.ir.lowering;

import com.pgmgen.ir.lambda.LambdaSink;
import com.pgmgen.ir.pgm.Domain;
import com.pgmgen.ir.pgm.VariableReference;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 遍历上下文：一个作用域（函数、循环体或条件分支）的版本状态。
 *
 * <p>嵌套作用域复制父作用域的映射，作用域内的写入不会影响父作用域；
 * 分支与循环结束后由调用方显式回写。名称登记表与 lambda 输出在一次翻译内共享。</p>
 */
public class TraversalContext {

    private final Map<String, Integer> lastDefs;
    private final Map<String, Integer> nextDefs;
    private final Map<String, Domain> varTypes;
    private final Set<String> conditionVariables;
    private final Set<String> reservedNames;
    private final int baselineVersion;
    private final String currentFunctionName;
    private final FunctionNameRegistry registry;
    private final LambdaSink lambdaSink;

    private TraversalContext(Map<String, Integer> lastDefs, Map<String, Integer> nextDefs,
                             Map<String, Domain> varTypes, Set<String> conditionVariables,
                             Set<String> reservedNames, int baselineVersion, String currentFunctionName,
                             FunctionNameRegistry registry, LambdaSink lambdaSink) {
        this.lastDefs = lastDefs;
        this.nextDefs = nextDefs;
        this.varTypes = varTypes;
        this.conditionVariables = conditionVariables;
        this.reservedNames = reservedNames;
        this.baselineVersion = baselineVersion;
        this.currentFunctionName = currentFunctionName;
        this.registry = registry;
        this.lambdaSink = lambdaSink;
    }

    /**
     * 顶层上下文：不在任何函数内
     */
    public static TraversalContext root(FunctionNameRegistry registry, LambdaSink lambdaSink) {
        return new TraversalContext(new LinkedHashMap<String, Integer>(), new HashMap<String, Integer>(),
                new HashMap<String, Domain>(), new HashSet<String>(), Collections.<String>emptySet(),
                0, null, registry, lambdaSink);
    }

    /**
     * 函数作用域：不继承外层任何状态，基线版本为 0
     */
    public TraversalContext forFunction(String functionName) {
        return forFunction(functionName, Collections.<String>emptySet());
    }

    /**
     * 函数作用域，{@code reservedNames} 为源码中已经使用的名称，条件变量不会取这些名字
     */
    public TraversalContext forFunction(String functionName, Set<String> reservedNames) {
        return new TraversalContext(new LinkedHashMap<String, Integer>(), new HashMap<String, Integer>(),
                new HashMap<String, Domain>(), new HashSet<String>(), reservedNames, 0, functionName,
                registry, lambdaSink);
    }

    /**
     * 循环体作用域：空版本映射，基线版本为 -1，类型信息沿用外层
     */
    public TraversalContext forLoop() {
        return new TraversalContext(new LinkedHashMap<String, Integer>(), new HashMap<String, Integer>(),
                new HashMap<String, Domain>(varTypes), new HashSet<String>(conditionVariables), reservedNames, -1,
                currentFunctionName, registry, lambdaSink);
    }

    /**
     * 条件分支作用域：复制当前全部映射
     */
    public TraversalContext forBranch() {
        return new TraversalContext(new LinkedHashMap<String, Integer>(lastDefs),
                new HashMap<String, Integer>(nextDefs), new HashMap<String, Domain>(varTypes),
                new HashSet<String>(conditionVariables), reservedNames, baselineVersion, currentFunctionName,
                registry, lambdaSink);
    }

    // ============ 版本 ============

    /**
     * 读取变量的当前版本。未定义的变量视为对作用域入口值的引用，登记为基线版本。
     */
    public int readVersion(String variable) {
        Integer version = lastDefs.get(variable);
        if (version == null) {
            lastDefs.put(variable, baselineVersion);
            return baselineVersion;
        }
        return version;
    }

    /**
     * 为变量分配下一个版本并使其对后续读取可见
     */
    public int writeVersion(String variable) {
        int version = nextDefs.getOrDefault(variable, baselineVersion + 1);
        nextDefs.put(variable, version + 1);
        lastDefs.put(variable, version);
        return version;
    }

    /**
     * 查看变量当前版本但不登记
     */
    public int peekVersion(String variable) {
        return lastDefs.getOrDefault(variable, baselineVersion);
    }

    public VariableReference read(String variable) {
        return new VariableReference(variable, readVersion(variable));
    }

    public VariableReference write(String variable) {
        return new VariableReference(variable, writeVersion(variable));
    }

    boolean isDefined(String variable) {
        return lastDefs.containsKey(variable);
    }

    /** 按首次出现顺序排列的已知变量及其当前版本 */
    public Map<String, Integer> getLastDefs() {
        return Collections.unmodifiableMap(lastDefs);
    }

    Map<String, Integer> getNextDefs() {
        return Collections.unmodifiableMap(nextDefs);
    }

    /**
     * 分支合并时登记外层原本没有的变量版本
     */
    void defineVersion(String variable, int version) {
        lastDefs.put(variable, version);
    }

    /**
     * 采用另一作用域的版本计数，使兄弟分支分配的版本互不重复
     */
    void adoptNextDefs(TraversalContext other) {
        nextDefs.putAll(other.nextDefs);
    }

    // ============ 类型 ============

    public Domain getType(String variable) {
        return varTypes.get(variable);
    }

    public void setType(String variable, Domain domain) {
        varTypes.put(variable, domain);
    }

    /**
     * 仅在尚无类型时登记（注解优先于字面量推断）
     */
    public void inferType(String variable, Domain domain) {
        if (domain != null && !varTypes.containsKey(variable)) {
            varTypes.put(variable, domain);
        }
    }

    void mergeTypesFrom(TraversalContext other) {
        for (Map.Entry<String, Domain> entry : other.varTypes.entrySet()) {
            varTypes.putIfAbsent(entry.getKey(), entry.getValue());
        }
    }

    // ============ 条件变量 ============

    /**
     * 取下一个未被占用的条件变量名，跳过源码使用过的名称和本作用域已知的变量
     */
    String nextConditionName() {
        String name;
        do {
            name = registry.nextConditionName(currentFunctionName);
        } while (reservedNames.contains(name) || lastDefs.containsKey(name) || varTypes.containsKey(name));
        return name;
    }

    void markCondition(String variable) {
        conditionVariables.add(variable);
    }

    public boolean isConditionVariable(String variable) {
        return conditionVariables.contains(variable);
    }

    void mergeConditionsFrom(TraversalContext other) {
        conditionVariables.addAll(other.conditionVariables);
    }

    // ============ 访问器 ============

    public int getBaselineVersion() {
        return baselineVersion;
    }

    public String getCurrentFunctionName() {
        return currentFunctionName;
    }

    public boolean isInsideFunction() {
        return currentFunctionName != null;
    }

    public FunctionNameRegistry getRegistry() {
        return registry;
    }

    public LambdaSink getLambdaSink() {
        return lambdaSink;
    }
}
