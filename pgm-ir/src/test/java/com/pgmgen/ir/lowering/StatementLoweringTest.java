package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.parser.Parser;
import com.pgmgen.ir.lambda.BufferedLambdaSink;
import com.pgmgen.ir.lambda.LambdaEmitter;
import com.pgmgen.ir.pgm.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * 语句降级测试
 */
class StatementLoweringTest {

    private final BufferedLambdaSink sink = new BufferedLambdaSink();

    private Fragment lower(String source) {
        return new AstToPgmLowering(sink).lower(Parser.parse(source, "test.py"));
    }

    private static <T extends PgmFunction> T function(Fragment fragment, String name, Class<T> type) {
        for (PgmFunction function : fragment.getFunctions()) {
            if (function.getName().equals(name)) {
                assertThat(function).isInstanceOf(type);
                return type.cast(function);
            }
        }
        throw new AssertionError("function not found: " + name);
    }

    private static List<String> names(Fragment fragment) {
        List<String> names = new ArrayList<>();
        for (PgmFunction function : fragment.getFunctions()) {
            names.add(function.getName());
        }
        return names;
    }

    private static List<String> variableNames(ContainerFunction container) {
        List<String> names = new ArrayList<>();
        for (TypedVariable variable : container.getVariables()) {
            names.add(variable.getName());
        }
        return names;
    }

    private static BodyRecord record(ContainerFunction container, String name) {
        for (BodyRecord record : container.getBody()) {
            if (record.getName().equals(name)) {
                return record;
            }
        }
        throw new AssertionError("record not found: " + name);
    }

    private static VariableInput input(String variable, int index) {
        return new VariableInput(new VariableReference(variable, index));
    }

    private static VariableReference ref(String variable, int index) {
        return new VariableReference(variable, index);
    }

    @Nested
    @DisplayName("赋值")
    class AssignTests {

        @Test
        @DisplayName("字面量赋值与依赖赋值")
        void testStraightLine() {
            Fragment fragment = lower("def f():\n    x: int = 2\n    y: int = x + 3\n");

            assertThat(names(fragment)).containsExactly("f__assign__x_0", "f__assign__y_0", "f");

            AssignFunction x = function(fragment, "f__assign__x_0", AssignFunction.class);
            assertThat(x.getTarget()).isEqualTo("x");
            assertThat(x.getSources()).isEmpty();
            assertThat(x.getBody()).isInstanceOf(LiteralBody.class);
            LiteralBody literal = (LiteralBody) x.getBody();
            assertThat(literal.getDtype()).isEqualTo(Domain.INTEGER);
            assertThat(literal.getValue()).isEqualTo("2");

            AssignFunction y = function(fragment, "f__assign__y_0", AssignFunction.class);
            assertThat(y.getSources()).containsExactly(FunctionSource.variable("x"));
            assertThat(y.getBody()).isInstanceOf(LambdaBody.class);
            LambdaBody lambda = (LambdaBody) y.getBody();
            assertThat(lambda.getName()).isEqualTo("f__lambda__y_0");
            assertThat(lambda.getReference()).isEqualTo(3);

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(f.getInput()).isEmpty();
            assertThat(f.getVariables()).extracting(TypedVariable::getName).containsExactly("x", "y");
            assertThat(f.getVariables()).extracting(TypedVariable::getDomain)
                    .containsExactly(Domain.INTEGER, Domain.INTEGER);
            assertThat(record(f, "f__assign__x_0").getOutput()).isEqualTo(ref("x", 1));
            assertThat(record(f, "f__assign__x_0").getInput()).isEmpty();
            assertThat(record(f, "f__assign__y_0").getOutput()).isEqualTo(ref("y", 1));
            assertThat(record(f, "f__assign__y_0").getInput()).containsExactly(input("x", 1));

            assertThat(sink.getNames()).containsExactly("f__lambda__y_0");
            assertThat(sink.getSource("f__lambda__y_0"))
                    .isEqualTo("def f__lambda__y_0(x):\n    y: int = x + 3\n    return y\n\n");
        }

        @Test
        @DisplayName("重复写入产生递增版本")
        void testRepeatedWrites() {
            Fragment fragment = lower("def f(a: int):\n    x = a\n    x = x + 1\n    x = 5\n");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__assign__x_0").getOutput()).isEqualTo(ref("x", 1));
            assertThat(record(f, "f__assign__x_0").getInput()).containsExactly(input("a", 0));
            assertThat(record(f, "f__assign__x_1").getInput()).containsExactly(input("x", 1));
            assertThat(record(f, "f__assign__x_1").getOutput()).isEqualTo(ref("x", 2));
            assertThat(record(f, "f__assign__x_2").getOutput()).isEqualTo(ref("x", 3));
            assertThat(f.getInput()).extracting(TypedVariable::getName).containsExactly("a");
        }

        @Test
        @DisplayName("常量表达式折叠为字面量")
        void testFolding() {
            Fragment fragment = lower("def f():\n    y = 2 * 3 + 1\n    r = 1 / 4\n");
            LiteralBody y = (LiteralBody) function(fragment, "f__assign__y_0", AssignFunction.class).getBody();
            assertThat(y.getDtype()).isEqualTo(Domain.INTEGER);
            assertThat(y.getValue()).isEqualTo("7");
            LiteralBody r = (LiteralBody) function(fragment, "f__assign__r_0", AssignFunction.class).getBody();
            assertThat(r.getDtype()).isEqualTo(Domain.REAL);
            assertThat(r.getValue()).isEqualTo("0.25");
            assertThat(sink.size()).isZero();

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(f.getVariables()).extracting(TypedVariable::getDomain)
                    .containsExactly(Domain.INTEGER, Domain.REAL);
        }

        @Test
        @DisplayName("注解类型优先于字面量推断")
        void testAnnotationWins() {
            Fragment fragment = lower("def f():\n    x: float = 1\n");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(f.getVariables().get(0).getDomain()).isEqualTo(Domain.REAL);
            LiteralBody body = (LiteralBody) function(fragment, "f__assign__x_0", AssignFunction.class).getBody();
            assertThat(body.getDtype()).isEqualTo(Domain.INTEGER);
        }

        @Test
        @DisplayName("只声明类型不产生函数")
        void testDeclarationOnly() {
            Fragment fragment = lower("def f():\n    x: int\n    xs: List[float] = []\n");
            assertThat(names(fragment)).containsExactly("f");
        }

        @Test
        @DisplayName("增量赋值读取原值")
        void testAugAssign() {
            Fragment fragment = lower("def f(x: int):\n    x += 2\n");
            AssignFunction assign = function(fragment, "f__assign__x_0", AssignFunction.class);
            assertThat(assign.getSources()).containsExactly(FunctionSource.variable("x"));
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__assign__x_0").getInput()).containsExactly(input("x", 0));
            assertThat(record(f, "f__assign__x_0").getOutput()).isEqualTo(ref("x", 1));
            assertThat(sink.getSource("f__lambda__x_0"))
                    .isEqualTo("def f__lambda__x_0(x):\n    x += 2\n    return x\n\n");
        }

        @Test
        @DisplayName("多目标赋值为每个目标各生成一个函数")
        void testMultipleTargets() {
            Fragment fragment = lower("def f(a: int):\n    x = y = a\n");
            assertThat(names(fragment)).containsExactly("f__assign__x_0", "f__assign__y_0", "f");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__assign__x_0").getInput()).containsExactly(input("a", 0));
            assertThat(record(f, "f__assign__y_0").getInput()).containsExactly(input("a", 0));
        }

        @Test
        @DisplayName("调用表达式记录被调函数与实参")
        void testCallInAssignment() {
            Fragment fragment = lower("def f(a: int):\n    y = g(a, 1)\n");
            AssignFunction assign = function(fragment, "f__assign__y_0", AssignFunction.class);
            assertThat(assign.getSources())
                    .containsExactly(FunctionSource.function("g"), FunctionSource.variable("a"));
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            List<BodyInput> expected = new ArrayList<>();
            expected.add(new CallInput("g", Arrays.<BodyInput>asList(input("a", 0))));
            assertThat(record(f, "f__assign__y_0").getInput()).isEqualTo(expected);
            assertThat(sink.getSource("f__lambda__y_0")).startsWith("def f__lambda__y_0(a):\n");
        }

        @Test
        @DisplayName("重复引用的变量只作为一个输入")
        void testDuplicateReads() {
            Fragment fragment = lower("def f(a: int):\n    y = a * a + a\n");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__assign__y_0").getInput()).containsExactly(input("a", 0));
            assertThat(sink.getSource("f__lambda__y_0")).startsWith("def f__lambda__y_0(a):\n");
        }
    }

    @Nested
    @DisplayName("数组")
    class ArrayTests {

        @Test
        @DisplayName("元素写入依赖数组旧版本")
        void testElementWrite() {
            Fragment fragment = lower("def f():\n    a = [1, 2]\n    a[0] = 5\n");
            assertThat(names(fragment)).containsExactly("f__assign__a_0", "f__assign__a_1", "f");

            AssignFunction write = function(fragment, "f__assign__a_1", AssignFunction.class);
            assertThat(write.getSources()).containsExactly(FunctionSource.variable("a"));
            assertThat(write.getBody()).isInstanceOf(LambdaBody.class);

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__assign__a_0").getOutput()).isEqualTo(ref("a", 1));
            assertThat(record(f, "f__assign__a_1").getInput()).containsExactly(input("a", 1));
            assertThat(record(f, "f__assign__a_1").getOutput()).isEqualTo(ref("a", 2));
            assertThat(sink.getSource("f__lambda__a_1"))
                    .isEqualTo("def f__lambda__a_1(a):\n    a[0] = 5\n    return a\n\n");
        }

        @Test
        @DisplayName("常量下标读取引用整个数组")
        void testElementRead() {
            Fragment fragment = lower("def f(a: List[int]):\n    y = a[1] + a[2]\n");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(f.getInput().get(0).getDomain()).isEqualTo(Domain.INTEGER);
            assertThat(record(f, "f__assign__y_0").getInput()).containsExactly(input("a", 0));
        }
    }

    @Nested
    @DisplayName("条件")
    class IfTests {

        @Test
        @DisplayName("两个分支都写入时合并两个新版本")
        void testBothBranches() {
            Fragment fragment = lower("def f(a: int, b: int):\n"
                    + "    if a <= b:\n"
                    + "        y = 1\n"
                    + "    else:\n"
                    + "        y = 2\n"
                    + "    z = y\n");

            assertThat(names(fragment)).containsExactly("f__condition__IF_1_0", "f__assign__y_0",
                    "f__assign__y_1", "f__decision__y_0", "f__assign__z_0", "f");

            AssignFunction condition = function(fragment, "f__condition__IF_1_0", AssignFunction.class);
            assertThat(condition.getTarget()).isEqualTo("IF_1");
            assertThat(condition.getSources())
                    .containsExactly(FunctionSource.variable("a"), FunctionSource.variable("b"));
            assertThat(((LambdaBody) condition.getBody()).getName()).isEqualTo("f__lambda__IF_1_0");
            assertThat(sink.getSource("f__lambda__IF_1_0"))
                    .isEqualTo("def f__lambda__IF_1_0(a, b):\n    return a <= b\n\n");

            DecisionFunction decision = function(fragment, "f__decision__y_0", DecisionFunction.class);
            assertThat(decision.getTarget()).isEqualTo("y");
            assertThat(decision.getInputs()).containsExactly(ref("IF_1", 1), ref("y", 1), ref("y", 2));
            assertThat(decision.getCondition()).isEqualTo(ref("IF_1", 1));

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__condition__IF_1_0").getOutput()).isEqualTo(ref("IF_1", 1));
            assertThat(record(f, "f__condition__IF_1_0").getInput())
                    .containsExactly(input("a", 0), input("b", 0));
            assertThat(record(f, "f__assign__y_0").getOutput()).isEqualTo(ref("y", 1));
            assertThat(record(f, "f__assign__y_1").getOutput()).isEqualTo(ref("y", 2));
            assertThat(record(f, "f__decision__y_0").getOutput()).isEqualTo(ref("y", 3));
            assertThat(record(f, "f__assign__z_0").getInput()).containsExactly(input("y", 3));

            assertThat(variableNames(f)).containsExactly("a", "b", "IF_1", "y", "z");
            assertThat(f.getVariables().get(2).getDomain()).isEqualTo(Domain.BOOLEAN);
            assertThat(f.getVariables().get(3).getDomain()).isEqualTo(Domain.INTEGER);
        }

        @Test
        @DisplayName("只有一个分支写入时与原版本合并")
        void testOneBranch() {
            Fragment fragment = lower("def f(a: int):\n"
                    + "    y = 0\n"
                    + "    if a > 0:\n"
                    + "        y = 1\n"
                    + "    z = y\n");
            DecisionFunction decision = function(fragment, "f__decision__y_0", DecisionFunction.class);
            assertThat(decision.getInputs()).containsExactly(ref("IF_1", 1), ref("y", 2), ref("y", 1));
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__decision__y_0").getOutput()).isEqualTo(ref("y", 3));
            assertThat(record(f, "f__assign__z_0").getInput()).containsExactly(input("y", 3));
        }

        @Test
        @DisplayName("只在 else 分支写入")
        void testElseOnly() {
            Fragment fragment = lower("def f(a: int):\n"
                    + "    y = 0\n"
                    + "    if a > 0:\n"
                    + "        z = 1\n"
                    + "    else:\n"
                    + "        y = 1\n");
            DecisionFunction y = function(fragment, "f__decision__y_0", DecisionFunction.class);
            assertThat(y.getInputs()).containsExactly(ref("IF_1", 1), ref("y", 2), ref("y", 1));
            DecisionFunction z = function(fragment, "f__decision__z_0", DecisionFunction.class);
            assertThat(z.getInputs()).containsExactly(ref("IF_1", 1), ref("z", 1), ref("z", 0));
        }

        @Test
        @DisplayName("分支内首次定义的变量也会合并")
        void testNewVariableMerged() {
            Fragment fragment = lower("def f(a: int):\n"
                    + "    if a > 0:\n"
                    + "        w = 1\n"
                    + "    v = w\n");
            DecisionFunction decision = function(fragment, "f__decision__w_0", DecisionFunction.class);
            assertThat(decision.getInputs()).containsExactly(ref("IF_1", 1), ref("w", 1), ref("w", 0));
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__assign__v_0").getInput()).containsExactly(input("w", 2));
        }

        @Test
        @DisplayName("分支中只读取的变量不产生 decision")
        void testReadOnlyInBranch() {
            Fragment fragment = lower("def f(a: int, b: int):\n"
                    + "    if a > 0:\n"
                    + "        y = b\n");
            assertThat(names(fragment)).containsExactly("f__condition__IF_1_0", "f__assign__y_0",
                    "f__decision__y_0", "f");
        }

        @Test
        @DisplayName("elif 展开为嵌套条件，内层条件变量对外可见")
        void testElifChain() {
            Fragment fragment = lower("def f(a: int):\n"
                    + "    if a > 0:\n"
                    + "        y = 1\n"
                    + "    elif a < 0:\n"
                    + "        y = 2\n"
                    + "    else:\n"
                    + "        y = 3\n");

            assertThat(names(fragment)).containsExactly("f__condition__IF_1_0", "f__assign__y_0",
                    "f__condition__IF_2_0", "f__assign__y_1", "f__assign__y_2",
                    "f__decision__y_0", "f__decision__y_1", "f");

            DecisionFunction inner = function(fragment, "f__decision__y_0", DecisionFunction.class);
            assertThat(inner.getInputs()).containsExactly(ref("IF_2", 1), ref("y", 2), ref("y", 3));
            DecisionFunction outer = function(fragment, "f__decision__y_1", DecisionFunction.class);
            assertThat(outer.getInputs()).containsExactly(ref("IF_1", 1), ref("y", 1), ref("y", 4));

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__decision__y_1").getOutput()).isEqualTo(ref("y", 5));
            assertThat(variableNames(f)).containsExactly("a", "IF_1", "y", "IF_2");
        }

        @Test
        @DisplayName("条件变量名避开源码中已有的同名变量")
        void testConditionNameAvoidsUserVariable() {
            Fragment fragment = lower("def f(a: int):\n"
                    + "    IF_1 = a * 3\n"
                    + "    if a > 0:\n"
                    + "        IF_1 = a + 5\n"
                    + "    g(IF_1)\n");

            assertThat(names(fragment)).containsExactly("f__assign__IF_1_0", "f__condition__IF_2_0",
                    "f__assign__IF_1_1", "f__decision__IF_1_0", "f");
            DecisionFunction decision = function(fragment, "f__decision__IF_1_0", DecisionFunction.class);
            assertThat(decision.getInputs()).containsExactly(ref("IF_2", 1), ref("IF_1", 2), ref("IF_1", 1));

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__decision__IF_1_0").getOutput()).isEqualTo(ref("IF_1", 3));
            assertThat(f.getBody().get(f.getBody().size() - 1).getInput()).containsExactly(input("IF_1", 3));
            assertThat(variableNames(f)).containsExactly("a", "IF_1", "IF_2");
            assertThat(f.getVariables().get(1).getDomain()).isNull();
            assertThat(f.getVariables().get(2).getDomain()).isEqualTo(Domain.BOOLEAN);
        }

        @Test
        @DisplayName("条件变量按函数分别编号")
        void testConditionNumbering() {
            Fragment fragment = lower("def f(a: int):\n"
                    + "    if a > 0:\n"
                    + "        y = 1\n"
                    + "    if a > 1:\n"
                    + "        y = 2\n"
                    + "\n"
                    + "def g(a: int):\n"
                    + "    if a > 0:\n"
                    + "        y = 1\n");
            assertThat(names(fragment)).contains("f__condition__IF_1_0", "f__condition__IF_2_0",
                    "g__condition__IF_1_0");
        }
    }

    @Nested
    @DisplayName("循环")
    class ForTests {

        @Test
        @DisplayName("循环体写入的变量以 -1 为基线")
        void testLoopPlate() {
            Fragment fragment = lower("def f(s: int):\n"
                    + "    for i in range(1, 5):\n"
                    + "        s = s + i\n");

            assertThat(names(fragment)).containsExactly("f__assign__s_0", "f__loop_plate__i_0", "f");

            LoopPlateFunction plate = function(fragment, "f__loop_plate__i_0", LoopPlateFunction.class);
            assertThat(plate.getIndexVariable()).isEqualTo("i");
            assertThat(plate.getInput()).containsExactly("s");
            assertThat(plate.getRange().getStart()).isEqualTo(new LiteralSource(Domain.INTEGER, 1L));
            assertThat(plate.getRange().getEnd()).isEqualTo(new LiteralSource(Domain.INTEGER, 5L));
            assertThat(plate.getBody()).hasSize(1);
            BodyRecord inner = plate.getBody().get(0);
            assertThat(inner.getName()).isEqualTo("f__assign__s_0");
            assertThat(inner.getInput()).containsExactly(input("s", -1), input("i", -1));
            assertThat(inner.getOutput()).isEqualTo(ref("s", 0));
            assertThat(sink.getSource("f__lambda__s_0")).startsWith("def f__lambda__s_0(s, i):\n");

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            BodyRecord call = record(f, "f__loop_plate__i_0");
            assertThat(call.hasOutput()).isFalse();
            assertThat(call.getInput()).containsExactly(input("s", 0));
            assertThat(variableNames(f)).containsExactly("s");
        }

        @Test
        @DisplayName("循环写入不影响外层版本")
        void testLoopIsolation() {
            Fragment fragment = lower("def f(n: int):\n"
                    + "    t = 0\n"
                    + "    for i in range(0, n):\n"
                    + "        t = t + i\n"
                    + "        u = t\n"
                    + "    r = t\n");
            LoopPlateFunction plate = function(fragment, "f__loop_plate__i_0", LoopPlateFunction.class);
            assertThat(plate.getInput()).containsExactly("t", "u");
            assertThat(plate.getRange().getEnd())
                    .isEqualTo(new VariableSource(new VariableReference("n", 0)));

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__loop_plate__i_0").getInput()).containsExactly(input("t", 1));
            assertThat(record(f, "f__assign__r_0").getInput()).containsExactly(input("t", 1));
            assertThat(variableNames(f)).containsExactly("n", "t", "r");
        }

        @Test
        @DisplayName("只在循环内定义的变量不出现在调用记录中")
        void testLoopLocalNotPassed() {
            Fragment fragment = lower("def f(s: int, n: int):\n"
                    + "    for i in range(0, n):\n"
                    + "        t = s * 2\n"
                    + "        s = t + i\n");
            LoopPlateFunction plate = function(fragment, "f__loop_plate__i_0", LoopPlateFunction.class);
            assertThat(plate.getInput()).containsExactly("s", "t");

            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(record(f, "f__loop_plate__i_0").getInput()).containsExactly(input("s", 0));
            assertThat(variableNames(f)).containsExactly("s", "n");
        }

        @Test
        @DisplayName("循环体内的条件")
        void testConditionInLoop() {
            Fragment fragment = lower("def f(s: int):\n"
                    + "    for i in range(0, 3):\n"
                    + "        if i > 1:\n"
                    + "            s = s + 1\n");
            LoopPlateFunction plate = function(fragment, "f__loop_plate__i_0", LoopPlateFunction.class);
            assertThat(plate.getInput()).containsExactly("s");
            DecisionFunction decision = function(fragment, "f__decision__s_0", DecisionFunction.class);
            assertThat(decision.getInputs()).containsExactly(ref("IF_1", 0), ref("s", 0), ref("s", -1));
            assertThat(plate.getBody()).extracting(BodyRecord::getName)
                    .containsExactly("f__condition__IF_1_0", "f__assign__s_0", "f__decision__s_0");
        }

        @Test
        @DisplayName("严格模式拒绝字面量端点")
        void testStrictBounds() {
            AstToPgmLowering strict = new AstToPgmLowering(sink, new LambdaEmitter(), true);
            LoweringException e = catchThrowableOfType(() -> strict.lower(Parser.parse(
                    "def f(n: int):\n    for i in range(0, n):\n        x = i\n", "test.py")),
                    LoweringException.class);
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_RANGE);

            AstToPgmLowering strictOk = new AstToPgmLowering(new BufferedLambdaSink(), new LambdaEmitter(), true);
            Fragment fragment = strictOk.lower(Parser.parse(
                    "def f(m: int, n: int):\n    for i in range(m, n):\n        x = i\n", "test.py"));
            assertThat(names(fragment)).contains("f__loop_plate__i_0");
        }
    }

    @Nested
    @DisplayName("函数与调用语句")
    class FunctionTests {

        @Test
        @DisplayName("调用语句生成外部调用记录")
        void testCallStatement() {
            Fragment fragment = lower("def f(a: int):\n    g(a, 1)\n    h()\n");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(f.getBody()).hasSize(2);
            BodyRecord g = f.getBody().get(0);
            assertThat(g.isExternal()).isTrue();
            assertThat(g.getName()).isEqualTo("g");
            assertThat(g.getInput()).containsExactly(input("a", 0));
            assertThat(g.hasOutput()).isFalse();
            assertThat(f.getBody().get(1).getInput()).isEmpty();
        }

        @Test
        @DisplayName("文档字符串被忽略")
        void testDocstring() {
            Fragment fragment = lower("def f():\n    \"\"\"doc\"\"\"\n    x = 1\n");
            assertThat(names(fragment)).containsExactly("f__assign__x_0", "f");
        }

        @Test
        @DisplayName("嵌套函数各自独立")
        void testNestedFunction() {
            Fragment fragment = lower("def f():\n"
                    + "    def g(a: int):\n"
                    + "        y = a\n"
                    + "    x = 1\n");
            assertThat(names(fragment)).containsExactly("g__assign__y_0", "g", "f__assign__x_0", "f");
            ContainerFunction f = function(fragment, "f", ContainerFunction.class);
            assertThat(variableNames(f)).containsExactly("x");
            ContainerFunction g = function(fragment, "g", ContainerFunction.class);
            assertThat(variableNames(g)).containsExactly("a", "y");
        }

        @Test
        @DisplayName("函数定义不产生顶层体记录")
        void testNoTopLevelBody() {
            Fragment fragment = lower("def f():\n    x = 1\n");
            assertThat(fragment.getBody()).isEmpty();
        }

        @Test
        @DisplayName("函数外的语句被拒绝")
        void testOutsideFunction() {
            StatementLowering statements = new StatementLowering();
            TraversalContext root = TraversalContext.root(new FunctionNameRegistry(), sink);
            LoweringException e = catchThrowableOfType(() -> statements.lowerBlock(
                    Parser.parse("x = 1\n", "test.py").getBody(), root), LoweringException.class);
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
            assertThat(e.getMessage()).contains("Statement outside of a function");
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        private LoweringException failure(String source) {
            LoweringException e = catchThrowableOfType(() -> lower(source), LoweringException.class);
            assertThat(e).as("expected lowering failure for:\n%s", source).isNotNull();
            return e;
        }

        @Test
        @DisplayName("参数缺少注解")
        void testMissingAnnotation() {
            LoweringException e = failure("def f(x):\n    y = x\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_TYPE);
            assertThat(e.getMessage()).contains("'x'");
        }

        @Test
        @DisplayName("无法识别的类型")
        void testUnknownType() {
            LoweringException e = failure("def f():\n    x: dict = 1\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_TYPE);
            assertThat(e.getMessage()).contains("Unrecognized annotation 'dict'");
            assertThat(failure("def f(x: Foo):\n    y = x\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_TYPE);
        }

        @Test
        @DisplayName("range 参数个数不对")
        void testRangeArity() {
            LoweringException e = failure("def f():\n    for i in range(5):\n        x = i\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_RANGE);
            assertThat(failure("def f():\n    for i in range(0, 9, 2):\n        x = i\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_RANGE);
        }

        @Test
        @DisplayName("range 端点是复合表达式")
        void testRangeBoundExpression() {
            LoweringException e = failure("def f(n: int):\n    for i in range(0, n + 1):\n        x = i\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_RANGE);
        }

        @Test
        @DisplayName("多个循环变量")
        void testMultipleIndices() {
            LoweringException e = failure("def f():\n    for i, j in range(0, 2):\n        x = i\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.MULTIPLE_LOOP_INDICES);
        }

        @Test
        @DisplayName("变量下标")
        void testVariableIndex() {
            assertThat(failure("def f(a: List[int], i: int):\n    a[i] = 1\n").getKind())
                    .isEqualTo(LoweringException.Kind.ARRAY_INDEXING_UNSUPPORTED);
            assertThat(failure("def f(a: List[int], i: int):\n    y = a[i]\n").getKind())
                    .isEqualTo(LoweringException.Kind.ARRAY_INDEXING_UNSUPPORTED);
        }

        @Test
        @DisplayName("不支持的语句")
        void testUnsupportedStatements() {
            LoweringException e = failure("def f(x: int):\n    while x:\n        x = x - 1\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
            assertThat(e.getConstructKind()).isEqualTo("While");

            assertThat(failure("def f(x: int):\n    return x\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
            assertThat(failure("def f():\n    import os\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
            assertThat(failure("def f(x: int):\n    x\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
        }

        @Test
        @DisplayName("不支持的循环形式")
        void testUnsupportedLoops() {
            assertThat(failure("def f(xs: List[int]):\n    for x in xs:\n        y = x\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
            assertThat(failure("def f():\n    for i in range(0, 2):\n        x = i\n    else:\n        x = 0\n")
                    .getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
        }

        @Test
        @DisplayName("不支持的赋值")
        void testUnsupportedAssignments() {
            assertThat(failure("def f():\n    a, b = 1, 2\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
            assertThat(failure("def f():\n    x = None\n").getKind())
                    .isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
        }

        @Test
        @DisplayName("调用语句的实参必须是单个引用")
        void testCallArgument() {
            LoweringException e = failure("def f(a: int, b: int):\n    print(a + b)\n");
            assertThat(e.getKind()).isEqualTo(LoweringException.Kind.UNSUPPORTED_CONSTRUCT);
        }

        @Test
        @DisplayName("错误消息包含位置")
        void testMessageLocation() {
            LoweringException e = failure("def f():\n    x = 1\n    x = None\n");
            assertThat(e.getLocation().getLine()).isEqualTo(3);
            assertThat(e.getMessage()).startsWith("Unsupported construct: ");
        }
    }
}
