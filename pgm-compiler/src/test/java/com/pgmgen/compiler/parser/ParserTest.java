package com.pgmgen.compiler.parser;

import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.stmt.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Module parse(String source) {
        return Parser.parse(source, "test.py");
    }

    private Statement single(String source) {
        List<Statement> body = parse(source).getBody();
        assertEquals(1, body.size(), "Expected single statement from: " + source);
        return body.get(0);
    }

    private Expression value(String source) {
        Statement stmt = single(source);
        assertInstanceOf(Assign.class, stmt);
        return ((Assign) stmt).getValue();
    }

    @Nested
    @DisplayName("函数定义")
    class FunctionDefTests {

        @Test
        @DisplayName("带注解参数与返回类型")
        void testAnnotatedParameters() {
            FunctionDef def = (FunctionDef) single("def add(a: int, b: float) -> float:\n    c = a + b\n");
            assertEquals("add", def.getName());
            assertEquals(2, def.getParams().size());
            Parameter b = def.getParams().get(1);
            assertEquals("b", b.getName());
            assertTrue(b.hasAnnotation());
            assertEquals("float", ((Name) b.getAnnotation()).getId());
            assertEquals("float", ((Name) def.getReturns()).getId());
            assertEquals(1, def.getBody().size());
            assertEquals(1, def.getLine());
        }

        @Test
        @DisplayName("未注解参数与默认值")
        void testUnannotatedParameter() {
            FunctionDef def = (FunctionDef) single("def f(x, y=1, *args, **kw):\n    pass\n");
            assertEquals(2, def.getParams().size());
            assertFalse(def.getParams().get(0).hasAnnotation());
            assertEquals("y", def.getParams().get(1).getName());
        }

        @Test
        @DisplayName("单行函数体")
        void testInlineSuite() {
            FunctionDef def = (FunctionDef) single("def f(): x = 1; y = 2\n");
            assertEquals(2, def.getBody().size());
        }

        @Test
        @DisplayName("装饰器整体记为不支持")
        void testDecorated() {
            Statement stmt = single("@cache\ndef f():\n    x = 1\n");
            assertEquals("Decorated", ((UnsupportedStmt) stmt).getKind());
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("elif 展开为 else 中的嵌套 if")
        void testElifChain() {
            IfStmt stmt = (IfStmt) single("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n");
            assertEquals(1, stmt.getOrElse().size());
            IfStmt nested = (IfStmt) stmt.getOrElse().get(0);
            assertEquals("b", ((Name) nested.getTest()).getId());
            assertTrue(nested.hasElse());
        }

        @Test
        @DisplayName("for 循环目标与可迭代对象")
        void testForRange() {
            ForStmt stmt = (ForStmt) single("for i in range(0, n):\n    s = s + i\n");
            assertEquals("i", ((Name) stmt.getTarget()).getId());
            CallExpr iter = (CallExpr) stmt.getIter();
            assertEquals("range", ((Name) iter.getCallee()).getId());
            assertEquals(2, iter.getArgs().size());
            assertFalse(stmt.hasElse());
        }

        @Test
        @DisplayName("多个循环变量解析为元组")
        void testTupleTarget() {
            ForStmt stmt = (ForStmt) single("for i, j in pairs:\n    x = i\n");
            assertInstanceOf(TupleExpr.class, stmt.getTarget());
            assertEquals(2, ((TupleExpr) stmt.getTarget()).getElements().size());
        }

        @Test
        @DisplayName("for/else")
        void testForElse() {
            ForStmt stmt = (ForStmt) single("for i in range(0, 3):\n    x = i\nelse:\n    x = 0\n");
            assertTrue(stmt.hasElse());
        }

        @Test
        @DisplayName("不支持的复合语句整体跳过")
        void testUnsupportedCompound() {
            List<Statement> body = parse("while x:\n    x = x - 1\nelse:\n    y = 1\nz = 2\n").getBody();
            assertEquals(2, body.size());
            assertEquals("While", ((UnsupportedStmt) body.get(0)).getKind());
            assertInstanceOf(Assign.class, body.get(1));
        }

        @Test
        @DisplayName("不支持的简单语句")
        void testUnsupportedSimple() {
            List<Statement> body = parse("def f():\n    return x\n    pass\n").getBody();
            List<Statement> fnBody = ((FunctionDef) body.get(0)).getBody();
            assertEquals("Return", ((UnsupportedStmt) fnBody.get(0)).getKind());
            assertEquals("Pass", ((UnsupportedStmt) fnBody.get(1)).getKind());
        }
    }

    @Nested
    @DisplayName("赋值")
    class AssignmentTests {

        @Test
        @DisplayName("链式赋值")
        void testChainedAssign() {
            Assign assign = (Assign) single("a = b = 1\n");
            assertEquals(2, assign.getTargets().size());
            assertInstanceOf(Literal.class, assign.getValue());
        }

        @Test
        @DisplayName("带注解赋值，有无初值")
        void testAnnAssign() {
            AnnAssign withValue = (AnnAssign) single("x: int = 5\n");
            assertTrue(withValue.hasValue());
            assertEquals("int", ((Name) withValue.getAnnotation()).getId());

            AnnAssign declaration = (AnnAssign) single("xs: List[float]\n");
            assertFalse(declaration.hasValue());
            assertInstanceOf(SubscriptExpr.class, declaration.getAnnotation());
        }

        @Test
        @DisplayName("复合赋值")
        void testAugAssign() {
            AugAssign aug = (AugAssign) single("s //= 2\n");
            assertEquals(BinaryOp.FLOOR_DIV, aug.getOperator());
            assertEquals("s", ((Name) aug.getTarget()).getId());
        }

        @Test
        @DisplayName("位运算复合赋值不支持")
        void testBitwiseAugAssign() {
            assertEquals("AugAssign", ((UnsupportedStmt) single("x |= 1\n")).getKind());
        }

        @Test
        @DisplayName("数组元素赋值")
        void testSubscriptTarget() {
            Assign assign = (Assign) single("a[0] = 1.5\n");
            SubscriptExpr target = (SubscriptExpr) assign.getTargets().get(0);
            assertEquals("a", ((Name) target.getValue()).getId());
            assertEquals(0L, ((Literal) target.getIndex()).getValue());
        }
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("乘法优先于加法")
        void testPrecedence() {
            BinaryExpr expr = (BinaryExpr) value("x = 1 + 2 * 3\n");
            assertEquals(BinaryOp.ADD, expr.getOperator());
            assertEquals(BinaryOp.MUL, ((BinaryExpr) expr.getRight()).getOperator());
        }

        @Test
        @DisplayName("幂运算高于一元负号且右结合")
        void testPower() {
            UnaryExpr neg = (UnaryExpr) value("x = -2 ** 3 ** 2\n");
            assertEquals(UnaryExpr.UnaryOp.NEG, neg.getOperator());
            BinaryExpr pow = (BinaryExpr) neg.getOperand();
            assertEquals(BinaryOp.POW, pow.getOperator());
            assertInstanceOf(BinaryExpr.class, pow.getRight());
        }

        @Test
        @DisplayName("布尔运算与比较")
        void testBoolOpAndCompare() {
            BoolOpExpr expr = (BoolOpExpr) value("x = a < b and not c or d\n");
            assertEquals(BoolOpExpr.BoolOp.OR, expr.getOperator());
            BoolOpExpr and = (BoolOpExpr) expr.getValues().get(0);
            assertInstanceOf(CompareExpr.class, and.getValues().get(0));
            assertInstanceOf(UnaryExpr.class, and.getValues().get(1));
        }

        @Test
        @DisplayName("链式比较")
        void testChainedCompare() {
            CompareExpr expr = (CompareExpr) value("x = 0 <= i < n\n");
            assertEquals(2, expr.getOperators().size());
            assertEquals(CompareExpr.CompareOp.LE, expr.getOperators().get(0));
        }

        @Test
        @DisplayName("模块函数调用")
        void testAttributeCall() {
            CallExpr call = (CallExpr) value("y = math.sqrt(x)\n");
            assertEquals("math.sqrt", ((AttributeExpr) call.getCallee()).getQualifiedName());
        }

        @Test
        @DisplayName("相邻字符串拼接")
        void testStringConcatenation() {
            assertEquals("ab", ((Literal) value("s = 'a' \"b\"\n")).getValue());
        }

        @Test
        @DisplayName("列表与元组")
        void testListAndTuple() {
            assertEquals(3, ((ListExpr) value("xs = [1, 2, 3]\n")).getElements().size());
            TupleExpr tuple = (TupleExpr) value("t = 1, 2\n");
            assertFalse(tuple.isParenthesized());
            assertTrue(((TupleExpr) value("t = (1,)\n")).isParenthesized());
        }

        @Test
        @DisplayName("不支持的表达式保留种类和源码")
        void testUnsupportedExpressions() {
            UnsupportedExpr lambda = (UnsupportedExpr) value("f = lambda x: x + 1\n");
            assertEquals("Lambda", lambda.getKind());
            assertEquals("lambda x: x + 1", lambda.getSourceText());

            CallExpr call = (CallExpr) value("y = f(x, key=1)\n");
            assertEquals("keyword", ((UnsupportedExpr) call.getArgs().get(1)).getKind());

            assertEquals("Dict", ((UnsupportedExpr) value("d = {1: 2}\n")).getKind());
            assertEquals("IfExp", ((UnsupportedExpr) value("y = a if c else b\n")).getKind());
            assertEquals("ListComp", ((UnsupportedExpr) value("ys = [x for x in xs]\n")).getKind());
            SubscriptExpr slice = (SubscriptExpr) value("ys = xs[1:2]\n");
            assertEquals("Slice", ((UnsupportedExpr) slice.getIndex()).getKind());
        }
    }

    @Nested
    @DisplayName("导入")
    class ImportTests {

        @Test
        @DisplayName("import 与 from import")
        void testImports() {
            List<Statement> body = parse("import math, os.path as p\nfrom typing import List, Dict\n").getBody();
            ImportStmt plain = (ImportStmt) body.get(0);
            assertFalse(plain.isFromImport());
            assertEquals(Arrays.asList("math", "os.path"), plain.getNames());
            ImportStmt from = (ImportStmt) body.get(1);
            assertEquals("typing", from.getModule());
            assertEquals("ImportFrom", from.getKindName());
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少冒号")
        void testMissingColon() {
            ParseException e = assertThrows(ParseException.class, () -> parse("def f()\n    x = 1\n"));
            assertTrue(e.getMessage().startsWith("Expected ':'"));
            assertEquals(1, e.getToken().getLine());
            assertEquals(com.pgmgen.compiler.lexer.TokenType.COLON, e.getExpectedType());
        }

        @Test
        @DisplayName("词法错误作为解析异常报告")
        void testLexicalError() {
            ParseException e = assertThrows(ParseException.class, () -> parse("x = 'abc\n"));
            assertTrue(e.getMessage().contains("Unterminated string"));
        }

        @Test
        @DisplayName("意外缩进")
        void testUnexpectedIndent() {
            assertThrows(ParseException.class, () -> parse("x = 1\n    y = 2\n"));
        }
    }
}
