package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.expr.CompareExpr.CompareOp;
import com.pgmgen.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.pgmgen.ir.pgm.Domain;
import com.pgmgen.ir.pgm.LiteralSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 常量折叠测试
 */
class ConstantFolderTest {

    private static LiteralSource i(long value) {
        return new LiteralSource(Domain.INTEGER, value);
    }

    private static LiteralSource r(double value) {
        return new LiteralSource(Domain.REAL, value);
    }

    private static LiteralSource s(String value) {
        return new LiteralSource(Domain.STRING, value);
    }

    private static LiteralSource b(boolean value) {
        return new LiteralSource(Domain.BOOLEAN, value);
    }

    @Nested
    @DisplayName("整数运算")
    class IntegerTests {

        @Test
        @DisplayName("加减乘保持整数")
        void testBasicArithmetic() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.ADD, i(10), i(1))).isEqualTo(i(11));
            assertThat(ConstantFolder.foldBinary(BinaryOp.SUB, i(2), i(5))).isEqualTo(i(-3));
            assertThat(ConstantFolder.foldBinary(BinaryOp.MUL, i(6), i(7))).isEqualTo(i(42));
        }

        @Test
        @DisplayName("真除法总是实数")
        void testTrueDivision() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.DIV, i(7), i(2))).isEqualTo(r(3.5));
            assertThat(ConstantFolder.foldBinary(BinaryOp.DIV, i(4), i(2))).isEqualTo(r(2.0));
        }

        @Test
        @DisplayName("整除与取模向负无穷取整")
        void testFloorSemantics() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.FLOOR_DIV, i(-7), i(2))).isEqualTo(i(-4));
            assertThat(ConstantFolder.foldBinary(BinaryOp.MOD, i(-7), i(2))).isEqualTo(i(1));
            assertThat(ConstantFolder.foldBinary(BinaryOp.MOD, i(7), i(-2))).isEqualTo(i(-1));
        }

        @Test
        @DisplayName("幂运算")
        void testPower() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.POW, i(2), i(10))).isEqualTo(i(1024));
            assertThat(ConstantFolder.foldBinary(BinaryOp.POW, i(2), i(-1))).isEqualTo(r(0.5));
            assertThat(ConstantFolder.foldBinary(BinaryOp.POW, i(5), i(0))).isEqualTo(i(1));
        }

        @Test
        @DisplayName("除零与溢出不折叠")
        void testNotFoldable() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.DIV, i(1), i(0))).isNull();
            assertThat(ConstantFolder.foldBinary(BinaryOp.MOD, i(1), i(0))).isNull();
            assertThat(ConstantFolder.foldBinary(BinaryOp.MUL, i(Long.MAX_VALUE), i(2))).isNull();
            assertThat(ConstantFolder.foldBinary(BinaryOp.POW, i(2), i(64))).isNull();
        }
    }

    @Nested
    @DisplayName("实数与混合运算")
    class RealTests {

        @Test
        @DisplayName("整数与实数混合得到实数")
        void testMixed() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.ADD, i(1), r(0.5))).isEqualTo(r(1.5));
            assertThat(ConstantFolder.foldBinary(BinaryOp.MUL, r(2.0), i(3))).isEqualTo(r(6.0));
        }

        @Test
        @DisplayName("实数整除与取模")
        void testRealFloor() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.FLOOR_DIV, r(7.5), i(2))).isEqualTo(r(3.0));
            assertThat(ConstantFolder.foldBinary(BinaryOp.MOD, r(-1.5), i(1))).isEqualTo(r(0.5));
        }

        @Test
        @DisplayName("非数值操作数不折叠")
        void testNonNumeric() {
            assertThat(ConstantFolder.foldBinary(BinaryOp.ADD, s("a"), s("b"))).isNull();
            assertThat(ConstantFolder.foldBinary(BinaryOp.ADD, b(true), i(1))).isNull();
            assertThat(ConstantFolder.foldBinary(BinaryOp.DIV, r(1.0), r(0.0))).isNull();
        }
    }

    @Nested
    @DisplayName("比较与一元运算")
    class CompareAndUnaryTests {

        @Test
        @DisplayName("数值比较")
        void testNumericCompare() {
            assertThat(ConstantFolder.foldCompare(CompareOp.LE, i(1), i(2))).isEqualTo(b(true));
            assertThat(ConstantFolder.foldCompare(CompareOp.GT, i(1), r(0.5))).isEqualTo(b(true));
            assertThat(ConstantFolder.foldCompare(CompareOp.EQ, i(1), r(1.0))).isEqualTo(b(true));
        }

        @Test
        @DisplayName("字符串与布尔比较")
        void testOtherCompare() {
            assertThat(ConstantFolder.foldCompare(CompareOp.LT, s("a"), s("b"))).isEqualTo(b(true));
            assertThat(ConstantFolder.foldCompare(CompareOp.NE, b(true), b(false))).isEqualTo(b(true));
            assertThat(ConstantFolder.foldCompare(CompareOp.LT, b(true), b(false))).isNull();
            assertThat(ConstantFolder.foldCompare(CompareOp.IN, s("a"), s("abc"))).isNull();
            assertThat(ConstantFolder.foldCompare(CompareOp.EQ, s("1"), i(1))).isNull();
        }

        @Test
        @DisplayName("一元运算")
        void testUnary() {
            assertThat(ConstantFolder.foldUnary(UnaryOp.NEG, i(3))).isEqualTo(i(-3));
            assertThat(ConstantFolder.foldUnary(UnaryOp.NEG, r(1.5))).isEqualTo(r(-1.5));
            assertThat(ConstantFolder.foldUnary(UnaryOp.POS, i(3))).isEqualTo(i(3));
            assertThat(ConstantFolder.foldUnary(UnaryOp.NOT, i(0))).isEqualTo(b(true));
            assertThat(ConstantFolder.foldUnary(UnaryOp.NOT, s("x"))).isEqualTo(b(false));
            assertThat(ConstantFolder.foldUnary(UnaryOp.NEG, s("x"))).isNull();
        }
    }
}
