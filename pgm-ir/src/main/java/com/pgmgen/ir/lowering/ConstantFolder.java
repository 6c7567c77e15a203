package com.pgmgen.ir.lowering;

import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.expr.CompareExpr.CompareOp;
import com.pgmgen.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.pgmgen.ir.pgm.Domain;
import com.pgmgen.ir.pgm.LiteralSource;

import java.math.BigInteger;

/**
 * 字面量常量折叠。
 *
 * <p>整数按 64 位精确运算，溢出、除零或非数值操作数时不折叠（返回 null），
 * 由调用方保留原来的来源列表。</p>
 */
public final class ConstantFolder {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private ConstantFolder() {
    }

    // ==================== 二元运算 ====================

    public static LiteralSource foldBinary(BinaryOp op, LiteralSource left, LiteralSource right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            return null;
        }
        if (left.getDomain() == Domain.INTEGER && right.getDomain() == Domain.INTEGER) {
            return foldInteger(op, (Long) left.getValue(), (Long) right.getValue());
        }
        return foldReal(op, toDouble(left), toDouble(right));
    }

    private static LiteralSource foldInteger(BinaryOp op, long l, long r) {
        try {
            switch (op) {
                case ADD: return integer(Math.addExact(l, r));
                case SUB: return integer(Math.subtractExact(l, r));
                case MUL: return integer(Math.multiplyExact(l, r));
                case DIV:
                    if (r == 0) return null;
                    return real((double) l / (double) r);
                case FLOOR_DIV:
                    if (r == 0 || (l == Long.MIN_VALUE && r == -1)) return null;
                    return integer(Math.floorDiv(l, r));
                case MOD:
                    if (r == 0) return null;
                    return integer(Math.floorMod(l, r));
                case POW:
                    return powInteger(l, r);
                default:
                    return null;
            }
        } catch (ArithmeticException e) {
            // 溢出
            return null;
        }
    }

    private static LiteralSource powInteger(long base, long exponent) {
        if (exponent < 0) {
            if (base == 0) return null;
            return real(Math.pow(base, exponent));
        }
        if (exponent > Integer.MAX_VALUE) {
            return null;
        }
        if (base == 0 || base == 1) {
            return integer(exponent == 0 ? 1 : base);
        }
        if (Math.abs(base) >= 2 && exponent > 64) {
            return null;
        }
        BigInteger result = BigInteger.valueOf(base).pow((int) exponent);
        if (result.compareTo(LONG_MIN) < 0 || result.compareTo(LONG_MAX) > 0) {
            return null;
        }
        return integer(result.longValue());
    }

    private static LiteralSource foldReal(BinaryOp op, double l, double r) {
        double result;
        switch (op) {
            case ADD: result = l + r; break;
            case SUB: result = l - r; break;
            case MUL: result = l * r; break;
            case DIV:
                if (r == 0.0) return null;
                result = l / r;
                break;
            case FLOOR_DIV:
                if (r == 0.0) return null;
                result = Math.floor(l / r);
                break;
            case MOD:
                if (r == 0.0) return null;
                result = l - r * Math.floor(l / r);
                break;
            case POW:
                if (l == 0.0 && r < 0) return null;
                result = Math.pow(l, r);
                break;
            default:
                return null;
        }
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            return null;
        }
        return real(result);
    }

    // ==================== 比较 ====================

    public static LiteralSource foldCompare(CompareOp op, LiteralSource left, LiteralSource right) {
        int cmp;
        if (isNumeric(left) && isNumeric(right)) {
            if (left.getDomain() == Domain.INTEGER && right.getDomain() == Domain.INTEGER) {
                cmp = Long.compare((Long) left.getValue(), (Long) right.getValue());
            } else {
                cmp = Double.compare(toDouble(left), toDouble(right));
            }
        } else if (left.getDomain() == Domain.STRING && right.getDomain() == Domain.STRING) {
            cmp = ((String) left.getValue()).compareTo((String) right.getValue());
        } else if (left.getDomain() == Domain.BOOLEAN && right.getDomain() == Domain.BOOLEAN) {
            if (op != CompareOp.EQ && op != CompareOp.NE) return null;
            cmp = left.getValue().equals(right.getValue()) ? 0 : 1;
        } else {
            return null;
        }
        switch (op) {
            case EQ: return bool(cmp == 0);
            case NE: return bool(cmp != 0);
            case LT: return bool(cmp < 0);
            case LE: return bool(cmp <= 0);
            case GT: return bool(cmp > 0);
            case GE: return bool(cmp >= 0);
            default: return null;
        }
    }

    // ==================== 一元运算 ====================

    public static LiteralSource foldUnary(UnaryOp op, LiteralSource operand) {
        switch (op) {
            case NOT:
                return bool(!isTruthy(operand));
            case POS:
                return isNumeric(operand) ? operand : null;
            case NEG:
                if (operand.getDomain() == Domain.INTEGER) {
                    long value = (Long) operand.getValue();
                    return value == Long.MIN_VALUE ? null : integer(-value);
                }
                if (operand.getDomain() == Domain.REAL) {
                    return real(-(Double) operand.getValue());
                }
                return null;
            default:
                return null;
        }
    }

    private static boolean isTruthy(LiteralSource literal) {
        Object value = literal.getValue();
        switch (literal.getDomain()) {
            case BOOLEAN: return (Boolean) value;
            case INTEGER: return (Long) value != 0L;
            case REAL: return (Double) value != 0.0;
            default: return !((String) value).isEmpty();
        }
    }

    // ==================== 辅助方法 ====================

    private static boolean isNumeric(LiteralSource literal) {
        return literal.getDomain() == Domain.INTEGER || literal.getDomain() == Domain.REAL;
    }

    private static double toDouble(LiteralSource literal) {
        return ((Number) literal.getValue()).doubleValue();
    }

    private static LiteralSource integer(long value) {
        return new LiteralSource(Domain.INTEGER, value);
    }

    private static LiteralSource real(double value) {
        return new LiteralSource(Domain.REAL, value);
    }

    private static LiteralSource bool(boolean value) {
        return new LiteralSource(Domain.BOOLEAN, value);
    }
}
