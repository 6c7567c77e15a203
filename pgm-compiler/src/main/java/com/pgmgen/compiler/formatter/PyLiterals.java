package com.pgmgen.compiler.formatter;

import com.pgmgen.compiler.ast.expr.Literal;

import java.math.BigDecimal;

/**
 * 字面量的源码表示，与目标语言 repr 的输出保持一致
 */
public final class PyLiterals {

    private PyLiterals() {
    }

    /**
     * 字面量节点的源码文本
     */
    public static String repr(Literal literal) {
        switch (literal.getKind()) {
            case INT:
                return String.valueOf(literal.getValue());
            case FLOAT:
                return reprReal(((Number) literal.getValue()).doubleValue());
            case STRING:
                return reprString((String) literal.getValue());
            case BOOLEAN:
                return Boolean.TRUE.equals(literal.getValue()) ? "True" : "False";
            default:
                return "None";
        }
    }

    /**
     * 任意常量值的文本形式（字符串不加引号），用于字面量载荷
     */
    public static String str(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "True" : "False";
        }
        if (value instanceof Double || value instanceof Float) {
            return reprReal(((Number) value).doubleValue());
        }
        return String.valueOf(value);
    }

    /**
     * 实数：总带小数部分或指数，指数 < -4 或 >= 16 时使用科学计数法
     */
    public static String reprReal(double value) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (value == 0.0) {
            return (1.0 / value) < 0 ? "-0.0" : "0.0";
        }

        BigDecimal decimal = new BigDecimal(Double.toString(value)).stripTrailingZeros();
        String digits = decimal.unscaledValue().abs().toString();
        int exponent = digits.length() - decimal.scale() - 1;
        String sign = decimal.signum() < 0 ? "-" : "";

        if (exponent < -4 || exponent >= 16) {
            StringBuilder sb = new StringBuilder(sign);
            sb.append(digits.charAt(0));
            if (digits.length() > 1) {
                sb.append('.').append(digits, 1, digits.length());
            }
            sb.append('e').append(exponent < 0 ? '-' : '+');
            int absExp = Math.abs(exponent);
            if (absExp < 10) {
                sb.append('0');
            }
            sb.append(absExp);
            return sb.toString();
        }

        String plain = decimal.abs().toPlainString();
        if (plain.indexOf('.') < 0) {
            plain = plain + ".0";
        }
        return sign + plain;
    }

    /**
     * 字符串：默认单引号，仅当内容含单引号且不含双引号时改用双引号
     */
    public static String reprString(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                    break;
            }
        }
        sb.append(quote);
        return sb.toString();
    }
}
