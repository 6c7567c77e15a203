package com.pgmgen.compiler.parser;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.expr.*;
import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.expr.BoolOpExpr.BoolOp;
import com.pgmgen.compiler.ast.expr.CompareExpr.CompareOp;
import com.pgmgen.compiler.ast.expr.Literal.LiteralKind;
import com.pgmgen.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.pgmgen.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.pgmgen.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 逗号分隔的表达式列表（赋值右侧、表达式语句、for 的可迭代对象）。
     * 出现逗号时生成无括号元组。
     */
    Expression parseExpressionList() {
        SourceLocation loc = parser.location();
        Expression first = parseStarOrTest();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (!startsExpression()) {
                break;
            }
            elements.add(parseStarOrTest());
        }
        return new TupleExpr(loc, elements, false);
    }

    /**
     * for 循环目标列表。不能使用 {@link #parseTest()}，否则 {@code in} 会被当作比较运算符。
     */
    Expression parseTargetList() {
        SourceLocation loc = parser.location();
        Expression first = parseStarOrBitOr();
        if (!parser.check(COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(KW_IN)) {
                break;
            }
            elements.add(parseStarOrBitOr());
        }
        return new TupleExpr(loc, elements, false);
    }

    /**
     * 允许海象运算符的表达式（if 条件、装饰器）
     */
    Expression parseNamedTest() {
        Token start = parser.current;
        Expression expr = parseTest();
        if (parser.match(WALRUS)) {
            parseTest();
            return unsupported(start, "NamedExpr");
        }
        return expr;
    }

    Expression parseTest() {
        Token start = parser.current;
        if (parser.match(KW_LAMBDA)) {
            parser.skipUntil(COLON);
            parser.expect(COLON, "Expected ':' in lambda");
            parseTest();
            return unsupported(start, "Lambda");
        }
        Expression expr = parseOrTest();
        if (parser.match(KW_IF)) {
            parseOrTest();
            parser.expect(KW_ELSE, "Expected 'else' in conditional expression");
            parseTest();
            return unsupported(start, "IfExp");
        }
        return expr;
    }

    private Expression parseStarOrTest() {
        Token start = parser.current;
        if (parser.match(STAR)) {
            parseBitOr();
            return unsupported(start, "Starred");
        }
        return parseTest();
    }

    private Expression parseStarOrBitOr() {
        Token start = parser.current;
        if (parser.match(STAR)) {
            parseBitOr();
            return unsupported(start, "Starred");
        }
        return parseBitOr();
    }

    // ============ 布尔运算 ============

    private Expression parseOrTest() {
        SourceLocation loc = parser.location();
        Expression first = parseAndTest();
        if (!parser.check(KW_OR)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_OR)) {
            values.add(parseAndTest());
        }
        return new BoolOpExpr(loc, BoolOp.OR, values);
    }

    private Expression parseAndTest() {
        SourceLocation loc = parser.location();
        Expression first = parseNotTest();
        if (!parser.check(KW_AND)) {
            return first;
        }
        List<Expression> values = new ArrayList<Expression>();
        values.add(first);
        while (parser.match(KW_AND)) {
            values.add(parseNotTest());
        }
        return new BoolOpExpr(loc, BoolOp.AND, values);
    }

    private Expression parseNotTest() {
        if (parser.check(KW_NOT)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new UnaryExpr(loc, UnaryOp.NOT, parseNotTest());
        }
        return parseComparison();
    }

    // ============ 比较 ============

    private Expression parseComparison() {
        SourceLocation loc = parser.location();
        Expression left = parseBitOr();
        List<CompareOp> ops = new ArrayList<CompareOp>();
        List<Expression> comparators = new ArrayList<Expression>();
        CompareOp op;
        while ((op = matchCompareOp()) != null) {
            ops.add(op);
            comparators.add(parseBitOr());
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new CompareExpr(loc, left, ops, comparators);
    }

    private CompareOp matchCompareOp() {
        switch (parser.current.getType()) {
            case EQ: parser.advance(); return CompareOp.EQ;
            case NE: parser.advance(); return CompareOp.NE;
            case LT: parser.advance(); return CompareOp.LT;
            case LE: parser.advance(); return CompareOp.LE;
            case GT: parser.advance(); return CompareOp.GT;
            case GE: parser.advance(); return CompareOp.GE;
            case KW_IN: parser.advance(); return CompareOp.IN;
            case KW_IS:
                parser.advance();
                return parser.match(KW_NOT) ? CompareOp.IS_NOT : CompareOp.IS;
            case KW_NOT:
                if (parser.peek().is(KW_IN)) {
                    parser.advance();
                    parser.advance();
                    return CompareOp.NOT_IN;
                }
                return null;
            default:
                return null;
        }
    }

    // ============ 位运算（不支持，整体记录为 BitOp） ============

    private Expression parseBitOr() {
        Token start = parser.current;
        Expression left = parseArith();
        boolean bitwise = false;
        while (parser.matchAny(PIPE, CARET, AMP, LSHIFT, RSHIFT)) {
            parseArith();
            bitwise = true;
        }
        return bitwise ? unsupported(start, "BitOp") : left;
    }

    // ============ 算术 ============

    private Expression parseArith() {
        Expression left = parseTerm();
        while (parser.checkAny(PLUS, MINUS)) {
            BinaryOp op = parser.advance().is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB;
            Expression right = parseTerm();
            left = new BinaryExpr(left.getLocation(), left, op, right);
        }
        return left;
    }

    private Expression parseTerm() {
        Token start = parser.current;
        Expression left = parseFactor();
        while (parser.checkAny(STAR, SLASH, DOUBLE_SLASH, PERCENT, AT)) {
            Token opToken = parser.advance();
            Expression right = parseFactor();
            BinaryOp op;
            switch (opToken.getType()) {
                case STAR: op = BinaryOp.MUL; break;
                case SLASH: op = BinaryOp.DIV; break;
                case DOUBLE_SLASH: op = BinaryOp.FLOOR_DIV; break;
                case PERCENT: op = BinaryOp.MOD; break;
                default:
                    left = unsupported(start, "MatMult");
                    continue;
            }
            left = new BinaryExpr(left.getLocation(), left, op, right);
        }
        return left;
    }

    private Expression parseFactor() {
        Token start = parser.current;
        SourceLocation loc = parser.location();
        if (parser.match(MINUS)) {
            return new UnaryExpr(loc, UnaryOp.NEG, parseFactor());
        }
        if (parser.match(PLUS)) {
            return new UnaryExpr(loc, UnaryOp.POS, parseFactor());
        }
        if (parser.match(TILDE)) {
            parseFactor();
            return unsupported(start, "Invert");
        }
        return parsePower();
    }

    private Expression parsePower() {
        Token start = parser.current;
        if (parser.match(KW_AWAIT)) {
            parsePower();
            return unsupported(start, "Await");
        }
        Expression base = parseAtomExpr();
        if (parser.match(DOUBLE_STAR)) {
            // 右结合，且优先级高于左侧一元运算符
            Expression exponent = parseFactor();
            return new BinaryExpr(base.getLocation(), base, BinaryOp.POW, exponent);
        }
        return base;
    }

    // ============ 后缀：调用、属性、下标 ============

    private Expression parseAtomExpr() {
        Expression expr = parseAtom();
        while (true) {
            if (parser.match(LPAREN)) {
                expr = finishCall(expr);
            } else if (parser.match(LBRACKET)) {
                expr = finishSubscript(expr);
            } else if (parser.match(DOT)) {
                String attr = parser.expect(NAME, "Expected attribute name after '.'").getLexeme();
                expr = new AttributeExpr(expr.getLocation(), expr, attr);
            } else {
                return expr;
            }
        }
    }

    private Expression finishCall(Expression callee) {
        List<Expression> args = new ArrayList<Expression>();
        while (!parser.check(RPAREN)) {
            args.add(parseArgument());
            if (parser.check(KW_FOR) || parser.check(KW_ASYNC)) {
                // 生成器实参 f(x for x in xs)
                Token start = parser.current;
                parser.skipUntil(RPAREN);
                args.set(args.size() - 1, unsupported(start, "GeneratorExp"));
            }
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expect(RPAREN, "Expected ')' after arguments");
        return new CallExpr(callee.getLocation(), callee, args);
    }

    private Expression parseArgument() {
        Token start = parser.current;
        if (parser.match(STAR)) {
            parseTest();
            return unsupported(start, "Starred");
        }
        if (parser.match(DOUBLE_STAR)) {
            parseTest();
            return unsupported(start, "DoubleStarred");
        }
        if (parser.check(NAME) && parser.peek().is(ASSIGN)) {
            parser.advance();
            parser.advance();
            parseTest();
            return unsupported(start, "keyword");
        }
        return parseNamedTest();
    }

    private Expression finishSubscript(Expression value) {
        Token start = parser.current;
        Expression index;
        if (parser.check(COLON)) {
            parser.skipUntil(RBRACKET);
            index = unsupported(start, "Slice");
        } else {
            index = parseExpressionList();
            if (parser.check(COLON)) {
                parser.skipUntil(RBRACKET);
                index = unsupported(start, "Slice");
            }
        }
        parser.expect(RBRACKET, "Expected ']' after subscript");
        return new SubscriptExpr(value.getLocation(), value, index);
    }

    // ============ 原子 ============

    private Expression parseAtom() {
        Token start = parser.current;
        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case NAME:
                return new Name(loc, parser.advance().getLexeme());
            case INT_LITERAL:
                return new Literal(loc, parser.advance().getLiteral(), LiteralKind.INT);
            case FLOAT_LITERAL:
                return new Literal(loc, parser.advance().getLiteral(), LiteralKind.FLOAT);
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, LiteralKind.BOOLEAN);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, LiteralKind.BOOLEAN);
            case KW_NONE:
                parser.advance();
                return new Literal(loc, null, LiteralKind.NONE);
            case STRING_LITERAL:
            case BYTES_LITERAL:
            case FORMATTED_STRING:
                return parseStrings(start, loc);
            case IMAGINARY_LITERAL:
                parser.advance();
                return unsupported(start, "Complex");
            case ELLIPSIS:
                parser.advance();
                return unsupported(start, "Ellipsis");
            case LPAREN:
                return parseParenthesized(start, loc);
            case LBRACKET:
                return parseListDisplay(start, loc);
            case LBRACE:
                parser.advance();
                parser.skipUntil(RBRACE);
                parser.expect(RBRACE, "Expected '}'");
                return unsupported(start, "Dict");
            default:
                throw new ParseException("Expected expression", parser.current);
        }
    }

    /**
     * 相邻字符串字面量拼接为一个
     */
    private Expression parseStrings(Token start, SourceLocation loc) {
        StringBuilder value = new StringBuilder();
        boolean bytes = false;
        boolean formatted = false;
        while (parser.checkAny(STRING_LITERAL, BYTES_LITERAL, FORMATTED_STRING)) {
            Token token = parser.advance();
            bytes |= token.is(BYTES_LITERAL);
            formatted |= token.is(FORMATTED_STRING);
            value.append((String) token.getLiteral());
        }
        if (formatted) {
            return unsupported(start, "JoinedStr");
        }
        if (bytes) {
            return unsupported(start, "Bytes");
        }
        return new Literal(loc, value.toString(), LiteralKind.STRING);
    }

    private Expression parseParenthesized(Token start, SourceLocation loc) {
        parser.expect(LPAREN, "Expected '('");
        if (parser.match(RPAREN)) {
            return new TupleExpr(loc, new ArrayList<Expression>(), true);
        }
        if (parser.check(KW_YIELD)) {
            parser.skipUntil(RPAREN);
            parser.expect(RPAREN, "Expected ')'");
            return unsupported(start, "Yield");
        }
        Expression first = parseStarOrNamedTest();
        if (parser.check(KW_FOR) || parser.check(KW_ASYNC)) {
            parser.skipUntil(RPAREN);
            parser.expect(RPAREN, "Expected ')'");
            return unsupported(start, "GeneratorExp");
        }
        if (parser.match(RPAREN)) {
            return first;
        }
        List<Expression> elements = new ArrayList<Expression>();
        elements.add(first);
        while (parser.match(COMMA)) {
            if (parser.check(RPAREN)) {
                break;
            }
            elements.add(parseStarOrNamedTest());
        }
        parser.expect(RPAREN, "Expected ')'");
        return new TupleExpr(loc, elements, true);
    }

    private Expression parseListDisplay(Token start, SourceLocation loc) {
        parser.expect(LBRACKET, "Expected '['");
        List<Expression> elements = new ArrayList<Expression>();
        if (parser.match(RBRACKET)) {
            return new ListExpr(loc, elements);
        }
        elements.add(parseStarOrNamedTest());
        if (parser.check(KW_FOR) || parser.check(KW_ASYNC)) {
            parser.skipUntil(RBRACKET);
            parser.expect(RBRACKET, "Expected ']'");
            return unsupported(start, "ListComp");
        }
        while (parser.match(COMMA)) {
            if (parser.check(RBRACKET)) {
                break;
            }
            elements.add(parseStarOrNamedTest());
        }
        parser.expect(RBRACKET, "Expected ']'");
        return new ListExpr(loc, elements);
    }

    private Expression parseStarOrNamedTest() {
        if (parser.check(STAR)) {
            return parseStarOrTest();
        }
        return parseNamedTest();
    }

    // ============ 辅助方法 ============

    private boolean startsExpression() {
        return !parser.checkAny(NEWLINE, SEMICOLON, EOF, ASSIGN, COLON, RPAREN, RBRACKET, RBRACE,
                PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, DOUBLE_SLASH_ASSIGN,
                PERCENT_ASSIGN, DOUBLE_STAR_ASSIGN, OTHER_ASSIGN);
    }

    private Expression unsupported(Token start, String kind) {
        return new UnsupportedExpr(parser.locationOf(start), kind, parser.sourceTextFrom(start));
    }
}
