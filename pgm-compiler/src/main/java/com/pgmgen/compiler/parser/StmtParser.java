package com.pgmgen.compiler.parser;

import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgmgen.compiler.ast.expr.Expression;
import com.pgmgen.compiler.ast.stmt.*;
import com.pgmgen.compiler.lexer.Token;
import com.pgmgen.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pgmgen.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    /**
     * 解析一条语句行。一行简单语句可以用分号分隔出多条语句，因此结果追加到 out。
     */
    void parseStatementInto(List<Statement> out) {
        parser.skipNewlines();

        if (parser.check(KW_DEF)) {
            out.add(parseFunctionDef());
            return;
        }
        if (parser.check(KW_IF)) {
            out.add(parseIfStmt());
            return;
        }
        if (parser.check(KW_FOR)) {
            out.add(parseForStmt());
            return;
        }
        if (parser.check(AT)) {
            out.add(parseDecorated());
            return;
        }
        if (parser.check(KW_WHILE)) {
            out.add(parseUnsupportedCompound("While", KW_ELSE));
            return;
        }
        if (parser.check(KW_CLASS)) {
            out.add(parseUnsupportedCompound("ClassDef"));
            return;
        }
        if (parser.check(KW_TRY)) {
            out.add(parseUnsupportedCompound("Try", KW_EXCEPT, KW_ELSE, KW_FINALLY));
            return;
        }
        if (parser.check(KW_WITH)) {
            out.add(parseUnsupportedCompound("With"));
            return;
        }
        if (parser.check(KW_ASYNC)) {
            out.add(parseUnsupportedCompound("Async"));
            return;
        }
        parseSimpleStatements(out);
    }

    /**
     * 解析语句块：冒号后的缩进块，或同一行上的简单语句
     */
    List<Statement> parseSuite() {
        parser.expect(COLON, "Expected ':'");
        List<Statement> body = new ArrayList<Statement>();
        if (parser.match(NEWLINE)) {
            parser.skipNewlines();
            parser.expect(INDENT, "Expected an indented block");
            while (!parser.check(DEDENT) && !parser.isAtEnd()) {
                parseStatementInto(body);
                parser.skipNewlines();
            }
            parser.expect(DEDENT, "Expected dedent");
        } else {
            parseSimpleStatements(body);
        }
        return body;
    }

    // ============ 复合语句 ============

    private FunctionDef parseFunctionDef() {
        SourceLocation loc = parser.location();
        parser.expect(KW_DEF, "Expected 'def'");
        String name = parser.expect(NAME, "Expected function name").getLexeme();
        parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = parseParameters();
        parser.expect(RPAREN, "Expected ')' after parameters");

        Expression returns = null;
        if (parser.match(ARROW)) {
            returns = parser.exprParser.parseTest();
        }
        List<Statement> body = parseSuite();
        return new FunctionDef(loc, name, params, returns, body);
    }

    /**
     * 参数列表。默认值、{@code *args}、{@code **kwargs} 与位置分隔符不参与翻译，解析后丢弃。
     */
    private List<Parameter> parseParameters() {
        List<Parameter> params = new ArrayList<Parameter>();
        while (!parser.check(RPAREN) && !parser.isAtEnd()) {
            if (parser.matchAny(STAR, DOUBLE_STAR)) {
                if (parser.check(NAME)) {
                    parser.advance();
                    if (parser.match(COLON)) {
                        parser.exprParser.parseTest();
                    }
                }
            } else if (parser.match(SLASH)) {
                // 仅位置参数分隔符
            } else {
                Token nameToken = parser.expect(NAME, "Expected parameter name");
                Expression annotation = null;
                if (parser.match(COLON)) {
                    annotation = parser.exprParser.parseTest();
                }
                if (parser.match(ASSIGN)) {
                    parser.exprParser.parseTest();
                }
                params.add(new Parameter(parser.locationOf(nameToken), nameToken.getLexeme(), annotation));
            }
            if (!parser.match(COMMA)) {
                break;
            }
        }
        return params;
    }

    private IfStmt parseIfStmt() {
        SourceLocation loc = parser.location();
        parser.advance();  // if / elif
        Expression test = parser.exprParser.parseNamedTest();
        List<Statement> body = parseSuite();

        List<Statement> orElse;
        if (parser.check(KW_ELIF)) {
            // elif 链展开为 else 分支中的嵌套 if
            orElse = Collections.<Statement>singletonList(parseIfStmt());
        } else if (parser.match(KW_ELSE)) {
            orElse = parseSuite();
        } else {
            orElse = Collections.emptyList();
        }
        return new IfStmt(loc, test, body, orElse);
    }

    private ForStmt parseForStmt() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FOR, "Expected 'for'");
        Expression target = parser.exprParser.parseTargetList();
        parser.expect(KW_IN, "Expected 'in' in for statement");
        Expression iter = parser.exprParser.parseExpressionList();
        List<Statement> body = parseSuite();

        List<Statement> orElse = Collections.emptyList();
        if (parser.match(KW_ELSE)) {
            orElse = parseSuite();
        }
        return new ForStmt(loc, target, iter, body, orElse);
    }

    private Statement parseDecorated() {
        SourceLocation loc = parser.location();
        while (parser.match(AT)) {
            parser.exprParser.parseNamedTest();
            parser.expect(NEWLINE, "Expected newline after decorator");
            parser.skipNewlines();
        }
        if (parser.check(KW_DEF) || parser.check(KW_CLASS) || parser.check(KW_ASYNC)) {
            List<Statement> ignored = new ArrayList<Statement>();
            parseStatementInto(ignored);
            return new UnsupportedStmt(loc, "Decorated");
        }
        throw new ParseException("Expected function or class after decorator", parser.current);
    }

    /**
     * 跳过不支持的复合语句（头部与所有子块），continuations 为可跟随的子句关键词
     */
    private Statement parseUnsupportedCompound(String kind, TokenType... continuations) {
        SourceLocation loc = parser.location();
        skipClause();
        while (parser.checkAny(continuations)) {
            skipClause();
        }
        return new UnsupportedStmt(loc, kind);
    }

    private void skipClause() {
        parser.skipUntil(NEWLINE);
        parser.expect(NEWLINE, "Expected newline");
        if (parser.match(INDENT)) {
            int depth = 1;
            while (depth > 0 && !parser.isAtEnd()) {
                if (parser.check(INDENT)) {
                    depth++;
                } else if (parser.check(DEDENT)) {
                    depth--;
                }
                parser.advance();
            }
        }
        parser.skipNewlines();
    }

    // ============ 简单语句 ============

    private void parseSimpleStatements(List<Statement> out) {
        out.add(parseSmallStatement());
        while (parser.match(SEMICOLON)) {
            if (parser.checkAny(NEWLINE, EOF)) {
                break;
            }
            out.add(parseSmallStatement());
        }
        if (!parser.isAtEnd()) {
            parser.expect(NEWLINE, "Expected end of statement");
        }
    }

    private Statement parseSmallStatement() {
        SourceLocation loc = parser.location();
        switch (parser.current.getType()) {
            case KW_PASS:
                return skipSimple(loc, "Pass");
            case KW_BREAK:
                return skipSimple(loc, "Break");
            case KW_CONTINUE:
                return skipSimple(loc, "Continue");
            case KW_RETURN:
                return skipSimple(loc, "Return");
            case KW_GLOBAL:
                return skipSimple(loc, "Global");
            case KW_NONLOCAL:
                return skipSimple(loc, "Nonlocal");
            case KW_DEL:
                return skipSimple(loc, "Delete");
            case KW_RAISE:
                return skipSimple(loc, "Raise");
            case KW_ASSERT:
                return skipSimple(loc, "Assert");
            case KW_YIELD:
                return skipSimple(loc, "Yield");
            case KW_IMPORT:
                return parseImport();
            case KW_FROM:
                return parseFromImport();
            default:
                return parseExpressionStatement();
        }
    }

    private Statement skipSimple(SourceLocation loc, String kind) {
        parser.advance();
        parser.skipUntil(NEWLINE, SEMICOLON);
        return new UnsupportedStmt(loc, kind);
    }

    private ImportStmt parseImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_IMPORT, "Expected 'import'");
        List<String> names = new ArrayList<String>();
        do {
            names.add(parseDottedName());
            if (parser.match(KW_AS)) {
                parser.expect(NAME, "Expected alias name");
            }
        } while (parser.match(COMMA));
        return new ImportStmt(loc, null, names);
    }

    private ImportStmt parseFromImport() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FROM, "Expected 'from'");
        StringBuilder module = new StringBuilder();
        while (parser.check(DOT) || parser.check(ELLIPSIS)) {
            module.append(parser.advance().getLexeme());
        }
        if (parser.check(NAME)) {
            module.append(parseDottedName());
        }
        parser.expect(KW_IMPORT, "Expected 'import'");

        List<String> names = new ArrayList<String>();
        if (parser.match(STAR)) {
            names.add("*");
        } else {
            boolean parenthesized = parser.match(LPAREN);
            do {
                if (parenthesized && parser.check(RPAREN)) {
                    break;
                }
                names.add(parser.expect(NAME, "Expected imported name").getLexeme());
                if (parser.match(KW_AS)) {
                    parser.expect(NAME, "Expected alias name");
                }
            } while (parser.match(COMMA));
            if (parenthesized) {
                parser.expect(RPAREN, "Expected ')'");
            }
        }
        return new ImportStmt(loc, module.toString(), names);
    }

    private String parseDottedName() {
        StringBuilder sb = new StringBuilder(parser.expect(NAME, "Expected module name").getLexeme());
        while (parser.match(DOT)) {
            sb.append('.').append(parser.expect(NAME, "Expected name after '.'").getLexeme());
        }
        return sb.toString();
    }

    /**
     * 表达式语句、赋值、带注解赋值与复合赋值
     */
    private Statement parseExpressionStatement() {
        SourceLocation loc = parser.location();
        Expression first = parser.exprParser.parseExpressionList();

        if (parser.match(COLON)) {
            Expression annotation = parser.exprParser.parseTest();
            Expression value = null;
            if (parser.match(ASSIGN)) {
                value = parser.exprParser.parseExpressionList();
            }
            return new AnnAssign(loc, first, annotation, value);
        }

        if (parser.check(ASSIGN)) {
            List<Expression> targets = new ArrayList<Expression>();
            Expression value = first;
            while (parser.match(ASSIGN)) {
                targets.add(value);
                value = parser.exprParser.parseExpressionList();
            }
            return new Assign(loc, targets, value);
        }

        BinaryOp augOp = augmentedOperator(parser.current.getType());
        if (augOp != null) {
            parser.advance();
            Expression value = parser.exprParser.parseExpressionList();
            return new AugAssign(loc, first, augOp, value);
        }
        if (parser.check(OTHER_ASSIGN)) {
            // 位运算与矩阵乘复合赋值
            parser.advance();
            parser.exprParser.parseExpressionList();
            return new UnsupportedStmt(loc, "AugAssign");
        }

        return new ExpressionStmt(loc, first);
    }

    private static BinaryOp augmentedOperator(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN: return BinaryOp.ADD;
            case MINUS_ASSIGN: return BinaryOp.SUB;
            case STAR_ASSIGN: return BinaryOp.MUL;
            case SLASH_ASSIGN: return BinaryOp.DIV;
            case DOUBLE_SLASH_ASSIGN: return BinaryOp.FLOOR_DIV;
            case PERCENT_ASSIGN: return BinaryOp.MOD;
            case DOUBLE_STAR_ASSIGN: return BinaryOp.POW;
            default: return null;
        }
    }
}
