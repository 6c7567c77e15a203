package com.pgmgen.compiler.parser;

import com.pgmgen.compiler.ast.Module;
import com.pgmgen.compiler.ast.SourceLocation;
import com.pgmgen.compiler.ast.stmt.Statement;
import com.pgmgen.compiler.lexer.Lexer;
import com.pgmgen.compiler.lexer.Token;
import com.pgmgen.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static com.pgmgen.compiler.lexer.TokenType.*;

/**
 * 语法分析器（递归下降）
 *
 * <p>覆盖完整的语句与表达式语法，但只为支持子集构造具体节点；其余构造解析为
 * {@link com.pgmgen.compiler.ast.stmt.UnsupportedStmt} 或
 * {@link com.pgmgen.compiler.ast.expr.UnsupportedExpr}，由降级阶段报告。</p>
 */
public class Parser {
    private static final Logger LOG = Logger.getLogger(Parser.class.getName());

    final String source;
    final String fileName;
    private final List<Token> tokens;
    private int position;
    Token current;
    Token previous;

    // === Helper 实例 ===
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
        this.tokens = new Lexer(source, fileName).scanTokens();
        this.position = 0;
        this.current = tokens.get(0);
        checkError(current);
    }

    /**
     * 解析单个源文件
     */
    public static Module parse(String source, String fileName) {
        return new Parser(source, fileName).parse();
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (position < tokens.size() - 1) {
            position++;
        }
        current = tokens.get(position);
        checkError(current);
        return previous;
    }

    private void checkError(Token token) {
        if (token.is(ERROR)) {
            throw new ParseException(String.valueOf(token.getLiteral()), token);
        }
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        return tokens.get(Math.min(position + 1, tokens.size() - 1));
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 检查当前 token 是否为给定类型之一
     */
    boolean checkAny(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 如果当前 token 匹配任一类型，则前进
     */
    boolean matchAny(TokenType... types) {
        for (TokenType type : types) {
            if (match(type)) return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(message, current, type);
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn());
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn());
    }

    /**
     * 从 startToken 到上一个已消费 token 的原始源码
     */
    String sourceTextFrom(Token startToken) {
        if (previous == null || previous.getOffset() < startToken.getOffset()) {
            return "";
        }
        int end = previous.getOffset() + previous.getLexeme().length();
        return source.substring(startToken.getOffset(), Math.min(end, source.length()));
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    /**
     * 跳过空行
     */
    void skipNewlines() {
        while (match(NEWLINE)) {
            // 跳过
        }
    }

    /**
     * 跳过括号平衡的 token，直到遇到深度为 0 的任一终止类型（不消费终止 token）
     */
    void skipUntil(TokenType... terminators) {
        int depth = 0;
        while (!isAtEnd()) {
            if (depth == 0 && checkAny(terminators)) {
                return;
            }
            if (checkAny(LPAREN, LBRACKET, LBRACE)) {
                depth++;
            } else if (checkAny(RPAREN, RBRACKET, RBRACE)) {
                if (depth == 0) {
                    return;
                }
                depth--;
            }
            advance();
        }
    }

    // ============ 程序解析 ============

    /**
     * 解析整个源文件
     */
    public Module parse() {
        SourceLocation loc = new SourceLocation(fileName, 1, 1);
        List<Statement> body = new ArrayList<Statement>();
        skipNewlines();
        while (!isAtEnd()) {
            if (check(INDENT)) {
                throw new ParseException("Unexpected indent", current);
            }
            stmtParser.parseStatementInto(body);
            skipNewlines();
        }
        LOG.fine(() -> "Parsed " + body.size() + " top-level statements from " + fileName);
        return new Module(loc, fileName, body);
    }
}
