package com.pgmgen.compiler.parser;

import com.pgmgen.compiler.lexer.Token;
import com.pgmgen.compiler.lexer.TokenType;

/**
 * 解析异常，携带出错时的当前 token 与期望的 token 类型（可为空）
 */
public class ParseException extends RuntimeException {
    private final Token token;
    private final TokenType expectedType;

    public ParseException(String message, Token token) {
        this(message, token, null);
    }

    public ParseException(String message, Token token, TokenType expectedType) {
        super(message);
        this.token = token;
        this.expectedType = expectedType;
    }

    public Token getToken() {
        return token;
    }

    public TokenType getExpectedType() {
        return expectedType;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (token == null) {
            return base;
        }
        String found = token.getLexeme().isEmpty()
                ? token.getType().name()
                : "'" + token.getLexeme().replace("\n", "\\n") + "'";
        StringBuilder sb = new StringBuilder(base)
                .append(" (line ").append(token.getLine())
                .append(':').append(token.getColumn())
                .append(", found ").append(found);
        if (expectedType != null) {
            sb.append(", want ").append(expectedType.name());
        }
        return sb.append(')').toString();
    }
}
