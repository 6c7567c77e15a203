package com.pgmgen.compiler.lexer;

/**
 * 词法单元。offset 为在源码中的字符偏移，供解析器截取原始文本
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;
    private final int offset;

    public Token(TokenType type, String lexeme, Object literal, int line, int column, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    public Object getLiteral() {
        return literal;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType type) {
        return this.type == type;
    }

    /**
     * 缩进结构产生的 token：NEWLINE、INDENT、DEDENT 与 EOF，没有源码文本
     */
    public boolean isLayout() {
        switch (type) {
            case NEWLINE:
            case INDENT:
            case DEDENT:
            case EOF:
                return true;
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (!isLayout()) {
            sb.append(" '").append(lexeme).append('\'');
        }
        if (literal != null && !literal.equals(lexeme)) {
            sb.append(" = ").append(literal);
        }
        return sb.append(" @").append(line).append(':').append(column).toString();
    }
}
