package com.pgmgen.compiler.lexer;

/**
 * 词法单元类型
 */
public enum TokenType {
    // ============ 字面量 ============
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    BYTES_LITERAL,       // b"..."，仅用于报告不支持的构造
    FORMATTED_STRING,    // f"..."，同上
    IMAGINARY_LITERAL,   // 1j，同上
    NAME,

    // ============ 关键词 ============
    KW_DEF,
    KW_IF,
    KW_ELIF,
    KW_ELSE,
    KW_FOR,
    KW_IN,
    KW_NOT,
    KW_AND,
    KW_OR,
    KW_IS,
    KW_TRUE,
    KW_FALSE,
    KW_NONE,
    KW_IMPORT,
    KW_FROM,
    KW_AS,
    KW_WHILE,
    KW_RETURN,
    KW_PASS,
    KW_BREAK,
    KW_CONTINUE,
    KW_CLASS,
    KW_TRY,
    KW_EXCEPT,
    KW_FINALLY,
    KW_WITH,
    KW_GLOBAL,
    KW_NONLOCAL,
    KW_DEL,
    KW_RAISE,
    KW_ASSERT,
    KW_LAMBDA,
    KW_YIELD,
    KW_ASYNC,
    KW_AWAIT,

    // ============ 运算符 ============
    PLUS,            // +
    MINUS,           // -
    STAR,            // *
    SLASH,           // /
    DOUBLE_SLASH,    // //
    PERCENT,         // %
    DOUBLE_STAR,     // **
    AMP,             // &
    PIPE,            // |
    CARET,           // ^
    TILDE,           // ~
    LSHIFT,          // <<
    RSHIFT,          // >>
    AT,              // @

    EQ,              // ==
    NE,              // !=
    LT,              // <
    LE,              // <=
    GT,              // >
    GE,              // >=

    ASSIGN,              // =
    WALRUS,              // :=
    PLUS_ASSIGN,         // +=
    MINUS_ASSIGN,        // -=
    STAR_ASSIGN,         // *=
    SLASH_ASSIGN,        // /=
    DOUBLE_SLASH_ASSIGN, // //=
    PERCENT_ASSIGN,      // %=
    DOUBLE_STAR_ASSIGN,  // **=
    OTHER_ASSIGN,        // &= |= ^= <<= >>= @=

    // ============ 分隔符 ============
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    SEMICOLON,
    DOT,
    ELLIPSIS,
    ARROW,           // ->

    // ============ 布局 ============
    NEWLINE,
    INDENT,
    DEDENT,

    ERROR,
    EOF
}
