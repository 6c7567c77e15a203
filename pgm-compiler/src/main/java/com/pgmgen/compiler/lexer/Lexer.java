package com.pgmgen.compiler.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 源码词法分析器
 *
 * <p>按缩进产生 INDENT / DEDENT，括号内换行与反斜杠续行不产生 NEWLINE，
 * 空行和纯注释行被跳过。错误以 {@link TokenType#ERROR} 记录，由解析器统一报告。</p>
 */
public class Lexer {
    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private final String source;
    private final String fileName;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起始位置
    private int tokenLine = 1;
    private int tokenColumn = 1;

    private int parenDepth = 0;
    private boolean atLineStart = true;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 支持子集
        map.put("def", TokenType.KW_DEF);
        map.put("if", TokenType.KW_IF);
        map.put("elif", TokenType.KW_ELIF);
        map.put("else", TokenType.KW_ELSE);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("not", TokenType.KW_NOT);
        map.put("and", TokenType.KW_AND);
        map.put("or", TokenType.KW_OR);
        map.put("is", TokenType.KW_IS);
        map.put("True", TokenType.KW_TRUE);
        map.put("False", TokenType.KW_FALSE);
        map.put("None", TokenType.KW_NONE);
        map.put("import", TokenType.KW_IMPORT);
        map.put("from", TokenType.KW_FROM);
        map.put("as", TokenType.KW_AS);

        // 可识别但不支持
        map.put("while", TokenType.KW_WHILE);
        map.put("return", TokenType.KW_RETURN);
        map.put("pass", TokenType.KW_PASS);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);
        map.put("class", TokenType.KW_CLASS);
        map.put("try", TokenType.KW_TRY);
        map.put("except", TokenType.KW_EXCEPT);
        map.put("finally", TokenType.KW_FINALLY);
        map.put("with", TokenType.KW_WITH);
        map.put("global", TokenType.KW_GLOBAL);
        map.put("nonlocal", TokenType.KW_NONLOCAL);
        map.put("del", TokenType.KW_DEL);
        map.put("raise", TokenType.KW_RAISE);
        map.put("assert", TokenType.KW_ASSERT);
        map.put("lambda", TokenType.KW_LAMBDA);
        map.put("yield", TokenType.KW_YIELD);
        map.put("async", TokenType.KW_ASYNC);
        map.put("await", TokenType.KW_AWAIT);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
        this.indents.push(0);
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 执行词法分析，返回 Token 列表
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            if (atLineStart && parenDepth == 0) {
                scanIndentation();
                continue;
            }
            start = current;
            tokenLine = line;
            tokenColumn = column;
            scanToken();
        }

        tokenLine = line;
        tokenColumn = column;
        start = current;
        if (!tokens.isEmpty() && !tokens.get(tokens.size() - 1).is(TokenType.NEWLINE)) {
            addLayoutToken(TokenType.NEWLINE);
        }
        while (indents.peek() > 0) {
            indents.pop();
            addLayoutToken(TokenType.DEDENT);
        }
        addLayoutToken(TokenType.EOF);
        LOG.fine(() -> "Scanned " + tokens.size() + " tokens from " + fileName);
        return tokens;
    }

    // ============ 缩进 ============

    private void scanIndentation() {
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / 8 + 1) * 8;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            advance();
        }
        if (isAtEnd()) {
            return;
        }

        char c = peek();
        if (c == '\r') {
            advance();
            return;
        }
        if (c == '\n') {
            advance();
            newLine();
            return;
        }
        if (c == '#') {
            skipComment();
            return;
        }
        if (c == '\\' && (peekNext() == '\n' || peekNext() == '\r')) {
            // 空行上的续行符
            advance();
            return;
        }

        atLineStart = false;
        start = current;
        tokenLine = line;
        tokenColumn = column;

        int top = indents.peek();
        if (width > top) {
            indents.push(width);
            addLayoutToken(TokenType.INDENT);
        } else if (width < top) {
            while (width < indents.peek()) {
                indents.pop();
                addLayoutToken(TokenType.DEDENT);
            }
            if (width != indents.peek()) {
                error("Unindent does not match any outer indentation level");
            }
        }
    }

    // ============ Token 扫描 ============

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': parenDepth++; addToken(TokenType.LPAREN); break;
            case ')': closeParen(); addToken(TokenType.RPAREN); break;
            case '[': parenDepth++; addToken(TokenType.LBRACKET); break;
            case ']': closeParen(); addToken(TokenType.RBRACKET); break;
            case '{': parenDepth++; addToken(TokenType.LBRACE); break;
            case '}': closeParen(); addToken(TokenType.RBRACE); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '~': addToken(TokenType.TILDE); break;

            case ':':
                addToken(match('=') ? TokenType.WALRUS : TokenType.COLON);
                break;

            case '.':
                if (isDigit(peek())) {
                    number(c);
                } else if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    addToken(TokenType.ELLIPSIS);
                } else {
                    addToken(TokenType.DOT);
                }
                break;

            case '+':
                addToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);
                break;

            case '-':
                if (match('>')) addToken(TokenType.ARROW);
                else if (match('=')) addToken(TokenType.MINUS_ASSIGN);
                else addToken(TokenType.MINUS);
                break;

            case '*':
                if (match('*')) {
                    addToken(match('=') ? TokenType.DOUBLE_STAR_ASSIGN : TokenType.DOUBLE_STAR);
                } else {
                    addToken(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR);
                }
                break;

            case '/':
                if (match('/')) {
                    addToken(match('=') ? TokenType.DOUBLE_SLASH_ASSIGN : TokenType.DOUBLE_SLASH);
                } else {
                    addToken(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH);
                }
                break;

            case '%':
                addToken(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT);
                break;

            case '@':
                addToken(match('=') ? TokenType.OTHER_ASSIGN : TokenType.AT);
                break;

            case '&':
                addToken(match('=') ? TokenType.OTHER_ASSIGN : TokenType.AMP);
                break;

            case '|':
                addToken(match('=') ? TokenType.OTHER_ASSIGN : TokenType.PIPE);
                break;

            case '^':
                addToken(match('=') ? TokenType.OTHER_ASSIGN : TokenType.CARET);
                break;

            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.OTHER_ASSIGN : TokenType.LSHIFT);
                } else {
                    addToken(match('=') ? TokenType.LE : TokenType.LT);
                }
                break;

            case '>':
                if (match('>')) {
                    addToken(match('=') ? TokenType.OTHER_ASSIGN : TokenType.RSHIFT);
                } else {
                    addToken(match('=') ? TokenType.GE : TokenType.GT);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character '!'");
                }
                break;

            case '#':
                skipComment();
                break;

            case '\\':
                // 续行符
                if (peek() == '\r') advance();
                if (peek() == '\n') {
                    advance();
                    newLine();
                } else {
                    error("Unexpected character after line continuation character");
                }
                break;

            // 空白字符
            case ' ':
            case '\r':
            case '\t':
            case '\f':
                break;

            case '\n':
                if (parenDepth > 0) {
                    newLine();
                } else {
                    addToken(TokenType.NEWLINE);
                    newLine();
                    atLineStart = true;
                }
                break;

            case '"':
            case '\'':
                current--;
                column--;
                string("");
                break;

            default:
                if (isDigit(c)) {
                    number(c);
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void closeParen() {
        if (parenDepth > 0) {
            parenDepth--;
        }
    }

    private void skipComment() {
        while (peek() != '\n' && !isAtEnd()) {
            advance();
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        if ((peek() == '"' || peek() == '\'') && isStringPrefix(text)) {
            string(text.toLowerCase());
            return;
        }
        TokenType type = KEYWORDS.get(text);
        addToken(type != null ? type : TokenType.NAME);
    }

    private static boolean isStringPrefix(String text) {
        switch (text.toLowerCase()) {
            case "r":
            case "u":
            case "b":
            case "f":
            case "br":
            case "rb":
            case "fr":
            case "rf":
                return true;
            default:
                return false;
        }
    }

    // ============ 字符串 ============

    private void string(String prefix) {
        char quote = advance();
        boolean triple = false;
        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            triple = true;
        }
        boolean raw = prefix.indexOf('r') >= 0;
        StringBuilder value = new StringBuilder();

        while (true) {
            if (isAtEnd()) {
                error(triple ? "Unterminated triple-quoted string" : "Unterminated string");
                return;
            }
            char c = peek();
            if (c == quote) {
                if (!triple) {
                    advance();
                    break;
                }
                if (peekNext() == quote && current + 2 < source.length()
                        && source.charAt(current + 2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
            }
            if (c == '\n') {
                if (!triple) {
                    error("Unterminated string");
                    return;
                }
                advance();
                newLine();
                value.append('\n');
                continue;
            }
            if (c == '\\') {
                advance();
                if (raw) {
                    value.append('\\');
                    if (!isAtEnd()) {
                        char next = advance();
                        if (next == '\n') newLine();
                        value.append(next);
                    }
                } else {
                    value.append(escape());
                }
                continue;
            }
            value.append(advance());
        }

        TokenType type = TokenType.STRING_LITERAL;
        if (prefix.indexOf('b') >= 0) {
            type = TokenType.BYTES_LITERAL;
        } else if (prefix.indexOf('f') >= 0) {
            type = TokenType.FORMATTED_STRING;
        }
        addToken(type, value.toString());
    }

    private String escape() {
        if (isAtEnd()) {
            return "\\";
        }
        char c = advance();
        switch (c) {
            case '\n': newLine(); return "";
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case 'a': return "\u0007";
            case 'b': return "\b";
            case 'f': return "\f";
            case 'v': return "\u000B";
            case '\\': return "\\";
            case '\'': return "'";
            case '"': return "\"";
            case 'x': return hexEscape(c, 2);
            case 'u': return hexEscape(c, 4);
            case 'U': return hexEscape(c, 8);
            default:
                if (c >= '0' && c <= '7') {
                    int value = c - '0';
                    for (int i = 0; i < 2 && peek() >= '0' && peek() <= '7'; i++) {
                        value = value * 8 + (advance() - '0');
                    }
                    return new String(Character.toChars(value));
                }
                // 未知转义保持原样
                return "\\" + c;
        }
    }

    private String hexEscape(char kind, int digits) {
        StringBuilder hex = new StringBuilder();
        for (int i = 0; i < digits; i++) {
            if (!isHexDigit(peek())) {
                error("Truncated \\" + kind + " escape");
                return "";
            }
            hex.append(advance());
        }
        int codePoint = (int) Long.parseLong(hex.toString(), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            error("Illegal Unicode character: \\" + kind + hex);
            return "";
        }
        return new String(Character.toChars(codePoint));
    }

    // ============ 数字 ============

    private void number(char first) {
        if (first == '0' && isRadixMarker(peek())) {
            radixNumber(Character.toLowerCase(advance()));
            return;
        }

        boolean isFloat = first == '.';
        digits();
        if (!isFloat && peek() == '.') {
            isFloat = true;
            advance();
            digits();
        }
        if (peek() == 'e' || peek() == 'E') {
            char next = peekNext();
            boolean signed = (next == '+' || next == '-')
                    && current + 2 < source.length() && isDigit(source.charAt(current + 2));
            if (isDigit(next) || signed) {
                isFloat = true;
                advance();
                if (signed) advance();
                digits();
            }
        }
        if (peek() == 'j' || peek() == 'J') {
            advance();
            addToken(TokenType.IMAGINARY_LITERAL, source.substring(start, current));
            return;
        }

        String text = stripUnderscores(source.substring(start, current));
        try {
            if (isFloat) {
                addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
            } else {
                addToken(TokenType.INT_LITERAL, Long.parseLong(text));
            }
        } catch (NumberFormatException e) {
            error("Invalid numeric literal: " + source.substring(start, current));
        }
    }

    private void radixNumber(char marker) {
        int radix = marker == 'x' ? 16 : marker == 'o' ? 8 : 2;
        while (isHexDigit(peek()) || peek() == '_') {
            advance();
        }
        String text = stripUnderscores(source.substring(start + 2, current));
        try {
            addToken(TokenType.INT_LITERAL, Long.parseLong(text, radix));
        } catch (NumberFormatException e) {
            error("Invalid integer literal: " + source.substring(start, current));
        }
    }

    private void digits() {
        while (isDigit(peek()) || (peek() == '_' && isDigit(peekNext()))) {
            advance();
        }
    }

    private static boolean isRadixMarker(char c) {
        return c == 'x' || c == 'X' || c == 'o' || c == 'O' || c == 'b' || c == 'B';
    }

    /** 移除数字中的下划线分隔符 */
    private static String stripUnderscores(String text) {
        return text.indexOf('_') >= 0 ? text.replace("_", "") : text;
    }

    // ============ 辅助方法 ============

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        column++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_' ||
               Character.isLetter(c);
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    // ============ Token 构建 ============

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, tokenLine, tokenColumn, start));
    }

    private void addLayoutToken(TokenType type) {
        tokens.add(new Token(type, "", null, tokenLine, tokenColumn, start));
    }

    private void error(String message) {
        LOG.fine(() -> String.format("[%s:%d:%d] Lexer error: %s", fileName, tokenLine, tokenColumn, message));
        addToken(TokenType.ERROR, message);
    }
}
