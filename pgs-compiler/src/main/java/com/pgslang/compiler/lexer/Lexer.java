package com.pgslang.compiler.lexer;

import com.pgslang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PgsLang 词法分析器
 *
 * <p>遇到第一个非法构造即抛出 {@link LexException}，不做错误恢复。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起点
    private int startLine = 1;
    private int startColumn = 1;

    private boolean finished;
    private TokenType lastType;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();

        // 声明
        map.put("mod", TokenType.KW_MOD);
        map.put("fn", TokenType.KW_FN);
        map.put("cont", TokenType.KW_CONT);
        map.put("impl", TokenType.KW_IMPL);
        map.put("import", TokenType.KW_IMPORT);
        map.put("var", TokenType.KW_VAR);

        // 控制流
        map.put("return", TokenType.KW_RETURN);
        map.put("if", TokenType.KW_IF);
        map.put("else", TokenType.KW_ELSE);
        map.put("while", TokenType.KW_WHILE);
        map.put("loop", TokenType.KW_LOOP);
        map.put("for", TokenType.KW_FOR);
        map.put("in", TokenType.KW_IN);
        map.put("break", TokenType.KW_BREAK);
        map.put("continue", TokenType.KW_CONTINUE);

        map.put("true", TokenType.KW_TRUE);
        map.put("false", TokenType.KW_FALSE);

        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合 */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）。到达末尾后持续返回 EOF。
     *
     * @return 下一个 Token
     */
    public Token nextToken() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                finished = true;
                return new Token(TokenType.EOF, "", null, line, column, current);
            }
            start = current;
            startLine = line;
            startColumn = column;
            Token token = scanToken();
            if (token != null) {
                lastType = token.getType();
                return token;
            }
            // 注释不产生 token
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（以 EOF 结尾）
     */
    public List<Token> scanTokens() {
        if (finished || current > 0) {
            throw new IllegalStateException("Lexer has already been consumed");
        }
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else {
                break;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '.': return makeToken(TokenType.DOT);
            case '~': return makeToken(TokenType.TILDE);

            case ':':
                return makeToken(match(':') ? TokenType.DOUBLE_COLON : TokenType.COLON);

            case '+':
                return makeToken(match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS);

            case '-':
                return makeToken(match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS);

            case '*':
                return makeToken(match('=') ? TokenType.MUL_ASSIGN : TokenType.MUL);

            case '/':
                if (match('/')) {
                    lineComment();
                    return null;
                }
                if (match('*')) {
                    blockComment();
                    return null;
                }
                return makeToken(match('=') ? TokenType.DIV_ASSIGN : TokenType.DIV);

            case '#':
                lineComment();
                return null;

            case '=':
                return makeToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);

            case '!':
                return makeToken(match('=') ? TokenType.NE : TokenType.NOT);

            case '<':
                return makeToken(match('=') ? TokenType.LE : TokenType.LT);

            case '>':
                return makeToken(match('=') ? TokenType.GE : TokenType.GT);

            case '"':
                return string();

            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                throw error("Illegal character '" + printable(c) + "'");
        }
    }

    // === 辅助方法 ===

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

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static String printable(char c) {
        if (c < 0x20 || c == 0x7f) {
            return String.format("\\u%04x", (int) c);
        }
        return String.valueOf(c);
    }

    // === Token 构建 ===

    private Token makeToken(TokenType type) {
        return makeToken(type, null);
    }

    private Token makeToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        return new Token(type, lexeme, literal, startLine, startColumn, start);
    }

    private LexException error(String message) {
        return new LexException(message,
                new SourceLocation(fileName, startLine, startColumn, start, Math.max(1, current - start)));
    }

    // === 复杂 Token 扫描 ===

    private Token string() {
        StringBuilder value = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                throw error("Unterminated string");
            }
            char c = advance();
            if (c == '"') {
                break;
            }
            if (c == '\\') {
                value.append(escapeChar());
            } else {
                value.append(c);
            }
        }
        return makeToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar() {
        if (isAtEnd()) {
            throw error("Unterminated string");
        }
        char c = advance();
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case 'r': return '\r';
            case '0': return '\0';
            case '\\': return '\\';
            case '"': return '"';
            default:
                throw error("Invalid escape character: \\" + printable(c));
        }
    }

    private Token number() {
        while (isDigit(peek())) advance();

        boolean isFloat = false;
        if (peek() == '.') {
            if (!isDigit(peekNext())) {
                advance();
                throw error("Malformed numeric literal: " + source.substring(start, current));
            }
            isFloat = true;
            advance(); // 消费 '.'
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
                throw error("Malformed numeric literal: " + source.substring(start, current));
            }
        }

        if (isAlpha(peek())) {
            while (isAlphaNumeric(peek())) advance();
            throw error("Malformed numeric literal: " + source.substring(start, current));
        }

        String text = source.substring(start, current);
        if (isFloat) {
            return makeToken(TokenType.FLOAT_LITERAL, Double.parseDouble(text));
        }
        try {
            return makeToken(TokenType.INT_LITERAL, Long.parseLong(text));
        } catch (NumberFormatException e) {
            // 2^63 紧跟在 '-' 之后时取 Long.MIN_VALUE，取负后按 64 位回绕仍为它自身
            if (lastType == TokenType.MINUS && MIN_INT_MAGNITUDE.equals(stripLeadingZeros(text))) {
                return makeToken(TokenType.INT_LITERAL, Long.MIN_VALUE);
            }
            throw error("Malformed numeric literal: " + text + " does not fit in 64 bits");
        }
    }

    private static final String MIN_INT_MAGNITUDE = "9223372036854775808";

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') i++;
        return digits.substring(i);
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        return makeToken(type);
    }

    private void lineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                if (advance() == '\n') newLine();
            }
        }
        if (depth > 0) {
            throw error("Unterminated block comment");
        }
    }
}
