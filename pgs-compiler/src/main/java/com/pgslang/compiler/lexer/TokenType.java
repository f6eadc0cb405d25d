package com.pgslang.compiler.lexer;

/**
 * Token 类型
 */
public enum TokenType {
    // 字面量
    INT_LITERAL,
    FLOAT_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,

    // 声明关键词
    KW_MOD,
    KW_FN,
    KW_CONT,
    KW_IMPL,
    KW_IMPORT,
    KW_VAR,

    // 控制流关键词
    KW_RETURN,
    KW_IF,
    KW_ELSE,
    KW_WHILE,
    KW_LOOP,
    KW_FOR,
    KW_IN,
    KW_BREAK,
    KW_CONTINUE,

    KW_TRUE,
    KW_FALSE,

    // 运算符
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    NOT,            // !
    EQ,             // ==
    NE,             // !=
    LT,             // <
    LE,             // <=
    GT,             // >
    GE,             // >=
    ASSIGN,         // =
    PLUS_ASSIGN,    // +=
    MINUS_ASSIGN,   // -=
    MUL_ASSIGN,     // *=
    DIV_ASSIGN,     // /=
    DOUBLE_COLON,   // ::
    COLON,          // :
    TILDE,          // ~

    // 分隔符
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,
    DOT,

    EOF;

    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    public boolean isCompoundAssign() {
        return this == PLUS_ASSIGN || this == MINUS_ASSIGN || this == MUL_ASSIGN || this == DIV_ASSIGN;
    }
}
