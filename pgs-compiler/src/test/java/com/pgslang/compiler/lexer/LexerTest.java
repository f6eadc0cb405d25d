package com.pgslang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回所有 token（含 EOF） */
    private List<Token> scan(String source) {
        return new Lexer(source, "<test>").scanTokens();
    }

    /** 扫描源码，返回非 EOF 的 token 类型 */
    private List<TokenType> types(String source) {
        return scan(source).stream()
                .map(Token::getType)
                .filter(t -> t != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private Token single(String source) {
        List<Token> toks = scan(source);
        assertEquals(2, toks.size(), "Expected single token from: " + source);
        return toks.get(0);
    }

    private LexException lexError(String source) {
        return assertThrows(LexException.class, () -> scan(source));
    }

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("所有关键词")
        void keywords() {
            assertEquals(List.of(TokenType.KW_MOD, TokenType.KW_FN, TokenType.KW_CONT, TokenType.KW_IMPL,
                    TokenType.KW_IMPORT, TokenType.KW_VAR, TokenType.KW_RETURN, TokenType.KW_IF,
                    TokenType.KW_ELSE, TokenType.KW_WHILE, TokenType.KW_LOOP, TokenType.KW_FOR,
                    TokenType.KW_IN, TokenType.KW_BREAK, TokenType.KW_CONTINUE,
                    TokenType.KW_TRUE, TokenType.KW_FALSE),
                    types("mod fn cont impl import var return if else while loop for in break continue true false"));
        }

        @Test
        @DisplayName("标识符可含下划线和数字")
        void identifiers() {
            List<Token> toks = scan("foo _bar x1 modular");
            assertEquals(5, toks.size());
            for (int i = 0; i < 4; i++) {
                assertEquals(TokenType.IDENTIFIER, toks.get(i).getType());
            }
            assertEquals("modular", toks.get(3).getLexeme());
        }
    }

    @Nested
    @DisplayName("数字字面量")
    class NumberTests {

        @Test
        @DisplayName("整数为 64 位")
        void integers() {
            Token t = single("9223372036854775807");
            assertEquals(TokenType.INT_LITERAL, t.getType());
            assertEquals(Long.MAX_VALUE, t.getLiteral());
            assertEquals(42L, single("42").getLiteral());
        }

        @Test
        @DisplayName("浮点数恰好一个小数点")
        void floats() {
            Token t = single("3.25");
            assertEquals(TokenType.FLOAT_LITERAL, t.getType());
            assertEquals(3.25, t.getLiteral());
        }

        @Test
        @DisplayName("超出 64 位的整数")
        void overflow() {
            LexException e = lexError("9223372036854775808");
            assertTrue(e.getRawMessage().startsWith("Malformed numeric literal"));
        }

        @Test
        @DisplayName("负号后的 2^63 表示最小的 64 位整数")
        void minimumAfterMinus() {
            List<Token> toks = scan("-9223372036854775808");
            assertEquals(TokenType.MINUS, toks.get(0).getType());
            assertEquals(TokenType.INT_LITERAL, toks.get(1).getType());
            assertEquals(Long.MIN_VALUE, toks.get(1).getLiteral());
            assertEquals(Long.MIN_VALUE, scan("x - 09223372036854775808").get(2).getLiteral());

            assertTrue(lexError("+9223372036854775808").getRawMessage().endsWith("does not fit in 64 bits"));
            assertTrue(lexError("-9223372036854775809").getRawMessage().startsWith("Malformed numeric literal"));
        }

        @Test
        @DisplayName("非法数字格式")
        void malformed() {
            assertTrue(lexError("1.2.3").getRawMessage().startsWith("Malformed numeric literal"));
            assertTrue(lexError("12abc").getRawMessage().startsWith("Malformed numeric literal"));
            assertTrue(lexError("1. ").getRawMessage().startsWith("Malformed numeric literal"));
        }
    }

    @Nested
    @DisplayName("字符串字面量")
    class StringTests {

        @Test
        @DisplayName("转义字符")
        void escapes() {
            Token t = single("\"a\\n\\t\\\\\\\"b\"");
            assertEquals(TokenType.STRING_LITERAL, t.getType());
            assertEquals("a\n\t\\\"b", t.getLiteral());
        }

        @Test
        @DisplayName("未闭合的字符串")
        void unterminated() {
            assertEquals("Unterminated string", lexError("\"abc").getRawMessage());
            assertEquals("Unterminated string", lexError("\"abc\nd\"").getRawMessage());
        }

        @Test
        @DisplayName("未知转义")
        void invalidEscape() {
            assertEquals("Invalid escape character: \\q", lexError("\"\\q\"").getRawMessage());
        }
    }

    @Nested
    @DisplayName("运算符与分隔符")
    class OperatorTests {

        @Test
        @DisplayName("运算符")
        void operators() {
            assertEquals(List.of(TokenType.PLUS, TokenType.MINUS, TokenType.MUL, TokenType.DIV,
                    TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE,
                    TokenType.ASSIGN, TokenType.DOUBLE_COLON, TokenType.COLON, TokenType.TILDE, TokenType.NOT,
                    TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MUL_ASSIGN, TokenType.DIV_ASSIGN),
                    types("+ - * / == != < <= > >= = :: : ~ ! += -= *= /="));
        }

        @Test
        @DisplayName("分隔符")
        void punctuation() {
            assertEquals(List.of(TokenType.LBRACE, TokenType.RBRACE, TokenType.LPAREN, TokenType.RPAREN,
                    TokenType.COMMA, TokenType.SEMICOLON, TokenType.DOT),
                    types("{ } ( ) , ; ."));
        }

        @Test
        @DisplayName("非法字符报告位置")
        void illegalCharacter() {
            LexException e = lexError("x\n  @");
            assertEquals("Illegal character '@'", e.getRawMessage());
            assertEquals(2, e.getLocation().getLine());
            assertEquals(3, e.getLocation().getColumn());
            assertEquals("Illegal character '@' at <test>:2:3", e.getMessage());
        }
    }

    @Nested
    @DisplayName("注释")
    class CommentTests {

        @Test
        @DisplayName("行注释与块注释被丢弃")
        void commentsDiscarded() {
            List<Token> toks = scan("a // c\n b # d\n /* e \n f */ c");
            assertEquals(4, toks.size());
            assertEquals("c", toks.get(2).getLexeme());
            assertEquals(4, toks.get(2).getLine());
        }

        @Test
        @DisplayName("块注释可嵌套")
        void nestedBlockComment() {
            assertEquals(List.of(TokenType.IDENTIFIER), types("/* a /* b */ c */ x"));
        }

        @Test
        @DisplayName("未闭合的块注释")
        void unterminatedBlockComment() {
            assertEquals("Unterminated block comment", lexError("x /* y").getRawMessage());
        }
    }

    @Nested
    @DisplayName("位置信息")
    class PositionTests {

        @Test
        @DisplayName("行、列与偏移")
        void positions() {
            List<Token> toks = scan("fn: main");
            assertEquals(1, toks.get(0).getColumn());
            assertEquals(0, toks.get(0).getOffset());
            assertEquals(3, toks.get(1).getColumn());
            assertEquals(5, toks.get(2).getColumn());
            assertEquals(4, toks.get(2).getOffset());
        }

        @Test
        @DisplayName("流式接口到达末尾后持续返回 EOF")
        void streaming() {
            Lexer lexer = new Lexer("x", "<test>");
            assertEquals(TokenType.IDENTIFIER, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
            assertEquals(TokenType.EOF, lexer.nextToken().getType());
        }
    }
}
