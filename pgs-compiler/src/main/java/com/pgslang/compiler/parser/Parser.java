package com.pgslang.compiler.parser;

import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.*;
import com.pgslang.compiler.lexer.Lexer;
import com.pgslang.compiler.lexer.Token;
import com.pgslang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.pgslang.compiler.lexer.TokenType.*;

/**
 * PgsLang 语法分析器（递归下降）
 *
 * <p>遇到第一个结构错误即抛出 {@link ParseException}。</p>
 */
public class Parser {

    final Lexer lexer;
    final String fileName;
    Token current;
    Token previous;
    private Token nextToken;  // 用于 lookahead 的缓冲

    /** 为 true 时标识符后的左花括号不解析为容器字面量（if/while/for 头部） */
    boolean noStructLiteral;

    /**
     * 表达式、块与模块的最大嵌套层数。
     * 语法树的高度受此约束，后续的递归遍历（解析、检查、降级）也随之有界。
     */
    static final int MAX_NESTING_DEPTH = 256;
    private int nesting;

    // === Helper 实例 ===
    final DeclParser declParser = new DeclParser(this);
    final StmtParser stmtParser = new StmtParser(this);
    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this.lexer = lexer;
        this.fileName = fileName;
        advance();  // 读取第一个 token
    }

    public Parser(String source, String fileName) {
        this(new Lexer(source, fileName), fileName);
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token
     */
    Token advance() {
        previous = current;
        if (nextToken != null) {
            current = nextToken;
            nextToken = null;
        } else {
            current = lexer.nextToken();
        }
        return previous;
    }

    /**
     * 查看下一个 token（不消费当前）
     */
    Token peek() {
        if (nextToken == null) {
            nextToken = lexer.nextToken();
        }
        return nextToken;
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
     * 期望特定 token，否则报错
     */
    Token expect(TokenType type, String message, String expected) {
        if (check(type)) {
            return advance();
        }
        throw error(message, expected);
    }

    Token expect(TokenType type, String message) {
        return expect(type, message, describe(type));
    }

    /**
     * 期望标识符，返回其文本
     */
    String expectIdentifier(String what) {
        return expect(IDENTIFIER, "Expected " + what, "identifier").getLexeme();
    }

    /**
     * 期望闭合分隔符；失败时报告开启位置
     */
    Token expectClosing(TokenType type, Token opening) {
        if (check(type)) {
            return advance();
        }
        throw error("Unbalanced delimiter: '" + opening.getLexeme() + "' opened at line "
                + opening.getLine() + ", column " + opening.getColumn() + " is not closed", describe(type));
    }

    ParseException error(String message, String expected) {
        return new ParseException(message, current, expected, fileName);
    }

    ParseException error(String message) {
        return new ParseException(message, current, fileName);
    }

    /**
     * 进入一层嵌套，超过 {@link #MAX_NESTING_DEPTH} 时在当前 token 处报错
     *
     * @param what 报错信息中的结构名，如 "Expression"
     */
    void enterNesting(String what) {
        if (++nesting > MAX_NESTING_DEPTH) {
            throw error(what + " nested too deeply (limit " + MAX_NESTING_DEPTH + ")");
        }
    }

    void exitNesting(int levels) {
        nesting -= levels;
    }

    static String describe(TokenType type) {
        switch (type) {
            case LPAREN: return "'('";
            case RPAREN: return "')'";
            case LBRACE: return "'{'";
            case RBRACE: return "'}'";
            case COMMA: return "','";
            case SEMICOLON: return "';'";
            case COLON: return "':'";
            case DOUBLE_COLON: return "'::'";
            case ASSIGN: return "'='";
            case TILDE: return "'~'";
            case DOT: return "'.'";
            case IDENTIFIER: return "identifier";
            case EOF: return "end of input";
            default:
                if (type.isKeyword()) {
                    return "'" + type.name().substring(3).toLowerCase() + "'";
                }
                return type.name();
        }
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return locationOf(current);
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return locationOf(previous);
    }

    SourceLocation locationOf(Token token) {
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    /**
     * 是否到达文件末尾
     */
    boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析程序：顶层条目构成根模块
     */
    public Program parse() {
        SourceLocation loc = location();
        List<Declaration> items = new ArrayList<>();
        while (!isAtEnd()) {
            items.add(declParser.parseItem());
        }
        return new Program(loc, fileName, items);
    }

    /**
     * 解析 {@code a::b::c} 形式的路径
     */
    QualifiedName parsePath(String what) {
        List<String> parts = new ArrayList<>();
        parts.add(expectIdentifier(what));
        while (match(DOUBLE_COLON)) {
            parts.add(expectIdentifier("name after '::'"));
        }
        return new QualifiedName(parts);
    }
}
