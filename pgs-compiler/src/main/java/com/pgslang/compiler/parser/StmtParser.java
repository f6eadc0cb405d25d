package com.pgslang.compiler.parser;

import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.expr.Expression;
import com.pgslang.compiler.ast.stmt.*;
import com.pgslang.compiler.ast.type.TypeRef;
import com.pgslang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.pgslang.compiler.lexer.TokenType.*;

/**
 * 语句解析辅助类
 */
class StmtParser {

    final Parser parser;

    StmtParser(Parser parser) {
        this.parser = parser;
    }

    Statement parseStatement() {
        if (parser.check(LBRACE)) {
            return parseBlock();
        }
        if (parser.check(KW_VAR)) {
            return parseVarDecl();
        }
        if (parser.check(KW_RETURN)) {
            return parseReturn();
        }
        if (parser.check(KW_IF)) {
            return parseIf();
        }
        if (parser.check(KW_WHILE)) {
            return parseWhile();
        }
        if (parser.check(KW_LOOP)) {
            SourceLocation loc = parser.location();
            parser.advance();
            return new LoopStmt(loc, parseBlock());
        }
        if (parser.check(KW_FOR)) {
            return parseFor();
        }
        if (parser.check(KW_BREAK)) {
            SourceLocation loc = parser.location();
            parser.advance();
            parser.expect(SEMICOLON, "Expected ';' after 'break'");
            return new BreakStmt(loc);
        }
        if (parser.check(KW_CONTINUE)) {
            SourceLocation loc = parser.location();
            parser.advance();
            parser.expect(SEMICOLON, "Expected ';' after 'continue'");
            return new ContinueStmt(loc);
        }
        return parseExpressionStmt();
    }

    Block parseBlock() {
        SourceLocation loc = parser.location();
        Token open = parser.expect(LBRACE, "Expected '{' to open block");
        parser.enterNesting("Block");
        try {
            List<Statement> statements = new ArrayList<>();
            while (!parser.check(RBRACE) && !parser.isAtEnd()) {
                statements.add(parseStatement());
            }
            parser.expectClosing(RBRACE, open);
            return new Block(loc, statements);
        } finally {
            parser.exitNesting(1);
        }
    }

    /**
     * var name: Type = expr;
     */
    private Statement parseVarDecl() {
        SourceLocation loc = parser.location();
        parser.advance(); // var
        String name = parser.expectIdentifier("variable name");
        parser.expect(COLON, "Expected ':' after variable name");
        TypeRef type = parser.declParser.parseType();
        parser.expect(ASSIGN, "Expected '=' in variable declaration");
        Expression init = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after variable declaration");
        return new VarDeclStmt(loc, name, type, init);
    }

    private Statement parseReturn() {
        SourceLocation loc = parser.location();
        parser.advance(); // return
        Expression value = null;
        if (!parser.check(SEMICOLON)) {
            value = parser.exprParser.parseExpression();
        }
        parser.expect(SEMICOLON, "Expected ';' after return");
        return new ReturnStmt(loc, value);
    }

    private IfStmt parseIf() {
        SourceLocation loc = parser.location();
        parser.advance(); // if
        Expression condition = parser.exprParser.parseCondition();
        Block thenBranch = parseBlock();
        Block elseBranch = null;
        if (parser.match(KW_ELSE)) {
            if (parser.check(KW_IF)) {
                // else if：包装为只含嵌套 if 的块
                SourceLocation nestedLoc = parser.location();
                parser.enterNesting("Block");
                IfStmt nested;
                try {
                    nested = parseIf();
                } finally {
                    parser.exitNesting(1);
                }
                elseBranch = new Block(nestedLoc, Collections.<Statement>singletonList(nested));
            } else {
                elseBranch = parseBlock();
            }
        }
        return new IfStmt(loc, condition, thenBranch, elseBranch);
    }

    private Statement parseWhile() {
        SourceLocation loc = parser.location();
        parser.advance(); // while
        Expression condition = parser.exprParser.parseCondition();
        return new WhileStmt(loc, condition, parseBlock());
    }

    /**
     * for name in expr { ... }
     */
    private Statement parseFor() {
        SourceLocation loc = parser.location();
        parser.advance(); // for
        SourceLocation varLoc = parser.location();
        String name = parser.expectIdentifier("loop variable");
        parser.expect(KW_IN, "Expected 'in' after loop variable");
        Expression iterable = parser.exprParser.parseCondition();
        return new ForStmt(loc, name, varLoc, iterable, parseBlock());
    }

    private Statement parseExpressionStmt() {
        SourceLocation loc = parser.location();
        Expression expr = parser.exprParser.parseExpression();
        parser.expect(SEMICOLON, "Expected ';' after expression");
        return new ExpressionStmt(loc, expr);
    }
}
