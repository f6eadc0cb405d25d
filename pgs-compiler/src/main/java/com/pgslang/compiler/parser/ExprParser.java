package com.pgslang.compiler.parser;

import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.QualifiedName;
import com.pgslang.compiler.ast.expr.*;
import com.pgslang.compiler.ast.expr.AssignExpr.AssignOp;
import com.pgslang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgslang.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.pgslang.compiler.lexer.Token;
import com.pgslang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.pgslang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类（优先级爬升）
 *
 * <pre>
 * assignment     := equality (("=" | "+=" | "-=" | "*=" | "/=") assignment)?
 * equality       := comparison (("==" | "!=") comparison)*
 * comparison     := additive (("&lt;" | "&lt;=" | "&gt;" | "&gt;=") additive)*
 * additive       := multiplicative (("+" | "-") multiplicative)*
 * multiplicative := unary (("*" | "/") unary)*
 * unary          := ("-" | "!") unary | postfix
 * postfix        := primary ("." ident ("(" args ")")? | "(" args ")")*
 * </pre>
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        parser.enterNesting("Expression");
        try {
            return parseAssignment();
        } finally {
            parser.exitNesting(1);
        }
    }

    /**
     * 解析 if/while/for 头部表达式，其中不允许裸容器字面量
     */
    Expression parseCondition() {
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = true;
        try {
            return parseExpression();
        } finally {
            parser.noStructLiteral = saved;
        }
    }

    /** 在括号等自带边界的位置重新允许容器字面量 */
    private Expression parseNested() {
        boolean saved = parser.noStructLiteral;
        parser.noStructLiteral = false;
        try {
            return parseExpression();
        } finally {
            parser.noStructLiteral = saved;
        }
    }

    private Expression parseAssignment() {
        Expression target = parseEquality();
        AssignOp op = assignOp(parser.current.getType());
        if (op == null) {
            return target;
        }
        Token opToken = parser.advance();
        if (!(target instanceof Identifier) && !(target instanceof MemberExpr)) {
            throw new ParseException("Invalid assignment target", opToken,
                    "variable or field before '" + opToken.getLexeme() + "'", parser.fileName);
        }
        parser.enterNesting("Expression");
        try {
            Expression value = parseAssignment();
            return new AssignExpr(parser.locationOf(opToken), target, op, value);
        } finally {
            parser.exitNesting(1);
        }
    }

    private static AssignOp assignOp(TokenType type) {
        switch (type) {
            case ASSIGN: return AssignOp.ASSIGN;
            case PLUS_ASSIGN: return AssignOp.ADD_ASSIGN;
            case MINUS_ASSIGN: return AssignOp.SUB_ASSIGN;
            case MUL_ASSIGN: return AssignOp.MUL_ASSIGN;
            case DIV_ASSIGN: return AssignOp.DIV_ASSIGN;
            default: return null;
        }
    }

    // 左结合的运算链每多一个运算符，语法树就高一层，同样计入嵌套深度

    private Expression parseEquality() {
        Expression left = parseComparison();
        int chain = 0;
        try {
            while (parser.checkAny(EQ, NE)) {
                Token op = parser.advance();
                parser.enterNesting("Expression");
                chain++;
                Expression right = parseComparison();
                left = new BinaryExpr(parser.locationOf(op), left,
                        op.is(EQ) ? BinaryOp.EQ : BinaryOp.NE, right);
            }
            return left;
        } finally {
            parser.exitNesting(chain);
        }
    }

    private Expression parseComparison() {
        Expression left = parseAdditive();
        int chain = 0;
        try {
            while (parser.checkAny(LT, LE, GT, GE)) {
                Token op = parser.advance();
                parser.enterNesting("Expression");
                chain++;
                BinaryOp binaryOp;
                switch (op.getType()) {
                    case LT: binaryOp = BinaryOp.LT; break;
                    case LE: binaryOp = BinaryOp.LE; break;
                    case GT: binaryOp = BinaryOp.GT; break;
                    default: binaryOp = BinaryOp.GE; break;
                }
                Expression right = parseAdditive();
                left = new BinaryExpr(parser.locationOf(op), left, binaryOp, right);
            }
            return left;
        } finally {
            parser.exitNesting(chain);
        }
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        int chain = 0;
        try {
            while (parser.checkAny(PLUS, MINUS)) {
                Token op = parser.advance();
                parser.enterNesting("Expression");
                chain++;
                Expression right = parseMultiplicative();
                left = new BinaryExpr(parser.locationOf(op), left,
                        op.is(PLUS) ? BinaryOp.ADD : BinaryOp.SUB, right);
            }
            return left;
        } finally {
            parser.exitNesting(chain);
        }
    }

    private Expression parseMultiplicative() {
        Expression left = parseUnary();
        int chain = 0;
        try {
            while (parser.checkAny(MUL, DIV)) {
                Token op = parser.advance();
                parser.enterNesting("Expression");
                chain++;
                Expression right = parseUnary();
                left = new BinaryExpr(parser.locationOf(op), left,
                        op.is(MUL) ? BinaryOp.MUL : BinaryOp.DIV, right);
            }
            return left;
        } finally {
            parser.exitNesting(chain);
        }
    }

    private Expression parseUnary() {
        if (parser.checkAny(MINUS, NOT)) {
            Token op = parser.advance();
            parser.enterNesting("Expression");
            try {
                Expression operand = parseUnary();
                return new UnaryExpr(parser.locationOf(op),
                        op.is(MINUS) ? UnaryOp.NEG : UnaryOp.NOT, operand);
            } finally {
                parser.exitNesting(1);
            }
        }
        return parsePostfix();
    }

    private Expression parsePostfix() {
        Expression expr = parsePrimary();
        int chain = 0;
        try {
            while (true) {
                if (parser.check(DOT)) {
                    Token dot = parser.advance();
                    parser.enterNesting("Expression");
                    chain++;
                    String member = parser.expectIdentifier("field or method name after '.'");
                    if (parser.check(LPAREN)) {
                        expr = new MethodCallExpr(parser.locationOf(dot), expr, member, parseArguments());
                    } else {
                        expr = new MemberExpr(parser.locationOf(dot), expr, member);
                    }
                } else if (parser.check(LPAREN)) {
                    if (!(expr instanceof Identifier)) {
                        throw parser.error("Only named functions can be called");
                    }
                    expr = new CallExpr(expr.getLocation(), (Identifier) expr, parseArguments());
                } else {
                    return expr;
                }
            }
        } finally {
            parser.exitNesting(chain);
        }
    }

    private List<Expression> parseArguments() {
        Token open = parser.expect(LPAREN, "Expected '('");
        List<Expression> args = new ArrayList<>();
        if (!parser.check(RPAREN)) {
            do {
                args.add(parseNested());
            } while (parser.match(COMMA));
        }
        parser.expectClosing(RPAREN, open);
        return args;
    }

    private Expression parsePrimary() {
        Token token = parser.current;
        SourceLocation loc = parser.location();
        switch (token.getType()) {
            case INT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.INT);
            case FLOAT_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.FLOAT);
            case STRING_LITERAL:
                parser.advance();
                return new Literal(loc, token.getLiteral(), Literal.LiteralKind.STRING);
            case KW_TRUE:
                parser.advance();
                return new Literal(loc, Boolean.TRUE, Literal.LiteralKind.BOOL);
            case KW_FALSE:
                parser.advance();
                return new Literal(loc, Boolean.FALSE, Literal.LiteralKind.BOOL);
            case LPAREN: {
                Token open = parser.advance();
                Expression inner = parseNested();
                parser.expectClosing(RPAREN, open);
                return inner;
            }
            case IDENTIFIER: {
                QualifiedName name = parser.parsePath("name");
                if (parser.check(LBRACE) && !parser.noStructLiteral) {
                    return parseStructLiteral(loc, name);
                }
                return new Identifier(loc, name);
            }
            default:
                throw parser.error("Expected expression", "expression");
        }
    }

    /**
     * Name { field: expr, ... }
     */
    private Expression parseStructLiteral(SourceLocation loc, QualifiedName name) {
        Token open = parser.advance(); // {
        List<StructLiteral.FieldInit> fields = new ArrayList<>();
        while (!parser.check(RBRACE)) {
            Token fieldToken = parser.current;
            String fieldName = parser.expectIdentifier("field name");
            parser.expect(COLON, "Expected ':' after field name");
            Expression value = parseNested();
            fields.add(new StructLiteral.FieldInit(parser.locationOf(fieldToken), fieldName, value));
            if (!parser.match(COMMA)) {
                break;
            }
        }
        parser.expectClosing(RBRACE, open);
        return new StructLiteral(loc, name, fields);
    }
}
