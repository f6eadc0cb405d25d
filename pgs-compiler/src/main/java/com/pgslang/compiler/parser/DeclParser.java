package com.pgslang.compiler.parser;

import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.*;
import com.pgslang.compiler.ast.stmt.Block;
import com.pgslang.compiler.ast.type.TypeRef;
import com.pgslang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.pgslang.compiler.lexer.TokenType.*;

/**
 * 模块级条目解析辅助类
 */
class DeclParser {

    final Parser parser;

    DeclParser(Parser parser) {
        this.parser = parser;
    }

    Declaration parseItem() {
        if (parser.check(KW_MOD)) {
            return parseModule();
        }
        if (parser.check(KW_CONT)) {
            return parseContainer();
        }
        if (parser.check(KW_IMPL)) {
            return parseImpl();
        }
        if (parser.check(KW_FN)) {
            return parseFunction();
        }
        if (parser.check(KW_IMPORT)) {
            return parseImport();
        }
        throw parser.error("Unexpected token at module level", "'mod', 'cont', 'impl', 'fn' or 'import'");
    }

    /**
     * mod: name { Item* }
     */
    ModuleDecl parseModule() {
        SourceLocation loc = parser.location();
        parser.advance(); // mod
        parser.expect(COLON, "Expected ':' after 'mod'");
        String name = parser.expectIdentifier("module name");
        Token open = parser.expect(LBRACE, "Expected '{' to open module body");
        parser.enterNesting("Module");
        try {
            List<Declaration> items = new ArrayList<>();
            while (!parser.check(RBRACE) && !parser.isAtEnd()) {
                items.add(parseItem());
            }
            parser.expectClosing(RBRACE, open);
            return new ModuleDecl(loc, name, items);
        } finally {
            parser.exitNesting(1);
        }
    }

    /**
     * cont: Name { field: Type; ... }
     */
    ContainerDecl parseContainer() {
        SourceLocation loc = parser.location();
        parser.advance(); // cont
        parser.expect(COLON, "Expected ':' after 'cont'");
        String name = parser.expectIdentifier("container name");
        Token open = parser.expect(LBRACE, "Expected '{' to open container body");
        List<FieldDecl> fields = new ArrayList<>();
        while (parser.check(IDENTIFIER)) {
            SourceLocation fieldLoc = parser.location();
            String fieldName = parser.advance().getLexeme();
            parser.expect(COLON, "Expected ':' after field name");
            TypeRef type = parseType();
            parser.expect(SEMICOLON, "Expected ';' after field declaration");
            fields.add(new FieldDecl(fieldLoc, fieldName, type));
        }
        parser.expectClosing(RBRACE, open);
        return new ContainerDecl(loc, name, fields);
    }

    /**
     * impl: Name { fn* }
     */
    ImplDecl parseImpl() {
        SourceLocation loc = parser.location();
        parser.advance(); // impl
        parser.expect(COLON, "Expected ':' after 'impl'");
        String name = parser.expectIdentifier("container name");
        Token open = parser.expect(LBRACE, "Expected '{' to open impl body");
        List<FunDecl> methods = new ArrayList<>();
        while (parser.check(KW_FN)) {
            methods.add(parseFunction());
        }
        parser.expectClosing(RBRACE, open);
        return new ImplDecl(loc, name, methods);
    }

    /**
     * fn: name(params) ~ Type { ... }   或以 ';' 结尾的原生函数声明
     */
    FunDecl parseFunction() {
        SourceLocation loc = parser.location();
        parser.expect(KW_FN, "Expected 'fn'");
        parser.expect(COLON, "Expected ':' after 'fn'");
        String name = parser.expectIdentifier("function name");

        Token open = parser.expect(LPAREN, "Expected '(' after function name");
        List<Parameter> params = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        if (!parser.check(RPAREN)) {
            do {
                Token paramToken = parser.current;
                String paramName = parser.expectIdentifier("parameter name");
                if (!seen.add(paramName)) {
                    throw new ParseException("Duplicate parameter '" + paramName + "'",
                            paramToken, parser.fileName);
                }
                parser.expect(COLON, "Expected ':' after parameter name");
                params.add(new Parameter(parser.locationOf(paramToken), paramName, parseType()));
            } while (parser.match(COMMA));
        }
        parser.expectClosing(RPAREN, open);

        TypeRef returnType = null;
        if (parser.match(TILDE)) {
            returnType = parseType();
        }

        Block body = null;
        if (!parser.match(SEMICOLON)) {
            if (!parser.check(LBRACE)) {
                throw parser.error("Expected function body or ';'", "'{' or ';'");
            }
            body = parser.stmtParser.parseBlock();
        }
        return new FunDecl(loc, name, params, returnType, body);
    }

    /**
     * import a::b::c (= alias)? ;
     */
    ImportDecl parseImport() {
        SourceLocation loc = parser.location();
        parser.advance(); // import
        QualifiedName path = parser.parsePath("import path");
        String alias = null;
        if (parser.match(ASSIGN)) {
            alias = parser.expectIdentifier("import alias");
        }
        parser.expect(SEMICOLON, "Expected ';' after import");
        return new ImportDecl(loc, path, alias);
    }

    TypeRef parseType() {
        SourceLocation loc = parser.location();
        return new TypeRef(loc, parser.parsePath("type name"));
    }
}
