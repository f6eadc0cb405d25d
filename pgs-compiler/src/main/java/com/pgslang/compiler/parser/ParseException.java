package com.pgslang.compiler.parser;

import com.pgslang.compiler.PgsCompileException;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.lexer.Token;

/**
 * 解析异常：意外的 token、不匹配的分隔符、缺少终结符
 */
public class ParseException extends PgsCompileException {
    private final Token token;
    private final String expected;

    public ParseException(String message, Token token, String expected, String fileName) {
        super(message, locationOf(token, fileName));
        this.token = token;
        this.expected = expected;
    }

    public ParseException(String message, Token token, String fileName) {
        this(message, token, null, fileName);
    }

    private static SourceLocation locationOf(Token token, String fileName) {
        if (token == null) {
            return SourceLocation.UNKNOWN;
        }
        return new SourceLocation(fileName, token.getLine(), token.getColumn(),
                token.getOffset(), token.getLexeme().length());
    }

    public Token getToken() {
        return token;
    }

    /** 期望的内容描述，可能为 null */
    public String getExpected() {
        return expected;
    }

    /** 实际遇到的 token 描述 */
    public String getFound() {
        return token != null ? token.describe() : "nothing";
    }

    @Override
    public String getStage() {
        return "parse";
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(getRawMessage());
        if (token != null) {
            sb.append(" at ").append(getLocation());
            sb.append(" (found ").append(getFound()).append(")");
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
