package com.pgslang.compiler.lexer;

import com.pgslang.compiler.PgsCompileException;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 词法错误：未闭合的字符串、非法数字字面量、非法字符等
 */
public class LexException extends PgsCompileException {

    public LexException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public String getStage() {
        return "lex";
    }
}
