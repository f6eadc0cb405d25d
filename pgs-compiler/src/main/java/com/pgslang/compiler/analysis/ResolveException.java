package com.pgslang.compiler.analysis;

import com.pgslang.compiler.PgsCompileException;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 名称解析与声明级类型检查错误
 */
public class ResolveException extends PgsCompileException {

    public enum Kind {
        UNKNOWN_SYMBOL,
        DUPLICATE_DEFINITION,
        IMPORT_CYCLE,
        UNRESOLVABLE_IMPORT,
        TYPE_MISMATCH,
        MISSING_RETURN,
        INVALID_ASSIGNMENT,
        RECURSIVE_CONTAINER
    }

    private final Kind kind;
    private final String symbolName;

    public ResolveException(Kind kind, String message, String symbolName, SourceLocation location) {
        super(message, location);
        this.kind = kind;
        this.symbolName = symbolName;
    }

    public Kind getKind() {
        return kind;
    }

    /** 相关的符号名（如未解析的名称），可能为 null */
    public String getSymbolName() {
        return symbolName;
    }

    @Override
    public String getStage() {
        return "resolve";
    }
}
