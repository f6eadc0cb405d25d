package com.pgslang.compiler.analysis;

/**
 * 符号种类
 */
public enum SymbolKind {
    MODULE,
    FUNCTION,
    NATIVE_FUNCTION,
    METHOD,
    CONTAINER,
    IMPORT_ALIAS,
    PARAMETER,
    LOCAL
}
