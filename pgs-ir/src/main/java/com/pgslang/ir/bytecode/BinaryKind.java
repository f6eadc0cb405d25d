package com.pgslang.ir.bytecode;

/**
 * 二元运算种类
 */
public enum BinaryKind {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"),
    EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

    private final String symbol;

    BinaryKind(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    private static final BinaryKind[] VALUES = values();

    public static BinaryKind of(int ordinal) {
        return VALUES[ordinal];
    }
}
