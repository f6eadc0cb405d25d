package com.pgslang.ir.bytecode;

/**
 * 一元运算种类
 */
public enum UnaryKind {
    NEG, NOT;

    private static final UnaryKind[] VALUES = values();

    public static UnaryKind of(int ordinal) {
        return VALUES[ordinal];
    }
}
