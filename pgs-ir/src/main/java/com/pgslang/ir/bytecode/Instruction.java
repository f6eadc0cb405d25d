package com.pgslang.ir.bytecode;

import pgs.runtime.ValueKind;

/**
 * 字节码指令：操作码、两个整数操作数和源码行号。
 */
public final class Instruction {

    private final Opcode op;
    private final int a;
    private final int b;
    private final int line;

    public Instruction(Opcode op, int a, int b, int line) {
        this.op = op;
        this.a = a;
        this.b = b;
        this.line = line;
    }

    public Instruction(Opcode op, int line) {
        this(op, 0, 0, line);
    }

    public Opcode getOp() { return op; }
    public int getA() { return a; }
    public int getB() { return b; }
    public int getLine() { return line; }

    /** 回填跳转目标 */
    Instruction withTarget(int target) {
        return new Instruction(op, target, b, line);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction that = (Instruction) o;
        return op == that.op && a == that.a && b == that.b && line == that.line;
    }

    @Override
    public int hashCode() {
        int h = op.hashCode();
        h = 31 * h + a;
        h = 31 * h + b;
        return 31 * h + line;
    }

    @Override
    public String toString() {
        switch (op) {
            case BINARY:
                return op.name() + " " + BinaryKind.of(a).name() + " " + ValueKind.values()[b].getTypeName();
            case UNARY:
                return op.name() + " " + UnaryKind.of(a).name() + " " + ValueKind.values()[b].getTypeName();
            case CALL:
            case CALL_NATIVE:
                return op.name() + " " + a + " " + b;
            case PUSH_CONST:
            case LOAD_LOCAL:
            case STORE_LOCAL:
            case LOAD_FIELD:
            case STORE_FIELD:
            case NEW_STRUCT:
            case JUMP:
            case JUMP_IF_FALSE:
                return op.name() + " " + a;
            default:
                return op.name();
        }
    }
}
