package com.pgslang.ir.bytecode;

import pgs.runtime.PgsValue;
import pgs.runtime.StructLayout;
import pgs.runtime.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Chunk 构建器：顺序发射指令，跳转先以占位目标发射、稍后回填。
 */
public final class ChunkBuilder {

    private static final int UNPATCHED = -1;

    private final String name;
    private final List<ValueKind> paramKinds;
    private final ValueKind returnKind;
    private List<String> paramContainers;
    private String returnContainer;
    private final List<Instruction> code = new ArrayList<>();
    private final ConstantPool constants = new ConstantPool();

    public ChunkBuilder(String name, List<ValueKind> paramKinds, ValueKind returnKind) {
        this.name = name;
        this.paramKinds = paramKinds;
        this.returnKind = returnKind;
    }

    /** 记录容器参数与返回值的全限定名，供运行时在入口和原生边界核对 */
    public ChunkBuilder containers(List<String> paramContainers, String returnContainer) {
        this.paramContainers = paramContainers;
        this.returnContainer = returnContainer;
        return this;
    }

    /** 下一条指令的地址 */
    public int offset() {
        return code.size();
    }

    public int emit(Opcode op, int a, int b, int line) {
        code.add(new Instruction(op, a, b, line));
        return code.size() - 1;
    }

    public int emit(Opcode op, int a, int line) {
        return emit(op, a, 0, line);
    }

    public int emit(Opcode op, int line) {
        return emit(op, 0, 0, line);
    }

    public int emitConst(PgsValue value, int line) {
        return emit(Opcode.PUSH_CONST, constants.add(value), line);
    }

    public int emitNewStruct(StructLayout layout, int line) {
        return emit(Opcode.NEW_STRUCT, constants.add(layout), line);
    }

    /** 发射目标待定的跳转，返回其地址供 {@link #patch} 使用 */
    public int emitJump(Opcode op, int line) {
        if (!op.isJump()) {
            throw new IllegalArgumentException("Not a jump: " + op);
        }
        return emit(op, UNPATCHED, line);
    }

    /** 发射跳往已知地址的跳转 */
    public int emitJumpTo(Opcode op, int target, int line) {
        return emit(op, target, line);
    }

    public void patch(int jumpAddress, int target) {
        Instruction jump = code.get(jumpAddress);
        if (!jump.getOp().isJump() || jump.getA() != UNPATCHED) {
            throw new IllegalStateException("Instruction " + jumpAddress + " is not an open jump: " + jump);
        }
        code.set(jumpAddress, jump.withTarget(target));
    }

    /** 把跳转回填到当前地址 */
    public void patchHere(int jumpAddress) {
        patch(jumpAddress, offset());
    }

    public Chunk build(int localCount) {
        for (int i = 0; i < code.size(); i++) {
            Instruction inst = code.get(i);
            if (inst.getOp().isJump() && inst.getA() == UNPATCHED) {
                throw new IllegalStateException("Unpatched jump at " + i + " in " + name);
            }
        }
        List<String> containers = paramContainers != null
                ? new ArrayList<>(paramContainers)
                : new ArrayList<String>(Collections.<String>nCopies(paramKinds.size(), null));
        return new Chunk(name, new ArrayList<>(paramKinds), containers, returnKind, returnContainer,
                localCount, new ArrayList<>(code), constants);
    }
}
