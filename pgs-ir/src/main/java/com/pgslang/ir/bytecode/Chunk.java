package com.pgslang.ir.bytecode;

import pgs.runtime.ValueKind;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 编译后的函数体：指令序列、常量池和局部槽位数。编译完成后不可变。
 */
public final class Chunk {

    private final String name;
    private final List<ValueKind> paramKinds;
    private final ValueKind returnKind;
    private final List<String> paramContainers;
    private final String returnContainer;
    private final int localCount;
    private final List<Instruction> instructions;
    private final ConstantPool constants;

    public Chunk(String name, List<ValueKind> paramKinds, ValueKind returnKind, int localCount,
                 List<Instruction> instructions, ConstantPool constants) {
        this(name, paramKinds, Collections.<String>nCopies(paramKinds.size(), null), returnKind, null,
                localCount, instructions, constants);
    }

    /**
     * @param paramContainers 每个参数的容器全限定名，非容器参数为 null
     * @param returnContainer 返回容器的全限定名，非容器返回为 null
     */
    public Chunk(String name, List<ValueKind> paramKinds, List<String> paramContainers,
                 ValueKind returnKind, String returnContainer, int localCount,
                 List<Instruction> instructions, ConstantPool constants) {
        if (paramContainers.size() != paramKinds.size()) {
            throw new IllegalArgumentException("Parameter container count mismatch for " + name);
        }
        this.name = name;
        this.paramKinds = Collections.unmodifiableList(paramKinds);
        this.paramContainers = Collections.unmodifiableList(paramContainers);
        this.returnKind = returnKind;
        this.returnContainer = returnContainer;
        this.localCount = localCount;
        this.instructions = Collections.unmodifiableList(instructions);
        this.constants = constants;
    }

    /** 全限定名，如 root::math::add */
    public String getName() {
        return name;
    }

    public List<ValueKind> getParamKinds() {
        return paramKinds;
    }

    public int getArity() {
        return paramKinds.size();
    }

    public ValueKind getReturnKind() {
        return returnKind;
    }

    public List<String> getParamContainers() {
        return paramContainers;
    }

    public String getReturnContainer() {
        return returnContainer;
    }

    /** 参数 i 的类型名，容器参数取其全限定名 */
    public String getParamTypeName(int i) {
        String container = paramContainers.get(i);
        return container != null ? container : paramKinds.get(i).getTypeName();
    }

    public String getReturnTypeName() {
        return returnContainer != null ? returnContainer : returnKind.getTypeName();
    }

    /** 局部槽位总数（含参数） */
    public int getLocalCount() {
        return localCount;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Instruction getInstruction(int ip) {
        return instructions.get(ip);
    }

    public int size() {
        return instructions.size();
    }

    public ConstantPool getConstants() {
        return constants;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk)) return false;
        Chunk that = (Chunk) o;
        return localCount == that.localCount
                && name.equals(that.name)
                && paramKinds.equals(that.paramKinds)
                && returnKind == that.returnKind
                && paramContainers.equals(that.paramContainers)
                && Objects.equals(returnContainer, that.returnContainer)
                && instructions.equals(that.instructions)
                && constants.equals(that.constants);
    }

    @Override
    public int hashCode() {
        int h = name.hashCode();
        h = 31 * h + paramKinds.hashCode();
        h = 31 * h + returnKind.hashCode();
        h = 31 * h + paramContainers.hashCode();
        h = 31 * h + Objects.hashCode(returnContainer);
        h = 31 * h + localCount;
        h = 31 * h + instructions.hashCode();
        return 31 * h + constants.hashCode();
    }

    @Override
    public String toString() {
        return "Chunk(" + name + ", " + instructions.size() + " instructions)";
    }
}
