package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.types.PgsType;

/**
 * for 循环的隐藏槽位：被迭代的序列、当前下标，以及循环变量
 */
public final class ForLoopSlots {
    private final int sequenceSlot;
    private final int indexSlot;
    private final LocalSymbol variable;
    private final PgsType sequenceType;

    ForLoopSlots(int sequenceSlot, int indexSlot, LocalSymbol variable, PgsType sequenceType) {
        this.sequenceSlot = sequenceSlot;
        this.indexSlot = indexSlot;
        this.variable = variable;
        this.sequenceType = sequenceType;
    }

    public int getSequenceSlot() { return sequenceSlot; }
    public int getIndexSlot() { return indexSlot; }
    public LocalSymbol getVariable() { return variable; }
    public PgsType getSequenceType() { return sequenceType; }
}
