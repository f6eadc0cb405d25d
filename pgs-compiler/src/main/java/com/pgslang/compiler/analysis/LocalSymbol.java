package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.types.PgsType;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 局部变量或参数，绑定到帧内的固定槽位
 */
public final class LocalSymbol extends Symbol {

    private final int slot;
    private final PgsType type;

    LocalSymbol(int id, String name, SymbolKind kind, int slot, PgsType type, SourceLocation location) {
        super(id, name, kind, location);
        this.slot = slot;
        this.type = type;
    }

    public int getSlot() {
        return slot;
    }

    public PgsType getType() {
        return type;
    }

    @Override
    public String getQualifiedName() {
        return getName();
    }
}
