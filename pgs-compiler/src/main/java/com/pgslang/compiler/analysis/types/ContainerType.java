package com.pgslang.compiler.analysis.types;

import com.pgslang.compiler.analysis.ContainerSymbol;
import pgs.runtime.ValueKind;

/**
 * 容器类型，与声明一一对应
 */
public final class ContainerType extends PgsType {

    private final ContainerSymbol symbol;

    public ContainerType(ContainerSymbol symbol) {
        this.symbol = symbol;
    }

    public ContainerSymbol getSymbol() {
        return symbol;
    }

    @Override
    public String getName() {
        return symbol.getQualifiedName();
    }

    @Override
    public String getContainerName() {
        return symbol.getQualifiedName();
    }

    @Override
    public ValueKind getValueKind() {
        return ValueKind.STRUCT;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ContainerType && ((ContainerType) o).symbol == symbol;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(symbol);
    }
}
