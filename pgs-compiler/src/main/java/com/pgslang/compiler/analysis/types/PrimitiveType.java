package com.pgslang.compiler.analysis.types;

import pgs.runtime.ValueKind;

/**
 * 内置类型：int、float、string、bool、handle、unit
 *
 * <p>每种只有一个实例，按引用比较。</p>
 */
public final class PrimitiveType extends PgsType {

    public static final PrimitiveType INT = new PrimitiveType(ValueKind.INT);
    public static final PrimitiveType FLOAT = new PrimitiveType(ValueKind.FLOAT);
    public static final PrimitiveType STRING = new PrimitiveType(ValueKind.STRING);
    public static final PrimitiveType BOOL = new PrimitiveType(ValueKind.BOOL);
    public static final PrimitiveType HANDLE = new PrimitiveType(ValueKind.HANDLE);
    public static final PrimitiveType UNIT = new PrimitiveType(ValueKind.UNIT);

    private final ValueKind kind;

    private PrimitiveType(ValueKind kind) {
        this.kind = kind;
    }

    /**
     * 按类型名查找内置类型
     *
     * @return 内置类型，名称不是内置类型时返回 null
     */
    public static PrimitiveType byName(String name) {
        ValueKind kind = ValueKind.fromTypeName(name);
        return kind == null ? null : forKind(kind);
    }

    /** 值种类对应的内置类型；STRUCT 没有对应的内置类型，返回 null */
    public static PrimitiveType forKind(ValueKind kind) {
        switch (kind) {
            case INT: return INT;
            case FLOAT: return FLOAT;
            case STRING: return STRING;
            case BOOL: return BOOL;
            case HANDLE: return HANDLE;
            case UNIT: return UNIT;
            default: return null;
        }
    }

    @Override
    public String getName() {
        return kind.getTypeName();
    }

    @Override
    public ValueKind getValueKind() {
        return kind;
    }

    @Override
    public boolean isUnit() {
        return this == UNIT;
    }

    @Override
    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }
}
