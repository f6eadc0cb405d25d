package com.pgslang.compiler.analysis.types;

import pgs.runtime.ValueKind;

/**
 * 静态类型描述符
 *
 * <p>类型兼容性是严格相等：没有隐式转换，int 不会提升为 float。</p>
 */
public abstract class PgsType {

    /** 源码中的类型名 */
    public abstract String getName();

    /** 对应的运行时值种类 */
    public abstract ValueKind getValueKind();

    /** 容器类型的全限定名，其他类型为 null */
    public String getContainerName() {
        return null;
    }

    public boolean isUnit() {
        return false;
    }

    /** 是否支持 + - * / 与大小比较 */
    public boolean isNumeric() {
        return false;
    }

    @Override
    public String toString() {
        return getName();
    }
}
