package com.pgslang.ir.bytecode;

import pgs.runtime.ValueKind;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 原生函数调用点引用的绑定：稳定名称和脚本侧声明的签名。
 * 运行时按名称到 {@link pgs.runtime.NativeRegistry} 中链接。
 */
public final class NativeBinding {

    private final String name;
    private final List<ValueKind> paramKinds;
    private final ValueKind returnKind;
    private final List<String> paramContainers;
    private final String returnContainer;

    public NativeBinding(String name, List<ValueKind> paramKinds, ValueKind returnKind) {
        this(name, paramKinds, Collections.<String>nCopies(paramKinds.size(), null), returnKind, null);
    }

    /**
     * @param paramContainers 每个参数的容器全限定名，非容器参数为 null
     * @param returnContainer 返回容器的全限定名，非容器返回为 null
     */
    public NativeBinding(String name, List<ValueKind> paramKinds, List<String> paramContainers,
                         ValueKind returnKind, String returnContainer) {
        if (paramContainers.size() != paramKinds.size()) {
            throw new IllegalArgumentException("Parameter container count mismatch for " + name);
        }
        this.name = name;
        this.paramKinds = Collections.unmodifiableList(paramKinds);
        this.paramContainers = Collections.unmodifiableList(paramContainers);
        this.returnKind = returnKind;
        this.returnContainer = returnContainer;
    }

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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NativeBinding)) return false;
        NativeBinding that = (NativeBinding) o;
        return name.equals(that.name) && paramKinds.equals(that.paramKinds) && returnKind == that.returnKind
                && paramContainers.equals(that.paramContainers)
                && Objects.equals(returnContainer, that.returnContainer);
    }

    @Override
    public int hashCode() {
        int h = (name.hashCode() * 31 + paramKinds.hashCode()) * 31 + returnKind.hashCode();
        return h * 31 + paramContainers.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < paramKinds.size(); i++) {
            if (i > 0) sb.append(", ");
            String container = paramContainers.get(i);
            sb.append(container != null ? container : paramKinds.get(i).getTypeName());
        }
        return sb.append(") ~ ")
                .append(returnContainer != null ? returnContainer : returnKind.getTypeName())
                .toString();
    }
}
