package com.pgslang.compiler.analysis.types;

import pgs.runtime.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数签名。原生函数的签名同时也是它与宿主之间的调用约定。
 */
public final class FunctionType extends PgsType {

    private final List<PgsType> paramTypes;
    private final PgsType returnType;

    public FunctionType(List<PgsType> paramTypes, PgsType returnType) {
        this.paramTypes = Collections.unmodifiableList(new ArrayList<>(paramTypes));
        this.returnType = returnType;
    }

    public List<PgsType> getParamTypes() {
        return paramTypes;
    }

    public PgsType getReturnType() {
        return returnType;
    }

    public int getArity() {
        return paramTypes.size();
    }

    public List<ValueKind> getParamKinds() {
        List<ValueKind> kinds = new ArrayList<>(paramTypes.size());
        for (PgsType t : paramTypes) {
            kinds.add(t.getValueKind());
        }
        return kinds;
    }

    /** 各参数的容器名，非容器参数为 null */
    public List<String> getParamContainers() {
        List<String> names = new ArrayList<>(paramTypes.size());
        for (PgsType t : paramTypes) {
            names.add(t.getContainerName());
        }
        return names;
    }

    @Override
    public String getName() {
        StringBuilder sb = new StringBuilder("fn(");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).getName());
        }
        return sb.append(") ~ ").append(returnType.getName()).toString();
    }

    @Override
    public ValueKind getValueKind() {
        throw new UnsupportedOperationException("Functions are not values");
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return paramTypes.equals(that.paramTypes) && returnType.equals(that.returnType);
    }

    @Override
    public int hashCode() {
        return paramTypes.hashCode() * 31 + returnType.hashCode();
    }
}
