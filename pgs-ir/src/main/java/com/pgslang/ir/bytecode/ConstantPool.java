package com.pgslang.ir.bytecode;

import pgs.runtime.PgsValue;
import pgs.runtime.StructLayout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 常量池：字面量值（{@link PgsValue}）和容器布局（{@link StructLayout}），相同条目只保存一次。
 */
public final class ConstantPool {

    private final List<Object> entries = new ArrayList<>();
    private final Map<Object, Integer> indices = new HashMap<>();

    public int add(PgsValue value) {
        return intern(value);
    }

    public int add(StructLayout layout) {
        return intern(layout);
    }

    private int intern(Object entry) {
        Integer existing = indices.get(entry);
        if (existing != null) {
            return existing;
        }
        int index = entries.size();
        entries.add(entry);
        indices.put(entry, index);
        return index;
    }

    public Object get(int index) {
        return entries.get(index);
    }

    public PgsValue getValue(int index) {
        Object entry = entries.get(index);
        if (!(entry instanceof PgsValue)) {
            throw new IllegalStateException("Constant #" + index + " is not a value: " + entry);
        }
        return (PgsValue) entry;
    }

    public StructLayout getLayout(int index) {
        Object entry = entries.get(index);
        if (!(entry instanceof StructLayout)) {
            throw new IllegalStateException("Constant #" + index + " is not a struct layout: " + entry);
        }
        return (StructLayout) entry;
    }

    public int size() {
        return entries.size();
    }

    public List<Object> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstantPool)) return false;
        return entries.equals(((ConstantPool) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
