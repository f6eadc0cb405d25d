package com.pgslang.compiler.analysis;

import com.pgslang.compiler.ast.SourceLocation;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模块：一个命名空间，包含子模块、函数、容器和导入别名
 */
public final class ModuleSymbol extends Symbol {
    public static final String ROOT_NAME = "root";

    private final ModuleSymbol parent;
    private final Map<String, Symbol> members = new LinkedHashMap<>();

    public ModuleSymbol(int id, String name, ModuleSymbol parent, SourceLocation location) {
        super(id, name, SymbolKind.MODULE, location);
        this.parent = parent;
    }

    public ModuleSymbol getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    @Override
    public String getQualifiedName() {
        if (parent == null) {
            return getName();
        }
        return parent.getQualifiedName() + "::" + getName();
    }

    /** 子成员的全限定名 */
    public String qualify(String memberName) {
        return getQualifiedName() + "::" + memberName;
    }

    /**
     * 在本模块命名空间中定义符号
     *
     * @return 已存在的同名符号；定义成功时返回 null
     */
    Symbol define(Symbol symbol) {
        Symbol existing = members.get(symbol.getName());
        if (existing != null) {
            return existing;
        }
        members.put(symbol.getName(), symbol);
        return null;
    }

    /** 仅查找本模块 */
    public Symbol lookupLocal(String name) {
        return members.get(name);
    }

    /** 从本模块向外层模块查找 */
    public Symbol lookup(String name) {
        for (ModuleSymbol m = this; m != null; m = m.parent) {
            Symbol s = m.members.get(name);
            if (s != null) return s;
        }
        return null;
    }

    public Collection<Symbol> getMembers() {
        return Collections.unmodifiableCollection(members.values());
    }
}
