package com.pgslang.compiler.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 函数体内的词法作用域
 */
public final class Scope {

    public enum ScopeType {
        FUNCTION,   // 参数
        BLOCK,      // 代码块
        LOOP        // for 循环变量
    }

    private final ScopeType type;
    private final Scope parent;
    private final Map<String, LocalSymbol> symbols = new LinkedHashMap<>();

    public Scope(ScopeType type, Scope parent) {
        this.type = type;
        this.parent = parent;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }

    /** 注册符号到当前作用域，同名已存在时返回 false */
    public boolean define(LocalSymbol symbol) {
        if (symbols.containsKey(symbol.getName())) {
            return false;
        }
        symbols.put(symbol.getName(), symbol);
        return true;
    }

    /** 从当前作用域向上查找，内层优先 */
    public LocalSymbol resolve(String name) {
        for (Scope s = this; s != null; s = s.parent) {
            LocalSymbol symbol = s.symbols.get(name);
            if (symbol != null) return symbol;
        }
        return null;
    }

    /** 仅查找当前作用域 */
    public LocalSymbol resolveLocal(String name) {
        return symbols.get(name);
    }
}
