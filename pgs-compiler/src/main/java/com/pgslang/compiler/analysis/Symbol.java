package com.pgslang.compiler.analysis;

import com.pgslang.compiler.ast.SourceLocation;

/**
 * 符号基类
 *
 * <p>每个符号在一次解析内有唯一的数字 id，AST 节点通过旁路表引用符号。</p>
 */
public abstract class Symbol {
    private final int id;
    private final String name;
    private final SymbolKind kind;
    private final SourceLocation location;

    protected Symbol(int id, String name, SymbolKind kind, SourceLocation location) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.location = location;
    }

    public int getId() { return id; }
    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public SourceLocation getLocation() { return location; }

    /** 全限定名，局部符号返回简单名 */
    public abstract String getQualifiedName();

    @Override
    public String toString() {
        return kind + " " + getQualifiedName() + "#" + id;
    }
}
