package com.pgslang.compiler.analysis;

import com.pgslang.compiler.ast.decl.ImportDecl;

/**
 * 导入别名，解析后指向唯一的目标符号
 */
public final class AliasSymbol extends Symbol {

    private final ModuleSymbol module;
    private final ImportDecl decl;
    private Symbol target;

    AliasSymbol(int id, ModuleSymbol module, ImportDecl decl) {
        super(id, decl.getAlias(), SymbolKind.IMPORT_ALIAS, decl.getLocation());
        this.module = module;
        this.decl = decl;
    }

    public ModuleSymbol getModule() {
        return module;
    }

    public ImportDecl getDecl() {
        return decl;
    }

    /** 最终目标（已跟随别名链），解析前为 null */
    public Symbol getTarget() {
        return target;
    }

    void setTarget(Symbol target) {
        this.target = target;
    }

    @Override
    public String getQualifiedName() {
        return module.qualify(getName());
    }
}
