package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 模块声明 {@code mod: name { ... }}
 */
public class ModuleDecl extends Declaration {
    private final List<Declaration> items;

    public ModuleDecl(SourceLocation location, String name, List<Declaration> items) {
        super(location, name);
        this.items = items;
    }

    public List<Declaration> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitModuleDecl(this, context);
    }
}
