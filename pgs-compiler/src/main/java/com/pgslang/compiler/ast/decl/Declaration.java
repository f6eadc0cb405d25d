package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 模块级条目的基类：mod、cont、impl、fn、import
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
