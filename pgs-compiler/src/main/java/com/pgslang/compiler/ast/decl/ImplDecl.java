package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 方法块 {@code impl: Name { fn: ... }}，name 为目标容器名
 */
public class ImplDecl extends Declaration {
    private final List<FunDecl> methods;

    public ImplDecl(SourceLocation location, String containerName, List<FunDecl> methods) {
        super(location, containerName);
        this.methods = methods;
    }

    public String getContainerName() {
        return name;
    }

    public List<FunDecl> getMethods() {
        return methods;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImplDecl(this, context);
    }
}
