package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 容器（记录类型）声明 {@code cont: Name { x: float; y: float; }}
 */
public class ContainerDecl extends Declaration {
    private final List<FieldDecl> fields;

    public ContainerDecl(SourceLocation location, String name, List<FieldDecl> fields) {
        super(location, name);
        this.fields = fields;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitContainerDecl(this, context);
    }
}
