package com.pgslang.compiler.ast.type;

import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.QualifiedName;

/**
 * 类型引用
 *
 * <p>内置类型（int、float 等）与容器名在语法上相同，由解析器区分。</p>
 */
public class TypeRef extends AstNode {
    private final QualifiedName name;

    public TypeRef(SourceLocation location, QualifiedName name) {
        super(location);
        this.name = name;
    }

    public QualifiedName getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTypeRef(this, context);
    }

    @Override
    public String toString() {
        return name.getFullName();
    }
}
