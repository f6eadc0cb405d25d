package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.type.TypeRef;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final TypeRef type;

    public Parameter(SourceLocation location, String name, TypeRef type) {
        super(location);
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitParameter(this, context);
    }
}
