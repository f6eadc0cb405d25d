package com.pgslang.compiler.ast.stmt;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.expr.Expression;
import com.pgslang.compiler.ast.type.TypeRef;

/**
 * 变量声明 {@code var name: Type = expr;}
 */
public class VarDeclStmt extends Statement {
    private final String name;
    private final TypeRef type;
    private final Expression initializer;

    public VarDeclStmt(SourceLocation location, String name, TypeRef type, Expression initializer) {
        super(location);
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public TypeRef getType() {
        return type;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDeclStmt(this, context);
    }
}
