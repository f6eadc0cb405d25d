package com.pgslang.compiler.ast.expr;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.QualifiedName;

/**
 * 名称引用：局部变量、函数，或 {@code a::b::f} 形式的限定名
 */
public class Identifier extends Expression {
    private final QualifiedName name;

    public Identifier(SourceLocation location, QualifiedName name) {
        super(location);
        this.name = name;
    }

    public QualifiedName getName() {
        return name;
    }

    /** 是否为不带 :: 的简单名 */
    public boolean isSimple() {
        return name.isSimple();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIdentifier(this, context);
    }

    @Override
    public String toString() {
        return name.getFullName();
    }
}
