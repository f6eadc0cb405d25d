package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 导入声明
 *
 * <ul>
 *   <li>{@code import math::add = plus;}：绑定别名 plus</li>
 *   <li>{@code import std::println;}：别名取路径最后一段</li>
 * </ul>
 */
public class ImportDecl extends Declaration {
    private final QualifiedName path;
    private final boolean explicitAlias;

    public ImportDecl(SourceLocation location, QualifiedName path, String alias) {
        super(location, alias != null ? alias : path.getLast());
        this.path = path;
        this.explicitAlias = alias != null;
    }

    public QualifiedName getPath() {
        return path;
    }

    public String getAlias() {
        return name;
    }

    public boolean hasExplicitAlias() {
        return explicitAlias;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
