package com.pgslang.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点构建后不再修改；解析阶段的结果以节点为键保存在旁路表中。</p>
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
