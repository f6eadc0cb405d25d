package com.pgslang.compiler.ast.stmt;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.expr.Expression;

/**
 * if 语句
 *
 * <p>{@code else if} 被解析为只含一个嵌套 IfStmt 的 else 块。</p>
 */
public class IfStmt extends Statement {
    private final Expression condition;
    private final Block thenBranch;
    private final Block elseBranch;  // 可为 null

    public IfStmt(SourceLocation location, Expression condition, Block thenBranch, Block elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Block getThenBranch() {
        return thenBranch;
    }

    public Block getElseBranch() {
        return elseBranch;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitIfStmt(this, context);
    }
}
