package com.pgslang.compiler.ast.stmt;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 无条件循环 {@code loop { ... }}，只能通过 break 或 return 退出
 */
public class LoopStmt extends Statement {
    private final Block body;

    public LoopStmt(SourceLocation location, Block body) {
        super(location);
        this.body = body;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopStmt(this, context);
    }
}
