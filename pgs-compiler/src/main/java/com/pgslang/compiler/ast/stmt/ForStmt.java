package com.pgslang.compiler.ast.stmt;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.expr.Expression;

/**
 * for 循环 {@code for x in expr { ... }}
 */
public class ForStmt extends Statement {
    private final String variable;
    private final SourceLocation variableLocation;
    private final Expression iterable;
    private final Block body;

    public ForStmt(SourceLocation location, String variable, SourceLocation variableLocation,
                   Expression iterable, Block body) {
        super(location);
        this.variable = variable;
        this.variableLocation = variableLocation;
        this.iterable = iterable;
        this.body = body;
    }

    public String getVariable() {
        return variable;
    }

    public SourceLocation getVariableLocation() {
        return variableLocation;
    }

    public Expression getIterable() {
        return iterable;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitForStmt(this, context);
    }
}
