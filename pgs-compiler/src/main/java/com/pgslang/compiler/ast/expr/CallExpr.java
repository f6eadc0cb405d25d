package com.pgslang.compiler.ast.expr;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 函数调用 {@code f(a, b)} 或 {@code mod::f(a)}
 *
 * <p>函数不是一等值，被调用方总是一个名称。</p>
 */
public class CallExpr extends Expression {
    private final Identifier callee;
    private final List<Expression> arguments;

    public CallExpr(SourceLocation location, Identifier callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = arguments;
    }

    public Identifier getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
