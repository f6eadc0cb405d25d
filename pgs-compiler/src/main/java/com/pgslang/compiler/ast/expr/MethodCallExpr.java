package com.pgslang.compiler.ast.expr;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 方法调用 {@code recv.m(args)}，在编译期静态绑定到 impl 中的函数
 */
public class MethodCallExpr extends Expression {
    private final Expression receiver;
    private final String method;
    private final List<Expression> arguments;

    public MethodCallExpr(SourceLocation location, Expression receiver, String method, List<Expression> arguments) {
        super(location);
        this.receiver = receiver;
        this.method = method;
        this.arguments = arguments;
    }

    public Expression getReceiver() {
        return receiver;
    }

    public String getMethod() {
        return method;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitMethodCallExpr(this, context);
    }
}
