package com.pgslang.compiler.ast.expr;

import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
