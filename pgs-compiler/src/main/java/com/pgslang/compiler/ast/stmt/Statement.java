package com.pgslang.compiler.ast.stmt;

import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
