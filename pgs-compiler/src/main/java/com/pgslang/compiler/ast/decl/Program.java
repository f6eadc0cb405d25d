package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;

import java.util.List;

/**
 * 程序（一个源文件），其条目构成根模块
 */
public class Program extends AstNode {
    private final String fileName;
    private final List<Declaration> items;

    public Program(SourceLocation location, String fileName, List<Declaration> items) {
        super(location);
        this.fileName = fileName;
        this.items = items;
    }

    public String getFileName() {
        return fileName;
    }

    public List<Declaration> getItems() {
        return items;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitProgram(this, context);
    }
}
