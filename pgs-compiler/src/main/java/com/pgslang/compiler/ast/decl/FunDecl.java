package com.pgslang.compiler.ast.decl;

import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.stmt.Block;
import com.pgslang.compiler.ast.type.TypeRef;

import java.util.List;

/**
 * 函数声明
 *
 * <p>没有函数体（以 {@code ;} 结尾）的声明是外部原生函数：</p>
 * <pre>
 * fn: sqrt(x: float) ~ float;
 * </pre>
 */
public class FunDecl extends Declaration {
    private final List<Parameter> params;
    private final TypeRef returnType;  // 可为 null（unit）
    private final Block body;          // null 表示原生函数

    public FunDecl(SourceLocation location, String name, List<Parameter> params,
                   TypeRef returnType, Block body) {
        super(location, name);
        this.params = params;
        this.returnType = returnType;
        this.body = body;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public TypeRef getReturnType() {
        return returnType;
    }

    public Block getBody() {
        return body;
    }

    public boolean isNative() {
        return body == null;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunDecl(this, context);
    }
}
