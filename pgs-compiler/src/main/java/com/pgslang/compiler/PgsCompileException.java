package com.pgslang.compiler;

import com.pgslang.compiler.ast.SourceLocation;

/**
 * 编译期异常基类
 *
 * <p>词法、语法、解析和字节码生成各阶段的异常都继承此类，
 * 嵌入方可用一个 catch 捕获任意编译失败。</p>
 */
public abstract class PgsCompileException extends RuntimeException {

    private final SourceLocation location;

    protected PgsCompileException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** 不含位置信息的原始消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /** 所属阶段，如 "lex"、"parse" */
    public abstract String getStage();

    @Override
    public String getMessage() {
        if (location == SourceLocation.UNKNOWN) {
            return super.getMessage();
        }
        return super.getMessage() + " at " + location;
    }
}
