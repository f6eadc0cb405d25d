package com.pgslang.ir.lowering;

import com.pgslang.compiler.PgsCompileException;
import com.pgslang.compiler.ast.SourceLocation;

/**
 * 字节码生成错误：无法降级的结构，如循环外的 break、无 break 的 loop 之后的代码
 */
public class CompileException extends PgsCompileException {

    public CompileException(String message, SourceLocation location) {
        super(message, location);
    }

    @Override
    public String getStage() {
        return "compile";
    }
}
