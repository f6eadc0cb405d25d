package com.pgslang.ir;

import com.pgslang.compiler.analysis.ResolvedProgram;
import com.pgslang.compiler.analysis.Resolver;
import com.pgslang.compiler.ast.decl.Program;
import com.pgslang.compiler.lexer.Lexer;
import com.pgslang.compiler.parser.Parser;
import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.lowering.BytecodeCompiler;
import pgs.runtime.NativeRegistry;

import java.util.logging.Logger;

/**
 * 编译管线门面：源码 → Lexer → Parser → AST → Resolver → 字节码。
 *
 * <p>每个阶段遇到第一个错误即抛出对应的
 * {@link com.pgslang.compiler.PgsCompileException} 子类，后续阶段不会执行。</p>
 */
public class PgsIrCompiler {

    private static final Logger LOG = Logger.getLogger(PgsIrCompiler.class.getName());

    private final NativeRegistry natives;

    public PgsIrCompiler() {
        this(null);
    }

    /**
     * @param natives 编译期可见的原生函数（可为 null），用于 {@code import std::println;} 这类导入
     */
    public PgsIrCompiler(NativeRegistry natives) {
        this.natives = natives;
    }

    /**
     * 编译源代码。
     *
     * @param source   源代码
     * @param fileName 文件名（仅用于诊断）
     */
    public BytecodeProgram compile(String source, String fileName) {
        ResolvedProgram resolved = resolve(source, fileName);
        return new BytecodeCompiler().compile(resolved);
    }

    /**
     * 只做到名称解析与类型检查。
     */
    public ResolvedProgram resolve(String source, String fileName) {
        long start = System.nanoTime();
        Lexer lexer = new Lexer(source, fileName);
        Parser parser = new Parser(lexer, fileName);
        Program program = parser.parse();
        ResolvedProgram resolved = new Resolver(natives).resolve(program);
        LOG.fine("Front end finished for " + fileName + " in " + (System.nanoTime() - start) / 1_000 + " us");
        return resolved;
    }
}
