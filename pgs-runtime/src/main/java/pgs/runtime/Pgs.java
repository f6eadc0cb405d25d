package pgs.runtime;

import com.pgslang.ir.PgsIrCompiler;
import com.pgslang.ir.bytecode.BytecodeProgram;
import pgs.runtime.vm.VirtualMachine;
import pgs.runtime.vm.VmOptions;

import java.util.logging.Logger;

/**
 * PgsLang 便捷 API
 *
 * <pre>
 * NativeRegistry natives = StandardNatives.install(new NativeRegistry(), System.out);
 * CompiledProgram program = Pgs.compile(source, "main.pgs", natives);
 * PgsValue result = Pgs.run(program, "main", natives);
 * </pre>
 *
 * <p>编译错误以 {@link com.pgslang.compiler.PgsCompileException} 子类抛出，
 * 运行时错误以 {@link pgs.runtime.vm.PgsRuntimeException} 抛出。</p>
 */
public final class Pgs {

    private static final Logger LOG = Logger.getLogger(Pgs.class.getName());

    private static final String DEFAULT_FILE_NAME = "<script>";

    private Pgs() {
    }

    public static CompiledProgram compile(String source) {
        return compile(source, DEFAULT_FILE_NAME, null);
    }

    public static CompiledProgram compile(String source, String fileName) {
        return compile(source, fileName, null);
    }

    /**
     * @param natives 编译期可见的原生函数，可为 null
     */
    public static CompiledProgram compile(String source, String fileName, NativeRegistry natives) {
        BytecodeProgram bytecode = new PgsIrCompiler(natives).compile(source, fileName);
        LOG.fine("Compiled " + fileName + ": " + bytecode.getChunks().size() + " function(s), "
                + bytecode.getNatives().size() + " native(s)");
        return new CompiledProgram(bytecode, fileName, natives);
    }

    /**
     * 在新的 VM 上执行入口函数
     *
     * @param entryName 简单名（{@code main}）或限定名（{@code math::add}、{@code root::math::add}）
     * @param args      Java 值或 {@link PgsValue}，按 {@link PgsValue#fromJava} 转换
     */
    public static PgsValue run(CompiledProgram program, String entryName, NativeRegistry natives, Object... args) {
        return run(program, entryName, natives, VmOptions.defaults(), args);
    }

    public static PgsValue run(CompiledProgram program, String entryName, NativeRegistry natives,
                               VmOptions options, Object... args) {
        String qualified = program.resolveEntry(entryName);
        PgsValue[] values = new PgsValue[args.length];
        for (int i = 0; i < args.length; i++) {
            values[i] = PgsValue.fromJava(args[i]);
        }
        VirtualMachine vm = program.newVirtualMachine(natives, options);
        return vm.execute(qualified, values);
    }

    /**
     * 编译并执行 {@code main}
     */
    public static PgsValue eval(String source, NativeRegistry natives) {
        return run(compile(source, DEFAULT_FILE_NAME, natives), "main", natives);
    }
}
