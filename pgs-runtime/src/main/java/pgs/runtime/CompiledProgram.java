package pgs.runtime;

import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.dump.BytecodeJson;
import com.pgslang.ir.dump.Disassembler;
import pgs.runtime.vm.PgsRuntimeException;
import pgs.runtime.vm.VirtualMachine;
import pgs.runtime.vm.VmOptions;

/**
 * 编译完成的 PgsLang 程序
 *
 * <p>通过 {@link Pgs#compile(String)} 创建。实例不可变，可以被多个线程上的
 * {@link VirtualMachine} 同时使用：</p>
 * <pre>
 * CompiledProgram program = Pgs.compile(source, "rules.pgs", natives);
 * PgsValue total = Pgs.run(program, "total", natives, 3, 4);
 *
 * // 需要资源限制或取消时直接创建 VM
 * VirtualMachine vm = program.newVirtualMachine(natives, VmOptions.custom().instructionBudget(10_000).build());
 * PgsValue result = vm.execute(program.resolveEntry("main"));
 * </pre>
 */
public final class CompiledProgram {

    private static final String ROOT_PREFIX = "root::";

    private final BytecodeProgram bytecode;
    private final String fileName;
    private final NativeRegistry natives;

    CompiledProgram(BytecodeProgram bytecode, String fileName, NativeRegistry natives) {
        this.bytecode = bytecode;
        this.fileName = fileName;
        this.natives = natives != null ? natives.copy() : new NativeRegistry();
    }

    public BytecodeProgram getBytecode() {
        return bytecode;
    }

    public String getFileName() {
        return fileName;
    }

    /** 编译时提供的原生函数（副本） */
    public NativeRegistry getNatives() {
        return natives.copy();
    }

    public boolean hasFunction(String name) {
        return findEntry(name) != null;
    }

    /**
     * 把入口名解析为全限定名
     *
     * <p>{@code main} 与 {@code math::add} 在根模块下查找，{@code root::math::add} 原样使用。</p>
     *
     * @return 全限定名，找不到时返回 null
     */
    public String findEntry(String name) {
        if (bytecode.indexOf(name) >= 0) {
            return name;
        }
        if (!name.startsWith(ROOT_PREFIX) && bytecode.indexOf(ROOT_PREFIX + name) >= 0) {
            return ROOT_PREFIX + name;
        }
        return null;
    }

    /**
     * 与 {@link #findEntry} 相同，找不到时抛出 {@code UNKNOWN_FUNCTION}
     */
    public String resolveEntry(String name) {
        String qualified = findEntry(name);
        if (qualified == null) {
            throw new PgsRuntimeException(PgsRuntimeException.Kind.UNKNOWN_FUNCTION,
                    "Unknown entry function '" + name + "' in " + fileName);
        }
        return qualified;
    }

    public VirtualMachine newVirtualMachine(NativeRegistry natives) {
        return new VirtualMachine(bytecode, natives);
    }

    public VirtualMachine newVirtualMachine(NativeRegistry natives, VmOptions options) {
        return new VirtualMachine(bytecode, natives, options);
    }

    /**
     * 使用编译时的原生函数执行入口函数
     */
    public PgsValue run(String entryName, Object... args) {
        return Pgs.run(this, entryName, natives, args);
    }

    /** 可读的字节码清单 */
    public String disassemble() {
        return Disassembler.disassemble(bytecode);
    }

    public String toJson() {
        return BytecodeJson.toJson(bytecode);
    }

    @Override
    public String toString() {
        return "CompiledProgram{" + fileName + ", " + bytecode.getChunks().size() + " functions}";
    }
}
