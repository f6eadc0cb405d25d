package com.pgslang.ir.lowering;

import com.pgslang.compiler.analysis.FunctionSymbol;
import com.pgslang.compiler.analysis.ResolvedProgram;
import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.bytecode.Chunk;
import com.pgslang.ir.bytecode.NativeBinding;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 把解析完成的程序降级为字节码。
 *
 * <p>每个带函数体的函数（含方法）生成一个 {@link Chunk}，chunk 下标按
 * {@link ResolvedProgram#getFunctions()} 的顺序分配；原生函数按
 * {@link ResolvedProgram#getNatives()} 的顺序进入绑定表。相同输入总是生成相同的字节码。</p>
 */
public final class BytecodeCompiler {

    private static final Logger LOG = Logger.getLogger(BytecodeCompiler.class.getName());

    public BytecodeProgram compile(ResolvedProgram program) {
        long start = System.nanoTime();

        Map<FunctionSymbol, Integer> chunkIndex = new IdentityHashMap<>();
        List<FunctionSymbol> functions = program.getFunctions();
        for (int i = 0; i < functions.size(); i++) {
            chunkIndex.put(functions.get(i), i);
        }

        Map<FunctionSymbol, Integer> nativeIndex = new IdentityHashMap<>();
        List<NativeBinding> natives = new ArrayList<>();
        for (FunctionSymbol fn : program.getNatives()) {
            nativeIndex.put(fn, natives.size());
            natives.add(new NativeBinding(fn.getNativeName(), fn.getType().getParamKinds(),
                    fn.getType().getParamContainers(), fn.getType().getReturnType().getValueKind(),
                    fn.getType().getReturnType().getContainerName()));
        }

        List<Chunk> chunks = new ArrayList<>(functions.size());
        for (FunctionSymbol fn : functions) {
            chunks.add(new FunctionLowering(program, fn, chunkIndex, nativeIndex).lower());
        }

        LOG.fine("Compiled " + chunks.size() + " chunks, " + natives.size() + " native bindings in "
                + (System.nanoTime() - start) / 1_000 + " us");
        return new BytecodeProgram(chunks, natives);
    }
}
