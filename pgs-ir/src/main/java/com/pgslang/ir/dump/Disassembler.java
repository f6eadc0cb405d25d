package com.pgslang.ir.dump;

import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.bytecode.Chunk;
import com.pgslang.ir.bytecode.Instruction;
import com.pgslang.ir.bytecode.NativeBinding;

import java.util.List;

/**
 * 字节码的文本形式，供调试和测试对比使用。
 *
 * <pre>
 * chunk root::main(int) ~ int  locals=2
 *   0000  L3  LOAD_LOCAL 0
 *   0001  L3  PUSH_CONST 0          ; 1
 * </pre>
 */
public final class Disassembler {

    private Disassembler() {}

    public static String disassemble(BytecodeProgram program) {
        StringBuilder sb = new StringBuilder();
        List<NativeBinding> natives = program.getNatives();
        for (int i = 0; i < natives.size(); i++) {
            sb.append("native #").append(i).append(' ').append(natives.get(i)).append('\n');
        }
        List<Chunk> chunks = program.getChunks();
        for (int i = 0; i < chunks.size(); i++) {
            if (sb.length() > 0) sb.append('\n');
            appendChunk(sb, chunks.get(i), program);
        }
        return sb.toString();
    }

    public static String disassemble(Chunk chunk) {
        StringBuilder sb = new StringBuilder();
        appendChunk(sb, chunk, null);
        return sb.toString();
    }

    private static void appendChunk(StringBuilder sb, Chunk chunk, BytecodeProgram program) {
        sb.append("chunk ").append(chunk.getName()).append('(');
        for (int i = 0; i < chunk.getArity(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(chunk.getParamTypeName(i));
        }
        sb.append(") ~ ").append(chunk.getReturnTypeName())
                .append("  locals=").append(chunk.getLocalCount()).append('\n');

        List<Instruction> code = chunk.getInstructions();
        for (int ip = 0; ip < code.size(); ip++) {
            Instruction inst = code.get(ip);
            String text = String.format("  %04d  L%-4d %s", ip, inst.getLine(), inst);
            String comment = commentFor(inst, chunk, program);
            if (comment != null) {
                text = String.format("%-40s ; %s", text, comment);
            }
            sb.append(text).append('\n');
        }
    }

    private static String commentFor(Instruction inst, Chunk chunk, BytecodeProgram program) {
        switch (inst.getOp()) {
            case PUSH_CONST:
            case NEW_STRUCT:
                return String.valueOf(chunk.getConstants().get(inst.getA()));
            case CALL:
                return program != null ? program.getChunk(inst.getA()).getName() : null;
            case CALL_NATIVE:
                return program != null ? program.getNative(inst.getA()).getName() : null;
            default:
                return null;
        }
    }
}
