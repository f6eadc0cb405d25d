package pgs.runtime.vm;

import com.pgslang.ir.bytecode.Chunk;

/**
 * 调用帧
 *
 * <p>局部变量位于操作数栈 {@code [base, base + localCount)}，
 * 参数占据前 arity 个槽位。返回时栈高度恢复为 base。</p>
 */
final class CallFrame {

    final Chunk chunk;
    final int base;
    int ip;

    CallFrame(Chunk chunk, int base) {
        this.chunk = chunk;
        this.base = base;
    }

    /** 当前（或刚执行的）指令对应的源码行 */
    int currentLine() {
        int at = ip > 0 ? ip - 1 : 0;
        if (at >= chunk.size()) {
            return 0;
        }
        return chunk.getInstruction(at).getLine();
    }
}
