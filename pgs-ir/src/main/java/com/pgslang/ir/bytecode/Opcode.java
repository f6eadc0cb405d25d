package com.pgslang.ir.bytecode;

/**
 * 字节码操作码。
 *
 * <p>操作数 a/b 的含义见各项注释；跳转目标为指令下标（绝对地址）。</p>
 */
public enum Opcode {
    // 常量与局部变量
    PUSH_CONST,     // push constants[a]
    LOAD_LOCAL,     // push locals[a]
    STORE_LOCAL,    // locals[a] = peek

    // 容器
    LOAD_FIELD,     // push pop().fields[a]
    STORE_FIELD,    // v = pop; s = pop; s.fields[a] = v; push v
    NEW_STRUCT,     // 按 constants[a] 的布局弹出 N 个字段值，push 新实例

    // 运算
    BINARY,         // a = BinaryKind 序号, b = 操作数 ValueKind 序号
    UNARY,          // a = UnaryKind 序号, b = 操作数 ValueKind 序号

    // 控制流
    JUMP,           // ip = a
    JUMP_IF_FALSE,  // if (!pop()) ip = a

    // 调用
    CALL,           // 调用 chunks[a]，b = 参数个数
    CALL_NATIVE,    // 调用 natives[a]，b = 参数个数
    RETURN,         // 弹出返回值，销毁帧

    // 栈
    POP,
    DUP,

    // for 循环迭代
    SEQ_LEN,        // push length(pop())：int n → max(n, 0)，string → 码点数
    SEQ_GET;        // i = pop; s = pop; push s[i]

    /** 是否以 a 为跳转目标 */
    public boolean isJump() {
        return this == JUMP || this == JUMP_IF_FALSE;
    }
}
