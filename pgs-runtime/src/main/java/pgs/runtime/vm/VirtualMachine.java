package pgs.runtime.vm;

import com.pgslang.ir.bytecode.BinaryKind;
import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.bytecode.Chunk;
import com.pgslang.ir.bytecode.Instruction;
import com.pgslang.ir.bytecode.NativeBinding;
import com.pgslang.ir.bytecode.UnaryKind;
import pgs.runtime.NativeFunction;
import pgs.runtime.NativeRegistry;
import pgs.runtime.PgsBool;
import pgs.runtime.PgsFloat;
import pgs.runtime.PgsInt;
import pgs.runtime.PgsString;
import pgs.runtime.PgsStruct;
import pgs.runtime.PgsUnit;
import pgs.runtime.PgsValue;
import pgs.runtime.StructLayout;
import pgs.runtime.ValueKind;
import pgs.runtime.vm.PgsRuntimeException.Kind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 字节码栈式虚拟机
 *
 * <p>单一操作数栈同时存放各帧的局部变量与临时值；调用帧记录 chunk、指令指针
 * 和局部变量基址。原生函数在首次调用时按名称从 {@link NativeRegistry} 链接。</p>
 *
 * <p>一个 VM 实例只能在一个线程上使用，且不可重入；{@link #cancel()} 是唯一
 * 允许从其他线程调用的方法。多个 VM 可以共享同一个 {@link BytecodeProgram}。</p>
 */
public final class VirtualMachine {

    private static final Logger LOG = Logger.getLogger(VirtualMachine.class.getName());

    private static final int INITIAL_STACK_SIZE = 256;
    private static final int TRACE_DISPLAY_LIMIT = 16;
    private static final ValueKind[] KINDS = ValueKind.values();

    private final BytecodeProgram program;
    private final NativeRegistry natives;
    private final VmOptions options;
    private final NativeFunction[] linked;
    private final HeapStats heapStats = new HeapStats();

    private PgsValue[] stack;
    private int sp;
    private final List<CallFrame> frames = new ArrayList<>();

    private long executed;
    private volatile boolean cancelled;
    private StepHook stepHook;
    private boolean running;

    public VirtualMachine(BytecodeProgram program, NativeRegistry natives) {
        this(program, natives, VmOptions.defaults());
    }

    public VirtualMachine(BytecodeProgram program, NativeRegistry natives, VmOptions options) {
        this.program = program;
        this.natives = natives != null ? natives : new NativeRegistry();
        this.options = options != null ? options : VmOptions.defaults();
        this.linked = new NativeFunction[program.getNatives().size()];
        this.stack = new PgsValue[Math.min(INITIAL_STACK_SIZE, this.options.getMaxStackSize())];
    }

    public BytecodeProgram getProgram() {
        return program;
    }

    public VmOptions getOptions() {
        return options;
    }

    public HeapStats getHeapStats() {
        return heapStats;
    }

    /** 最近一次（或正在进行的）执行已执行的指令数 */
    public long getExecutedInstructions() {
        return executed;
    }

    public void setStepHook(StepHook stepHook) {
        this.stepHook = stepHook;
    }

    /**
     * 请求终止执行，可从任意线程调用。
     *
     * <p>在下一个检查点生效（每 {@code checkInterval} 条指令），以 {@code INTERRUPTED} 结束。
     * 标志在本次执行结束后清除；执行尚未开始时调用则作用于下一次执行。</p>
     */
    public void cancel() {
        cancelled = true;
    }

    /**
     * 按全限定名执行函数
     *
     * @param qualifiedName 如 {@code root::main}
     * @param args          入口参数，必须与函数参数的个数和种类一致
     * @return 返回值；容器实例由调用方持有一次引用
     */
    public PgsValue execute(String qualifiedName, PgsValue... args) {
        int index = program.indexOf(qualifiedName);
        if (index < 0) {
            throw new PgsRuntimeException(Kind.UNKNOWN_FUNCTION, "Unknown function '" + qualifiedName + "'");
        }
        return execute(index, args);
    }

    public PgsValue execute(int chunkIndex, PgsValue... args) {
        if (running) {
            throw new IllegalStateException("VirtualMachine is already executing");
        }
        if (chunkIndex < 0 || chunkIndex >= program.getChunks().size()) {
            throw new PgsRuntimeException(Kind.UNKNOWN_FUNCTION, "Unknown function #" + chunkIndex);
        }
        Chunk entry = program.getChunk(chunkIndex);
        checkEntryArguments(entry, args);

        running = true;
        executed = 0;
        try {
            for (PgsValue arg : args) {
                // 调用方对入口参数保留自己的一次引用
                retain(arg);
                push(arg);
            }
            pushFrame(entry, args.length);
            return run();
        } catch (PgsRuntimeException e) {
            if (!frames.isEmpty()) {
                CallFrame top = frames.get(frames.size() - 1);
                e.attachFrame(top.chunk.getName(), top.currentLine(), formatStackTrace());
            }
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Execution of " + entry.getName() + " failed: " + e.getKind() + " " + e.getRawMessage());
            }
            throw e;
        } finally {
            unwind();
            running = false;
            cancelled = false;
        }
    }

    private void checkEntryArguments(Chunk entry, PgsValue[] args) {
        if (args.length != entry.getArity()) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Function '" + entry.getName() + "' expects "
                    + entry.getArity() + " argument(s) but got " + args.length);
        }
        for (int i = 0; i < args.length; i++) {
            ValueKind expected = entry.getParamKinds().get(i);
            if (args[i] == null) {
                throw new PgsRuntimeException(Kind.TYPE_MISMATCH,
                        "Argument " + (i + 1) + " of '" + entry.getName() + "' is null");
            }
            if (args[i].getKind() != expected || !isInstanceOf(args[i], entry.getParamContainers().get(i))) {
                throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Argument " + (i + 1) + " of '"
                        + entry.getName() + "' expects " + entry.getParamTypeName(i)
                        + " but got " + args[i].getTypeName());
            }
        }
    }

    /** 容器值按布局的全限定名比较；container 为 null 表示不限定容器 */
    private static boolean isInstanceOf(PgsValue value, String container) {
        return container == null
                || value instanceof PgsStruct && container.equals(((PgsStruct) value).getLayout().getName());
    }

    private static String typeName(ValueKind kind, String container) {
        return container != null ? container : kind.getTypeName();
    }

    // ============ 主循环 ============

    private PgsValue run() {
        CallFrame frame = frames.get(frames.size() - 1);
        Chunk chunk = frame.chunk;
        while (true) {
            Instruction inst = chunk.getInstruction(frame.ip++);
            tick();
            switch (inst.getOp()) {
                case PUSH_CONST:
                    push(chunk.getConstants().getValue(inst.getA()));
                    break;

                case LOAD_LOCAL:
                    push(stack[frame.base + inst.getA()]);
                    break;

                case STORE_LOCAL: {
                    // 赋值表达式的值留在栈顶
                    PgsValue value = peek(0);
                    int slot = frame.base + inst.getA();
                    retain(value);
                    PgsValue old = stack[slot];
                    stack[slot] = value;
                    release(old);
                    break;
                }

                case LOAD_FIELD: {
                    PgsStruct target = checkField(peek(0), inst.getA());
                    pop();
                    push(target.getField(inst.getA()));
                    release(target);
                    break;
                }

                case STORE_FIELD: {
                    PgsStruct target = checkField(peek(1), inst.getA());
                    PgsValue value = pop();
                    pop();
                    retain(value);
                    release(target.setField(inst.getA(), value));
                    pushOwned(value);
                    release(target);
                    break;
                }

                case NEW_STRUCT:
                    newStruct(chunk.getConstants().getLayout(inst.getA()));
                    break;

                case BINARY: {
                    PgsValue right = peek(0);
                    PgsValue left = peek(1);
                    PgsValue result = binary(BinaryKind.of(inst.getA()), KINDS[inst.getB()], left, right);
                    pop();
                    pop();
                    push(result);
                    release(left);
                    release(right);
                    break;
                }

                case UNARY: {
                    PgsValue result = unary(UnaryKind.of(inst.getA()), KINDS[inst.getB()], peek(0));
                    pop();
                    push(result);
                    break;
                }

                case JUMP:
                    frame.ip = inst.getA();
                    break;

                case JUMP_IF_FALSE: {
                    PgsValue cond = peek(0);
                    if (cond.getKind() != ValueKind.BOOL) {
                        throw new PgsRuntimeException(Kind.TYPE_MISMATCH,
                                "Condition must be bool but got " + cond.getTypeName());
                    }
                    pop();
                    if (!cond.asBool()) {
                        frame.ip = inst.getA();
                    }
                    break;
                }

                case CALL:
                    frame = invoke(inst.getA(), inst.getB());
                    chunk = frame.chunk;
                    break;

                case CALL_NATIVE:
                    invokeNative(inst.getA(), inst.getB());
                    break;

                case RETURN: {
                    PgsValue result = pop();
                    popFrame(frame);
                    if (frames.isEmpty()) {
                        return result;
                    }
                    pushOwned(result);
                    frame = frames.get(frames.size() - 1);
                    chunk = frame.chunk;
                    break;
                }

                case POP:
                    release(pop());
                    break;

                case DUP:
                    push(peek(0));
                    break;

                case SEQ_LEN: {
                    PgsValue seq = peek(0);
                    PgsValue length = PgsInt.of(sequenceLength(seq));
                    pop();
                    push(length);
                    release(seq);
                    break;
                }

                case SEQ_GET: {
                    PgsValue index = peek(0);
                    PgsValue seq = peek(1);
                    PgsValue element = sequenceElement(seq, index);
                    pop();
                    pop();
                    push(element);
                    release(seq);
                    break;
                }

                default:
                    throw new IllegalStateException("Unknown opcode: " + inst.getOp());
            }
        }
    }

    /** 每条指令计数一次；预算每条都检查，取消与回调按 checkInterval 检查 */
    private void tick() {
        executed++;
        if (options.hasInstructionBudget() && executed > options.getInstructionBudget()) {
            throw new PgsRuntimeException(Kind.BUDGET_EXHAUSTED,
                    "Instruction budget of " + options.getInstructionBudget() + " exhausted");
        }
        if (executed % options.getCheckInterval() == 0) {
            if (cancelled) {
                throw new PgsRuntimeException(Kind.INTERRUPTED, "Execution cancelled");
            }
            StepHook hook = stepHook;
            if (hook != null && !hook.onStep(executed)) {
                throw new PgsRuntimeException(Kind.INTERRUPTED,
                        "Execution stopped by step hook after " + executed + " instructions");
            }
        }
    }

    // ============ 调用 ============

    private CallFrame invoke(int chunkIndex, int argc) {
        if (chunkIndex < 0 || chunkIndex >= program.getChunks().size()) {
            throw new PgsRuntimeException(Kind.UNKNOWN_FUNCTION, "Unknown function #" + chunkIndex);
        }
        Chunk callee = program.getChunk(chunkIndex);
        if (argc != callee.getArity()) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Function '" + callee.getName() + "' expects "
                    + callee.getArity() + " argument(s) but got " + argc);
        }
        return pushFrame(callee, argc);
    }

    /** 栈顶 argc 个值成为新帧的前 argc 个局部变量 */
    private CallFrame pushFrame(Chunk chunk, int argc) {
        if (frames.size() >= options.getMaxFrames()) {
            throw new PgsRuntimeException(Kind.STACK_OVERFLOW,
                    "Maximum call depth exceeded (" + options.getMaxFrames() + ")");
        }
        int base = sp - argc;
        ensureCapacity(base + chunk.getLocalCount());
        for (int i = sp; i < base + chunk.getLocalCount(); i++) {
            stack[i] = PgsUnit.UNIT;
        }
        sp = base + chunk.getLocalCount();
        CallFrame frame = new CallFrame(chunk, base);
        frames.add(frame);
        return frame;
    }

    private void popFrame(CallFrame frame) {
        while (sp > frame.base) {
            release(pop());
        }
        frames.remove(frames.size() - 1);
    }

    private void invokeNative(int nativeIndex, int argc) {
        NativeFunction fn = link(nativeIndex);
        if (argc != fn.getArity()) {
            throw new PgsRuntimeException(Kind.NATIVE_ARITY_MISMATCH, "Native '" + fn.getName()
                    + "' expects " + fn.getArity() + " argument(s) but got " + argc);
        }
        NativeBinding binding = program.getNative(nativeIndex);
        for (int i = 0; i < argc; i++) {
            PgsValue arg = stack[sp - argc + i];
            ValueKind expected = fn.getParamKinds().get(i);
            String container = binding.getParamContainers().get(i);
            if (arg.getKind() != expected || !isInstanceOf(arg, container)) {
                throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Argument " + (i + 1) + " of native '"
                        + fn.getName() + "' expects " + typeName(expected, container)
                        + " but got " + arg.getTypeName());
            }
        }

        PgsValue[] args = new PgsValue[argc];
        for (int i = argc - 1; i >= 0; i--) {
            args[i] = pop();
        }
        PgsValue result;
        try {
            result = fn.invoke(args);
        } catch (PgsRuntimeException e) {
            releaseAll(args);
            throw e;
        } catch (RuntimeException e) {
            releaseAll(args);
            throw new PgsRuntimeException(Kind.NATIVE_FAILURE,
                    "Native '" + fn.getName() + "' failed: " + e.getMessage(), e);
        }

        if (result == null && fn.getReturnKind() == ValueKind.UNIT) {
            result = PgsUnit.UNIT;
        }
        if (result == null || result.getKind() != fn.getReturnKind()
                || !isInstanceOf(result, binding.getReturnContainer())) {
            releaseAll(args);
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Native '" + fn.getName() + "' returned "
                    + (result == null ? "null" : result.getTypeName())
                    + " but declares " + typeName(fn.getReturnKind(), binding.getReturnContainer()));
        }
        if (result instanceof PgsStruct && ((PgsStruct) result).getRefCount() == 0) {
            // 宿主新建的实例从此由 VM 计数
            heapStats.recordAllocation();
        }
        push(result);
        releaseAll(args);
    }

    /** 首次调用时按名称链接，并核对注册签名与脚本声明一致 */
    private NativeFunction link(int nativeIndex) {
        NativeFunction fn = linked[nativeIndex];
        if (fn != null) {
            return fn;
        }
        NativeBinding binding = program.getNative(nativeIndex);
        fn = natives.lookup(binding.getName());
        if (fn == null) {
            throw new PgsRuntimeException(Kind.UNDEFINED_NATIVE,
                    "Native function '" + binding.getName() + "' is not registered");
        }
        if (fn.getArity() != binding.getArity()) {
            throw new PgsRuntimeException(Kind.NATIVE_ARITY_MISMATCH, "Native '" + fn.getName()
                    + "' is registered with " + fn.getArity() + " parameter(s) but declared with "
                    + binding.getArity());
        }
        if (!fn.getParamKinds().equals(binding.getParamKinds()) || fn.getReturnKind() != binding.getReturnKind()) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Native '" + fn.getName()
                    + "' is registered as " + fn.signature() + " but declared as " + binding);
        }
        LOG.fine("Linked native " + fn.signature());
        linked[nativeIndex] = fn;
        return fn;
    }

    // ============ 运算 ============

    private PgsValue binary(BinaryKind op, ValueKind kind, PgsValue left, PgsValue right) {
        if (left.getKind() != kind || right.getKind() != kind) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Operator '" + op.getSymbol() + "' expects "
                    + kind.getTypeName() + " operands but got " + left.getTypeName() + " and " + right.getTypeName());
        }
        switch (kind) {
            case INT:
                return intBinary(op, left.asLong(), right.asLong());
            case FLOAT:
                return floatBinary(op, left.asDouble(), right.asDouble());
            default:
                break;
        }
        boolean equal;
        switch (kind) {
            case UNIT:
                equal = true;
                break;
            case STRUCT:
                // 容器按引用比较
                equal = left == right;
                break;
            default:
                equal = left.equals(right);
                break;
        }
        if (op == BinaryKind.EQ) return PgsBool.of(equal);
        if (op == BinaryKind.NE) return PgsBool.of(!equal);
        throw new PgsRuntimeException(Kind.TYPE_MISMATCH,
                "Operator '" + op.getSymbol() + "' is not defined for " + kind.getTypeName());
    }

    private static PgsValue intBinary(BinaryKind op, long l, long r) {
        switch (op) {
            case ADD: return PgsInt.of(l + r);
            case SUB: return PgsInt.of(l - r);
            case MUL: return PgsInt.of(l * r);
            case DIV:
                if (r == 0) {
                    throw new PgsRuntimeException(Kind.DIVISION_BY_ZERO, "Integer division by zero");
                }
                return PgsInt.of(l / r);
            case EQ: return PgsBool.of(l == r);
            case NE: return PgsBool.of(l != r);
            case LT: return PgsBool.of(l < r);
            case LE: return PgsBool.of(l <= r);
            case GT: return PgsBool.of(l > r);
            case GE: return PgsBool.of(l >= r);
            default:
                throw new IllegalStateException("Unknown operator: " + op);
        }
    }

    private static PgsValue floatBinary(BinaryKind op, double l, double r) {
        switch (op) {
            case ADD: return PgsFloat.of(l + r);
            case SUB: return PgsFloat.of(l - r);
            case MUL: return PgsFloat.of(l * r);
            case DIV: return PgsFloat.of(l / r);
            case EQ: return PgsBool.of(l == r);
            case NE: return PgsBool.of(l != r);
            case LT: return PgsBool.of(l < r);
            case LE: return PgsBool.of(l <= r);
            case GT: return PgsBool.of(l > r);
            case GE: return PgsBool.of(l >= r);
            default:
                throw new IllegalStateException("Unknown operator: " + op);
        }
    }

    private static PgsValue unary(UnaryKind op, ValueKind kind, PgsValue operand) {
        if (operand.getKind() != kind) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Unary operator expects "
                    + kind.getTypeName() + " but got " + operand.getTypeName());
        }
        if (op == UnaryKind.NOT && kind == ValueKind.BOOL) {
            return PgsBool.of(!operand.asBool());
        }
        if (op == UnaryKind.NEG && kind == ValueKind.INT) {
            return PgsInt.of(-operand.asLong());
        }
        if (op == UnaryKind.NEG && kind == ValueKind.FLOAT) {
            return PgsFloat.of(-operand.asDouble());
        }
        throw new PgsRuntimeException(Kind.TYPE_MISMATCH,
                "Operator " + op + " is not defined for " + kind.getTypeName());
    }

    // ============ 容器 ============

    private PgsStruct checkField(PgsValue value, int field) {
        if (!(value instanceof PgsStruct)) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH,
                    "Field access on non-container value of type " + value.getTypeName());
        }
        PgsStruct struct = (PgsStruct) value;
        if (field < 0 || field >= struct.getFieldCount()) {
            throw new PgsRuntimeException(Kind.UNDEFINED_FIELD,
                    "Container " + struct.getLayout().getName() + " has no field #" + field);
        }
        return struct;
    }

    /** 弹出的字段值直接转移给新实例，引用数不变 */
    private void newStruct(StructLayout layout) {
        int count = layout.getFieldCount();
        for (int i = 0; i < count; i++) {
            PgsValue value = stack[sp - count + i];
            ValueKind expected = layout.getFieldKinds().get(i);
            if (value.getKind() != expected) {
                throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Field '" + layout.getFieldNames().get(i)
                        + "' of " + layout.getName() + " expects " + expected.getTypeName()
                        + " but got " + value.getTypeName());
            }
        }
        PgsValue[] fields = new PgsValue[count];
        for (int i = count - 1; i >= 0; i--) {
            fields[i] = pop();
        }
        PgsStruct struct = new PgsStruct(layout, fields);
        heapStats.recordAllocation();
        push(struct);
    }

    // ============ for 迭代 ============

    private static long sequenceLength(PgsValue seq) {
        switch (seq.getKind()) {
            case INT:
                return Math.max(seq.asLong(), 0);
            case STRING: {
                String s = seq.asString();
                return s.codePointCount(0, s.length());
            }
            default:
                throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Cannot iterate over " + seq.getTypeName());
        }
    }

    private static PgsValue sequenceElement(PgsValue seq, PgsValue index) {
        if (index.getKind() != ValueKind.INT) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Sequence index must be int but got "
                    + index.getTypeName());
        }
        long i = index.asLong();
        if (seq.getKind() == ValueKind.INT) {
            return index;
        }
        if (seq.getKind() != ValueKind.STRING) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Cannot iterate over " + seq.getTypeName());
        }
        String s = seq.asString();
        if (i < 0 || i >= s.codePointCount(0, s.length())) {
            throw new PgsRuntimeException(Kind.TYPE_MISMATCH, "Index " + i + " out of range for string of length "
                    + s.codePointCount(0, s.length()));
        }
        int offset = s.offsetByCodePoints(0, (int) i);
        return PgsString.of(new String(Character.toChars(s.codePointAt(offset))));
    }

    // ============ 栈与引用计数 ============

    private void push(PgsValue value) {
        ensureCapacity(sp + 1);
        retain(value);
        stack[sp++] = value;
    }

    /** 压入一个已持有引用的值（刚从栈上弹出的） */
    private void pushOwned(PgsValue value) {
        ensureCapacity(sp + 1);
        stack[sp++] = value;
    }

    /** 弹出的引用归调用方，用完须 release 或转移 */
    private PgsValue pop() {
        PgsValue value = stack[--sp];
        stack[sp] = null;
        return value;
    }

    private PgsValue peek(int depth) {
        return stack[sp - 1 - depth];
    }

    private void ensureCapacity(int required) {
        if (required > options.getMaxStackSize()) {
            throw new PgsRuntimeException(Kind.STACK_OVERFLOW,
                    "Operand stack overflow (" + options.getMaxStackSize() + " slots)");
        }
        if (required > stack.length) {
            int size = (int) Math.min((long) stack.length * 2, options.getMaxStackSize());
            stack = Arrays.copyOf(stack, Math.max(size, required));
        }
    }

    private static void retain(PgsValue value) {
        if (value instanceof PgsStruct) {
            ((PgsStruct) value).retain();
        }
    }

    private void release(PgsValue value) {
        if (value instanceof PgsStruct) {
            PgsStruct struct = (PgsStruct) value;
            if (struct.release() == 0) {
                heapStats.recordRelease();
                for (int i = 0; i < struct.getFieldCount(); i++) {
                    release(struct.getField(i));
                }
            }
        }
    }

    private void releaseAll(PgsValue[] values) {
        for (PgsValue value : values) {
            release(value);
        }
    }

    /** 出错或结束后清空栈与调用帧 */
    private void unwind() {
        while (sp > 0) {
            release(pop());
        }
        frames.clear();
    }

    // ============ 调用栈 ============

    /** 最近的帧在前；超过显示上限时折叠中间部分 */
    private String formatStackTrace() {
        int size = frames.size();
        StringBuilder sb = new StringBuilder("Call stack:");
        if (size <= TRACE_DISPLAY_LIMIT) {
            for (int i = size - 1; i >= 0; i--) {
                appendFrame(sb, frames.get(i));
            }
        } else {
            int half = TRACE_DISPLAY_LIMIT / 2;
            for (int i = size - 1; i >= size - half; i--) {
                appendFrame(sb, frames.get(i));
            }
            sb.append("\n  ... ").append(size - TRACE_DISPLAY_LIMIT).append(" frames omitted ...");
            for (int i = half - 1; i >= 0; i--) {
                appendFrame(sb, frames.get(i));
            }
        }
        return sb.toString();
    }

    private static void appendFrame(StringBuilder sb, CallFrame frame) {
        sb.append("\n  at ").append(frame.chunk.getName());
        int line = frame.currentLine();
        if (line > 0) {
            sb.append(" (line ").append(line).append(')');
        }
    }
}
