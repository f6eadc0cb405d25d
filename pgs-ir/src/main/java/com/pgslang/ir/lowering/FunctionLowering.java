package com.pgslang.ir.lowering;

import com.pgslang.compiler.analysis.ContainerSymbol;
import com.pgslang.compiler.analysis.ForLoopSlots;
import com.pgslang.compiler.analysis.FunctionSymbol;
import com.pgslang.compiler.analysis.LocalSymbol;
import com.pgslang.compiler.analysis.ResolvedProgram;
import com.pgslang.compiler.analysis.Symbol;
import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.expr.*;
import com.pgslang.compiler.ast.stmt.*;
import com.pgslang.ir.bytecode.BinaryKind;
import com.pgslang.ir.bytecode.Chunk;
import com.pgslang.ir.bytecode.ChunkBuilder;
import com.pgslang.ir.bytecode.Opcode;
import com.pgslang.ir.bytecode.UnaryKind;
import pgs.runtime.PgsBool;
import pgs.runtime.PgsFloat;
import pgs.runtime.PgsInt;
import pgs.runtime.PgsString;
import pgs.runtime.PgsUnit;
import pgs.runtime.ValueKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * 单个函数体的降级。语句不改变栈高度；表达式恰好压入一个值。
 */
final class FunctionLowering implements AstVisitor<Void, Void> {

    private final ResolvedProgram program;
    private final FunctionSymbol function;
    private final Map<FunctionSymbol, Integer> chunkIndex;
    private final Map<FunctionSymbol, Integer> nativeIndex;
    private final ChunkBuilder builder;
    private final Deque<LoopContext> loops = new ArrayDeque<>();

    /**
     * 一层打开的循环。continue 目标已知时直接跳转，否则（for 的递增段）先登记后回填。
     */
    private static final class LoopContext {
        final List<Integer> breakJumps = new ArrayList<>();
        final List<Integer> continueJumps = new ArrayList<>();
        int continueTarget = -1;
    }

    FunctionLowering(ResolvedProgram program, FunctionSymbol function,
                     Map<FunctionSymbol, Integer> chunkIndex, Map<FunctionSymbol, Integer> nativeIndex) {
        this.program = program;
        this.function = function;
        this.chunkIndex = chunkIndex;
        this.nativeIndex = nativeIndex;
        this.builder = new ChunkBuilder(function.getQualifiedName(), function.getType().getParamKinds(),
                function.getType().getReturnType().getValueKind())
                .containers(function.getType().getParamContainers(),
                        function.getType().getReturnType().getContainerName());
    }

    Chunk lower() {
        Block body = function.getDecl().getBody();
        lowerBlock(body);
        // unit 函数可以执行到末尾
        int line = body.getLocation().getLine();
        builder.emitConst(PgsUnit.UNIT, line);
        builder.emit(Opcode.RETURN, line);
        return builder.build(function.getLocalCount());
    }

    // ============ 语句 ============

    private void lowerBlock(Block block) {
        SourceLocation unreachableAfter = null;
        for (Statement stmt : block.getStatements()) {
            if (unreachableAfter != null) {
                throw new CompileException("Unreachable code after 'loop' without 'break' (loop at line "
                        + unreachableAfter.getLine() + ")", stmt.getLocation());
            }
            if (stmt instanceof LoopStmt) {
                if (!lowerLoop((LoopStmt) stmt)) {
                    unreachableAfter = stmt.getLocation();
                }
            } else {
                stmt.accept(this, null);
            }
        }
    }

    @Override
    public Void visitBlock(Block node, Void ctx) {
        lowerBlock(node);
        return null;
    }

    @Override
    public Void visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        LocalSymbol local = program.localOf(node);
        lowerExpr(node.getInitializer());
        builder.emit(Opcode.STORE_LOCAL, local.getSlot(), line(node));
        builder.emit(Opcode.POP, line(node));
        return null;
    }

    @Override
    public Void visitReturnStmt(ReturnStmt node, Void ctx) {
        if (node.hasValue()) {
            lowerExpr(node.getValue());
        } else {
            builder.emitConst(PgsUnit.UNIT, line(node));
        }
        builder.emit(Opcode.RETURN, line(node));
        return null;
    }

    @Override
    public Void visitIfStmt(IfStmt node, Void ctx) {
        lowerExpr(node.getCondition());
        int skipThen = builder.emitJump(Opcode.JUMP_IF_FALSE, line(node));
        lowerBlock(node.getThenBranch());
        if (node.hasElse()) {
            int skipElse = builder.emitJump(Opcode.JUMP, line(node));
            builder.patchHere(skipThen);
            lowerBlock(node.getElseBranch());
            builder.patchHere(skipElse);
        } else {
            builder.patchHere(skipThen);
        }
        return null;
    }

    @Override
    public Void visitWhileStmt(WhileStmt node, Void ctx) {
        int head = builder.offset();
        lowerExpr(node.getCondition());
        int exit = builder.emitJump(Opcode.JUMP_IF_FALSE, line(node));

        LoopContext loop = openLoop(head);
        lowerBlock(node.getBody());
        builder.emitJumpTo(Opcode.JUMP, head, line(node));
        builder.patchHere(exit);
        closeLoop(loop);
        return null;
    }

    @Override
    public Void visitLoopStmt(LoopStmt node, Void ctx) {
        lowerLoop(node);
        return null;
    }

    /**
     * @return 循环体内是否有跳出该循环的 break
     */
    private boolean lowerLoop(LoopStmt node) {
        int head = builder.offset();
        LoopContext loop = openLoop(head);
        lowerBlock(node.getBody());
        builder.emitJumpTo(Opcode.JUMP, head, line(node));
        boolean hasBreak = !loop.breakJumps.isEmpty();
        closeLoop(loop);
        return hasBreak;
    }

    /**
     * for x in seq { body }  降级为：
     * <pre>
     *   seq → $seq; 0 → $i
     * head:
     *   if !($i &lt; len($seq)) goto exit
     *   x = $seq[$i]
     *   body
     * next:
     *   $i = $i + 1; goto head
     * exit:
     * </pre>
     */
    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        ForLoopSlots slots = program.forLoopOf(node);
        int line = line(node);
        int seq = slots.getSequenceSlot();
        int index = slots.getIndexSlot();

        lowerExpr(node.getIterable());
        builder.emit(Opcode.STORE_LOCAL, seq, line);
        builder.emit(Opcode.POP, line);
        builder.emitConst(PgsInt.of(0), line);
        builder.emit(Opcode.STORE_LOCAL, index, line);
        builder.emit(Opcode.POP, line);

        int head = builder.offset();
        builder.emit(Opcode.LOAD_LOCAL, index, line);
        builder.emit(Opcode.LOAD_LOCAL, seq, line);
        builder.emit(Opcode.SEQ_LEN, line);
        builder.emit(Opcode.BINARY, BinaryKind.LT.ordinal(), ValueKind.INT.ordinal(), line);
        int exit = builder.emitJump(Opcode.JUMP_IF_FALSE, line);

        builder.emit(Opcode.LOAD_LOCAL, seq, line);
        builder.emit(Opcode.LOAD_LOCAL, index, line);
        builder.emit(Opcode.SEQ_GET, line);
        builder.emit(Opcode.STORE_LOCAL, slots.getVariable().getSlot(), line);
        builder.emit(Opcode.POP, line);

        LoopContext loop = openLoop(-1);
        lowerBlock(node.getBody());

        int next = builder.offset();
        for (int jump : loop.continueJumps) {
            builder.patch(jump, next);
        }
        builder.emit(Opcode.LOAD_LOCAL, index, line);
        builder.emitConst(PgsInt.of(1), line);
        builder.emit(Opcode.BINARY, BinaryKind.ADD.ordinal(), ValueKind.INT.ordinal(), line);
        builder.emit(Opcode.STORE_LOCAL, index, line);
        builder.emit(Opcode.POP, line);
        builder.emitJumpTo(Opcode.JUMP, head, line);
        builder.patchHere(exit);
        closeLoop(loop);
        return null;
    }

    @Override
    public Void visitBreakStmt(BreakStmt node, Void ctx) {
        LoopContext loop = loops.peek();
        if (loop == null) {
            throw new CompileException("'break' outside of a loop", node.getLocation());
        }
        loop.breakJumps.add(builder.emitJump(Opcode.JUMP, line(node)));
        return null;
    }

    @Override
    public Void visitContinueStmt(ContinueStmt node, Void ctx) {
        LoopContext loop = loops.peek();
        if (loop == null) {
            throw new CompileException("'continue' outside of a loop", node.getLocation());
        }
        if (loop.continueTarget >= 0) {
            builder.emitJumpTo(Opcode.JUMP, loop.continueTarget, line(node));
        } else {
            loop.continueJumps.add(builder.emitJump(Opcode.JUMP, line(node)));
        }
        return null;
    }

    @Override
    public Void visitExpressionStmt(ExpressionStmt node, Void ctx) {
        lowerExpr(node.getExpression());
        builder.emit(Opcode.POP, line(node));
        return null;
    }

    private LoopContext openLoop(int continueTarget) {
        LoopContext loop = new LoopContext();
        loop.continueTarget = continueTarget;
        loops.push(loop);
        return loop;
    }

    /** 关闭循环并把 break 回填到当前地址 */
    private void closeLoop(LoopContext loop) {
        loops.pop();
        for (int jump : loop.breakJumps) {
            builder.patchHere(jump);
        }
    }

    // ============ 表达式 ============

    private void lowerExpr(Expression expr) {
        expr.accept(this, null);
    }

    @Override
    public Void visitLiteral(Literal node, Void ctx) {
        int line = line(node);
        switch (node.getKind()) {
            case INT:
                builder.emitConst(PgsInt.of((Long) node.getValue()), line);
                break;
            case FLOAT:
                builder.emitConst(PgsFloat.of((Double) node.getValue()), line);
                break;
            case STRING:
                builder.emitConst(PgsString.of((String) node.getValue()), line);
                break;
            default:
                builder.emitConst(PgsBool.of((Boolean) node.getValue()), line);
                break;
        }
        return null;
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        builder.emit(Opcode.LOAD_LOCAL, localOf(node).getSlot(), line(node));
        return null;
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr node, Void ctx) {
        lowerExpr(node.getLeft());
        lowerExpr(node.getRight());
        emitBinary(node.getOperator(), node.getLeft(), line(node));
        return null;
    }

    private void emitBinary(BinaryExpr.BinaryOp op, Expression leftOperand, int line) {
        ValueKind kind = program.typeOf(leftOperand).getValueKind();
        builder.emit(Opcode.BINARY, BinaryKind.valueOf(op.name()).ordinal(), kind.ordinal(), line);
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr node, Void ctx) {
        lowerExpr(node.getOperand());
        UnaryKind kind = node.getOperator() == UnaryExpr.UnaryOp.NEG ? UnaryKind.NEG : UnaryKind.NOT;
        builder.emit(Opcode.UNARY, kind.ordinal(), program.typeOf(node.getOperand()).getValueKind().ordinal(),
                line(node));
        return null;
    }

    @Override
    public Void visitCallExpr(CallExpr node, Void ctx) {
        FunctionSymbol callee = functionOf(node);
        for (Expression arg : node.getArguments()) {
            lowerExpr(arg);
        }
        emitCall(callee, node.getArguments().size(), node.getLocation());
        return null;
    }

    @Override
    public Void visitMethodCallExpr(MethodCallExpr node, Void ctx) {
        FunctionSymbol method = functionOf(node);
        lowerExpr(node.getReceiver());
        for (Expression arg : node.getArguments()) {
            lowerExpr(arg);
        }
        emitCall(method, node.getArguments().size() + 1, node.getLocation());
        return null;
    }

    private void emitCall(FunctionSymbol callee, int argc, SourceLocation location) {
        if (callee.isNative()) {
            Integer index = nativeIndex.get(callee);
            if (index == null) {
                throw new CompileException("No native binding for '" + callee.getQualifiedName() + "'", location);
            }
            builder.emit(Opcode.CALL_NATIVE, index, argc, location.getLine());
        } else {
            Integer index = chunkIndex.get(callee);
            if (index == null) {
                throw new CompileException("No compiled body for '" + callee.getQualifiedName() + "'", location);
            }
            builder.emit(Opcode.CALL, index, argc, location.getLine());
        }
    }

    @Override
    public Void visitMemberExpr(MemberExpr node, Void ctx) {
        lowerExpr(node.getTarget());
        builder.emit(Opcode.LOAD_FIELD, fieldIndexOf(node), line(node));
        return null;
    }

    @Override
    public Void visitAssignExpr(AssignExpr node, Void ctx) {
        int line = line(node);
        Expression target = node.getTarget();
        if (target instanceof Identifier) {
            int slot = localOf((Identifier) target).getSlot();
            if (node.isCompound()) {
                builder.emit(Opcode.LOAD_LOCAL, slot, line);
                lowerExpr(node.getValue());
                emitBinary(node.getOperator().getBinaryOp(), target, line);
            } else {
                lowerExpr(node.getValue());
            }
            builder.emit(Opcode.STORE_LOCAL, slot, line);
        } else if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            int field = fieldIndexOf(member);
            lowerExpr(member.getTarget());
            if (node.isCompound()) {
                builder.emit(Opcode.DUP, line);
                builder.emit(Opcode.LOAD_FIELD, field, line);
                lowerExpr(node.getValue());
                emitBinary(node.getOperator().getBinaryOp(), target, line);
            } else {
                lowerExpr(node.getValue());
            }
            builder.emit(Opcode.STORE_FIELD, field, line);
        } else {
            throw new CompileException("Invalid assignment target", target.getLocation());
        }
        return null;
    }

    /**
     * 初始化表达式按书写顺序求值，字段值按布局顺序入栈后由 NewStruct 装配。
     * 书写顺序与布局不同时，各值先存入解析器分配的隐藏槽位。
     */
    @Override
    public Void visitStructLiteral(StructLiteral node, Void ctx) {
        Symbol symbol = program.symbolOf(node);
        if (!(symbol instanceof ContainerSymbol)) {
            throw new CompileException("Unresolved container literal '" + node.getTypeName() + "'",
                    node.getLocation());
        }
        ContainerSymbol container = (ContainerSymbol) symbol;
        int line = line(node);
        int temps = program.structTempsOf(node);
        if (temps < 0) {
            for (ContainerSymbol.Field field : container.getFields()) {
                lowerExpr(initializerOf(node, field.getName()));
            }
            builder.emitNewStruct(container.toLayout(), line);
            return null;
        }

        for (StructLiteral.FieldInit init : node.getFields()) {
            lowerExpr(init.getValue());
            builder.emit(Opcode.STORE_LOCAL, temps + container.getField(init.getName()).getIndex(), line);
            builder.emit(Opcode.POP, line);
        }
        for (ContainerSymbol.Field field : container.getFields()) {
            builder.emit(Opcode.LOAD_LOCAL, temps + field.getIndex(), line);
        }
        builder.emitNewStruct(container.toLayout(), line);
        // 暂存的容器引用不能留到函数返回
        for (ContainerSymbol.Field field : container.getFields()) {
            if (field.getType().getValueKind() == ValueKind.STRUCT) {
                builder.emitConst(PgsUnit.UNIT, line);
                builder.emit(Opcode.STORE_LOCAL, temps + field.getIndex(), line);
                builder.emit(Opcode.POP, line);
            }
        }
        return null;
    }

    private static Expression initializerOf(StructLiteral node, String fieldName) {
        for (StructLiteral.FieldInit init : node.getFields()) {
            if (init.getName().equals(fieldName)) {
                return init.getValue();
            }
        }
        throw new CompileException("Missing field '" + fieldName + "'", node.getLocation());
    }

    // ============ 辅助 ============

    private LocalSymbol localOf(Identifier node) {
        Symbol symbol = program.symbolOf(node);
        if (!(symbol instanceof LocalSymbol)) {
            throw new CompileException("'" + node + "' does not name a local variable", node.getLocation());
        }
        return (LocalSymbol) symbol;
    }

    private FunctionSymbol functionOf(Expression call) {
        Symbol symbol = program.symbolOf(call);
        if (!(symbol instanceof FunctionSymbol)) {
            throw new CompileException("Unresolved call", call.getLocation());
        }
        return (FunctionSymbol) symbol;
    }

    private int fieldIndexOf(MemberExpr node) {
        int index = program.fieldIndexOf(node);
        if (index < 0) {
            throw new CompileException("Unresolved field '" + node.getMember() + "'", node.getLocation());
        }
        return index;
    }

    private static int line(AstNode node) {
        return node.getLocation().getLine();
    }
}
