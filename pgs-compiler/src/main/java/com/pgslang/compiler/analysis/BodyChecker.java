package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.ResolveException.Kind;
import com.pgslang.compiler.analysis.types.ContainerType;
import com.pgslang.compiler.analysis.types.PgsType;
import com.pgslang.compiler.analysis.types.PrimitiveType;
import com.pgslang.compiler.ast.AstVisitor;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.expr.*;
import com.pgslang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.pgslang.compiler.ast.stmt.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 函数体检查：局部变量槽位分配、名称绑定与类型检查
 *
 * <p>语句访问返回 Boolean，表示该语句能否正常执行完毕（用于缺失 return 的检查）；
 * 表达式访问返回其静态类型。</p>
 *
 * <p>槽位分配规则：参数占前 N 个槽位，之后每个 var 声明（含嵌套块中的）
 * 和 for 循环的隐藏槽位按出现顺序各取一个新槽位，离开块后不复用。</p>
 */
final class BodyChecker implements AstVisitor<Object, Void> {

    private final Resolver resolver;
    private final ResolvedProgram result;
    private final FunctionSymbol function;
    private final ModuleSymbol module;
    private final PgsType returnType;

    private Scope scope;
    private int nextSlot;
    // 每层循环是否出现了 break
    private final Deque<boolean[]> loops = new ArrayDeque<>();

    BodyChecker(Resolver resolver, ResolvedProgram result, FunctionSymbol function) {
        this.resolver = resolver;
        this.result = result;
        this.function = function;
        this.module = function.getModule();
        this.returnType = function.getType().getReturnType();
    }

    void check() {
        scope = new Scope(Scope.ScopeType.FUNCTION, null);
        for (LocalSymbol param : function.getParams()) {
            scope.define(param);
        }
        nextSlot = function.getParams().size();

        Block body = function.getDecl().getBody();
        boolean completes = checkBlock(body);
        if (completes && !returnType.isUnit()) {
            throw new ResolveException(Kind.MISSING_RETURN,
                    "Function '" + function.getQualifiedName() + "' must return a value of type "
                            + returnType.getName() + " on every path",
                    function.getName(), function.getLocation());
        }
        function.setLocalCount(nextSlot);
    }

    // ============ 语句 ============

    private boolean checkStmt(Statement stmt) {
        return (Boolean) stmt.accept(this, null);
    }

    private boolean checkBlock(Block block) {
        Scope saved = scope;
        scope = new Scope(Scope.ScopeType.BLOCK, saved);
        try {
            boolean completes = true;
            for (Statement stmt : block.getStatements()) {
                if (!checkStmt(stmt)) {
                    completes = false;
                }
            }
            return completes;
        } finally {
            scope = saved;
        }
    }

    @Override
    public Object visitBlock(Block node, Void ctx) {
        return checkBlock(node);
    }

    @Override
    public Object visitVarDeclStmt(VarDeclStmt node, Void ctx) {
        PgsType declared = resolver.resolveType(module, node.getType());
        // 初始化表达式在变量声明之前求值，可以引用外层同名变量
        PgsType actual = checkExpr(node.getInitializer());
        expectType(declared, actual, node.getInitializer().getLocation(),
                "Cannot initialize variable '" + node.getName() + "'");
        LocalSymbol local = newLocal(node.getName(), declared, node.getLocation());
        result.recordLocal(node, local);
        return Boolean.TRUE;
    }

    @Override
    public Object visitReturnStmt(ReturnStmt node, Void ctx) {
        if (!node.hasValue()) {
            if (!returnType.isUnit()) {
                throw new ResolveException(Kind.TYPE_MISMATCH,
                        "Missing return value, expected " + returnType.getName(),
                        function.getName(), node.getLocation());
            }
            return Boolean.FALSE;
        }
        PgsType actual = checkExpr(node.getValue());
        expectType(returnType, actual, node.getValue().getLocation(), "Invalid return value");
        return Boolean.FALSE;
    }

    @Override
    public Object visitIfStmt(IfStmt node, Void ctx) {
        expectCondition(node.getCondition(), "if");
        boolean thenCompletes = checkBlock(node.getThenBranch());
        if (!node.hasElse()) {
            return Boolean.TRUE;
        }
        boolean elseCompletes = checkBlock(node.getElseBranch());
        return thenCompletes || elseCompletes;
    }

    @Override
    public Object visitWhileStmt(WhileStmt node, Void ctx) {
        expectCondition(node.getCondition(), "while");
        loops.push(new boolean[1]);
        try {
            checkBlock(node.getBody());
        } finally {
            loops.pop();
        }
        return Boolean.TRUE;
    }

    @Override
    public Object visitLoopStmt(LoopStmt node, Void ctx) {
        boolean[] hasBreak = new boolean[1];
        loops.push(hasBreak);
        try {
            checkBlock(node.getBody());
        } finally {
            loops.pop();
        }
        // 没有 break 的 loop 只能通过 return 离开
        return hasBreak[0];
    }

    @Override
    public Object visitForStmt(ForStmt node, Void ctx) {
        PgsType seqType = checkExpr(node.getIterable());
        PgsType elementType;
        if (seqType == PrimitiveType.INT) {
            elementType = PrimitiveType.INT;
        } else if (seqType == PrimitiveType.STRING) {
            elementType = PrimitiveType.STRING;
        } else {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Cannot iterate over " + seqType.getName() + ", expected int or string",
                    null, node.getIterable().getLocation());
        }
        int seqSlot = nextSlot++;
        int indexSlot = nextSlot++;

        Scope saved = scope;
        scope = new Scope(Scope.ScopeType.LOOP, saved);
        loops.push(new boolean[1]);
        try {
            LocalSymbol variable = newLocal(node.getVariable(), elementType, node.getVariableLocation());
            result.recordForLoop(node, new ForLoopSlots(seqSlot, indexSlot, variable, seqType));
            checkBlock(node.getBody());
        } finally {
            loops.pop();
            scope = saved;
        }
        return Boolean.TRUE;
    }

    @Override
    public Object visitBreakStmt(BreakStmt node, Void ctx) {
        // 循环外的 break 由字节码编译器报告
        if (!loops.isEmpty()) {
            loops.peek()[0] = true;
        }
        return Boolean.FALSE;
    }

    @Override
    public Object visitContinueStmt(ContinueStmt node, Void ctx) {
        return Boolean.FALSE;
    }

    @Override
    public Object visitExpressionStmt(ExpressionStmt node, Void ctx) {
        checkExpr(node.getExpression());
        return Boolean.TRUE;
    }

    // ============ 表达式 ============

    private PgsType checkExpr(Expression expr) {
        PgsType type = (PgsType) expr.accept(this, null);
        return result.recordType(expr, type);
    }

    @Override
    public Object visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INT: return PrimitiveType.INT;
            case FLOAT: return PrimitiveType.FLOAT;
            case STRING: return PrimitiveType.STRING;
            default: return PrimitiveType.BOOL;
        }
    }

    @Override
    public Object visitIdentifier(Identifier node, Void ctx) {
        if (node.isSimple()) {
            LocalSymbol local = scope.resolve(node.getName().getFirst());
            if (local != null) {
                result.recordReference(node, local);
                return local.getType();
            }
        }
        Symbol symbol = resolver.lookupPath(module, node.getName(), node.getLocation());
        if (symbol instanceof FunctionSymbol) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Function '" + node + "' cannot be used as a value", node.toString(), node.getLocation());
        }
        throw new ResolveException(Kind.TYPE_MISMATCH,
                "'" + node + "' is a " + symbol.getKind().name().toLowerCase().replace('_', ' ')
                        + ", not a value",
                node.toString(), node.getLocation());
    }

    @Override
    public Object visitBinaryExpr(BinaryExpr node, Void ctx) {
        PgsType left = checkExpr(node.getLeft());
        PgsType right = checkExpr(node.getRight());
        return binaryResult(node.getOperator(), left, right, node.getLocation());
    }

    private PgsType binaryResult(BinaryOp op, PgsType left, PgsType right, SourceLocation location) {
        if (!left.equals(right)) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Operator '" + op.getSymbol() + "' cannot be applied to " + left.getName()
                            + " and " + right.getName(),
                    null, location);
        }
        if (op.isEquality()) {
            return PrimitiveType.BOOL;
        }
        if (!left.isNumeric()) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Operator '" + op.getSymbol() + "' requires int or float operands, found " + left.getName(),
                    null, location);
        }
        return op.isComparison() ? PrimitiveType.BOOL : left;
    }

    @Override
    public Object visitUnaryExpr(UnaryExpr node, Void ctx) {
        PgsType operand = checkExpr(node.getOperand());
        if (node.getOperator() == UnaryExpr.UnaryOp.NEG) {
            if (!operand.isNumeric()) {
                throw new ResolveException(Kind.TYPE_MISMATCH,
                        "Operator '-' requires int or float, found " + operand.getName(), null, node.getLocation());
            }
            return operand;
        }
        if (operand != PrimitiveType.BOOL) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Operator '!' requires bool, found " + operand.getName(), null, node.getLocation());
        }
        return PrimitiveType.BOOL;
    }

    @Override
    public Object visitCallExpr(CallExpr node, Void ctx) {
        Identifier callee = node.getCallee();
        if (callee.isSimple() && scope.resolve(callee.getName().getFirst()) != null) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "'" + callee + "' is a variable, not a function", callee.toString(), callee.getLocation());
        }
        Symbol symbol = resolver.lookupPath(module, callee.getName(), callee.getLocation());
        if (!(symbol instanceof FunctionSymbol)) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "'" + callee + "' is not a function", callee.toString(), callee.getLocation());
        }
        FunctionSymbol fn = (FunctionSymbol) symbol;
        checkArguments(fn, fn.getType().getParamTypes(), node.getArguments(), node.getLocation());
        result.recordReference(node, fn);
        return fn.getType().getReturnType();
    }

    @Override
    public Object visitMethodCallExpr(MethodCallExpr node, Void ctx) {
        PgsType receiverType = checkExpr(node.getReceiver());
        if (!(receiverType instanceof ContainerType)) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Cannot call method '" + node.getMethod() + "' on " + receiverType.getName(),
                    node.getMethod(), node.getLocation());
        }
        ContainerSymbol container = ((ContainerType) receiverType).getSymbol();
        FunctionSymbol method = container.getMethod(node.getMethod());
        if (method == null) {
            throw new ResolveException(Kind.UNKNOWN_SYMBOL,
                    "Container " + container.getQualifiedName() + " has no method '" + node.getMethod() + "'",
                    node.getMethod(), node.getLocation());
        }
        List<PgsType> params = method.getType().getParamTypes();
        checkArguments(method, params.subList(1, params.size()), node.getArguments(), node.getLocation());
        result.recordReference(node, method);
        return method.getType().getReturnType();
    }

    private void checkArguments(FunctionSymbol fn, List<PgsType> params, List<Expression> args,
                                SourceLocation location) {
        if (params.size() != args.size()) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Function '" + fn.getQualifiedName() + "' expects " + params.size()
                            + " argument(s) but got " + args.size(),
                    fn.getName(), location);
        }
        for (int i = 0; i < args.size(); i++) {
            PgsType actual = checkExpr(args.get(i));
            expectType(params.get(i), actual, args.get(i).getLocation(),
                    "Argument " + (i + 1) + " of '" + fn.getName() + "'");
        }
    }

    @Override
    public Object visitMemberExpr(MemberExpr node, Void ctx) {
        PgsType targetType = checkExpr(node.getTarget());
        ContainerSymbol.Field field = fieldOf(targetType, node.getMember(), node.getLocation());
        result.recordFieldIndex(node, field.getIndex());
        return field.getType();
    }

    private ContainerSymbol.Field fieldOf(PgsType targetType, String name, SourceLocation location) {
        if (!(targetType instanceof ContainerType)) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Cannot access field '" + name + "' on " + targetType.getName(), name, location);
        }
        ContainerSymbol container = ((ContainerType) targetType).getSymbol();
        ContainerSymbol.Field field = container.getField(name);
        if (field == null) {
            throw new ResolveException(Kind.UNKNOWN_SYMBOL,
                    "Container " + container.getQualifiedName() + " has no field '" + name + "'", name, location);
        }
        return field;
    }

    @Override
    public Object visitAssignExpr(AssignExpr node, Void ctx) {
        Expression target = node.getTarget();
        PgsType targetType;
        if (target instanceof Identifier) {
            Identifier id = (Identifier) target;
            LocalSymbol local = id.isSimple() ? scope.resolve(id.getName().getFirst()) : null;
            if (local == null) {
                // 触发未知符号错误，或报告不可赋值
                Symbol symbol = resolver.lookupPath(module, id.getName(), id.getLocation());
                throw new ResolveException(Kind.INVALID_ASSIGNMENT,
                        "Cannot assign to " + symbol.getKind().name().toLowerCase().replace('_', ' ')
                                + " '" + id + "'",
                        id.toString(), id.getLocation());
            }
            result.recordReference(id, local);
            targetType = result.recordType(id, local.getType());
        } else if (target instanceof MemberExpr) {
            targetType = checkExpr(target);
        } else {
            throw new ResolveException(Kind.INVALID_ASSIGNMENT,
                    "Invalid assignment target", null, target.getLocation());
        }

        PgsType valueType = checkExpr(node.getValue());
        if (node.isCompound()) {
            binaryResult(node.getOperator().getBinaryOp(), targetType, valueType, node.getLocation());
        } else {
            expectType(targetType, valueType, node.getValue().getLocation(), "Cannot assign");
        }
        return targetType;
    }

    @Override
    public Object visitStructLiteral(StructLiteral node, Void ctx) {
        Symbol symbol = resolver.lookupPath(module, node.getTypeName(), node.getLocation());
        if (!(symbol instanceof ContainerSymbol)) {
            throw new ResolveException(Kind.UNKNOWN_SYMBOL,
                    "'" + node.getTypeName() + "' is not a container", node.getTypeName().getFullName(),
                    node.getLocation());
        }
        ContainerSymbol container = (ContainerSymbol) symbol;
        Set<String> seen = new HashSet<>();
        boolean layoutOrder = true;
        for (StructLiteral.FieldInit init : node.getFields()) {
            ContainerSymbol.Field field = container.getField(init.getName());
            if (field == null) {
                throw new ResolveException(Kind.UNKNOWN_SYMBOL,
                        "Container " + container.getQualifiedName() + " has no field '" + init.getName() + "'",
                        init.getName(), init.getLocation());
            }
            if (!seen.add(init.getName())) {
                throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                        "Field '" + init.getName() + "' initialized twice", init.getName(), init.getLocation());
            }
            PgsType actual = checkExpr(init.getValue());
            expectType(field.getType(), actual, init.getValue().getLocation(),
                    "Field '" + init.getName() + "'");
            layoutOrder &= field.getIndex() == seen.size() - 1;
        }
        for (ContainerSymbol.Field field : container.getFields()) {
            if (!seen.contains(field.getName())) {
                throw new ResolveException(Kind.TYPE_MISMATCH,
                        "Missing field '" + field.getName() + "' in " + container.getQualifiedName() + " literal",
                        field.getName(), node.getLocation());
            }
        }
        if (!layoutOrder) {
            // 初始化表达式按书写顺序求值，先暂存再按布局顺序装配
            result.recordStructTemps(node, nextSlot);
            nextSlot += container.getFields().size();
        }
        result.recordReference(node, container);
        return container.getType();
    }

    // ============ 辅助 ============

    private LocalSymbol newLocal(String name, PgsType type, SourceLocation location) {
        LocalSymbol local = new LocalSymbol(resolver.nextId(), name, SymbolKind.LOCAL, nextSlot++, type, location);
        if (!scope.define(local)) {
            throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                    "Variable '" + name + "' is already defined in this block", name, location);
        }
        return local;
    }

    private void expectCondition(Expression condition, String construct) {
        PgsType type = checkExpr(condition);
        if (type != PrimitiveType.BOOL) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "Condition of '" + construct + "' must be bool, found " + type.getName(),
                    null, condition.getLocation());
        }
    }

    private static void expectType(PgsType expected, PgsType actual, SourceLocation location, String what) {
        if (!expected.equals(actual)) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    what + ": expected " + expected.getName() + " but found " + actual.getName(),
                    null, location);
        }
    }
}
