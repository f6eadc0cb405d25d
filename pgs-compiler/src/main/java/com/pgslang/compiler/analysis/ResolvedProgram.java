package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.types.PgsType;
import com.pgslang.compiler.ast.AstNode;
import com.pgslang.compiler.ast.decl.Program;
import com.pgslang.compiler.ast.expr.Expression;
import com.pgslang.compiler.ast.expr.StructLiteral;
import com.pgslang.compiler.ast.stmt.ForStmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析结果：模块树、函数与容器列表，以及以 AST 节点为键的注解表
 *
 * <p>构建完成后只读，可被多个编译或执行过程共享。</p>
 */
public final class ResolvedProgram {

    private final Program program;
    private final ModuleSymbol root;
    private final List<FunctionSymbol> functions = new ArrayList<>();
    private final List<FunctionSymbol> natives = new ArrayList<>();
    private final List<ContainerSymbol> containers = new ArrayList<>();
    private final Map<String, FunctionSymbol> functionsByName = new LinkedHashMap<>();

    // AST 注解（按节点身份）
    private final Map<Expression, PgsType> expressionTypes = new IdentityHashMap<>();
    private final Map<AstNode, Symbol> references = new IdentityHashMap<>();
    private final Map<AstNode, LocalSymbol> declaredLocals = new IdentityHashMap<>();
    private final Map<AstNode, Integer> fieldIndices = new IdentityHashMap<>();
    private final Map<ForStmt, ForLoopSlots> forLoops = new IdentityHashMap<>();
    private final Map<StructLiteral, Integer> structTemps = new IdentityHashMap<>();

    ResolvedProgram(Program program, ModuleSymbol root) {
        this.program = program;
        this.root = root;
    }

    public Program getProgram() {
        return program;
    }

    public ModuleSymbol getRoot() {
        return root;
    }

    /** 所有带函数体的函数（含方法），按声明顺序 */
    public List<FunctionSymbol> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /** 所有原生函数，按声明顺序 */
    public List<FunctionSymbol> getNatives() {
        return Collections.unmodifiableList(natives);
    }

    public List<ContainerSymbol> getContainers() {
        return Collections.unmodifiableList(containers);
    }

    /** 按全限定名查找函数或方法，如 root::main、root::Vec::length */
    public FunctionSymbol findFunction(String qualifiedName) {
        return functionsByName.get(qualifiedName);
    }

    public PgsType typeOf(Expression expr) {
        PgsType type = expressionTypes.get(expr);
        if (type == null) {
            throw new IllegalStateException("Expression was not resolved: " + expr.getLocation());
        }
        return type;
    }

    /**
     * 节点引用的符号：Identifier → 局部变量，CallExpr/MethodCallExpr → 函数，
     * StructLiteral → 容器
     */
    public Symbol symbolOf(AstNode node) {
        return references.get(node);
    }

    /** VarDeclStmt 声明的局部变量 */
    public LocalSymbol localOf(AstNode declaration) {
        return declaredLocals.get(declaration);
    }

    /** MemberExpr 访问的字段下标，未解析时返回 -1 */
    public int fieldIndexOf(AstNode member) {
        Integer index = fieldIndices.get(member);
        return index != null ? index : -1;
    }

    public ForLoopSlots forLoopOf(ForStmt stmt) {
        return forLoops.get(stmt);
    }

    /**
     * 书写顺序与布局顺序不同的容器字面量所用隐藏槽位的起点。
     * 字段 i 的值暂存在起点 + i 处；顺序一致时返回 -1。
     */
    public int structTempsOf(StructLiteral literal) {
        Integer first = structTemps.get(literal);
        return first != null ? first : -1;
    }

    // ============ 构建（仅 Resolver 使用） ============

    void addFunction(FunctionSymbol fn) {
        functionsByName.put(fn.getQualifiedName(), fn);
        if (fn.isNative()) {
            natives.add(fn);
        } else {
            functions.add(fn);
        }
    }

    void addContainer(ContainerSymbol container) {
        containers.add(container);
    }

    PgsType recordType(Expression expr, PgsType type) {
        expressionTypes.put(expr, type);
        return type;
    }

    void recordReference(AstNode node, Symbol symbol) {
        references.put(node, symbol);
    }

    void recordLocal(AstNode node, LocalSymbol local) {
        declaredLocals.put(node, local);
    }

    void recordFieldIndex(AstNode node, int index) {
        fieldIndices.put(node, index);
    }

    void recordForLoop(ForStmt stmt, ForLoopSlots slots) {
        forLoops.put(stmt, slots);
    }

    void recordStructTemps(StructLiteral literal, int firstSlot) {
        structTemps.put(literal, firstSlot);
    }
}
