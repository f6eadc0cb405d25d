package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.types.FunctionType;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.FunDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数符号：普通函数、impl 方法或原生函数
 *
 * <p>方法的第 0 个参数是隐式的 {@code self}。原生函数的 nativeName
 * 是相对根模块的限定名（如 {@code std::sqrt}），运行时据此链接宿主实现。</p>
 */
public final class FunctionSymbol extends Symbol {

    private final ModuleSymbol module;
    private final String qualifiedName;
    private final FunDecl decl;          // 注册表原生函数为 null
    private final ContainerSymbol owner; // 非方法为 null
    private FunctionType type;
    private final List<LocalSymbol> params = new ArrayList<>();
    private int localCount;

    FunctionSymbol(int id, String name, SymbolKind kind, ModuleSymbol module, String qualifiedName,
                   FunDecl decl, ContainerSymbol owner, SourceLocation location) {
        super(id, name, kind, location);
        this.module = module;
        this.qualifiedName = qualifiedName;
        this.decl = decl;
        this.owner = owner;
    }

    @Override
    public String getQualifiedName() {
        return qualifiedName;
    }

    /** 声明所在模块（方法为容器所在模块） */
    public ModuleSymbol getModule() {
        return module;
    }

    public FunDecl getDecl() {
        return decl;
    }

    public boolean isNative() {
        return getKind() == SymbolKind.NATIVE_FUNCTION;
    }

    public boolean isMethod() {
        return getKind() == SymbolKind.METHOD;
    }

    public ContainerSymbol getOwner() {
        return owner;
    }

    /** 原生函数的稳定链接名 */
    public String getNativeName() {
        String prefix = ModuleSymbol.ROOT_NAME + "::";
        return qualifiedName.startsWith(prefix) ? qualifiedName.substring(prefix.length()) : qualifiedName;
    }

    public FunctionType getType() {
        return type;
    }

    void setType(FunctionType type) {
        this.type = type;
    }

    /** 参数（方法包括 self），即前 N 个局部槽位 */
    public List<LocalSymbol> getParams() {
        return Collections.unmodifiableList(params);
    }

    void addParam(LocalSymbol param) {
        params.add(param);
    }

    public int getArity() {
        return type.getArity();
    }

    /** 函数体需要的局部槽位总数（含参数和 for 循环隐藏槽位） */
    public int getLocalCount() {
        return localCount;
    }

    void setLocalCount(int localCount) {
        this.localCount = localCount;
    }
}
