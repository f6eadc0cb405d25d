package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.ResolveException.Kind;
import com.pgslang.compiler.analysis.types.ContainerType;
import com.pgslang.compiler.analysis.types.FunctionType;
import com.pgslang.compiler.analysis.types.PgsType;
import com.pgslang.compiler.analysis.types.PrimitiveType;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.*;
import com.pgslang.compiler.ast.type.TypeRef;
import pgs.runtime.NativeFunction;
import pgs.runtime.NativeRegistry;
import pgs.runtime.ValueKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 名称解析器
 *
 * <p>处理顺序：</p>
 * <ol>
 *   <li>声明：建立模块树，登记所有函数、容器和导入别名（同模块内允许前向引用）</li>
 *   <li>注册表原生模块：把嵌入方提供的原生函数挂到对应模块下</li>
 *   <li>导入：逐个解析别名，跟随别名链并检测环</li>
 *   <li>容器字段与函数签名，impl 方法注册</li>
 *   <li>函数体检查（{@link BodyChecker}）</li>
 * </ol>
 *
 * <p>第一个错误即抛出 {@link ResolveException}。</p>
 */
public final class Resolver {

    private static final Logger LOG = Logger.getLogger(Resolver.class.getName());

    private final NativeRegistry nativeRegistry;

    private int nextId;
    private ModuleSymbol root;
    private ResolvedProgram result;
    private final List<AliasSymbol> aliases = new ArrayList<>();
    private final List<FunctionSymbol> declaredFunctions = new ArrayList<>();
    private final List<ContainerSymbol> declaredContainers = new ArrayList<>();
    private final List<PendingImpl> pendingImpls = new ArrayList<>();

    public Resolver() {
        this(null);
    }

    /**
     * @param nativeRegistry 编译期可见的原生函数，可为 null
     */
    public Resolver(NativeRegistry nativeRegistry) {
        this.nativeRegistry = nativeRegistry;
    }

    /**
     * 解析程序。一个 Resolver 实例只能使用一次。
     */
    public ResolvedProgram resolve(Program program) {
        if (result != null) {
            throw new IllegalStateException("Resolver instance already used");
        }
        root = new ModuleSymbol(nextId++, ModuleSymbol.ROOT_NAME, null, program.getLocation());
        result = new ResolvedProgram(program, root);

        declareItems(root, program.getItems());
        declareRegistryNatives();

        for (AliasSymbol alias : aliases) {
            resolveAlias(alias, new LinkedHashSet<AliasSymbol>());
        }
        for (ContainerSymbol container : declaredContainers) {
            resolveFields(container);
        }
        checkRecursiveContainers();
        for (FunctionSymbol fn : declaredFunctions) {
            resolveSignature(fn, null);
        }
        for (PendingImpl impl : pendingImpls) {
            registerImpl(impl);
        }

        for (FunctionSymbol fn : result.getFunctions()) {
            new BodyChecker(this, result, fn).check();
        }

        LOG.fine("Resolved " + result.getFunctions().size() + " functions, "
                + result.getNatives().size() + " natives, "
                + result.getContainers().size() + " containers");
        return result;
    }

    int nextId() {
        return nextId++;
    }

    // ============ 声明 ============

    private void declareItems(ModuleSymbol module, List<Declaration> items) {
        for (Declaration item : items) {
            if (item instanceof ModuleDecl) {
                ModuleDecl decl = (ModuleDecl) item;
                ModuleSymbol child = new ModuleSymbol(nextId++, decl.getName(), module, decl.getLocation());
                define(module, child);
                declareItems(child, decl.getItems());
            } else if (item instanceof ContainerDecl) {
                ContainerSymbol container = new ContainerSymbol(nextId++, module, (ContainerDecl) item);
                define(module, container);
                declaredContainers.add(container);
                result.addContainer(container);
            } else if (item instanceof FunDecl) {
                FunDecl decl = (FunDecl) item;
                FunctionSymbol fn = new FunctionSymbol(nextId++, decl.getName(),
                        decl.isNative() ? SymbolKind.NATIVE_FUNCTION : SymbolKind.FUNCTION,
                        module, module.qualify(decl.getName()), decl, null, decl.getLocation());
                define(module, fn);
                declaredFunctions.add(fn);
                result.addFunction(fn);
            } else if (item instanceof ImportDecl) {
                AliasSymbol alias = new AliasSymbol(nextId++, module, (ImportDecl) item);
                define(module, alias);
                aliases.add(alias);
            } else if (item instanceof ImplDecl) {
                pendingImpls.add(new PendingImpl(module, (ImplDecl) item));
            }
        }
    }

    private void define(ModuleSymbol module, Symbol symbol) {
        if (ModuleSymbol.ROOT_NAME.equals(symbol.getName())) {
            throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                    "'root' is reserved for the root module", symbol.getName(), symbol.getLocation());
        }
        Symbol existing = module.define(symbol);
        if (existing != null) {
            throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                    "Duplicate definition of '" + symbol.getName() + "' in module " + module.getQualifiedName()
                            + " (first defined at " + existing.getLocation() + ")",
                    symbol.getName(), symbol.getLocation());
        }
    }

    /**
     * 把注册表中的原生函数声明到对应模块，模块按需创建。
     * 源码中以 {@code fn: name(...) ~ T;} 声明的同名外部函数优先。
     */
    private void declareRegistryNatives() {
        if (nativeRegistry == null) {
            return;
        }
        for (NativeFunction nf : nativeRegistry.getFunctions()) {
            PgsType returnType = PrimitiveType.forKind(nf.getReturnKind());
            List<PgsType> paramTypes = new ArrayList<>();
            boolean expressible = returnType != null;
            for (ValueKind kind : nf.getParamKinds()) {
                PgsType t = PrimitiveType.forKind(kind);
                if (t == null) {
                    expressible = false;
                    break;
                }
                paramTypes.add(t);
            }
            if (!expressible) {
                // 容器参数无法从种类推出具体类型，只能通过外部声明使用
                LOG.fine("Skipping native " + nf.getName() + ": signature needs an extern declaration");
                continue;
            }

            ModuleSymbol module = root;
            if (!nf.getModulePath().isEmpty()) {
                for (String segment : nf.getModulePath().split("::")) {
                    Symbol existing = module.lookupLocal(segment);
                    if (existing == null) {
                        ModuleSymbol child = new ModuleSymbol(nextId++, segment, module, SourceLocation.UNKNOWN);
                        define(module, child);
                        module = child;
                    } else if (existing instanceof ModuleSymbol) {
                        module = (ModuleSymbol) existing;
                    } else {
                        throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                                "Native module '" + segment + "' conflicts with " + existing.getKind().name().toLowerCase()
                                        + " " + existing.getQualifiedName(),
                                segment, existing.getLocation());
                    }
                }
            }

            Symbol existing = module.lookupLocal(nf.getSimpleName());
            if (existing == null) {
                FunctionSymbol fn = new FunctionSymbol(nextId++, nf.getSimpleName(), SymbolKind.NATIVE_FUNCTION,
                        module, module.qualify(nf.getSimpleName()), null, null, SourceLocation.UNKNOWN);
                fn.setType(new FunctionType(paramTypes, returnType));
                module.define(fn);
                result.addFunction(fn);
            } else if (!(existing instanceof FunctionSymbol) || !((FunctionSymbol) existing).isNative()) {
                throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                        "Native function '" + nf.getName() + "' conflicts with " + existing.getQualifiedName(),
                        nf.getName(), existing.getLocation());
            }
        }
    }

    // ============ 导入与路径查找 ============

    private Symbol resolveAlias(AliasSymbol alias, Set<AliasSymbol> visiting) {
        if (alias.getTarget() != null) {
            return alias.getTarget();
        }
        if (!visiting.add(alias)) {
            StringBuilder chain = new StringBuilder();
            for (AliasSymbol a : visiting) {
                chain.append(a.getQualifiedName()).append(" -> ");
            }
            chain.append(alias.getQualifiedName());
            throw new ResolveException(Kind.IMPORT_CYCLE,
                    "Import cycle: " + chain, alias.getName(), alias.getLocation());
        }
        Symbol target = lookupPath(alias.getModule(), alias.getDecl().getPath(),
                alias.getLocation(), visiting, true);
        alias.setTarget(target);
        visiting.remove(alias);
        return target;
    }

    /**
     * 查找路径：首段从当前模块向外查找（{@code root} 表示根模块），
     * 其余各段在前一段的模块中查找。别名会被透明跟随。
     */
    Symbol lookupPath(ModuleSymbol from, QualifiedName path, SourceLocation location) {
        return lookupPath(from, path, location, new LinkedHashSet<AliasSymbol>(), false);
    }

    private Symbol lookupPath(ModuleSymbol from, QualifiedName path, SourceLocation location,
                              Set<AliasSymbol> visiting, boolean forImport) {
        List<String> parts = path.getParts();
        String first = parts.get(0);
        Symbol current = ModuleSymbol.ROOT_NAME.equals(first) ? root : from.lookup(first);
        if (current == null) {
            throw notFound(path, first, from, location, forImport);
        }
        current = follow(current, visiting);
        for (int i = 1; i < parts.size(); i++) {
            if (!(current instanceof ModuleSymbol)) {
                throw new ResolveException(forImport ? Kind.UNRESOLVABLE_IMPORT : Kind.UNKNOWN_SYMBOL,
                        "'" + current.getQualifiedName() + "' is not a module in path '" + path + "'",
                        path.getFullName(), location);
            }
            ModuleSymbol module = (ModuleSymbol) current;
            Symbol next = module.lookupLocal(parts.get(i));
            if (next == null) {
                throw notFound(path, parts.get(i), module, location, forImport);
            }
            current = follow(next, visiting);
        }
        return current;
    }

    private Symbol follow(Symbol symbol, Set<AliasSymbol> visiting) {
        if (symbol instanceof AliasSymbol) {
            return resolveAlias((AliasSymbol) symbol, visiting);
        }
        return symbol;
    }

    private ResolveException notFound(QualifiedName path, String segment, ModuleSymbol in,
                                      SourceLocation location, boolean forImport) {
        if (forImport) {
            return new ResolveException(Kind.UNRESOLVABLE_IMPORT,
                    "Cannot resolve import '" + path + "': '" + segment + "' not found in " + in.getQualifiedName(),
                    path.getFullName(), location);
        }
        if (path.isSimple()) {
            return new ResolveException(Kind.UNKNOWN_SYMBOL,
                    "Unknown symbol '" + segment + "'", segment, location);
        }
        return new ResolveException(Kind.UNKNOWN_SYMBOL,
                "Unknown symbol '" + path + "': '" + segment + "' not found in " + in.getQualifiedName(),
                path.getFullName(), location);
    }

    // ============ 类型与签名 ============

    PgsType resolveType(ModuleSymbol module, TypeRef ref) {
        QualifiedName name = ref.getName();
        if (name.isSimple()) {
            PrimitiveType primitive = PrimitiveType.byName(name.getFirst());
            if (primitive != null) {
                return primitive;
            }
        }
        Symbol symbol = lookupPath(module, name, ref.getLocation());
        if (symbol instanceof ContainerSymbol) {
            return ((ContainerSymbol) symbol).getType();
        }
        throw new ResolveException(Kind.UNKNOWN_SYMBOL,
                "'" + name + "' is not a type", name.getFullName(), ref.getLocation());
    }

    private PgsType resolveValueType(ModuleSymbol module, TypeRef ref, String what) {
        PgsType type = resolveType(module, ref);
        if (type.isUnit()) {
            throw new ResolveException(Kind.TYPE_MISMATCH,
                    "unit is not a valid " + what + " type", ref.toString(), ref.getLocation());
        }
        return type;
    }

    private void resolveFields(ContainerSymbol container) {
        for (FieldDecl field : container.getDecl().getFields()) {
            PgsType type = resolveValueType(container.getModule(), field.getType(), "field");
            if (!container.addField(field.getName(), type, field.getLocation())) {
                throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                        "Duplicate field '" + field.getName() + "' in container " + container.getQualifiedName(),
                        field.getName(), field.getLocation());
            }
        }
    }

    /**
     * 容器只能包含基本类型或其他容器，不允许（间接）包含自身
     */
    private void checkRecursiveContainers() {
        Map<ContainerSymbol, Integer> state = new HashMap<>();
        for (ContainerSymbol container : declaredContainers) {
            visitContainer(container, state);
        }
    }

    private void visitContainer(ContainerSymbol container, Map<ContainerSymbol, Integer> state) {
        Integer s = state.get(container);
        if (s != null && s == 2) {
            return;
        }
        state.put(container, 1);
        for (ContainerSymbol.Field field : container.getFields()) {
            if (!(field.getType() instanceof ContainerType)) {
                continue;
            }
            ContainerSymbol target = ((ContainerType) field.getType()).getSymbol();
            Integer ts = state.get(target);
            if (ts != null && ts == 1) {
                throw new ResolveException(Kind.RECURSIVE_CONTAINER,
                        "Container " + container.getQualifiedName() + " contains itself through field '"
                                + field.getName() + "'",
                        container.getName(), field.getLocation());
            }
            visitContainer(target, state);
        }
        state.put(container, 2);
    }

    /**
     * 解析参数与返回类型；方法额外在 0 号槽位放入 self
     */
    private void resolveSignature(FunctionSymbol fn, ContainerSymbol owner) {
        FunDecl decl = fn.getDecl();
        ModuleSymbol module = fn.getModule();
        List<PgsType> paramTypes = new ArrayList<>();
        Set<String> names = new LinkedHashSet<>();
        int slot = 0;
        if (owner != null) {
            LocalSymbol self = new LocalSymbol(nextId++, "self", SymbolKind.PARAMETER, slot++,
                    owner.getType(), decl.getLocation());
            fn.addParam(self);
            paramTypes.add(owner.getType());
            names.add("self");
        }
        for (Parameter param : decl.getParams()) {
            if (!names.add(param.getName())) {
                throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                        "Duplicate parameter '" + param.getName() + "'", param.getName(), param.getLocation());
            }
            PgsType type = resolveValueType(module, param.getType(), "parameter");
            fn.addParam(new LocalSymbol(nextId++, param.getName(), SymbolKind.PARAMETER, slot++,
                    type, param.getLocation()));
            paramTypes.add(type);
        }
        PgsType returnType = decl.getReturnType() == null
                ? PrimitiveType.UNIT
                : resolveType(module, decl.getReturnType());
        fn.setType(new FunctionType(paramTypes, returnType));
    }

    private void registerImpl(PendingImpl impl) {
        ImplDecl decl = impl.decl;
        Symbol target = lookupPath(impl.module, QualifiedName.of(decl.getContainerName()), decl.getLocation());
        if (!(target instanceof ContainerSymbol)) {
            throw new ResolveException(Kind.UNKNOWN_SYMBOL,
                    "impl target '" + decl.getContainerName() + "' is not a container",
                    decl.getContainerName(), decl.getLocation());
        }
        ContainerSymbol container = (ContainerSymbol) target;
        for (FunDecl methodDecl : decl.getMethods()) {
            if (methodDecl.isNative()) {
                throw new ResolveException(Kind.TYPE_MISMATCH,
                        "Method '" + methodDecl.getName() + "' must have a body",
                        methodDecl.getName(), methodDecl.getLocation());
            }
            FunctionSymbol method = new FunctionSymbol(nextId++, methodDecl.getName(), SymbolKind.METHOD,
                    impl.module, container.getQualifiedName() + "::" + methodDecl.getName(),
                    methodDecl, container, methodDecl.getLocation());
            if (!container.addMethod(method)) {
                throw new ResolveException(Kind.DUPLICATE_DEFINITION,
                        "Duplicate method '" + methodDecl.getName() + "' for container "
                                + container.getQualifiedName(),
                        methodDecl.getName(), methodDecl.getLocation());
            }
            resolveSignature(method, container);
            result.addFunction(method);
        }
    }

    private static final class PendingImpl {
        final ModuleSymbol module;
        final ImplDecl decl;

        PendingImpl(ModuleSymbol module, ImplDecl decl) {
            this.module = module;
            this.decl = decl;
        }
    }
}
