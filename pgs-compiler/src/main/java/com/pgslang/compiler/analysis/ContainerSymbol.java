package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.types.ContainerType;
import com.pgslang.compiler.analysis.types.PgsType;
import com.pgslang.compiler.ast.SourceLocation;
import com.pgslang.compiler.ast.decl.ContainerDecl;
import pgs.runtime.StructLayout;
import pgs.runtime.ValueKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 容器（记录类型）符号，持有字段布局与 impl 方法表
 */
public final class ContainerSymbol extends Symbol {

    private final ModuleSymbol module;
    private final ContainerDecl decl;
    private final ContainerType type = new ContainerType(this);
    private final Map<String, Field> fields = new LinkedHashMap<>();
    private final Map<String, FunctionSymbol> methods = new LinkedHashMap<>();

    public ContainerSymbol(int id, ModuleSymbol module, ContainerDecl decl) {
        super(id, decl.getName(), SymbolKind.CONTAINER, decl.getLocation());
        this.module = module;
        this.decl = decl;
    }

    public ModuleSymbol getModule() {
        return module;
    }

    public ContainerDecl getDecl() {
        return decl;
    }

    public ContainerType getType() {
        return type;
    }

    @Override
    public String getQualifiedName() {
        return module.qualify(getName());
    }

    boolean addField(String name, PgsType fieldType, SourceLocation location) {
        if (fields.containsKey(name)) {
            return false;
        }
        fields.put(name, new Field(name, fields.size(), fieldType, location));
        return true;
    }

    /** 按名称查找字段，不存在返回 null */
    public Field getField(String name) {
        return fields.get(name);
    }

    public List<Field> getFields() {
        return Collections.unmodifiableList(new ArrayList<>(fields.values()));
    }

    /** 注册方法；同名方法已存在时返回 false */
    boolean addMethod(FunctionSymbol method) {
        if (methods.containsKey(method.getName())) {
            return false;
        }
        methods.put(method.getName(), method);
        return true;
    }

    public FunctionSymbol getMethod(String name) {
        return methods.get(name);
    }

    public Collection<FunctionSymbol> getMethods() {
        return Collections.unmodifiableCollection(methods.values());
    }

    /** 运行时布局描述，按字段声明顺序 */
    public StructLayout toLayout() {
        List<String> names = new ArrayList<>(fields.size());
        List<ValueKind> kinds = new ArrayList<>(fields.size());
        for (Field f : fields.values()) {
            names.add(f.getName());
            kinds.add(f.getType().getValueKind());
        }
        return new StructLayout(getQualifiedName(), names, kinds);
    }

    /**
     * 字段
     */
    public static final class Field {
        private final String name;
        private final int index;
        private final PgsType type;
        private final SourceLocation location;

        Field(String name, int index, PgsType type, SourceLocation location) {
            this.name = name;
            this.index = index;
            this.type = type;
            this.location = location;
        }

        public String getName() { return name; }
        public int getIndex() { return index; }
        public PgsType getType() { return type; }
        public SourceLocation getLocation() { return location; }
    }
}
