package pgs.runtime;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * 原生函数注册表
 *
 * <p>嵌入方在编译或运行前注册原生函数，名称可带模块前缀：</p>
 * <pre>
 * NativeRegistry natives = new NativeRegistry()
 *     .register1("std::sqrt", ValueKind.FLOAT, ValueKind.FLOAT,
 *             x -&gt; PgsFloat.of(Math.sqrt(x.asDouble())))
 *     .register1("log", ValueKind.STRING, ValueKind.UNIT, msg -&gt; { ...; return PgsUnit.UNIT; });
 * </pre>
 *
 * <p>注册阶段不是线程安全的；注册完成后可被多个 VM 并发只读使用。</p>
 */
public final class NativeRegistry {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(::[A-Za-z_][A-Za-z0-9_]*)*");

    private final Map<String, NativeFunction> functions = new LinkedHashMap<>();

    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches() && !name.startsWith("root::") && !name.equals("root");
    }

    public NativeRegistry register(NativeFunction function) {
        if (functions.containsKey(function.getName())) {
            throw new IllegalArgumentException("Native function already registered: " + function.getName());
        }
        functions.put(function.getName(), function);
        return this;
    }

    public NativeRegistry register(String name, ValueKind returnKind, NativeCallable callable, ValueKind... paramKinds) {
        return register(new NativeFunction(name, Arrays.asList(paramKinds), returnKind, callable));
    }

    public NativeRegistry register0(String name, ValueKind returnKind, Supplier<PgsValue> body) {
        return register(name, returnKind, args -> body.get());
    }

    public NativeRegistry register1(String name, ValueKind param, ValueKind returnKind,
                                    Function<PgsValue, PgsValue> body) {
        return register(name, returnKind, args -> body.apply(args[0]), param);
    }

    public NativeRegistry register2(String name, ValueKind param1, ValueKind param2, ValueKind returnKind,
                                    BiFunction<PgsValue, PgsValue, PgsValue> body) {
        return register(name, returnKind, args -> body.apply(args[0], args[1]), param1, param2);
    }

    public NativeRegistry register3(String name, ValueKind param1, ValueKind param2, ValueKind param3,
                                    ValueKind returnKind, Function3 body) {
        return register(name, returnKind, args -> body.apply(args[0], args[1], args[2]), param1, param2, param3);
    }

    /**
     * 三参数原生函数体
     */
    @FunctionalInterface
    public interface Function3 {
        PgsValue apply(PgsValue a, PgsValue b, PgsValue c);
    }

    /**
     * 按限定名查找
     *
     * @return 原生函数，不存在时返回 null
     */
    public NativeFunction lookup(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Collection<NativeFunction> getFunctions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    /** 所有非空模块路径（含中间层），按注册顺序 */
    public Set<String> getModulePaths() {
        Set<String> paths = new LinkedHashSet<>();
        for (NativeFunction fn : functions.values()) {
            String path = fn.getModulePath();
            while (!path.isEmpty()) {
                paths.add(path);
                int idx = path.lastIndexOf("::");
                path = idx < 0 ? "" : path.substring(0, idx);
            }
        }
        return paths;
    }

    public int size() {
        return functions.size();
    }

    /** 复制一份可独立修改的注册表 */
    public NativeRegistry copy() {
        NativeRegistry copy = new NativeRegistry();
        copy.functions.putAll(functions);
        return copy;
    }
}
