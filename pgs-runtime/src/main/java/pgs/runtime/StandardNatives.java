package pgs.runtime;

import java.io.PrintStream;

/**
 * 标准原生函数（std 模块）
 *
 * <pre>
 * NativeRegistry natives = StandardNatives.install(new NativeRegistry(), System.out);
 * // 脚本中：import std::println; 或直接 std::println("hi");
 * </pre>
 */
public final class StandardNatives {

    public static final String MODULE = "std";

    private StandardNatives() {
    }

    /**
     * 注册 std::print、std::println、std::printi、std::sqrt
     *
     * @param out 打印输出目标
     * @return 传入的注册表
     */
    public static NativeRegistry install(NativeRegistry registry, PrintStream out) {
        registry.register1(MODULE + "::print", ValueKind.STRING, ValueKind.UNIT, s -> {
            out.print(s.asString());
            return PgsUnit.UNIT;
        });
        registry.register1(MODULE + "::println", ValueKind.STRING, ValueKind.UNIT, s -> {
            out.println(s.asString());
            return PgsUnit.UNIT;
        });
        registry.register1(MODULE + "::printi", ValueKind.INT, ValueKind.UNIT, i -> {
            out.println(i.asLong());
            return PgsUnit.UNIT;
        });
        registry.register1(MODULE + "::sqrt", ValueKind.FLOAT, ValueKind.FLOAT,
                x -> PgsFloat.of(Math.sqrt(x.asDouble())));
        return registry;
    }
}
