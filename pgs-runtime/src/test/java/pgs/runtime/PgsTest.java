package pgs.runtime;

import com.pgslang.compiler.PgsCompileException;
import com.pgslang.compiler.analysis.ResolveException;
import com.pgslang.compiler.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pgs.runtime.vm.PgsRuntimeException;
import pgs.runtime.vm.VirtualMachine;
import pgs.runtime.vm.VmOptions;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Pgs 便捷 API 与 CompiledProgram 测试
 */
class PgsTest {

    private static final String MATH = "mod: math {\n"
            + "  fn: add(a: int, b: int) ~ int { return a + b; }\n"
            + "}\n"
            + "import math::add = plus;\n"
            + "fn: viaAlias(a: int, b: int) ~ int { return plus(a, b); }\n"
            + "fn: direct(a: int, b: int) ~ int { return root::math::add(a, b); }\n";

    @Nested
    @DisplayName("编译与执行")
    class RunTests {

        @Test
        @DisplayName("Java 参数按 fromJava 转换")
        void runWithJavaArguments() {
            CompiledProgram program = Pgs.compile(MATH, "math.pgs");
            assertThat(Pgs.run(program, "viaAlias", null, 2, 3)).isEqualTo(PgsInt.of(5));
        }

        @Test
        @DisplayName("别名调用与全限定调用结果一致")
        void aliasMatchesQualifiedCall() {
            CompiledProgram program = Pgs.compile(MATH, "math.pgs");
            for (int i = -3; i <= 3; i++) {
                PgsValue alias = Pgs.run(program, "viaAlias", null, i, 10);
                assertThat(alias).isEqualTo(Pgs.run(program, "direct", null, i, 10));
                assertThat(alias).isEqualTo(Pgs.run(program, "math::add", null, i, 10));
                assertThat(alias).isEqualTo(Pgs.run(program, "root::math::add", null, i, 10));
            }
        }

        @Test
        @DisplayName("入口名解析")
        void entryResolution() {
            CompiledProgram program = Pgs.compile(MATH, "math.pgs");
            assertThat(program.findEntry("direct")).isEqualTo("root::direct");
            assertThat(program.findEntry("math::add")).isEqualTo("root::math::add");
            assertThat(program.findEntry("root::math::add")).isEqualTo("root::math::add");
            assertThat(program.findEntry("add")).isNull();
            assertThat(program.hasFunction("viaAlias")).isTrue();

            PgsRuntimeException e = catchThrowableOfType(
                    () -> Pgs.run(program, "missing", null), PgsRuntimeException.class);
            assertThat(e.getKind()).isEqualTo(PgsRuntimeException.Kind.UNKNOWN_FUNCTION);
            assertThat(e.getRawMessage()).isEqualTo("Unknown entry function 'missing' in math.pgs");
        }

        @Test
        @DisplayName("eval 编译并执行 main")
        void eval() {
            assertThat(Pgs.eval("fn: main() ~ int { return 6 * 7; }", null)).isEqualTo(PgsInt.of(42));
        }

        @Test
        @DisplayName("带资源限制执行")
        void runWithOptions() {
            CompiledProgram program = Pgs.compile("fn: main() ~ int { var i: int = 0; loop { i += 1; } }");
            PgsRuntimeException e = catchThrowableOfType(
                    () -> Pgs.run(program, "main", null, VmOptions.custom().instructionBudget(500).build()),
                    PgsRuntimeException.class);
            assertThat(e.getKind()).isEqualTo(PgsRuntimeException.Kind.BUDGET_EXHAUSTED);
        }
    }

    @Nested
    @DisplayName("编译错误")
    class CompileErrorTests {

        @Test
        @DisplayName("未知标识符在解析阶段报告")
        void unknownIdentifier() {
            assertThatThrownBy(() -> Pgs.compile("fn: main() ~ int { return y; }", "bad.pgs"))
                    .isInstanceOf(ResolveException.class)
                    .hasMessage("Unknown symbol 'y' at bad.pgs:1:27");
        }

        @Test
        @DisplayName("语法错误带阶段名")
        void syntaxError() {
            PgsCompileException e = catchThrowableOfType(
                    () -> Pgs.compile("fn: main( { }", "bad.pgs"), PgsCompileException.class);
            assertThat(e).isInstanceOf(ParseException.class);
            assertThat(e.getStage()).isEqualTo("parse");
        }
    }

    @Nested
    @DisplayName("标准原生函数")
    class StandardNativesTests {

        @Test
        @DisplayName("std 模块的打印与 sqrt")
        void printAndSqrt() {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            PrintStream out = new PrintStream(buffer, true);
            NativeRegistry natives = StandardNatives.install(new NativeRegistry(), out);

            CompiledProgram program = Pgs.compile("import std::println;\n"
                    + "fn: main() ~ float {\n"
                    + "  println(\"hello\");\n"
                    + "  std::print(\"n=\");\n"
                    + "  std::printi(42);\n"
                    + "  return std::sqrt(2.25);\n"
                    + "}\n", "std.pgs", natives);

            assertThat(Pgs.run(program, "main", natives)).isEqualTo(PgsFloat.of(1.5));
            String printed = new String(buffer.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
            assertThat(printed).isEqualTo("hello\nn=42\n");
        }

        @Test
        @DisplayName("CompiledProgram.run 使用编译时的注册表")
        void runWithCompileTimeRegistry() {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            NativeRegistry natives = StandardNatives.install(new NativeRegistry(), new PrintStream(buffer, true));
            CompiledProgram program = Pgs.compile("fn: main() { std::printi(7); }", "std.pgs", natives);

            assertThat(program.run("main")).isSameAs(PgsUnit.UNIT);
            assertThat(buffer.toString().trim()).isEqualTo("7");
        }

        @Test
        @DisplayName("注册的名称与签名")
        void registeredSignatures() {
            NativeRegistry natives = StandardNatives.install(new NativeRegistry(), System.out);
            assertThat(natives.getModulePaths()).containsExactly("std");
            assertThat(natives.lookup("std::sqrt").signature()).isEqualTo("std::sqrt(float) ~ float");
            assertThat(natives.lookup("std::printi").signature()).isEqualTo("std::printi(int) ~ unit");
        }
    }

    @Nested
    @DisplayName("共享与转储")
    class SharingTests {

        @Test
        @DisplayName("多个线程上的 VM 共享同一个 CompiledProgram")
        void sharedAcrossThreads() throws Exception {
            CompiledProgram program = Pgs.compile("fn: fib(n: int) ~ int {\n"
                    + "  if n < 2 { return n; }\n"
                    + "  return fib(n - 1) + fib(n - 2);\n"
                    + "}\n", "fib.pgs");

            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<PgsValue>> results = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    results.add(executor.submit((Callable<PgsValue>) () -> {
                        VirtualMachine vm = program.newVirtualMachine(null);
                        return vm.execute("root::fib", PgsInt.of(15));
                    }));
                }
                for (Future<PgsValue> result : results) {
                    assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(PgsInt.of(610));
                }
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("反汇编与 JSON 转储")
        void dumps() {
            CompiledProgram program = Pgs.compile(MATH, "math.pgs");
            assertThat(program.disassemble()).contains("chunk root::math::add(int, int) ~ int");
            assertThat(program.toJson()).contains("\"root::viaAlias\"");
            assertThat(program.toString()).isEqualTo("CompiledProgram{math.pgs, 3 functions}");
        }
    }
}
