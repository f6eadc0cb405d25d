package pgs.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * NativeRegistry 单元测试
 */
class NativeRegistryTest {

    @Nested
    @DisplayName("注册")
    class Registration {

        @Test
        @DisplayName("注册后可按限定名查找")
        void lookupByQualifiedName() {
            NativeRegistry registry = new NativeRegistry()
                    .register1("std::sqrt", ValueKind.FLOAT, ValueKind.FLOAT,
                            x -> PgsFloat.of(Math.sqrt(x.asDouble())));

            NativeFunction fn = registry.lookup("std::sqrt");
            assertThat(fn).isNotNull();
            assertThat(fn.getSimpleName()).isEqualTo("sqrt");
            assertThat(fn.getModulePath()).isEqualTo("std");
            assertThat(fn.getArity()).isEqualTo(1);
            assertThat(fn.signature()).isEqualTo("std::sqrt(float) ~ float");
            assertThat(fn.invoke(new PgsValue[]{PgsFloat.of(16.0)})).isEqualTo(PgsFloat.of(4.0));
        }

        @Test
        @DisplayName("三参数辅助方法按顺序传参")
        void threeArgumentHelper() {
            NativeRegistry registry = new NativeRegistry()
                    .register3("clamp", ValueKind.INT, ValueKind.INT, ValueKind.INT, ValueKind.INT,
                            (v, lo, hi) -> PgsInt.of(Math.max(lo.asLong(), Math.min(hi.asLong(), v.asLong()))));

            NativeFunction fn = registry.lookup("clamp");
            assertThat(fn.signature()).isEqualTo("clamp(int, int, int) ~ int");
            assertThat(fn.invoke(new PgsValue[]{PgsInt.of(42), PgsInt.of(0), PgsInt.of(10)}))
                    .isEqualTo(PgsInt.of(10));
        }

        @Test
        @DisplayName("重复注册抛出异常")
        void duplicateRejected() {
            NativeRegistry registry = new NativeRegistry()
                    .register0("now", ValueKind.INT, () -> PgsInt.of(1));
            assertThatThrownBy(() -> registry.register0("now", ValueKind.INT, () -> PgsInt.of(2)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("now");
        }

        @Test
        @DisplayName("非法名称被拒绝")
        void invalidNames() {
            NativeRegistry registry = new NativeRegistry();
            assertThatThrownBy(() -> registry.register0("std.print", ValueKind.UNIT, () -> PgsUnit.UNIT))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register0("root::x", ValueKind.UNIT, () -> PgsUnit.UNIT))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.register1("f", ValueKind.UNIT, ValueKind.UNIT, v -> v))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("模块路径包含中间层")
        void modulePaths() {
            NativeRegistry registry = new NativeRegistry()
                    .register0("a::b::f", ValueKind.UNIT, () -> PgsUnit.UNIT)
                    .register0("c::g", ValueKind.UNIT, () -> PgsUnit.UNIT)
                    .register0("top", ValueKind.UNIT, () -> PgsUnit.UNIT);
            assertThat(registry.getModulePaths()).containsExactlyInAnyOrder("a::b", "a", "c");
        }
    }

    @Nested
    @DisplayName("值模型")
    class Values {

        @Test
        @DisplayName("fromJava 映射基本类型")
        void fromJava() {
            assertThat(PgsValue.fromJava(3)).isEqualTo(PgsInt.of(3));
            assertThat(PgsValue.fromJava(2.5)).isEqualTo(PgsFloat.of(2.5));
            assertThat(PgsValue.fromJava("hi")).isEqualTo(PgsString.of("hi"));
            assertThat(PgsValue.fromJava(true)).isSameAs(PgsBool.TRUE);
            assertThat(PgsValue.fromJava(null)).isSameAs(PgsUnit.UNIT);
            assertThat(PgsValue.fromJava(new Object()).getKind()).isEqualTo(ValueKind.HANDLE);
        }

        @Test
        @DisplayName("种类不符的取值抛出 PgsException")
        void accessorMismatch() {
            assertThatThrownBy(() -> PgsString.of("x").asLong())
                    .isInstanceOf(PgsException.class)
                    .hasMessage("Expected int but got string");
        }

        @Test
        @DisplayName("float 常量区分正负零")
        void signedZero() {
            assertThat(PgsFloat.of(0.0)).isNotEqualTo(PgsFloat.of(-0.0));
        }

        @Test
        @DisplayName("容器实例引用计数")
        void structRefCount() {
            StructLayout layout = new StructLayout("root::P",
                    java.util.Arrays.asList("x", "y"),
                    java.util.Arrays.asList(ValueKind.INT, ValueKind.INT));
            PgsStruct p = new PgsStruct(layout, new PgsValue[]{PgsInt.of(1), PgsInt.of(2)});
            p.retain();
            p.retain();
            assertThat(p.release()).isEqualTo(1);
            assertThat(p.isReleased()).isFalse();
            assertThat(p.release()).isZero();
            assertThat(p.isReleased()).isTrue();
            assertThatThrownBy(p::retain).isInstanceOf(PgsException.class);
            assertThat(p.getField("y")).isEqualTo(PgsInt.of(2));
            assertThat(p.toString()).isEqualTo("root::P { x: 1, y: 2 }");
        }
    }
}
