package com.pgslang.ir.lowering;

import com.pgslang.compiler.PgsCompileException;
import com.pgslang.ir.PgsIrCompiler;
import com.pgslang.ir.bytecode.BytecodeProgram;
import com.pgslang.ir.bytecode.Chunk;
import com.pgslang.ir.bytecode.Instruction;
import com.pgslang.ir.bytecode.NativeBinding;
import com.pgslang.ir.bytecode.Opcode;
import com.pgslang.ir.dump.Disassembler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pgs.runtime.PgsInt;
import pgs.runtime.PgsUnit;
import pgs.runtime.StructLayout;
import pgs.runtime.ValueKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * 字节码生成单元测试
 */
class BytecodeCompilerTest {

    private BytecodeProgram compile(String source) {
        return new PgsIrCompiler().compile(source, "<test>");
    }

    private Chunk chunk(String source, String name) {
        Chunk chunk = compile(source).findChunk(name);
        assertThat(chunk).as("chunk %s", name).isNotNull();
        return chunk;
    }

    private static List<String> code(Chunk chunk) {
        List<String> lines = new ArrayList<>();
        for (Instruction inst : chunk.getInstructions()) {
            lines.add(inst.toString());
        }
        return lines;
    }

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("算术表达式按后序发射")
        void arithmetic() {
            Chunk c = chunk("fn: f() ~ int { return (2 + 3) * 4; }", "root::f");
            assertThat(code(c)).containsExactly(
                    "PUSH_CONST 0", "PUSH_CONST 1", "BINARY ADD int",
                    "PUSH_CONST 2", "BINARY MUL int", "RETURN",
                    "PUSH_CONST 3", "RETURN");
            assertThat(c.getConstants().getValue(2)).isEqualTo(PgsInt.of(4));
            assertThat(c.getConstants().getValue(3)).isSameAs(PgsUnit.UNIT);
        }

        @Test
        @DisplayName("相同常量只保存一次")
        void constantDeduplication() {
            Chunk c = chunk("fn: f() ~ int { return 7 + 7 + 7; }", "root::f");
            assertThat(code(c)).startsWith("PUSH_CONST 0", "PUSH_CONST 0", "BINARY ADD int", "PUSH_CONST 0");
        }

        @Test
        @DisplayName("二元运算记录操作数种类")
        void operandKinds() {
            Chunk c = chunk("fn: f(a: float, b: float) ~ bool { return a < b; }", "root::f");
            assertThat(code(c)).contains("BINARY LT float");
        }

        @Test
        @DisplayName("书写顺序与布局一致的容器字面量直接入栈")
        void structLiteralLayoutOrder() {
            Chunk c = chunk("cont: P { x: int; y: int; }\nfn: f() ~ P { return P { x: 1, y: 2 }; }", "root::f");
            assertThat(code(c)).startsWith("PUSH_CONST 0", "PUSH_CONST 1", "NEW_STRUCT 2");
            assertThat(c.getConstants().getValue(0)).isEqualTo(PgsInt.of(1));
            StructLayout layout = c.getConstants().getLayout(2);
            assertThat(layout.getName()).isEqualTo("root::P");
            assertThat(layout.getFieldKinds()).containsExactly(ValueKind.INT, ValueKind.INT);
            assertThat(c.getLocalCount()).isZero();
        }

        @Test
        @DisplayName("乱序的容器字面量按书写顺序求值后经隐藏槽位装配")
        void structLiteralSourceOrder() {
            Chunk c = chunk("cont: P { x: int; y: int; }\nfn: f() ~ P { return P { y: 2, x: 1 }; }", "root::f");
            assertThat(code(c)).startsWith(
                    "PUSH_CONST 0", "STORE_LOCAL 1", "POP",
                    "PUSH_CONST 1", "STORE_LOCAL 0", "POP",
                    "LOAD_LOCAL 0", "LOAD_LOCAL 1", "NEW_STRUCT 2", "RETURN");
            assertThat(c.getConstants().getValue(0)).isEqualTo(PgsInt.of(2));
            assertThat(c.getLocalCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("暂存的容器字段在装配后清空")
        void structLiteralClearsContainerTemps() {
            Chunk c = chunk("cont: B { v: int; }\ncont: P { a: B; n: int; }\n"
                    + "fn: f(b: B) ~ P { return P { n: 1, a: b }; }", "root::f");
            assertThat(code(c)).containsSubsequence(
                    "PUSH_CONST 0", "STORE_LOCAL 2", "POP",
                    "LOAD_LOCAL 0", "STORE_LOCAL 1", "POP",
                    "LOAD_LOCAL 1", "LOAD_LOCAL 2", "NEW_STRUCT 1",
                    "PUSH_CONST 2", "STORE_LOCAL 1", "POP", "RETURN");
            assertThat(c.getConstants().getValue(2)).isEqualTo(PgsUnit.UNIT);
        }

        @Test
        @DisplayName("字段复合赋值")
        void compoundFieldAssignment() {
            Chunk c = chunk("cont: P { x: int; }\nfn: f(p: P) { p.x += 2; }", "root::f");
            assertThat(code(c)).startsWith(
                    "LOAD_LOCAL 0", "DUP", "LOAD_FIELD 0", "PUSH_CONST 0", "BINARY ADD int",
                    "STORE_FIELD 0", "POP");
        }

        @Test
        @DisplayName("方法调用把接收者作为第一个参数")
        void methodCall() {
            BytecodeProgram program = compile(
                    "cont: P { x: int; }\n" +
                    "impl: P { fn: get(k: int) ~ int { return self.x * k; } }\n" +
                    "fn: main() ~ int { var p: P = P { x: 3 }; return p.get(2); }\n");
            int method = program.indexOf("root::P::get");
            assertThat(method).isGreaterThanOrEqualTo(0);
            Chunk main = program.findChunk("root::main");
            assertThat(code(main)).contains("CALL " + method + " 2");
            assertThat(program.getChunk(method).getParamKinds()).containsExactly(ValueKind.STRUCT, ValueKind.INT);
        }

        @Test
        @DisplayName("外部函数编译为原生调用")
        void nativeCall() {
            BytecodeProgram program = compile(
                    "fn: sqrt(x: float) ~ float;\nfn: main() ~ float { return sqrt(2.0); }");
            assertThat(program.getNatives()).containsExactly(
                    new NativeBinding("sqrt", Arrays.asList(ValueKind.FLOAT), ValueKind.FLOAT));
            assertThat(code(program.findChunk("root::main"))).contains("CALL_NATIVE 0 1");
            assertThat(program.findChunk("root::sqrt")).isNull();
        }
    }

    @Nested
    @DisplayName("控制流")
    class ControlFlowTests {

        @Test
        @DisplayName("if/else 跳转")
        void ifElse() {
            Chunk c = chunk("fn: f(x: int) ~ int { if x > 0 { return 1; } else { return 2; } }", "root::f");
            assertThat(code(c)).containsExactly(
                    "LOAD_LOCAL 0", "PUSH_CONST 0", "BINARY GT int", "JUMP_IF_FALSE 7",
                    "PUSH_CONST 1", "RETURN", "JUMP 9",
                    "PUSH_CONST 2", "RETURN",
                    "PUSH_CONST 3", "RETURN");
        }

        @Test
        @DisplayName("while 先判断后执行并向后跳转")
        void whileLoop() {
            Chunk c = chunk("fn: f(n: int) ~ int { var i: int = 0; while i < n { i += 1; } return i; }",
                    "root::f");
            assertThat(code(c)).containsExactly(
                    "PUSH_CONST 0", "STORE_LOCAL 1", "POP",
                    "LOAD_LOCAL 1", "LOAD_LOCAL 0", "BINARY LT int", "JUMP_IF_FALSE 13",
                    "LOAD_LOCAL 1", "PUSH_CONST 1", "BINARY ADD int", "STORE_LOCAL 1", "POP",
                    "JUMP 3",
                    "LOAD_LOCAL 1", "RETURN",
                    "PUSH_CONST 2", "RETURN");
            assertThat(c.getLocalCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("loop 中的 break 回填到循环之后")
        void loopBreak() {
            Chunk c = chunk("fn: f() { loop { break; } }", "root::f");
            assertThat(code(c)).containsExactly("JUMP 2", "JUMP 0", "PUSH_CONST 0", "RETURN");
        }

        @Test
        @DisplayName("for 的 continue 跳到递增段")
        void forContinue() {
            Chunk c = chunk("fn: f(s: string) { for ch in s { continue; } }", "root::f");
            List<Instruction> code = c.getInstructions();
            int continueJump = -1;
            int increment = -1;
            for (int i = 0; i < code.size(); i++) {
                if (code.get(i).getOp() == Opcode.SEQ_GET) {
                    // SEQ_GET, STORE_LOCAL, POP 之后是循环体的 continue
                    continueJump = i + 3;
                    increment = i + 4;
                }
            }
            assertThat(code.get(continueJump).getOp()).isEqualTo(Opcode.JUMP);
            assertThat(code.get(continueJump).getA()).isEqualTo(increment);
            assertThat(code.get(increment).toString()).isEqualTo("LOAD_LOCAL 2");
            assertThat(c.getLocalCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("循环外的 break")
        void breakOutsideLoop() {
            CompileException e = catchThrowableOfType(
                    () -> compile("fn: f() {\n  break;\n}"), CompileException.class);
            assertThat(e.getRawMessage()).isEqualTo("'break' outside of a loop");
            assertThat(e.getLocation().getLine()).isEqualTo(2);
            assertThat(e.getStage()).isEqualTo("compile");
        }

        @Test
        @DisplayName("循环外的 continue")
        void continueOutsideLoop() {
            assertThatThrownBy(() -> compile("fn: f() { if true { continue; } }"))
                    .isInstanceOf(CompileException.class)
                    .hasMessageContaining("'continue' outside of a loop");
        }

        @Test
        @DisplayName("无 break 的 loop 之后的代码不可达")
        void unreachableAfterLoop() {
            assertThatThrownBy(() -> compile("fn: f() { loop { } var x: int = 1; }"))
                    .isInstanceOf(PgsCompileException.class)
                    .hasMessageStartingWith("Unreachable code after 'loop' without 'break'");
        }

        @Test
        @DisplayName("内层 while 的 break 不算外层 loop 的 break")
        void nestedBreak() {
            assertThatThrownBy(() -> compile("fn: f() { loop { while true { break; } } return; }"))
                    .isInstanceOf(CompileException.class);
        }
    }

    @Test
    @DisplayName("重复编译得到结构相同的字节码")
    void deterministic() {
        String source =
                "mod: math { fn: add(a: int, b: int) ~ int { return a + b; } }\n" +
                "import math::add = plus;\n" +
                "cont: V { x: float; y: float; }\n" +
                "impl: V { fn: dot(o: V) ~ float { return self.x * o.x + self.y * o.y; } }\n" +
                "fn: main() ~ int { var s: int = 0; for i in 10 { s = plus(s, i); } return s; }\n";
        BytecodeProgram first = compile(source);
        BytecodeProgram second = compile(source);
        assertThat(second).isEqualTo(first);
        assertThat(second.hashCode()).isEqualTo(first.hashCode());
        assertThat(Disassembler.disassemble(second)).isEqualTo(Disassembler.disassemble(first));
    }
}
