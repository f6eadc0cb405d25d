package com.pgslang.compiler.analysis;

import com.pgslang.compiler.analysis.ResolveException.Kind;
import com.pgslang.compiler.analysis.types.PrimitiveType;
import com.pgslang.compiler.ast.decl.FunDecl;
import com.pgslang.compiler.ast.decl.Program;
import com.pgslang.compiler.ast.expr.CallExpr;
import com.pgslang.compiler.ast.stmt.ReturnStmt;
import com.pgslang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import pgs.runtime.NativeRegistry;
import pgs.runtime.PgsFloat;
import pgs.runtime.ValueKind;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Resolver 单元测试
 */
class ResolverTest {

    private ResolvedProgram resolve(String source) {
        return new Resolver().resolve(new Parser(source, "<test>").parse());
    }

    private ResolveException resolveError(String source) {
        return assertThrows(ResolveException.class, () -> resolve(source));
    }

    @Nested
    @DisplayName("名称查找")
    class LookupTests {

        @Test
        @DisplayName("同模块内允许前向引用")
        void forwardReference() {
            ResolvedProgram rp = resolve(
                    "fn: main() ~ int { return helper(); }\n" +
                    "fn: helper() ~ int { return 1; }\n");
            FunctionSymbol main = rp.findFunction("root::main");
            FunctionSymbol helper = rp.findFunction("root::helper");
            assertNotNull(main);
            assertNotNull(helper);

            ReturnStmt ret = (ReturnStmt) main.getDecl().getBody().getStatements().get(0);
            assertSame(helper, rp.symbolOf(ret.getValue()));
            assertEquals(PrimitiveType.INT, rp.typeOf(ret.getValue()));
        }

        @Test
        @DisplayName("导入别名对调用透明")
        void importAlias() {
            ResolvedProgram rp = resolve(
                    "mod: math { fn: add(a: int, b: int) ~ int { return a + b; } }\n" +
                    "import math::add = plus;\n" +
                    "fn: main() ~ int { return plus(1, 2) + math::add(3, 4) + root::math::add(5, 6); }\n");
            FunctionSymbol add = rp.findFunction("root::math::add");
            assertEquals("root::math", add.getModule().getQualifiedName());
            assertEquals(2, add.getArity());
        }

        @Test
        @DisplayName("子模块可以看到外层模块的符号")
        void enclosingModuleLookup() {
            ResolvedProgram rp = resolve(
                    "fn: one() ~ int { return 1; }\n" +
                    "mod: inner { fn: two() ~ int { return one() + one(); } }\n");
            assertNotNull(rp.findFunction("root::inner::two"));
        }

        @Test
        @DisplayName("导入别名链")
        void aliasChain() {
            ResolvedProgram rp = resolve(
                    "mod: a { fn: f() ~ int { return 7; } }\n" +
                    "import a::f = g;\n" +
                    "import g = h;\n" +
                    "fn: main() ~ int { return h(); }\n");
            FunctionSymbol main = rp.findFunction("root::main");
            ReturnStmt ret = (ReturnStmt) main.getDecl().getBody().getStatements().get(0);
            assertSame(rp.findFunction("root::a::f"), rp.symbolOf((CallExpr) ret.getValue()));
        }

        @Test
        @DisplayName("导入环")
        void importCycle() {
            ResolveException e = resolveError("import a = b;\nimport b = a;\n");
            assertEquals(Kind.IMPORT_CYCLE, e.getKind());
            assertTrue(e.getRawMessage().startsWith("Import cycle: "));
        }

        @Test
        @DisplayName("无法解析的导入")
        void unresolvableImport() {
            ResolveException e = resolveError("mod: math { }\nimport math::nope;\n");
            assertEquals(Kind.UNRESOLVABLE_IMPORT, e.getKind());
            assertEquals("Cannot resolve import 'math::nope': 'nope' not found in root::math", e.getRawMessage());
            assertEquals(2, e.getLocation().getLine());
        }

        @Test
        @DisplayName("未知标识符报告名称与位置")
        void unknownSymbol() {
            ResolveException e = resolveError("fn: main() ~ int {\n  return y;\n}\n");
            assertEquals(Kind.UNKNOWN_SYMBOL, e.getKind());
            assertEquals("y", e.getSymbolName());
            assertEquals(2, e.getLocation().getLine());
            assertEquals(10, e.getLocation().getColumn());
            assertEquals("Unknown symbol 'y' at <test>:2:10", e.getMessage());
        }

        @Test
        @DisplayName("局部变量在块外不可见")
        void blockScope() {
            ResolveException e = resolveError(
                    "fn: main() ~ int { if true { var x: int = 1; } return x; }");
            assertEquals(Kind.UNKNOWN_SYMBOL, e.getKind());
            assertEquals("x", e.getSymbolName());
        }
    }

    @Nested
    @DisplayName("重复定义")
    class DuplicateTests {

        @Test
        @DisplayName("同一模块中的重复函数")
        void duplicateFunction() {
            ResolveException e = resolveError("fn: f() { }\nfn: f() { }\n");
            assertEquals(Kind.DUPLICATE_DEFINITION, e.getKind());
            assertEquals("f", e.getSymbolName());
            assertEquals(2, e.getLocation().getLine());
        }

        @Test
        @DisplayName("同一块中重复声明变量")
        void duplicateVariable() {
            ResolveException e = resolveError("fn: f() { var x: int = 1; var x: int = 2; }");
            assertEquals(Kind.DUPLICATE_DEFINITION, e.getKind());
        }

        @Test
        @DisplayName("内层块可以遮蔽外层变量")
        void shadowing() {
            ResolvedProgram rp = resolve(
                    "fn: f() ~ int { var x: int = 1; if true { var x: float = 2.0; } return x; }");
            assertEquals(2, rp.findFunction("root::f").getLocalCount());
        }

        @Test
        @DisplayName("root 为保留名")
        void reservedRoot() {
            ResolveException e = resolveError("mod: root { }");
            assertEquals(Kind.DUPLICATE_DEFINITION, e.getKind());
        }
    }

    @Nested
    @DisplayName("类型检查")
    class TypeTests {

        @Test
        @DisplayName("初始化类型不匹配")
        void initializerMismatch() {
            ResolveException e = resolveError("fn: f() { var x: int = 1.5; }");
            assertEquals(Kind.TYPE_MISMATCH, e.getKind());
            assertEquals("Cannot initialize variable 'x': expected int but found float", e.getRawMessage());
        }

        @Test
        @DisplayName("没有隐式数值转换")
        void noPromotion() {
            ResolveException e = resolveError("fn: f() ~ float { return 1 + 2.0; }");
            assertEquals(Kind.TYPE_MISMATCH, e.getKind());
            assertEquals("Operator '+' cannot be applied to int and float", e.getRawMessage());
        }

        @Test
        @DisplayName("条件必须是 bool")
        void condition() {
            ResolveException e = resolveError("fn: f() { while 1 { } }");
            assertEquals("Condition of 'while' must be bool, found int", e.getRawMessage());
        }

        @Test
        @DisplayName("参数个数不匹配")
        void arity() {
            ResolveException e = resolveError(
                    "fn: add(a: int, b: int) ~ int { return a + b; }\nfn: f() ~ int { return add(1); }");
            assertEquals(Kind.TYPE_MISMATCH, e.getKind());
            assertEquals("Function 'root::add' expects 2 argument(s) but got 1", e.getRawMessage());
        }

        @Test
        @DisplayName("字符串只支持相等比较")
        void stringOperators() {
            resolve("fn: f(a: string, b: string) ~ bool { return a == b; }");
            ResolveException e = resolveError("fn: f(a: string, b: string) ~ bool { return a < b; }");
            assertEquals("Operator '<' requires int or float operands, found string", e.getRawMessage());
        }

        @Test
        @DisplayName("不能给函数赋值")
        void assignToFunction() {
            ResolveException e = resolveError("fn: g() { }\nfn: f() { g = 1; }");
            assertEquals(Kind.INVALID_ASSIGNMENT, e.getKind());
        }

        @Test
        @DisplayName("unit 不能作为参数类型")
        void unitParameter() {
            ResolveException e = resolveError("fn: f(x: unit) { }");
            assertEquals(Kind.TYPE_MISMATCH, e.getKind());
        }

        @Test
        @DisplayName("for 只能遍历 int 或 string")
        void forIterable() {
            resolve("fn: f(s: string) { for c in s { } for i in 10 { } }");
            ResolveException e = resolveError("fn: f() { for x in 1.0 { } }");
            assertEquals("Cannot iterate over float, expected int or string", e.getRawMessage());
        }

        @Test
        @DisplayName("容器字面量必须给出所有字段")
        void structLiteralFields() {
            ResolveException e = resolveError(
                    "cont: P { x: int; y: int; }\nfn: f() ~ P { return P { x: 1 }; }");
            assertEquals("Missing field 'y' in root::P literal", e.getRawMessage());

            e = resolveError("cont: P { x: int; }\nfn: f() ~ P { return P { x: 1, z: 2 }; }");
            assertEquals(Kind.UNKNOWN_SYMBOL, e.getKind());
            assertEquals("z", e.getSymbolName());
        }
    }

    @Nested
    @DisplayName("返回路径")
    class ReturnTests {

        @Test
        @DisplayName("缺少 return")
        void missingReturn() {
            ResolveException e = resolveError("fn: f(x: int) ~ int { if x > 0 { return 1; } }");
            assertEquals(Kind.MISSING_RETURN, e.getKind());
            assertEquals("f", e.getSymbolName());
        }

        @Test
        @DisplayName("if/else 两个分支都返回")
        void bothBranches() {
            resolve("fn: f(x: int) ~ int { if x > 0 { return 1; } else { return 2; } }");
        }

        @Test
        @DisplayName("没有 break 的 loop 不会落到函数末尾")
        void infiniteLoop() {
            resolve("fn: f() ~ int { var i: int = 0; loop { i += 1; if i > 3 { return i; } } }");
            ResolveException e = resolveError("fn: f() ~ int { loop { break; } }");
            assertEquals(Kind.MISSING_RETURN, e.getKind());
        }
    }

    @Nested
    @DisplayName("容器与方法")
    class ContainerTests {

        @Test
        @DisplayName("方法的 self 占用 0 号槽位")
        void methodSelf() {
            ResolvedProgram rp = resolve(
                    "cont: Point { x: float; y: float; }\n" +
                    "impl: Point { fn: scaled(k: float) ~ float { return self.x * k; } }\n" +
                    "fn: main() ~ float { var p: Point = Point { x: 1.0, y: 2.0 }; return p.scaled(2.0); }\n");
            FunctionSymbol method = rp.findFunction("root::Point::scaled");
            assertTrue(method.isMethod());
            assertEquals("self", method.getParams().get(0).getName());
            assertEquals(0, method.getParams().get(0).getSlot());
            assertEquals(1, method.getParams().get(1).getSlot());
            assertEquals(2, method.getArity());

            ContainerSymbol point = rp.getContainers().get(0);
            assertEquals(1, point.getField("y").getIndex());
            assertEquals("root::Point", point.toLayout().getName());
        }

        @Test
        @DisplayName("未知方法")
        void unknownMethod() {
            ResolveException e = resolveError(
                    "cont: P { x: int; }\nfn: f(p: P) ~ int { return p.nope(); }");
            assertEquals(Kind.UNKNOWN_SYMBOL, e.getKind());
            assertEquals("Container root::P has no method 'nope'", e.getRawMessage());
        }

        @Test
        @DisplayName("互相包含的容器")
        void recursiveContainer() {
            ResolveException e = resolveError("cont: A { b: B; }\ncont: B { a: A; }\n");
            assertEquals(Kind.RECURSIVE_CONTAINER, e.getKind());
        }

        @Test
        @DisplayName("重复方法")
        void duplicateMethod() {
            ResolveException e = resolveError(
                    "cont: P { x: int; }\nimpl: P { fn: m() { } }\nimpl: P { fn: m() { } }");
            assertEquals(Kind.DUPLICATE_DEFINITION, e.getKind());
            assertEquals("m", e.getSymbolName());
        }
    }

    @Test
    @DisplayName("局部槽位按出现顺序分配")
    void slotAllocation() {
        Program program = new Parser(
                "fn: f(a: int, b: int) {\n" +
                "  var x: int = a;\n" +
                "  if true { var y: int = b; }\n" +
                "  for c in 3 { var z: int = c; }\n" +
                "}\n", "<test>").parse();
        ResolvedProgram rp = new Resolver().resolve(program);
        FunctionSymbol f = rp.findFunction("root::f");
        // a b x y seq idx c z
        assertEquals(8, f.getLocalCount());

        FunDecl decl = (FunDecl) program.getItems().get(0);
        assertEquals(2, rp.localOf(decl.getBody().getStatements().get(0)).getSlot());
        ForLoopSlots loop = rp.forLoopOf(
                (com.pgslang.compiler.ast.stmt.ForStmt) decl.getBody().getStatements().get(2));
        assertEquals(4, loop.getSequenceSlot());
        assertEquals(5, loop.getIndexSlot());
        assertEquals(6, loop.getVariable().getSlot());
    }

    @Nested
    @DisplayName("注册表原生函数")
    class NativeTests {

        private ResolvedProgram resolveWith(NativeRegistry registry, String source) {
            return new Resolver(registry).resolve(new Parser(source, "<test>").parse());
        }

        @Test
        @DisplayName("原生函数挂到按需创建的模块下")
        void registryModules() {
            NativeRegistry registry = new NativeRegistry()
                    .register1("std::math::sqrt", ValueKind.FLOAT, ValueKind.FLOAT,
                            v -> PgsFloat.of(Math.sqrt(v.asDouble())));
            ResolvedProgram rp = resolveWith(registry,
                    "import std::math::sqrt;\nfn: main() ~ float { return sqrt(16.0); }\n");
            FunctionSymbol sqrt = rp.findFunction("root::std::math::sqrt");
            assertTrue(sqrt.isNative());
            assertEquals("std::math::sqrt", sqrt.getNativeName());
            assertEquals(1, rp.getNatives().size());
        }

        @Test
        @DisplayName("外部声明优先于注册表")
        void externDeclaration() {
            NativeRegistry registry = new NativeRegistry()
                    .register1("sqrt", ValueKind.FLOAT, ValueKind.FLOAT, v -> v);
            ResolvedProgram rp = resolveWith(registry,
                    "fn: sqrt(x: float) ~ float;\nfn: main() ~ float { return sqrt(2.0); }\n");
            FunctionSymbol sqrt = rp.findFunction("root::sqrt");
            assertNotNull(sqrt.getDecl());
            assertEquals(1, rp.getNatives().size());
        }

        @Test
        @DisplayName("原生模块与源码符号冲突")
        void moduleConflict() {
            NativeRegistry registry = new NativeRegistry()
                    .register0("std::now", ValueKind.INT, () -> null);
            ResolveException e = assertThrows(ResolveException.class,
                    () -> resolveWith(registry, "fn: std() { }"));
            assertEquals(Kind.DUPLICATE_DEFINITION, e.getKind());
        }
    }
}
