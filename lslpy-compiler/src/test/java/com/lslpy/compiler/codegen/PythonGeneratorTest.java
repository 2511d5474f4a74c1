package com.lslpy.compiler.codegen;

import com.lslpy.compiler.analysis.LslType;
import com.lslpy.compiler.analysis.Symbol;
import com.lslpy.compiler.ast.AstNode;
import com.lslpy.compiler.ast.CoordinateMember;
import com.lslpy.compiler.ast.decl.*;
import com.lslpy.compiler.ast.expr.*;
import com.lslpy.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lslpy.compiler.ast.expr.UnaryExpr.UnaryOp;
import com.lslpy.compiler.ast.stmt.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.lslpy.compiler.AstFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PythonGenerator 单元测试
 */
class PythonGeneratorTest {

    private final PythonGenerator generator = new PythonGenerator();

    private final Symbol i = local("i", LslType.INTEGER);
    private final Symbol f = local("f", LslType.FLOAT);
    private final Symbol v = local("v", LslType.VECTOR);
    private final Symbol g = global("g", LslType.INTEGER);
    private final Symbol gv = global("gv", LslType.VECTOR);
    private final Symbol llSay = builtin("llSay", LslType.NONE);

    private String emit(AstNode node) {
        GenerationContext ctx = new GenerationContext(new GenerationConfig());
        node.accept(generator, ctx);
        return ctx.getOutput();
    }

    // ============ 常量 ============

    @Nested
    @DisplayName("常量")
    class ConstantTests {

        @Test
        @DisplayName("整数")
        void testInteger() {
            assertEquals("42", emit(integer(42)));
            assertEquals("-7", emit(integer(-7)));
            assertEquals("-2147483648", emit(integer(Integer.MIN_VALUE)));
        }

        @Test
        @DisplayName("浮点")
        void testFloat() {
            assertEquals("2.0", emit(flt(2.0f)));
            assertEquals("-0.0", emit(flt(-0.0f)));
            assertThat(emit(flt(0.5f))).startsWith("bin2float('0.500000', '");
        }

        @Test
        @DisplayName("字符串转义")
        void testString() {
            assertEquals("\"a\\\"b\\n\"", emit(str("a\"b\n")));
            assertEquals("\"C:\\\\tmp\\t\\x01\"", emit(str("C:\\tmp\t\u0001")));
            assertEquals("\"\"", emit(str("")));
        }

        @Test
        @DisplayName("key")
        void testKey() {
            assertEquals("Key(\"abc\")", emit(new KeyConstant(LOC, "abc")));
        }

        @Test
        @DisplayName("vector 与 rotation")
        void testCoordinates() {
            assertEquals("Vector((1.0, 2.0, 3.0))", emit(new VectorConstant(LOC, 1f, 2f, 3f)));
            assertEquals("Quaternion((0.0, 0.0, 0.0, 1.0))", emit(new QuaternionConstant(LOC, 0f, 0f, 0f, 1f)));
        }

        @Test
        @DisplayName("列表")
        void testList() {
            assertEquals("[1, \"a\"]", emit(new ListConstant(LOC, exprs(integer(1), str("a")))));
            assertEquals("[]", emit(new ListConstant(LOC, Collections.<Expression>emptyList())));
        }
    }

    // ============ 表达式 ============

    @Nested
    @DisplayName("表达式")
    class ExpressionTests {

        @Test
        @DisplayName("坐标与列表表达式")
        void testAggregates() {
            VectorExpr vector = new VectorExpr(LOC, exprs(ref(f), flt(2f), integer(0)));
            assertEquals("Vector((f, 2.0, 0))", emit(vector));
            QuaternionExpr rot = new QuaternionExpr(LOC, exprs(ref(f), ref(f), ref(f), flt(1f)));
            assertEquals("Quaternion((f, f, f, 1.0))", emit(rot));
            assertEquals("[self.g, v]", emit(new ListExpr(LOC, exprs(ref(g), ref(v)))));
        }

        @Test
        @DisplayName("类型转换")
        void testTypecast() {
            assertEquals("float(i)", emit(new TypecastExpr(LOC, LslType.FLOAT, ref(i))));
            assertEquals("typecast(f, str)", emit(new TypecastExpr(LOC, LslType.STRING, ref(f))));
            assertEquals("typecast(i, str)", emit(new TypecastExpr(LOC, LslType.STRING, ref(i))));
            assertEquals("typecast(\"1\", Key)", emit(new TypecastExpr(LOC, LslType.KEY, str("1"))));
            assertEquals("typecast(f, int)", emit(new TypecastExpr(LOC, LslType.INTEGER, ref(f))));
        }

        @Test
        @DisplayName("内置函数与用户函数调用")
        void testCalls() {
            assertEquals("lslfuncs.llSay(0, \"hi\")", emit(call(llSay, integer(0), str("hi"))));
            assertEquals("self.foo(1)", emit(call(global("foo", LslType.INTEGER), integer(1))));
            assertEquals("self.bar()", emit(call(global("bar", LslType.NONE))));
        }

        @Test
        @DisplayName("变量引用与分量访问")
        void testReferences() {
            assertEquals("self.g", emit(ref(g)));
            assertEquals("i", emit(ref(i)));
            assertEquals("v[1]", emit(ref(v, CoordinateMember.Y)));
            Symbol q = global("q", LslType.QUATERNION);
            assertEquals("self.q[3]", emit(ref(q, CoordinateMember.S)));
        }

        @Test
        @DisplayName("二元运算右操作数在前")
        void testBinaryOperandOrder() {
            assertEquals("radd(1, i)", emit(binary(ref(i), BinaryOp.ADD, integer(1))));
            BinaryExpr nested = binary(binary(ref(i), BinaryOp.SUB, ref(g)), BinaryOp.MUL, integer(3));
            assertEquals("rmul(3, rsub(self.g, i))", emit(nested));
        }

        @Test
        @DisplayName("所有非赋值二元运算符的辅助函数名")
        void testBinaryHelpers() {
            Symbol l = local("l", LslType.INTEGER);
            Symbol r = local("r", LslType.INTEGER);
            BinaryOp[] ops = {BinaryOp.ADD, BinaryOp.SUB, BinaryOp.MUL, BinaryOp.DIV, BinaryOp.MOD,
                    BinaryOp.EQ, BinaryOp.NE, BinaryOp.GT, BinaryOp.LT, BinaryOp.GE, BinaryOp.LE,
                    BinaryOp.AND, BinaryOp.OR, BinaryOp.BIT_AND, BinaryOp.BIT_OR, BinaryOp.BIT_XOR,
                    BinaryOp.SHL, BinaryOp.SHR};
            String[] helpers = {"radd", "rsub", "rmul", "rdiv", "rmod",
                    "req", "rneq", "rgreater", "rless", "rgeq", "rleq",
                    "rbooland", "rboolor", "rbitand", "rbitor", "rbitxor",
                    "rshl", "rshr"};
            for (int k = 0; k < ops.length; k++) {
                assertEquals(helpers[k] + "(r, l)", emit(binary(ref(l), ops[k], ref(r))), ops[k].name());
            }
        }

        @Test
        @DisplayName("一元运算与包装节点")
        void testUnaryAndWrappers() {
            assertEquals("neg(i)", emit(unary(UnaryOp.NEG, ref(i), true)));
            assertEquals("bitnot(i)", emit(unary(UnaryOp.BIT_NOT, ref(i), true)));
            assertEquals("boolnot(i)", emit(unary(UnaryOp.BOOL_NOT, ref(i), true)));
            assertEquals("print(i)", emit(new PrintExpr(LOC, ref(i))));
            assertEquals("(radd(1, i))", emit(new ParenthesisExpr(LOC, binary(ref(i), BinaryOp.ADD, integer(1)))));
            assertEquals("cond(self.g)", emit(cond(ref(g))));
        }
    }

    // ============ 赋值 ============

    @Nested
    @DisplayName("赋值")
    class AssignmentTests {

        @Test
        @DisplayName("语句上下文的普通赋值")
        void testStatementAssign() {
            assertEquals("i = 5", emit(assign(ref(i), integer(5), false)));
            assertEquals("self.g = 5", emit(assign(ref(g), integer(5), false)));
        }

        @Test
        @DisplayName("分量赋值重建整个坐标")
        void testMemberAssign() {
            assertEquals("v = replace_coord_axis(v, 0, 5.0)",
                    emit(assign(ref(v, CoordinateMember.X), flt(5f), false)));
            assertEquals("self.gv = replace_coord_axis(self.gv, 2, f)",
                    emit(assign(ref(gv, CoordinateMember.Z), ref(f), false)));
        }

        @Test
        @DisplayName("表达式上下文的赋值")
        void testUsedAssign() {
            assertEquals("(i := 5)", emit(assign(ref(i), integer(5), true)));
            assertEquals("assign(self.__dict__, \"g\", 5)", emit(assign(ref(g), integer(5), true)));
        }

        @Test
        @DisplayName("表达式上下文的分量赋值取回分量值")
        void testUsedMemberAssign() {
            assertEquals("(v := replace_coord_axis(v, 2, 1.0))[2]",
                    emit(assign(ref(v, CoordinateMember.Z), flt(1f), true)));
            assertEquals("assign(self.__dict__, \"gv\", replace_coord_axis(self.gv, 1, 1.0))[1]",
                    emit(assign(ref(gv, CoordinateMember.Y), flt(1f), true)));
        }

        @Test
        @DisplayName("赋值作为函数实参")
        void testAssignInCall() {
            FunctionCallExpr expr = call(llSay, integer(0), assign(ref(g), integer(3), true));
            assertEquals("lslfuncs.llSay(0, assign(self.__dict__, \"g\", 3))", emit(expr));
        }

        @Test
        @DisplayName("整数 *= 浮点收窄回整数")
        void testMulAssign() {
            BinaryExpr local = new BinaryExpr(LOC, LslType.INTEGER, ref(i), BinaryOp.MUL_ASSIGN, ref(f));
            assertEquals("(i := typecast(rmul(f, i), int))", emit(local));
            BinaryExpr glob = new BinaryExpr(LOC, LslType.INTEGER, ref(g), BinaryOp.MUL_ASSIGN, flt(1.5f));
            assertThat(emit(glob))
                    .startsWith("assign(self.__dict__, \"g\", typecast(rmul(bin2float('1.500000', ")
                    .endsWith("), self.g), int))");
        }
    }

    // ============ 自增自减 ============

    @Nested
    @DisplayName("自增自减")
    class IncDecTests {

        @Test
        @DisplayName("结果不需要时写成增量赋值")
        void testStatementForm() {
            assertEquals("i += 1", emit(unary(UnaryOp.PRE_INCR, ref(i), false)));
            assertEquals("i -= 1", emit(unary(UnaryOp.POST_DECR, ref(i), false)));
            assertEquals("self.g += 1", emit(unary(UnaryOp.POST_INCR, ref(g), false)));
            assertEquals("f -= 1.0", emit(unary(UnaryOp.PRE_DECR, ref(f), false)));
        }

        @Test
        @DisplayName("结果需要时调用运行时辅助函数")
        void testUsedForm() {
            assertEquals("preincr(locals(), \"i\")", emit(unary(UnaryOp.PRE_INCR, ref(i), true)));
            assertEquals("postdecr(self.__dict__, \"g\")", emit(unary(UnaryOp.POST_DECR, ref(g), true)));
            assertEquals("self.foo(postincr(locals(), \"i\"))",
                    emit(call(global("foo", LslType.NONE), unary(UnaryOp.POST_INCR, ref(i), true))));
        }

        @Test
        @DisplayName("分量自增总是调用辅助函数")
        void testMemberForm() {
            assertEquals("postincr(locals(), \"v\", 0)",
                    emit(unary(UnaryOp.POST_INCR, ref(v, CoordinateMember.X), false)));
            assertEquals("predecr(self.__dict__, \"gv\", 2)",
                    emit(unary(UnaryOp.PRE_DECR, ref(gv, CoordinateMember.Z), true)));
        }
    }

    // ============ 语句 ============

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("空语句与空块")
        void testEmpty() {
            assertEquals("pass\n", emit(new NopStmt(LOC)));
            assertEquals("pass\n", emit(block()));
        }

        @Test
        @DisplayName("局部变量声明及零值")
        void testDeclarations() {
            assertEquals("i: int = 0\n", emit(new DeclarationStmt(LOC, i, null)));
            assertEquals("i: int = 3\n", emit(new DeclarationStmt(LOC, i, integer(3))));
            assertEquals("f: float = 0.0\n", emit(new DeclarationStmt(LOC, f, null)));
            assertEquals("s: str = \"\"\n", emit(new DeclarationStmt(LOC, local("s", LslType.STRING), null)));
            assertEquals("k: Key = Key(\"\")\n", emit(new DeclarationStmt(LOC, local("k", LslType.KEY), null)));
            assertEquals("v: Vector = Vector((0.0, 0.0, 0.0))\n", emit(new DeclarationStmt(LOC, v, null)));
            assertEquals("q: Quaternion = Quaternion((0.0, 0.0, 0.0, 0.0))\n",
                    emit(new DeclarationStmt(LOC, local("q", LslType.QUATERNION), null)));
            assertEquals("l: list = []\n", emit(new DeclarationStmt(LOC, local("l", LslType.LIST), null)));
        }

        @Test
        @DisplayName("if / else")
        void testIf() {
            IfStmt stmt = new IfStmt(LOC, cond(ref(i)), block(), new ReturnStmt(LOC, null));
            assertEquals("if cond(i):\n    pass\nelse:\n    return\n", emit(stmt));

            IfStmt noElse = new IfStmt(LOC, cond(ref(i)), stmt(call(llSay, integer(0), str("x"))), null);
            assertEquals("if cond(i):\n    lslfuncs.llSay(0, \"x\")\n", emit(noElse));
        }

        @Test
        @DisplayName("for 循环展开为 while True")
        void testFor() {
            ForStmt loop = new ForStmt(LOC,
                    exprs(assign(ref(i), integer(0), false)),
                    cond(binary(ref(i), BinaryOp.LT, integer(10))),
                    exprs(unary(UnaryOp.PRE_INCR, ref(i), false)),
                    block(stmt(call(llSay, integer(0), str("x")))));
            String expected = ""
                    + "i = 0\n"
                    + "while True:\n"
                    + "    if not cond(rless(10, i)):\n"
                    + "        break\n"
                    + "    lslfuncs.llSay(0, \"x\")\n"
                    + "    i += 1\n";
            assertEquals(expected, emit(loop));
        }

        @Test
        @DisplayName("while 与 do-while")
        void testWhileAndDo() {
            WhileStmt loop = new WhileStmt(LOC, cond(ref(i)),
                    block(stmt(unary(UnaryOp.POST_DECR, ref(i), false))));
            assertEquals("while cond(i):\n    i -= 1\n", emit(loop));

            DoStmt doLoop = new DoStmt(LOC, block(stmt(unary(UnaryOp.PRE_INCR, ref(i), false))), cond(ref(i)));
            assertEquals("while True:\n    i += 1\n    if not cond(i):\n        break\n", emit(doLoop));
        }

        @Test
        @DisplayName("嵌套块逐层缩进")
        void testNestedIndent() {
            IfStmt inner = new IfStmt(LOC, cond(ref(g)), block(new JumpStmt(LOC, "done")), null);
            WhileStmt loop = new WhileStmt(LOC, cond(ref(i)), block(inner, new LabelStmt(LOC, "done")));
            String expected = ""
                    + "while cond(i):\n"
                    + "    if cond(self.g):\n"
                    + "        goto .done\n"
                    + "    label .done\n";
            assertEquals(expected, emit(loop));
        }

        @Test
        @DisplayName("跳转、返回与状态切换")
        void testControlTransfer() {
            assertEquals("goto .done\n", emit(new JumpStmt(LOC, "done")));
            assertEquals("label .done\n", emit(new LabelStmt(LOC, "done")));
            assertEquals("return\n", emit(new ReturnStmt(LOC, null)));
            assertEquals("return 1\n", emit(new ReturnStmt(LOC, integer(1))));
            assertEquals("raise StateChangeException('other')\n", emit(new StateChangeStmt(LOC, "other")));
        }
    }

    // ============ 整个脚本 ============

    @Nested
    @DisplayName("脚本")
    class ScriptTests {

        private Script sampleScript() {
            Symbol a = local("a", LslType.INTEGER);
            Symbol b = local("b", LslType.INTEGER);
            Symbol n = local("n", LslType.INTEGER);
            Symbol gf = global("gf", LslType.FLOAT);
            List<Declaration> globals = new ArrayList<Declaration>();
            globals.add(new GlobalVariable(LOC, g, integer(1)));
            globals.add(new GlobalVariable(LOC, gv, null));
            globals.add(new GlobalVariable(LOC, gf, new TypecastExpr(LOC, LslType.FLOAT, ref(g))));
            globals.add(new GlobalFunction(LOC, "add", LslType.INTEGER, Arrays.asList(a, b),
                    block(new ReturnStmt(LOC, binary(ref(a), BinaryOp.ADD, ref(b))))));

            StateDecl defaultState = new StateDecl(LOC, StateDecl.DEFAULT_STATE, Arrays.asList(
                    new EventHandler(LOC, "default", "state_entry", Collections.<Symbol>emptyList(),
                            block(stmt(call(llSay, integer(0), str("hi"))))),
                    new EventHandler(LOC, "default", "touch_start", Collections.singletonList(n), block())));
            StateDecl other = new StateDecl(LOC, "other", Collections.singletonList(
                    new EventHandler(LOC, "other", "state_entry", Collections.<Symbol>emptyList(),
                            block(new StateChangeStmt(LOC, "default")))));
            return new Script(LOC, globals, Arrays.asList(defaultState, other));
        }

        @Test
        @DisplayName("完整脚本布局")
        void testFullScript() {
            String expected = ""
                    + "from lummao import *\n"
                    + "\n"
                    + "\n"
                    + "class Script(BaseLSLScript):\n"
                    + "    g: int\n"
                    + "    gv: Vector\n"
                    + "    gf: float\n"
                    + "\n"
                    + "    def __init__(self):\n"
                    + "        super().__init__()\n"
                    + "        self.g = 1\n"
                    + "        self.gv = Vector((0.0, 0.0, 0.0))\n"
                    + "        self.gf = float(self.g)\n"
                    + "\n"
                    + "    @with_goto\n"
                    + "    def add(self, a: int, b: int) -> int:\n"
                    + "        return radd(b, a)\n"
                    + "\n"
                    + "    @with_goto\n"
                    + "    def edefaultstate_entry(self) -> None:\n"
                    + "        lslfuncs.llSay(0, \"hi\")\n"
                    + "\n"
                    + "    @with_goto\n"
                    + "    def edefaulttouch_start(self, n: int) -> None:\n"
                    + "        pass\n"
                    + "\n"
                    + "    @with_goto\n"
                    + "    def eotherstate_entry(self) -> None:\n"
                    + "        raise StateChangeException('default')\n"
                    + "\n";
            assertEquals(expected, generator.generate(sampleScript()));
        }

        @Test
        @DisplayName("空脚本仍有构造函数")
        void testEmptyScript() {
            Script script = new Script(LOC, Collections.<Declaration>emptyList(), Collections.<StateDecl>emptyList());
            String expected = ""
                    + "from lummao import *\n"
                    + "\n"
                    + "\n"
                    + "class Script(BaseLSLScript):\n"
                    + "\n"
                    + "    def __init__(self):\n"
                    + "        super().__init__()\n"
                    + "\n";
            assertEquals(expected, generator.generate(script));
        }

        @Test
        @DisplayName("自定义配置")
        void testCustomConfig() {
            GenerationConfig config = new GenerationConfig();
            config.setUseSpaces(false);
            config.setRuntimeModule("lsl_runtime");
            config.setClassName("Door");
            config.setHandlerPrefix("on_");
            String out = generator.generate(sampleScript(), config);
            assertThat(out)
                    .startsWith("from lsl_runtime import *\n\n\nclass Door(BaseLSLScript):\n\tg: int\n")
                    .contains("\tdef on_defaultstate_entry(self) -> None:\n\t\tlslfuncs.llSay(0, \"hi\")\n");
        }

        @Test
        @DisplayName("无初始化的全局变量在构造函数里取零值，处理器读取属性")
        void testGlobalZeroValue() {
            Symbol count = global("count", LslType.INTEGER);
            Script script = new Script(LOC,
                    Collections.<Declaration>singletonList(new GlobalVariable(LOC, count, null)),
                    Collections.singletonList(new StateDecl(LOC, "default", Collections.singletonList(
                            new EventHandler(LOC, "default", "touch_start", Collections.<Symbol>emptyList(),
                                    block(stmt(call(llSay, integer(0),
                                            new TypecastExpr(LOC, LslType.STRING, ref(count))))))))));
            String out = generator.generate(script);
            assertThat(out)
                    .contains("        self.count = 0\n")
                    .contains("        lslfuncs.llSay(0, typecast(self.count, str))\n");
        }

        @Test
        @DisplayName("同一生成器并发生成结果一致")
        void testConcurrentGeneration() throws Exception {
            String expected = generator.generate(sampleScript());
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> futures = new ArrayList<Future<String>>();
                for (int k = 0; k < 16; k++) {
                    futures.add(pool.submit(() -> generator.generate(sampleScript())));
                }
                for (Future<String> future : futures) {
                    assertEquals(expected, future.get());
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    // ============ 违反前端约定 ============

    @Nested
    @DisplayName("违反前端约定")
    class ContractViolationTests {

        @Test
        @DisplayName("未去糖的复合赋值")
        void testUnloweredCompoundAssign() {
            BinaryExpr expr = new BinaryExpr(LOC, LslType.INTEGER, ref(i), BinaryOp.ADD_ASSIGN, integer(1));
            GenerationException e = assertThrows(GenerationException.class, () -> emit(expr));
            assertThat(e.getMessage()).contains("+=").contains("test.lsl");
            assertSame(LOC, e.getLocation());
        }

        @Test
        @DisplayName("除 *= 外的复合赋值全部拒绝")
        void testAllCompoundAssignRejected() {
            BinaryOp[] ops = {BinaryOp.ADD_ASSIGN, BinaryOp.SUB_ASSIGN, BinaryOp.DIV_ASSIGN, BinaryOp.MOD_ASSIGN};
            for (BinaryOp op : ops) {
                assertTrue(op.isAssignment());
                BinaryExpr expr = new BinaryExpr(LOC, LslType.INTEGER, ref(i), op, integer(2));
                GenerationException e = assertThrows(GenerationException.class, () -> emit(expr));
                assertThat(e.getMessage()).contains("复合赋值 " + op.toSourceString());
            }
            assertFalse(BinaryOp.ADD.isAssignment());
        }

        @Test
        @DisplayName("赋值目标不是左值")
        void testNonLValueTarget() {
            BinaryExpr expr = new BinaryExpr(LOC, LslType.INTEGER, integer(1), BinaryOp.ASSIGN, integer(2));
            assertThrows(GenerationException.class, () -> emit(expr));
            UnaryExpr incr = unary(UnaryOp.PRE_INCR, integer(1), false);
            assertThrows(GenerationException.class, () -> emit(incr));
        }

        @Test
        @DisplayName("分量上的 *=")
        void testMemberMulAssign() {
            BinaryExpr expr = new BinaryExpr(LOC, LslType.FLOAT, ref(v, CoordinateMember.X),
                    BinaryOp.MUL_ASSIGN, flt(2f));
            assertThrows(GenerationException.class, () -> emit(expr));
        }

        @Test
        @DisplayName("错误类型的声明")
        void testErrorType() {
            DeclarationStmt decl = new DeclarationStmt(LOC, local("x", LslType.ERROR), null);
            assertThrows(GenerationException.class, () -> emit(decl));
        }

        @Test
        @DisplayName("不支持自增的类型")
        void testIncrementString() {
            UnaryExpr incr = unary(UnaryOp.PRE_INCR, ref(local("s", LslType.STRING)), false);
            assertThrows(GenerationException.class, () -> emit(incr));
        }
    }
}
