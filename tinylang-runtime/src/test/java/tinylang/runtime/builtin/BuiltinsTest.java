package tinylang.runtime.builtin;

import com.tinylang.bytecode.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tinylang.runtime.vm.InterpretResult;
import tinylang.runtime.vm.RuntimeErrorKind;
import tinylang.runtime.vm.TinyRuntimeException;
import tinylang.runtime.vm.VirtualMachine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内置函数测试
 */
class BuiltinsTest {

    private VirtualMachine vm;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        vm = new VirtualMachine();
        out = new ByteArrayOutputStream();
        vm.setStdout(new PrintStream(out, true, StandardCharsets.UTF_8));
        vm.setStderr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    private String run(String source) {
        assertEquals(InterpretResult.OK, vm.interpret(source));
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private TinyRuntimeException runFailing(String source) {
        assertEquals(InterpretResult.RUNTIME_ERROR, vm.interpret(source));
        return vm.getLastError();
    }

    @Nested
    @DisplayName("输出与计时")
    class OutputTests {

        @Test
        @DisplayName("print 以空格连接参数")
        void testPrintJoinsArguments() {
            assertEquals("1 a true nil\n", run("print(1, \"a\", true, nil);"));
        }

        @Test
        @DisplayName("无参 print 输出空行")
        void testEmptyPrint() {
            assertEquals("\n", run("print();"));
        }

        @Test
        @DisplayName("clock 返回非负秒数")
        void testClock() {
            assertEquals("true\n", run("print clock() >= 0;"));
        }

        @Test
        @DisplayName("内置函数位于全局表")
        void testRegisteredAsGlobals() {
            assertTrue(vm.globalsSnapshot().keySet().containsAll(
                    Arrays.asList("print", "clock", "len", "assert", "toNumber", "toString", "range")));
        }
    }

    @Nested
    @DisplayName("转换函数")
    class ConversionTests {

        @Test
        @DisplayName("toNumber 解析数字字符串")
        void testToNumber() {
            assertEquals("42 -1.5 1000 nil nil 1 0 7\n",
                    run("print toNumber(\"42\"), toNumber(\" -1.5 \"), toNumber(\"1e3\"), toNumber(\"x\"), "
                            + "toNumber(\"\"), toNumber(true), toNumber(false), toNumber(7);"));
        }

        @Test
        @DisplayName("toNumber 拒绝非数字文本")
        void testToNumberRejects() {
            assertEquals(Value.NIL, Builtins.toNumber(Value.string("12abc")));
            assertEquals(Value.NIL, Builtins.toNumber(Value.string("NaN")));
            assertEquals(Value.NIL, Builtins.toNumber(Value.NIL));
            assertEquals(0.5, Builtins.toNumber(Value.string(".5")).asNumber());
        }

        @Test
        @DisplayName("toString 与字符串拼接")
        void testToString() {
            assertEquals("3! <fn f> true\n",
                    run("fn f() {} print toString(3) + \"!\", toString(f), toString(true);"));
        }

        @Test
        @DisplayName("len 返回字符串长度")
        void testLen() {
            assertEquals("5 0\n", run("print len(\"hello\"), len(\"\");"));
        }

        @Test
        @DisplayName("range 生成序列文本")
        void testRange() {
            assertEquals("[0, 1, 2]\n[]\n", run("print range(3); print range(0);"));
            assertEquals("[]", Builtins.range(-4));
            assertEquals("[0, 1]", Builtins.range(2.7));
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("assert 假值时失败")
        void testAssertFails() {
            TinyRuntimeException e = runFailing("assert(1 == 1); assert(false);");
            assertEquals(RuntimeErrorKind.ASSERTION_FAILED, e.getKind());
            assertEquals("Assertion failed: false is falsy.", e.getRawMessage());
        }

        @Test
        @DisplayName("len 参数类型错误")
        void testLenTypeMismatch() {
            TinyRuntimeException e = runFailing("len(1);");
            assertEquals(RuntimeErrorKind.TYPE_MISMATCH, e.getKind());
            assertEquals("len() expects a string but got number.", e.getRawMessage());
        }

        @Test
        @DisplayName("参数个数由虚拟机校验")
        void testArity() {
            TinyRuntimeException e = runFailing("len();");
            assertEquals(RuntimeErrorKind.ARITY_MISMATCH, e.getKind());
            assertEquals("Expected 1 arguments but got 0.", e.getRawMessage());
        }

        @Test
        @DisplayName("range 参数过大或类型错误")
        void testRangeErrors() {
            assertEquals(RuntimeErrorKind.TYPE_MISMATCH, runFailing("range(\"3\");").getKind());
            TinyRuntimeException e = runFailing("range(2000000);");
            assertEquals("range() argument too large: 2000000.", e.getRawMessage());
        }
    }
}
