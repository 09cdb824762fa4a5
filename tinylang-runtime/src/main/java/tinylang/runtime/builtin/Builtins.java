package tinylang.runtime.builtin;

import com.tinylang.bytecode.NativeFunction;
import com.tinylang.bytecode.Value;
import tinylang.runtime.vm.RuntimeErrorKind;
import tinylang.runtime.vm.TinyRuntimeException;
import tinylang.runtime.vm.VirtualMachine;

import java.util.regex.Pattern;

/**
 * 内置函数注册
 *
 * 内置函数以 {@link NativeFunction} 值存入全局表，按名称在调用时分派。
 * 参数个数由虚拟机按声明的 arity 校验，参数类型由各函数自行校验。
 */
public final class Builtins {

    /** range() 输出的元素上限 */
    static final int MAX_RANGE = 1 << 20;

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Builtins() {}

    /**
     * 注册所有内置函数到虚拟机的全局表
     */
    public static void register(VirtualMachine vm) {
        // print(...) - 参数以空格分隔输出并换行
        vm.defineNative(new NativeFunction("print", NativeFunction.VARIADIC, args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.length; i++) {
                if (i > 0) sb.append(' ');
                sb.append(vm.display(args[i]));
            }
            vm.getStdout().println(sb);
            return Value.NIL;
        }));

        // clock() - VM 创建以来的秒数
        vm.defineNative(new NativeFunction("clock", 0, args -> Value.number(vm.getElapsedSeconds())));

        // len(s) - 字符串长度
        vm.defineNative(new NativeFunction("len", 1, args -> {
            Value s = args[0];
            if (!s.isString()) {
                throw typeError("len() expects a string but got " + s.typeName() + ".");
            }
            return Value.number(s.asString().length());
        }));

        // assert(v) - v 为假值时报错
        vm.defineNative(new NativeFunction("assert", 1, args -> {
            if (!args[0].isTruthy()) {
                throw new TinyRuntimeException(RuntimeErrorKind.ASSERTION_FAILED,
                        "Assertion failed: " + vm.display(args[0]) + " is falsy.");
            }
            return Value.NIL;
        }));

        // toNumber(v) - 数值原样返回，字符串解析（失败为 nil），布尔映射为 1/0
        vm.defineNative(new NativeFunction("toNumber", 1, args -> toNumber(args[0])));

        // toString(v) - 文本形式
        vm.defineNative(new NativeFunction("toString", 1, args -> Value.string(vm.display(args[0]))));

        // range(n) - "[0, 1, ..., n-1]"
        vm.defineNative(new NativeFunction("range", 1, args -> {
            Value n = args[0];
            if (!n.isNumber()) {
                throw typeError("range() expects a number but got " + n.typeName() + ".");
            }
            if (n.asNumber() > MAX_RANGE) {
                throw typeError("range() argument too large: " + vm.display(n) + ".");
            }
            return Value.string(range(n.asNumber()));
        }));
    }

    static Value toNumber(Value v) {
        switch (v.getKind()) {
            case NUMBER:
                return v;
            case BOOL:
                return Value.number(v.asBool() ? 1 : 0);
            case STRING: {
                String text = v.asString().trim();
                if (!NUMBER.matcher(text).matches()) {
                    return Value.NIL;
                }
                return Value.number(Double.parseDouble(text));
            }
            default:
                return Value.NIL;
        }
    }

    static String range(double n) {
        StringBuilder sb = new StringBuilder("[");
        long count = (long) Math.floor(n);
        for (long i = 0; i < count; i++) {
            if (i > 0) sb.append(", ");
            sb.append(i);
        }
        return sb.append(']').toString();
    }

    private static TinyRuntimeException typeError(String message) {
        return new TinyRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, message);
    }
}
