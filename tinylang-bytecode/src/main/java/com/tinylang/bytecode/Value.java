package com.tinylang.bytecode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * TinyLang 运行时值。
 *
 * 封闭的标签联合：nil / bool / number / string 按值存储；
 * function / closure 只保存堆句柄，由 {@link Heap} 解析；
 * native 直接持有 {@link NativeFunction}。
 */
public final class Value {

    public enum Kind {
        NIL, BOOL, NUMBER, STRING, FUNCTION, CLOSURE, NATIVE
    }

    public static final Value NIL = new Value(Kind.NIL, 0, null, -1);
    public static final Value TRUE = new Value(Kind.BOOL, 1, null, -1);
    public static final Value FALSE = new Value(Kind.BOOL, 0, null, -1);

    /** 从 .tbc 文件读回的函数常量，没有可执行的函数体 */
    public static final Value FUNCTION_PLACEHOLDER = new Value(Kind.FUNCTION, 0, null, -1);

    private static final MathContext DISPLAY_PRECISION = new MathContext(12, RoundingMode.HALF_EVEN);

    private final Kind kind;
    private final double number;
    private final Object ref;
    private final int handle;

    private Value(Kind kind, double number, Object ref, int handle) {
        this.kind = kind;
        this.number = number;
        this.ref = ref;
        this.handle = handle;
    }

    // ============ 工厂 ============

    public static Value bool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Value number(double d) {
        return new Value(Kind.NUMBER, d, null, -1);
    }

    public static Value string(String s) {
        return new Value(Kind.STRING, 0, Objects.requireNonNull(s, "s"), -1);
    }

    public static Value function(int handle) {
        return new Value(Kind.FUNCTION, 0, null, handle);
    }

    public static Value closure(int handle) {
        return new Value(Kind.CLOSURE, 0, null, handle);
    }

    public static Value nativeFunction(NativeFunction fn) {
        return new Value(Kind.NATIVE, 0, Objects.requireNonNull(fn, "fn"), -1);
    }

    // ============ 访问 ============

    public Kind getKind() {
        return kind;
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public boolean isNil() {
        return kind == Kind.NIL;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    /** 是否为堆对象引用（函数或闭包） */
    public boolean isHeapRef() {
        return (kind == Kind.FUNCTION || kind == Kind.CLOSURE) && handle >= 0;
    }

    public boolean asBool() {
        checkKind(Kind.BOOL);
        return number != 0;
    }

    public double asNumber() {
        checkKind(Kind.NUMBER);
        return number;
    }

    public String asString() {
        checkKind(Kind.STRING);
        return (String) ref;
    }

    public NativeFunction asNative() {
        checkKind(Kind.NATIVE);
        return (NativeFunction) ref;
    }

    public int getHandle() {
        if (kind != Kind.FUNCTION && kind != Kind.CLOSURE) {
            throw new IllegalStateException("Not a heap reference: " + kind);
        }
        return handle;
    }

    private void checkKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " but was " + kind);
        }
    }

    /** nil、false、0 与空字符串为假，其余为真 */
    public boolean isTruthy() {
        switch (kind) {
            case NIL:
                return false;
            case BOOL:
            case NUMBER:
                return number != 0;
            case STRING:
                return !((String) ref).isEmpty();
            default:
                return true;
        }
    }

    /** 类型名，用于错误消息 */
    public String typeName() {
        switch (kind) {
            case NIL: return "nil";
            case BOOL: return "bool";
            case NUMBER: return "number";
            case STRING: return "string";
            case NATIVE: return "native function";
            default: return "function";
        }
    }

    // ============ 相等 ============

    /**
     * 语言层面的相等：两个 NaN 视为相等，字符串比较内容，函数与闭包比较身份。
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (kind != other.kind) return false;
        switch (kind) {
            case NIL:
                return true;
            case BOOL:
                return number == other.number;
            case NUMBER:
                return number == other.number || (Double.isNaN(number) && Double.isNaN(other.number));
            case STRING:
                return ref.equals(other.ref);
            case NATIVE:
                return ref == other.ref;
            default:
                // 占位函数没有身份，只与自身相等
                return handle >= 0 && handle == other.handle;
        }
    }

    @Override
    public int hashCode() {
        switch (kind) {
            case NUMBER:
                if (Double.isNaN(number)) return 0x7ff80000;
                // 0.0 与 -0.0 相等，散列也必须一致
                return Double.hashCode(number == 0 ? 0.0 : number);
            case STRING:
            case NATIVE:
                return ref.hashCode();
            case FUNCTION:
            case CLOSURE:
                return kind.hashCode() * 31 + handle;
            default:
                return kind.hashCode() * 31 + (int) number;
        }
    }

    /**
     * 常量池意义上的同一：数值按位比较，区分 0.0 与 -0.0。
     */
    public static boolean sameConstant(Value a, Value b) {
        if (a.kind != b.kind) return false;
        if (a.kind == Kind.NUMBER) {
            return Double.doubleToLongBits(a.number) == Double.doubleToLongBits(b.number);
        }
        if (a.kind == Kind.FUNCTION && a.handle < 0) {
            return a == b;
        }
        return a.equals(b);
    }

    // ============ 文本 ============

    /**
     * 数值的文本形式：最多 12 位有效数字，去掉尾随零，
     * 指数小于 -4 或不小于 12 时使用科学计数法（如 1e+20）。
     */
    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == 0) return (1 / d < 0) ? "-0" : "0";

        BigDecimal bd = new BigDecimal(d).round(DISPLAY_PRECISION);
        int exponent = bd.precision() - bd.scale() - 1;
        if (exponent < -4 || exponent >= 12) {
            String mantissa = bd.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            int abs = Math.abs(exponent);
            return mantissa + "e" + (exponent < 0 ? "-" : "+") + (abs < 10 ? "0" : "") + abs;
        }
        return bd.stripTrailingZeros().toPlainString();
    }

    /**
     * 不需要堆即可得到的文本形式；函数类值请使用 {@link Heap#display(Value)}。
     */
    @Override
    public String toString() {
        switch (kind) {
            case NIL: return "nil";
            case BOOL: return number != 0 ? "true" : "false";
            case NUMBER: return formatNumber(number);
            case STRING: return (String) ref;
            case NATIVE: return "<native fn " + ((NativeFunction) ref).getName() + ">";
            case CLOSURE: return "<closure #" + handle + ">";
            default: return handle < 0 ? "<fn ?>" : "<fn #" + handle + ">";
        }
    }
}
