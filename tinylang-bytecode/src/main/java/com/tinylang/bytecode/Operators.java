package com.tinylang.bytecode;

/**
 * 运算符语义，编译期折叠、窥孔优化与虚拟机共用。
 */
public final class Operators {

    private Operators() {
    }

    /** 两个数值的算术运算 */
    public static double arithmetic(OpCode op, double a, double b) {
        switch (op) {
            case ADD: return a + b;
            case SUBTRACT: return a - b;
            case MULTIPLY: return a * b;
            case DIVIDE: return a / b;
            case MODULO: return a % b;
            default:
                throw new IllegalArgumentException("Not an arithmetic opcode: " + op);
        }
    }

    /** 两个数值或两个字符串的大小比较 */
    public static boolean compare(OpCode op, Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            double x = a.asNumber();
            double y = b.asNumber();
            switch (op) {
                case LESS: return x < y;
                case LESS_EQUAL: return x <= y;
                case GREATER: return x > y;
                case GREATER_EQUAL: return x >= y;
                default:
                    throw new IllegalArgumentException("Not a comparison opcode: " + op);
            }
        }
        int cmp = a.asString().compareTo(b.asString());
        switch (op) {
            case LESS: return cmp < 0;
            case LESS_EQUAL: return cmp <= 0;
            case GREATER: return cmp > 0;
            case GREATER_EQUAL: return cmp >= 0;
            default:
                throw new IllegalArgumentException("Not a comparison opcode: " + op);
        }
    }

    public static boolean isComparison(OpCode op) {
        return op == OpCode.LESS || op == OpCode.LESS_EQUAL
                || op == OpCode.GREATER || op == OpCode.GREATER_EQUAL;
    }

    /**
     * 尝试在编译期求值二元运算。
     *
     * @return 结果；类型不匹配或除数/模数为零时返回 null，保留运行时语义
     */
    public static Value tryFold(OpCode op, Value a, Value b) {
        if (op == OpCode.EQUAL) return Value.bool(a.equals(b));
        if (op == OpCode.NOT_EQUAL) return Value.bool(!a.equals(b));
        if (isComparison(op)) {
            boolean comparable = (a.isNumber() && b.isNumber()) || (a.isString() && b.isString());
            return comparable ? Value.bool(compare(op, a, b)) : null;
        }
        if (!op.isBinaryArithmetic()) return null;
        if (op == OpCode.ADD && a.isString() && b.isString()) {
            return Value.string(a.asString() + b.asString());
        }
        if (!a.isNumber() || !b.isNumber()) return null;
        if ((op == OpCode.DIVIDE || op == OpCode.MODULO) && b.asNumber() == 0) return null;
        return Value.number(arithmetic(op, a.asNumber(), b.asNumber()));
    }

    /**
     * 尝试在编译期求值一元运算（NEGATE / NOT）。
     */
    public static Value tryFoldUnary(OpCode op, Value v) {
        switch (op) {
            case NEGATE:
                return v.isNumber() ? Value.number(-v.asNumber()) : null;
            case NOT:
                return Value.bool(!v.isTruthy());
            default:
                return null;
        }
    }
}
