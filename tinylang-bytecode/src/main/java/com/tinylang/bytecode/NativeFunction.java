package com.tinylang.bytecode;

/**
 * 宿主实现的内置函数。
 *
 * 内置函数在调用方的栈帧中同步执行，不压入新帧。
 */
public final class NativeFunction {

    /** 可变参数 */
    public static final int VARIADIC = -1;

    @FunctionalInterface
    public interface Body {
        Value call(Value[] args);
    }

    private final String name;
    private final int arity;
    private final Body body;

    public NativeFunction(String name, int arity, Body body) {
        this.name = name;
        this.arity = arity;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public boolean isVariadic() {
        return arity == VARIADIC;
    }

    public Value call(Value[] args) {
        return body.call(args);
    }

    @Override
    public String toString() {
        return "<native fn " + name + ">";
    }
}
