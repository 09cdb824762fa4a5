package com.tinylang.bytecode;

/**
 * 编译期捕获描述：被捕获变量位于直接外层函数的局部槽（local = true），
 * 或位于外层函数自己的 upvalue 列表。
 */
public final class UpvalueDescriptor {

    private final boolean local;
    private final int index;

    public UpvalueDescriptor(boolean local, int index) {
        this.local = local;
        this.index = index;
    }

    public boolean isLocal() {
        return local;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UpvalueDescriptor)) return false;
        UpvalueDescriptor that = (UpvalueDescriptor) o;
        return local == that.local && index == that.index;
    }

    @Override
    public int hashCode() {
        return (local ? 1 : 0) * 31 + index;
    }

    @Override
    public String toString() {
        return (local ? "local " : "upvalue ") + index;
    }
}
