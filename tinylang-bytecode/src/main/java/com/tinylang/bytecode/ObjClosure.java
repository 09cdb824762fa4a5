package com.tinylang.bytecode;

/**
 * 闭包：函数句柄加上自己独占的捕获单元列表。
 */
public final class ObjClosure extends HeapObject {

    private final int functionHandle;
    private final UpvalueCell[] upvalues;

    public ObjClosure(int functionHandle, int upvalueCount) {
        this.functionHandle = functionHandle;
        this.upvalues = new UpvalueCell[upvalueCount];
    }

    public int getFunctionHandle() {
        return functionHandle;
    }

    public UpvalueCell[] getUpvalues() {
        return upvalues;
    }

    @Override
    public long estimateSize() {
        return 32 + upvalues.length * 24L;
    }
}
