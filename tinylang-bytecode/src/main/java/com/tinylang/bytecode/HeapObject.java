package com.tinylang.bytecode;

/**
 * 堆对象基类：函数与闭包。
 */
public abstract class HeapObject {

    private int handle = -1;
    private boolean marked;

    public int getHandle() {
        return handle;
    }

    void setHandle(int handle) {
        this.handle = handle;
    }

    public boolean isMarked() {
        return marked;
    }

    public void setMarked(boolean marked) {
        this.marked = marked;
    }

    /** 用于收集阈值统计的估算字节数 */
    public abstract long estimateSize();
}
