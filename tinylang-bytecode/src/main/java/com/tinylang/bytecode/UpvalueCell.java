package com.tinylang.bytecode;

/**
 * 运行时被捕获变量的存储单元。
 *
 * 打开状态下指向操作数栈上的槽位；变量离开作用域时关闭，
 * 值搬入单元自身。同一变量的所有闭包共享同一个单元，因此写入彼此可见。
 */
public final class UpvalueCell {

    private int slot;
    private boolean open;
    private Value closed = Value.NIL;

    /** 按槽位降序排列的打开单元链表 */
    private UpvalueCell next;

    public UpvalueCell(int slot) {
        this.slot = slot;
        this.open = true;
    }

    public int getSlot() {
        return slot;
    }

    public boolean isOpen() {
        return open;
    }

    public Value getClosed() {
        return closed;
    }

    public void setClosed(Value value) {
        this.closed = value;
    }

    /** 关闭单元，value 为槽位上的最终值 */
    public void close(Value value) {
        this.closed = value;
        this.open = false;
        this.slot = -1;
    }

    public UpvalueCell getNext() {
        return next;
    }

    public void setNext(UpvalueCell next) {
        this.next = next;
    }
}
