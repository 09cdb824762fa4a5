package com.tinylang.bytecode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * 函数与闭包的对象竞技场。
 *
 * 对象以整数句柄寻址；句柄在对象释放后回收复用。
 * 分配前会通知 {@link CollectionTrigger}，收集器借此决定是否先做一次回收。
 */
public final class Heap {

    /**
     * 分配钩子。在新对象进入竞技场之前调用，因此新对象不会被本次回收释放。
     */
    @FunctionalInterface
    public interface CollectionTrigger {
        void beforeAllocate(Heap heap, long bytes);
    }

    private final List<HeapObject> slots = new ArrayList<>();
    private final Deque<Integer> freeHandles = new ArrayDeque<>();
    private long bytesInUse;
    private int liveCount;
    private CollectionTrigger trigger;

    public void setCollectionTrigger(CollectionTrigger trigger) {
        this.trigger = trigger;
    }

    /**
     * 分配对象，返回句柄。
     */
    public int allocate(HeapObject object) {
        long size = object.estimateSize();
        if (trigger != null) {
            trigger.beforeAllocate(this, size);
        }
        int handle;
        if (!freeHandles.isEmpty()) {
            handle = freeHandles.pop();
            slots.set(handle, object);
        } else {
            handle = slots.size();
            slots.add(object);
        }
        object.setHandle(handle);
        object.setMarked(false);
        bytesInUse += size;
        liveCount++;
        return handle;
    }

    public Value allocateFunction(ObjFunction function) {
        return Value.function(allocate(function));
    }

    public Value allocateClosure(ObjClosure closure) {
        return Value.closure(allocate(closure));
    }

    /**
     * 解析句柄。
     *
     * @throws IllegalStateException 句柄已释放或从未分配
     */
    public HeapObject get(int handle) {
        if (handle < 0 || handle >= slots.size() || slots.get(handle) == null) {
            throw new IllegalStateException("dangling heap handle #" + handle);
        }
        return slots.get(handle);
    }

    public ObjFunction function(int handle) {
        HeapObject obj = get(handle);
        if (!(obj instanceof ObjFunction)) {
            throw new IllegalStateException("Heap handle #" + handle + " is not a function");
        }
        return (ObjFunction) obj;
    }

    public ObjClosure closure(int handle) {
        HeapObject obj = get(handle);
        if (!(obj instanceof ObjClosure)) {
            throw new IllegalStateException("Heap handle #" + handle + " is not a closure");
        }
        return (ObjClosure) obj;
    }

    /** 值所指向的函数（函数值或闭包值） */
    public ObjFunction functionOf(Value value) {
        if (value.is(Value.Kind.CLOSURE)) {
            return function(closure(value.getHandle()).getFunctionHandle());
        }
        return function(value.getHandle());
    }

    public boolean isLive(int handle) {
        return handle >= 0 && handle < slots.size() && slots.get(handle) != null;
    }

    /** 释放句柄（仅收集器调用） */
    public void free(int handle) {
        HeapObject obj = get(handle);
        slots.set(handle, null);
        freeHandles.push(handle);
        bytesInUse -= obj.estimateSize();
        liveCount--;
    }

    /** 遍历所有存活对象 */
    public void forEachLive(Consumer<HeapObject> action) {
        for (HeapObject obj : slots) {
            if (obj != null) {
                action.accept(obj);
            }
        }
    }

    /** 当前占用的估算字节数 */
    public long getBytesInUse() {
        return bytesInUse;
    }

    public int getLiveCount() {
        return liveCount;
    }

    /** 值的文本形式，函数类值解析名称 */
    public String display(Value value) {
        switch (value.getKind()) {
            case FUNCTION:
                if (!value.isHeapRef()) return "<fn ?>";
                return function(value.getHandle()).toString();
            case CLOSURE:
                return functionOf(value).toString();
            default:
                return value.toString();
        }
    }
}
