package com.tinylang.bytecode;

import java.util.Collections;
import java.util.List;

/**
 * 编译后的函数：名称、参数个数、字节块与捕获描述。
 *
 * 编译完成后不再修改（优化器只在执行前改写字节块）。
 */
public final class ObjFunction extends HeapObject {

    /** 顶层脚本的函数名 */
    public static final String SCRIPT_NAME = "script";

    private final String name;
    private final int arity;
    private final Chunk chunk;
    private final List<UpvalueDescriptor> upvalues;

    public ObjFunction(String name, int arity, Chunk chunk, List<UpvalueDescriptor> upvalues) {
        this.name = name;
        this.arity = arity;
        this.chunk = chunk;
        this.upvalues = Collections.unmodifiableList(upvalues);
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public List<UpvalueDescriptor> getUpvalues() {
        return upvalues;
    }

    public int getUpvalueCount() {
        return upvalues.size();
    }

    public boolean isScript() {
        return SCRIPT_NAME.equals(name);
    }

    @Override
    public long estimateSize() {
        return 64 + chunk.count() * 5L + chunk.constantCount() * 16L + upvalues.size() * 8L;
    }

    @Override
    public String toString() {
        return isScript() ? "<script>" : "<fn " + name + ">";
    }
}
