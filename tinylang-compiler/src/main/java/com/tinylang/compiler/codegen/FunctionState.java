package com.tinylang.compiler.codegen;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.UpvalueDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个函数的编译上下文，通过 enclosing 链接到词法外层函数。
 */
final class FunctionState {

    /** 每个函数最多 256 个局部槽位与 256 个 upvalue（1 字节操作数） */
    static final int MAX_LOCALS = 256;
    static final int MAX_UPVALUES = 256;

    final FunctionState enclosing;
    final String name;
    final int arity;
    final Chunk chunk = new Chunk();
    final List<Local> locals = new ArrayList<>();
    final List<UpvalueDescriptor> upvalues = new ArrayList<>();
    int scopeDepth;
    LoopContext loop;

    FunctionState(FunctionState enclosing, String name, int arity) {
        this.enclosing = enclosing;
        this.name = name;
        this.arity = arity;
    }

    /**
     * 从内向外查找局部变量。
     *
     * @return 槽位，未找到返回 -1
     */
    int resolveLocal(String name) {
        for (int i = locals.size() - 1; i >= 0; i--) {
            if (locals.get(i).name.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /** 当前作用域内是否已声明同名变量 */
    boolean declaredInCurrentScope(String name) {
        for (int i = locals.size() - 1; i >= 0; i--) {
            Local local = locals.get(i);
            if (local.depth < scopeDepth) break;
            if (local.name.equals(name)) return true;
        }
        return false;
    }

    /**
     * 登记 upvalue；同一捕获只占一个槽位。
     *
     * @return upvalue 下标，超出上限返回 -1
     */
    int addUpvalue(boolean isLocal, int index) {
        UpvalueDescriptor descriptor = new UpvalueDescriptor(isLocal, index);
        int existing = upvalues.indexOf(descriptor);
        if (existing >= 0) return existing;
        if (upvalues.size() >= MAX_UPVALUES) return -1;
        upvalues.add(descriptor);
        return upvalues.size() - 1;
    }
}
