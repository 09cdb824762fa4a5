package tinylang.runtime.vm;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.ObjClosure;
import com.tinylang.bytecode.ObjFunction;

/**
 * 调用帧：活动闭包、指令指针，以及该调用局部槽位在共享操作数栈上的起点。
 * 槽位 base 存放第一个实参，base - 1 为被调用者本身（顶层脚本除外）。
 */
final class CallFrame {
    final ObjClosure closure;
    final ObjFunction function;
    final Chunk chunk;
    final int base;
    int ip;

    CallFrame(ObjClosure closure, ObjFunction function, int base) {
        this.closure = closure;
        this.function = function;
        this.chunk = function.getChunk();
        this.base = base;
    }

    /** 正在执行（或刚执行过）的指令所在源码行 */
    int currentLine() {
        if (chunk.count() == 0) return 0;
        int offset = Math.max(0, Math.min(ip - 1, chunk.count() - 1));
        return chunk.lineAt(offset);
    }

    String describe() {
        String where = function.isScript() ? "script" : function.getName() + "()";
        return "[line " + currentLine() + "] in " + where;
    }
}
