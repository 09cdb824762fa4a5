package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;

import java.util.List;
import java.util.Set;

/**
 * 窥孔 pass 基类：逐条指令尝试匹配，每次成功改写后重新扫描，
 * 直到整块没有可匹配的窗口。
 */
public abstract class PeepholePass implements ChunkPass {

    @Override
    public final int run(Chunk chunk) {
        int rewrites = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            List<Integer> offsets = chunk.instructionOffsets();
            Set<Integer> targets = chunk.jumpTargets();
            for (int i = 0; i < offsets.size(); i++) {
                if (rewriteAt(chunk, offsets, i, targets)) {
                    rewrites++;
                    changed = true;
                    break;
                }
            }
        }
        return rewrites;
    }

    /**
     * 尝试在第 index 条指令处改写。
     *
     * @param offsets 改写前的指令偏移
     * @param targets 改写前的跳转目标
     * @return 是否改写了字节块
     */
    protected abstract boolean rewriteAt(Chunk chunk, List<Integer> offsets, int index, Set<Integer> targets);

    /**
     * 窗口 [from, to] 的内部指令（不含首条）是否有跳转落入。
     * 有则不能把窗口合并成一条指令。
     */
    protected static boolean hasInteriorTarget(List<Integer> offsets, int from, int to, Set<Integer> targets) {
        for (int i = from + 1; i <= to; i++) {
            if (targets.contains(offsets.get(i))) {
                return true;
            }
        }
        return false;
    }

    /** 第 index 条指令起算的窗口是否还有 width 条指令 */
    protected static boolean hasWindow(List<Integer> offsets, int index, int width) {
        return index + width <= offsets.size();
    }
}
