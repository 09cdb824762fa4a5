package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.OpCode;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 跳转链折叠。
 * <ul>
 *   <li>目标是另一条无条件跳转（JUMP / LOOP）时，直接改指向链尾。</li>
 *   <li>JUMP_IF_FALSE 同样折叠，但只接受前向的最终目标。</li>
 *   <li>距离为 0 的 JUMP / LOOP 删除。</li>
 * </ul>
 * 成环的跳转链保持原样。
 */
public class JumpChainCollapsing extends PeepholePass {

    @Override
    public String getName() {
        return "JumpChainCollapsing";
    }

    @Override
    protected boolean rewriteAt(Chunk chunk, List<Integer> offsets, int index, Set<Integer> targets) {
        int offset = offsets.get(index);
        OpCode op = chunk.opAt(offset);
        if (!op.isJump()) return false;

        int target = chunk.jumpTarget(offset);
        if (op != OpCode.JUMP_IF_FALSE && target == offset + 3) {
            chunk.removeInstruction(offset);
            return true;
        }

        int finalTarget = followChain(chunk, target);
        if (finalTarget < 0 || finalTarget == target) return false;
        if (op == OpCode.JUMP_IF_FALSE && finalTarget < offset + 3) return false;

        chunk.redirectJump(offset, finalTarget);
        return true;
    }

    /**
     * 沿无条件跳转链走到第一条非跳转指令。
     *
     * @return 链尾偏移；成环时返回 -1
     */
    private static int followChain(Chunk chunk, int start) {
        Set<Integer> visited = new HashSet<>();
        int pos = start;
        while (pos < chunk.count()) {
            OpCode op = chunk.opAt(pos);
            if (op != OpCode.JUMP && op != OpCode.LOOP) break;
            if (!visited.add(pos)) return -1;
            pos = chunk.jumpTarget(pos);
        }
        return pos;
    }
}
