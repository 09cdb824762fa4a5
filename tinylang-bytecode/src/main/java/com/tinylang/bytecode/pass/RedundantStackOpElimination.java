package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.OpCode;

import java.util.List;
import java.util.Set;

/**
 * 冗余栈操作消除。
 * <ul>
 *   <li>无副作用的压栈紧跟 POP：两条一起删除。</li>
 *   <li>POP / POPN 相邻：合并为一条 POPN n（n 不超过 255）。</li>
 *   <li>SET_x a; POP; GET_x a：值本就留在栈顶，只保留 SET_x a。</li>
 * </ul>
 */
public class RedundantStackOpElimination extends PeepholePass {

    @Override
    public String getName() {
        return "RedundantStackOpElimination";
    }

    @Override
    protected boolean rewriteAt(Chunk chunk, List<Integer> offsets, int index, Set<Integer> targets) {
        if (!hasWindow(offsets, index, 2) || hasInteriorTarget(offsets, index, index + 1, targets)) {
            return false;
        }
        int first = offsets.get(index);
        int second = offsets.get(index + 1);
        OpCode a = chunk.opAt(first);
        OpCode b = chunk.opAt(second);

        if (isPurePush(a) && b == OpCode.POP) {
            chunk.removeInstruction(second);
            chunk.removeInstruction(first);
            return true;
        }

        if (isPop(a) && isPop(b)) {
            int total = popCount(chunk, first) + popCount(chunk, second);
            if (total > 0xFF) return false;
            chunk.removeInstruction(second);
            chunk.replaceInstruction(first, OpCode.POPN, total);
            return true;
        }

        if (hasWindow(offsets, index, 3) && b == OpCode.POP
                && !hasInteriorTarget(offsets, index, index + 2, targets)) {
            int third = offsets.get(index + 2);
            OpCode c = chunk.opAt(third);
            if (getterOf(a) == c && chunk.readByte(first + 1) == chunk.readByte(third + 1)) {
                chunk.removeInstruction(third);
                chunk.removeInstruction(second);
                return true;
            }
        }
        return false;
    }

    /** 压入一个值且不会失败、不产生副作用 */
    private static boolean isPurePush(OpCode op) {
        switch (op) {
            case CONSTANT:
            case NIL:
            case TRUE:
            case FALSE:
            case GET_LOCAL:
            case GET_UPVALUE:
                return true;
            default:
                return false;
        }
    }

    private static boolean isPop(OpCode op) {
        return op == OpCode.POP || op == OpCode.POPN;
    }

    private static int popCount(Chunk chunk, int offset) {
        return chunk.opAt(offset) == OpCode.POP ? 1 : chunk.readByte(offset + 1);
    }

    private static OpCode getterOf(OpCode setter) {
        switch (setter) {
            case SET_LOCAL: return OpCode.GET_LOCAL;
            case SET_UPVALUE: return OpCode.GET_UPVALUE;
            case SET_GLOBAL: return OpCode.GET_GLOBAL;
            default: return null;
        }
    }
}
