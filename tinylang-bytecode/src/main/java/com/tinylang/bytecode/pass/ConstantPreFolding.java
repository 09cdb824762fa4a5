package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Operators;
import com.tinylang.bytecode.Value;

import java.util.List;
import java.util.Set;

/**
 * 常量预折叠。
 * <ul>
 *   <li>CONSTANT a; CONSTANT b; 算术运算 → CONSTANT (a op b)</li>
 *   <li>CONSTANT a; NEGATE → CONSTANT -a</li>
 * </ul>
 * 除数或模数为零、类型不匹配时不折叠；常量池已满且没有可复用的项时也不折叠。
 */
public class ConstantPreFolding extends PeepholePass {

    @Override
    public String getName() {
        return "ConstantPreFolding";
    }

    @Override
    protected boolean rewriteAt(Chunk chunk, List<Integer> offsets, int index, Set<Integer> targets) {
        int first = offsets.get(index);
        if (chunk.opAt(first) != OpCode.CONSTANT || !hasWindow(offsets, index, 2)) {
            return false;
        }
        Value left = chunk.getConstant(chunk.readByte(first + 1));
        int second = offsets.get(index + 1);
        OpCode next = chunk.opAt(second);

        if (next == OpCode.NEGATE) {
            if (hasInteriorTarget(offsets, index, index + 1, targets)) return false;
            Value folded = Operators.tryFoldUnary(OpCode.NEGATE, left);
            return folded != null && replaceWindow(chunk, first, folded, second);
        }

        if (next != OpCode.CONSTANT || !hasWindow(offsets, index, 3)) {
            return false;
        }
        int third = offsets.get(index + 2);
        OpCode op = chunk.opAt(third);
        if (!op.isBinaryArithmetic() || hasInteriorTarget(offsets, index, index + 2, targets)) {
            return false;
        }
        Value right = chunk.getConstant(chunk.readByte(second + 1));
        Value folded = Operators.tryFold(op, left, right);
        return folded != null && replaceWindow(chunk, first, folded, third, second);
    }

    /** 将首条 CONSTANT 改为 folded，并按从后往前的顺序删除其余指令 */
    private static boolean replaceWindow(Chunk chunk, int first, Value folded, int... removeDescending) {
        int idx = chunk.findConstant(folded);
        if (idx < 0) {
            if (chunk.constantCount() >= Chunk.MAX_CONSTANTS) return false;
            idx = chunk.addConstant(folded);
        }
        for (int offset : removeDescending) {
            chunk.removeInstruction(offset);
        }
        chunk.replaceInstruction(first, OpCode.CONSTANT, idx);
        return true;
    }
}
