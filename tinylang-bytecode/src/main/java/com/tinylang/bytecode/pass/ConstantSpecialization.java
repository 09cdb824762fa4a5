package com.tinylang.bytecode.pass;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Value;

import java.util.List;
import java.util.Set;

/**
 * 常量特化：nil / true / false 的 CONSTANT 改为零操作数的 NIL / TRUE / FALSE。
 */
public class ConstantSpecialization extends PeepholePass {

    @Override
    public String getName() {
        return "ConstantSpecialization";
    }

    @Override
    protected boolean rewriteAt(Chunk chunk, List<Integer> offsets, int index, Set<Integer> targets) {
        int offset = offsets.get(index);
        if (chunk.opAt(offset) != OpCode.CONSTANT) return false;

        Value value = chunk.getConstant(chunk.readByte(offset + 1));
        OpCode replacement;
        switch (value.getKind()) {
            case NIL:
                replacement = OpCode.NIL;
                break;
            case BOOL:
                replacement = value.asBool() ? OpCode.TRUE : OpCode.FALSE;
                break;
            default:
                return false;
        }
        chunk.replaceInstruction(offset, replacement, 0);
        return true;
    }
}
