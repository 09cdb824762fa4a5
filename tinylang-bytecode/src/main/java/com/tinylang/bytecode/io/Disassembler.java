package com.tinylang.bytecode.io;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 字节块的文本反汇编。
 *
 * 输出格式：
 * <pre>
 * == script ==
 * 0000    1 CONSTANT          0 '3'
 * 0002    | POP
 * 0003    2 JUMP_IF_FALSE     4 -> 10
 * </pre>
 * 提供 {@link Heap} 时，常量池中的嵌套函数会接着反汇编。
 */
public final class Disassembler {

    /** 一条解码后的指令 */
    public static final class Instruction {
        private final int offset;
        private final int line;
        private final OpCode op;
        private final int operand;
        private final String detail;

        Instruction(int offset, int line, OpCode op, int operand, String detail) {
            this.offset = offset;
            this.line = line;
            this.op = op;
            this.operand = operand;
            this.detail = detail;
        }

        public int getOffset() { return offset; }
        public int getLine() { return line; }
        public OpCode getOp() { return op; }
        /** 无操作数时为 -1 */
        public int getOperand() { return operand; }
        /** 常量文本或跳转目标，可能为 null */
        public String getDetail() { return detail; }
    }

    private final Heap heap;

    public Disassembler() {
        this(null);
    }

    public Disassembler(Heap heap) {
        this.heap = heap;
    }

    /** 解码字节块中的全部指令 */
    public List<Instruction> decode(Chunk chunk) {
        List<Instruction> result = new ArrayList<>();
        for (int offset : chunk.instructionOffsets()) {
            result.add(decodeAt(chunk, offset));
        }
        return result;
    }

    public Instruction decodeAt(Chunk chunk, int offset) {
        OpCode op = chunk.opAt(offset);
        int line = chunk.lineAt(offset);
        switch (op.getOperandWidth()) {
            case 0:
                return new Instruction(offset, line, op, -1, null);
            case 1: {
                int operand = chunk.readByte(offset + 1);
                String detail = null;
                if (op.usesConstant()) {
                    detail = operand < chunk.constantCount()
                            ? "'" + describe(chunk.getConstant(operand)) + "'"
                            : "<bad constant>";
                }
                return new Instruction(offset, line, op, operand, detail);
            }
            default: {
                int operand = chunk.readShort(offset + 1);
                return new Instruction(offset, line, op, operand, "-> " + chunk.jumpTarget(offset));
            }
        }
    }

    /** 反汇编字节块（含嵌套函数） */
    public String disassemble(Chunk chunk, String name) {
        StringBuilder sb = new StringBuilder();
        appendChunk(sb, chunk, name);
        return sb.toString();
    }

    private void appendChunk(StringBuilder sb, Chunk chunk, String name) {
        sb.append("== ").append(name).append(" ==\n");
        int prevLine = -1;
        for (Instruction insn : decode(chunk)) {
            sb.append(String.format("%04d ", insn.getOffset()));
            if (insn.getLine() == prevLine) {
                sb.append("   | ");
            } else {
                sb.append(String.format("%4d ", insn.getLine()));
            }
            prevLine = insn.getLine();
            if (insn.getOperand() < 0) {
                sb.append(insn.getOp().name());
            } else {
                sb.append(String.format("%-16s %4d", insn.getOp().name(), insn.getOperand()));
                if (insn.getDetail() != null) {
                    sb.append(' ').append(insn.getDetail());
                }
            }
            sb.append('\n');
        }

        if (heap == null) return;
        for (Value constant : chunk.getConstants()) {
            if (constant.is(Value.Kind.FUNCTION) && constant.isHeapRef()) {
                ObjFunction fn = heap.function(constant.getHandle());
                sb.append('\n');
                appendChunk(sb, fn.getChunk(), fn.getName());
            }
        }
    }

    /** 各操作码出现次数 */
    public Map<OpCode, Integer> opcodeStatistics(Chunk chunk) {
        Map<OpCode, Integer> stats = new EnumMap<>(OpCode.class);
        for (int offset : chunk.instructionOffsets()) {
            stats.merge(chunk.opAt(offset), 1, Integer::sum);
        }
        return stats;
    }

    private String describe(Value value) {
        if (heap != null && value.isHeapRef()) {
            return heap.display(value);
        }
        return value.toString();
    }
}
