package com.tinylang.bytecode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * 字节块：指令字节流、常量池与逐字节行号表。
 *
 * 常量池只追加，索引一经分配不再变化；行号表与指令字节一一对应。
 * 所有结构性编辑（删除/插入/替换指令）都经由 {@link #splice}，
 * 它会重新计算并回填编辑区两侧所有跳转的偏移。
 */
public final class Chunk {

    /** 常量池容量（1 字节操作数） */
    public static final int MAX_CONSTANTS = 256;

    /** 跳转距离上限（2 字节操作数） */
    public static final int MAX_JUMP = 0xFFFF;

    private byte[] code;
    private int[] lines;
    private int count;
    private final List<Value> constants;

    public Chunk() {
        this.code = new byte[16];
        this.lines = new int[16];
        this.count = 0;
        this.constants = new ArrayList<>();
    }

    /**
     * 由已有数据构造（字节码读取器使用）。
     */
    public Chunk(byte[] code, int[] lines, List<Value> constants) {
        if (code.length != lines.length) {
            throw new IllegalArgumentException(
                    "Line table size " + lines.length + " does not match code size " + code.length);
        }
        if (constants.size() > MAX_CONSTANTS) {
            throw new ChunkLimitException("Too many constants in one chunk: " + constants.size());
        }
        this.code = Arrays.copyOf(code, Math.max(16, code.length));
        this.lines = Arrays.copyOf(lines, Math.max(16, lines.length));
        this.count = code.length;
        this.constants = new ArrayList<>(constants);
    }

    // ============ 追加 ============

    public void write(byte b, int line) {
        ensureCapacity(count + 1);
        code[count] = b;
        lines[count] = line;
        count++;
    }

    public void writeOp(OpCode op, int line) {
        if (op.getOperandWidth() != 0) {
            throw new IllegalArgumentException(op + " takes an operand");
        }
        write(op.getCode(), line);
    }

    /** 追加带 1 字节操作数的指令 */
    public void writeOp(OpCode op, int operand, int line) {
        if (op.getOperandWidth() != 1) {
            throw new IllegalArgumentException(op + " does not take a 1-byte operand");
        }
        if (operand < 0 || operand > 0xFF) {
            throw new IllegalArgumentException("Operand out of range for " + op + ": " + operand);
        }
        write(op.getCode(), line);
        write((byte) operand, line);
    }

    /** 追加带 2 字节小端操作数的指令 */
    public void writeShortOp(OpCode op, int operand, int line) {
        if (op.getOperandWidth() != 2) {
            throw new IllegalArgumentException(op + " does not take a 2-byte operand");
        }
        checkJumpDistance(operand);
        write(op.getCode(), line);
        write((byte) (operand & 0xFF), line);
        write((byte) ((operand >> 8) & 0xFF), line);
    }

    /**
     * 追加一条前向跳转，操作数留空待回填。
     *
     * @return 操作数所在偏移，交给 {@link #patchJump(int)}
     */
    public int writeJump(OpCode op, int line) {
        if (op != OpCode.JUMP && op != OpCode.JUMP_IF_FALSE) {
            throw new IllegalArgumentException("Not a forward jump: " + op);
        }
        write(op.getCode(), line);
        write((byte) 0xFF, line);
        write((byte) 0xFF, line);
        return count - 2;
    }

    /** 回填前向跳转，使其落在当前末尾 */
    public void patchJump(int operandOffset) {
        patchShort(operandOffset, count - (operandOffset + 2));
    }

    /** 追加一条回跳到 loopStart 的 LOOP 指令 */
    public void writeLoop(int loopStart, int line) {
        int distance = count + 3 - loopStart;
        writeShortOp(OpCode.LOOP, distance, line);
    }

    /**
     * 追加常量。
     *
     * @return 常量索引
     * @throws ChunkLimitException 常量池已满
     */
    public int addConstant(Value value) {
        if (constants.size() >= MAX_CONSTANTS) {
            throw new ChunkLimitException("Too many constants in one chunk.");
        }
        constants.add(value);
        return constants.size() - 1;
    }

    /** 查找按位相同的常量，未找到返回 -1 */
    public int findConstant(Value value) {
        for (int i = 0; i < constants.size(); i++) {
            if (Value.sameConstant(constants.get(i), value)) {
                return i;
            }
        }
        return -1;
    }

    /** 复用已有常量，否则追加 */
    public int internConstant(Value value) {
        int idx = findConstant(value);
        return idx >= 0 ? idx : addConstant(value);
    }

    // ============ 读取 ============

    public int count() {
        return count;
    }

    public byte byteAt(int offset) {
        checkOffset(offset, 1);
        return code[offset];
    }

    public int readByte(int offset) {
        return byteAt(offset) & 0xFF;
    }

    public int readShort(int offset) {
        checkOffset(offset, 2);
        return (code[offset] & 0xFF) | ((code[offset + 1] & 0xFF) << 8);
    }

    public void patchShort(int offset, int value) {
        checkOffset(offset, 2);
        checkJumpDistance(value);
        code[offset] = (byte) (value & 0xFF);
        code[offset + 1] = (byte) ((value >> 8) & 0xFF);
    }

    public int lineAt(int offset) {
        checkOffset(offset, 1);
        return lines[offset];
    }

    /**
     * 解码指定偏移的操作码。
     *
     * @throws IllegalStateException 未知字节
     */
    public OpCode opAt(int offset) {
        OpCode op = OpCode.fromByte(byteAt(offset));
        if (op == null) {
            throw new IllegalStateException(
                    String.format("Unknown opcode 0x%02x at offset %d", code[offset] & 0xFF, offset));
        }
        return op;
    }

    /** 下一条指令的偏移 */
    public int nextOffset(int offset) {
        return offset + opAt(offset).getLength();
    }

    /** 所有指令的起始偏移（按顺序） */
    public List<Integer> instructionOffsets() {
        List<Integer> offsets = new ArrayList<>();
        int offset = 0;
        while (offset < count) {
            offsets.add(offset);
            offset = nextOffset(offset);
        }
        return offsets;
    }

    /** 跳转指令的绝对目标 */
    public int jumpTarget(int offset) {
        OpCode op = opAt(offset);
        int distance = readShort(offset + 1);
        switch (op) {
            case JUMP:
            case JUMP_IF_FALSE:
                return offset + 3 + distance;
            case LOOP:
                return offset + 3 - distance;
            default:
                throw new IllegalArgumentException("Not a jump at offset " + offset + ": " + op);
        }
    }

    /** 所有跳转目标的集合 */
    public TreeSet<Integer> jumpTargets() {
        TreeSet<Integer> targets = new TreeSet<>();
        for (int offset : instructionOffsets()) {
            if (opAt(offset).isJump()) {
                targets.add(jumpTarget(offset));
            }
        }
        return targets;
    }

    public boolean isJumpTarget(int offset) {
        return jumpTargets().contains(offset);
    }

    public List<Value> getConstants() {
        return Collections.unmodifiableList(constants);
    }

    public Value getConstant(int index) {
        return constants.get(index);
    }

    public int constantCount() {
        return constants.size();
    }

    /** 指令字节副本 */
    public byte[] getCode() {
        return Arrays.copyOf(code, count);
    }

    /** 行号表副本 */
    public int[] getLines() {
        return Arrays.copyOf(lines, count);
    }

    public Chunk copy() {
        return new Chunk(getCode(), getLines(), constants);
    }

    // ============ 结构性编辑 ============

    /**
     * 删除一条指令。指向它的跳转改为指向其后继指令。
     */
    public void removeInstruction(int offset) {
        splice(offset, opAt(offset).getLength(), new byte[0], 0);
    }

    /**
     * 在 offset 处插入一条指令。原先指向 offset 的跳转落在新指令上。
     */
    public void insertInstruction(int offset, OpCode op, int operand, int line) {
        if (offset != count) {
            opAt(offset);
        }
        splice(offset, 0, encode(op, operand), line);
    }

    /**
     * 将 offset 处的指令替换为另一条（长度可以不同）。
     */
    public void replaceInstruction(int offset, OpCode op, int operand) {
        int line = lineAt(offset);
        splice(offset, opAt(offset).getLength(), encode(op, operand), line);
    }

    /**
     * 将 offset 处的跳转改指向 target。JUMP 与 LOOP 按方向互换，
     * JUMP_IF_FALSE 只能前跳。
     */
    public void redirectJump(int offset, int target) {
        OpCode op = opAt(offset);
        if (!op.isJump()) {
            throw new IllegalArgumentException("Not a jump at offset " + offset + ": " + op);
        }
        int end = offset + 3;
        if (target >= end) {
            OpCode forward = op == OpCode.LOOP ? OpCode.JUMP : op;
            code[offset] = forward.getCode();
            patchShort(offset + 1, target - end);
        } else {
            if (op == OpCode.JUMP_IF_FALSE) {
                throw new IllegalArgumentException("JUMP_IF_FALSE cannot jump backward");
            }
            code[offset] = OpCode.LOOP.getCode();
            patchShort(offset + 1, end - target);
        }
    }

    /**
     * 用 insert 替换 [offset, offset + removeLen) 的字节，并重定位所有跳转。
     *
     * 区外跳转的目标映射：目标在区前不变；目标等于 offset 或落在被删区间内
     * 映射到 offset；目标在区后按长度差平移。源指令位于被删区间内的跳转随之消失，
     * insert 中的字节原样写入。
     */
    public void splice(int offset, int removeLen, byte[] insert, int line) {
        if (offset < 0 || removeLen < 0 || offset + removeLen > count) {
            throw new IndexOutOfBoundsException(
                    "Splice [" + offset + ", " + (offset + removeLen) + ") outside chunk of " + count + " bytes");
        }
        int removeEnd = offset + removeLen;
        int delta = insert.length - removeLen;

        // 编辑前记录所有区外跳转及其旧目标
        List<int[]> jumps = new ArrayList<>();
        for (int pos : instructionOffsets()) {
            if (pos >= offset && pos < removeEnd) continue;
            if (opAt(pos).isJump()) {
                jumps.add(new int[]{pos, jumpTarget(pos)});
            }
        }

        byte[] newCode = new byte[Math.max(16, count + delta)];
        int[] newLines = new int[newCode.length];
        System.arraycopy(code, 0, newCode, 0, offset);
        System.arraycopy(lines, 0, newLines, 0, offset);
        System.arraycopy(insert, 0, newCode, offset, insert.length);
        Arrays.fill(newLines, offset, offset + insert.length, line);
        System.arraycopy(code, removeEnd, newCode, offset + insert.length, count - removeEnd);
        System.arraycopy(lines, removeEnd, newLines, offset + insert.length, count - removeEnd);

        this.code = newCode;
        this.lines = newLines;
        this.count += delta;

        for (int[] jump : jumps) {
            int source = jump[0] < offset ? jump[0] : jump[0] + delta;
            int target = relocate(jump[1], offset, removeEnd, delta);
            redirectJump(source, target);
        }
    }

    private static int relocate(int pos, int offset, int removeEnd, int delta) {
        if (pos <= offset) return pos;
        if (pos < removeEnd) return offset;
        return pos + delta;
    }

    private static byte[] encode(OpCode op, int operand) {
        switch (op.getOperandWidth()) {
            case 0:
                return new byte[]{op.getCode()};
            case 1:
                if (operand < 0 || operand > 0xFF) {
                    throw new IllegalArgumentException("Operand out of range for " + op + ": " + operand);
                }
                return new byte[]{op.getCode(), (byte) operand};
            default:
                checkJumpDistance(operand);
                return new byte[]{op.getCode(), (byte) (operand & 0xFF), (byte) ((operand >> 8) & 0xFF)};
        }
    }

    // ============ 校验 ============

    /**
     * 校验结构不变量：操作码合法且操作数完整、跳转目标落在指令起始处、
     * 常量操作数在池范围内。
     *
     * @throws IllegalStateException 发现违例
     */
    public void verify() {
        TreeSet<Integer> starts = new TreeSet<>();
        int offset = 0;
        while (offset < count) {
            OpCode op = OpCode.fromByte(code[offset]);
            if (op == null) {
                throw new IllegalStateException(
                        String.format("Unknown opcode 0x%02x at offset %d", code[offset] & 0xFF, offset));
            }
            if (offset + op.getLength() > count) {
                throw new IllegalStateException("Truncated operand for " + op + " at offset " + offset);
            }
            if (op.usesConstant() && readByte(offset + 1) >= constants.size()) {
                throw new IllegalStateException("Constant index " + readByte(offset + 1)
                        + " out of range at offset " + offset + " (pool size " + constants.size() + ")");
            }
            starts.add(offset);
            offset += op.getLength();
        }
        starts.add(count);
        for (int pos : starts) {
            if (pos == count || !opAt(pos).isJump()) continue;
            int target = jumpTarget(pos);
            if (!starts.contains(target)) {
                throw new IllegalStateException("Jump at offset " + pos + " lands on " + target
                        + ", which is not an instruction boundary");
            }
        }
    }

    // ============ 内部 ============

    private void ensureCapacity(int needed) {
        if (needed > code.length) {
            int newCap = Math.max(needed, code.length * 2);
            code = Arrays.copyOf(code, newCap);
            lines = Arrays.copyOf(lines, newCap);
        }
    }

    private void checkOffset(int offset, int width) {
        if (offset < 0 || offset + width > count) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside chunk of " + count + " bytes");
        }
    }

    private static void checkJumpDistance(int distance) {
        if (distance < 0 || distance > MAX_JUMP) {
            throw new ChunkLimitException("Too much code to jump over.");
        }
    }
}
