package com.tinylang.bytecode.io;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.ChunkLimitException;
import com.tinylang.bytecode.Value;

import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 读取 .tbc 格式的字节块。函数常量读回为 {@link Value#FUNCTION_PLACEHOLDER}。
 */
public final class BytecodeReader {

    public Chunk read(Path path) throws IOException {
        return fromBytes(Files.readAllBytes(path));
    }

    public Chunk read(InputStream in) throws IOException {
        return fromBytes(in.readAllBytes());
    }

    public Chunk fromBytes(byte[] data) throws BytecodeFormatException {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        try {
            checkHeader(buf);

            byte[] code = new byte[readCount(buf, "code", 1)];
            buf.get(code);

            int[] lines = new int[readCount(buf, "line", 4)];
            for (int i = 0; i < lines.length; i++) {
                lines[i] = buf.getInt();
            }

            int constantCount = readCount(buf, "constant", 1);
            List<Value> constants = new ArrayList<>(constantCount);
            for (int i = 0; i < constantCount; i++) {
                constants.add(readConstant(buf, i));
            }

            if (buf.hasRemaining()) {
                throw new BytecodeFormatException(buf.remaining() + " trailing bytes after constant pool");
            }
            return new Chunk(code, lines, constants);
        } catch (BufferUnderflowException e) {
            throw new BytecodeFormatException("Unexpected end of bytecode data", e);
        } catch (IllegalArgumentException | ChunkLimitException e) {
            throw new BytecodeFormatException(e.getMessage(), e);
        }
    }

    private void checkHeader(ByteBuffer buf) throws BytecodeFormatException {
        if (buf.remaining() < BytecodeFormat.MAGIC.length + 1) {
            throw new BytecodeFormatException("File too short for a TBC header");
        }
        for (byte expected : BytecodeFormat.MAGIC) {
            if (buf.get() != expected) {
                throw new BytecodeFormatException("Invalid magic number, not a TBC file");
            }
        }
        int version = buf.get() & 0xFF;
        if (version != BytecodeFormat.VERSION) {
            throw new BytecodeFormatException("Unsupported bytecode version: " + version);
        }
    }

    /** 读取计数并确认剩余数据至少能容纳 count * minSize 字节 */
    private int readCount(ByteBuffer buf, String what, int minSize) throws BytecodeFormatException {
        long count = buf.getInt() & 0xFFFFFFFFL;
        if (count * minSize > buf.remaining()) {
            throw new BytecodeFormatException("Truncated " + what + " section: declared " + count
                    + " entries, " + buf.remaining() + " bytes remain");
        }
        return (int) count;
    }

    private Value readConstant(ByteBuffer buf, int index) throws BytecodeFormatException {
        int tag = buf.get() & 0xFF;
        switch (tag) {
            case BytecodeFormat.TAG_NIL:
                return Value.NIL;
            case BytecodeFormat.TAG_BOOL:
                return Value.bool(buf.get() != 0);
            case BytecodeFormat.TAG_NUMBER:
                return Value.number(buf.getDouble());
            case BytecodeFormat.TAG_STRING:
                byte[] utf8 = new byte[readCount(buf, "string", 1)];
                buf.get(utf8);
                return Value.string(new String(utf8, StandardCharsets.UTF_8));
            case BytecodeFormat.TAG_FUNCTION:
                return Value.FUNCTION_PLACEHOLDER;
            default:
                throw new BytecodeFormatException("Unknown constant tag " + tag + " at index " + index);
        }
    }
}
