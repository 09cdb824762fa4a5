package com.tinylang.bytecode.io;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.Value;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 将字节块序列化为 .tbc 格式。
 *
 * 只保存当前字节块本身；函数常量写成无负载的占位标签。
 */
public final class BytecodeWriter {

    public byte[] toBytes(Chunk chunk) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            write(chunk, out);
        } catch (IOException e) {
            // ByteArrayOutputStream 不会抛出 IOException
            throw new IllegalStateException(e);
        }
        return out.toByteArray();
    }

    public void write(Chunk chunk, Path path) throws IOException {
        Files.write(path, toBytes(chunk));
    }

    public void write(Chunk chunk, OutputStream out) throws IOException {
        out.write(BytecodeFormat.MAGIC);
        out.write(BytecodeFormat.VERSION);

        byte[] code = chunk.getCode();
        writeU32(out, code.length);
        out.write(code);

        int[] lines = chunk.getLines();
        writeU32(out, lines.length);
        ByteBuffer lineBuf = ByteBuffer.allocate(lines.length * 4).order(ByteOrder.LITTLE_ENDIAN);
        for (int line : lines) {
            lineBuf.putInt(line);
        }
        out.write(lineBuf.array());

        writeU32(out, chunk.constantCount());
        for (Value constant : chunk.getConstants()) {
            writeConstant(out, constant);
        }
    }

    private void writeConstant(OutputStream out, Value value) throws IOException {
        switch (value.getKind()) {
            case NIL:
                out.write(BytecodeFormat.TAG_NIL);
                break;
            case BOOL:
                out.write(BytecodeFormat.TAG_BOOL);
                out.write(value.asBool() ? 1 : 0);
                break;
            case NUMBER:
                out.write(BytecodeFormat.TAG_NUMBER);
                out.write(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN)
                        .putDouble(value.asNumber()).array());
                break;
            case STRING:
                byte[] utf8 = value.asString().getBytes(StandardCharsets.UTF_8);
                out.write(BytecodeFormat.TAG_STRING);
                writeU32(out, utf8.length);
                out.write(utf8);
                break;
            case FUNCTION:
                out.write(BytecodeFormat.TAG_FUNCTION);
                break;
            default:
                throw new IllegalArgumentException("Cannot serialize constant of type " + value.typeName());
        }
    }

    private static void writeU32(OutputStream out, int value) throws IOException {
        out.write(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array());
    }
}
