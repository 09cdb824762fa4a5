package com.tinylang.bytecode.io;

/**
 * .tbc 文件格式常量。
 *
 * <pre>
 * "TBC" | version:u8 | codeLen:u32 code[codeLen] | lineLen:u32 line:i32[lineLen]
 *       | constCount:u32 (tag:u8 payload)[constCount]
 * </pre>
 * 所有多字节整数与浮点数均为小端序。
 */
public final class BytecodeFormat {

    public static final byte[] MAGIC = {'T', 'B', 'C'};
    public static final int VERSION = 1;
    public static final String FILE_EXTENSION = ".tbc";

    public static final int TAG_NIL = 0;
    public static final int TAG_BOOL = 1;
    public static final int TAG_NUMBER = 2;
    public static final int TAG_STRING = 3;
    public static final int TAG_FUNCTION = 4;

    private BytecodeFormat() {
    }
}
