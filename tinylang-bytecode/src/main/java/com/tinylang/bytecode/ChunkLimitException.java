package com.tinylang.bytecode;

/**
 * 字节块超出编码宽度限制（常量池 256 项、跳转距离 65535 字节）。
 */
public class ChunkLimitException extends RuntimeException {

    public ChunkLimitException(String message) {
        super(message);
    }
}
