package com.tinylang.bytecode.io;

import java.io.IOException;

/**
 * .tbc 数据不合法：魔数错误、版本不支持、数据截断或未知常量标签。
 */
public class BytecodeFormatException extends IOException {

    public BytecodeFormatException(String message) {
        super(message);
    }

    public BytecodeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
