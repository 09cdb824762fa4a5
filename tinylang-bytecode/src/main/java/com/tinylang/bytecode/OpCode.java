package com.tinylang.bytecode;

/**
 * TinyLang 字节码操作码。
 *
 * 每个操作码的操作数宽度固定（0、1 或 2 字节），由操作码本身唯一决定。
 * 2 字节操作数为小端序，跳转偏移相对于操作数之后的下一条指令。
 */
public enum OpCode {
    // 常量 / 栈
    CONSTANT(0x00, 1),       // push constants[idx]
    NIL(0x01, 0),
    TRUE(0x02, 0),
    FALSE(0x03, 0),
    POP(0x04, 0),
    POPN(0x05, 1),           // pop n

    // 变量
    GET_LOCAL(0x06, 1),
    SET_LOCAL(0x07, 1),
    DEFINE_GLOBAL(0x08, 1),  // 操作数为名称常量
    GET_GLOBAL(0x09, 1),
    SET_GLOBAL(0x0A, 1),
    GET_UPVALUE(0x0B, 1),
    SET_UPVALUE(0x0C, 1),
    CLOSE_UPVALUE(0x0D, 0),

    // 算术
    ADD(0x0E, 0),
    SUBTRACT(0x0F, 0),
    MULTIPLY(0x10, 0),
    DIVIDE(0x11, 0),
    MODULO(0x12, 0),
    NEGATE(0x13, 0),
    NOT(0x14, 0),

    // 比较
    EQUAL(0x15, 0),
    NOT_EQUAL(0x16, 0),
    LESS(0x17, 0),
    LESS_EQUAL(0x18, 0),
    GREATER(0x19, 0),
    GREATER_EQUAL(0x1A, 0),

    // 控制流
    JUMP(0x1B, 2),           // ip += offset
    JUMP_IF_FALSE(0x1C, 2),  // 栈顶为假则 ip += offset（不弹出）
    LOOP(0x1D, 2),           // ip -= offset

    // 函数
    CALL(0x1E, 1),           // argc
    CLOSURE(0x1F, 1),        // 函数常量索引
    RETURN(0x20, 0);

    private static final OpCode[] BY_CODE = new OpCode[256];

    static {
        for (OpCode op : values()) {
            BY_CODE[op.code] = op;
        }
    }

    private final int code;
    private final int operandWidth;

    OpCode(int code, int operandWidth) {
        this.code = code;
        this.operandWidth = operandWidth;
    }

    public byte getCode() {
        return (byte) code;
    }

    public int getOperandWidth() {
        return operandWidth;
    }

    /** 指令总长度（操作码 + 操作数） */
    public int getLength() {
        return 1 + operandWidth;
    }

    public boolean isJump() {
        return this == JUMP || this == JUMP_IF_FALSE || this == LOOP;
    }

    /** 操作数是否为常量池索引 */
    public boolean usesConstant() {
        switch (this) {
            case CONSTANT:
            case DEFINE_GLOBAL:
            case GET_GLOBAL:
            case SET_GLOBAL:
            case CLOSURE:
                return true;
            default:
                return false;
        }
    }

    public boolean isBinaryArithmetic() {
        switch (this) {
            case ADD:
            case SUBTRACT:
            case MULTIPLY:
            case DIVIDE:
            case MODULO:
                return true;
            default:
                return false;
        }
    }

    /**
     * 按字节码查找操作码。
     *
     * @return 对应操作码，未知字节返回 null
     */
    public static OpCode fromByte(byte b) {
        return BY_CODE[b & 0xFF];
    }
}
