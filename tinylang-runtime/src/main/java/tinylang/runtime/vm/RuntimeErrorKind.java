package tinylang.runtime.vm;

/**
 * 运行时错误分类
 */
public enum RuntimeErrorKind {
    UNDEFINED_VARIABLE,
    TYPE_MISMATCH,
    DIVISION_BY_ZERO,
    ARITY_MISMATCH,
    STACK_OVERFLOW,
    STACK_UNDERFLOW,
    ASSERTION_FAILED,
    /** 字节码损坏或引用了无法执行的常量（通常来自持久化文件） */
    INVALID_BYTECODE
}
