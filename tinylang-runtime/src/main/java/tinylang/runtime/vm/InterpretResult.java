package tinylang.runtime.vm;

/**
 * 一次 interpret 调用的结果状态
 */
public enum InterpretResult {
    OK,
    COMPILE_ERROR,
    RUNTIME_ERROR
}
