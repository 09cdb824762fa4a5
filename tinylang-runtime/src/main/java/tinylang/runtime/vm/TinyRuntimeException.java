package tinylang.runtime.vm;

/**
 * TinyLang 运行时异常
 *
 * 由虚拟机或内置函数抛出；虚拟机捕获后补充调用帧跟踪（最内层在前）再报告。
 */
public class TinyRuntimeException extends RuntimeException {

    private final RuntimeErrorKind kind;
    private String frameTrace;

    public TinyRuntimeException(RuntimeErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TinyRuntimeException(RuntimeErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public RuntimeErrorKind getKind() {
        return kind;
    }

    public String getFrameTrace() {
        return frameTrace;
    }

    void setFrameTrace(String trace) {
        if (trace != null && this.frameTrace == null) {
            this.frameTrace = trace;
        }
    }

    /** 返回不含调用帧跟踪的纯错误消息 */
    public String getRawMessage() {
        return super.getMessage();
    }

    /**
     * 输出格式:
     * Division by zero.
     * [line 3] in divide()
     * [line 7] in script
     */
    @Override
    public String getMessage() {
        if (frameTrace == null || frameTrace.isEmpty()) {
            return super.getMessage();
        }
        return super.getMessage() + "\n" + frameTrace;
    }
}
