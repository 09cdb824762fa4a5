package tinylang.runtime.vm;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.NativeFunction;
import com.tinylang.bytecode.ObjClosure;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Operators;
import com.tinylang.bytecode.UpvalueCell;
import com.tinylang.bytecode.UpvalueDescriptor;
import com.tinylang.bytecode.Value;
import com.tinylang.bytecode.io.BytecodeFormat;
import com.tinylang.bytecode.io.BytecodeReader;
import com.tinylang.bytecode.pass.PeepholeOptimizer;
import com.tinylang.compiler.CompileResult;
import com.tinylang.compiler.TinyCompiler;
import com.tinylang.compiler.codegen.CompilerOptions;
import tinylang.runtime.builtin.Builtins;
import tinylang.runtime.gc.GarbageCollector;
import tinylang.runtime.gc.RootSet;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TinyLang 栈式虚拟机
 *
 * 每个实例独占自己的操作数栈、调用帧栈、全局表和堆，多个实例可在同一进程中并存。
 * 全局表在多次 interpret 调用之间保留（REPL 依赖这一点），栈和帧在每次调用开始时重置。
 */
public class VirtualMachine implements RootSet {

    private static final Logger LOG = Logger.getLogger(VirtualMachine.class.getName());

    private final VmConfig config;
    private final Heap heap = new Heap();
    private final GarbageCollector gc;
    private final TinyCompiler compiler;
    private final PeepholeOptimizer optimizer = PeepholeOptimizer.createDefault();

    private Value[] stack;
    private int sp;
    private final CallFrame[] frames;
    private int frameCount;
    private UpvalueCell openUpvalues;

    /** 按定义顺序保存，快照输出稳定 */
    private final Map<String, Value> globals = new LinkedHashMap<>();

    private PrintStream stdout = System.out;
    private PrintStream stderr = System.err;

    private final long startNanos = System.nanoTime();
    private long instructionCount;
    private InterpretResult lastResult;
    private TinyRuntimeException lastError;
    private Value lastValue = Value.NIL;

    public VirtualMachine() {
        this(VmConfig.defaults());
    }

    public VirtualMachine(VmConfig config) {
        this.config = config;
        this.stack = new Value[config.getInitialStackCapacity()];
        this.frames = new CallFrame[config.getMaxFrames()];
        this.gc = new GarbageCollector(heap, this, config.getGcInitialThreshold(),
                config.getGcGrowFactor(), config.isStressGc());
        this.compiler = new TinyCompiler(heap,
                CompilerOptions.defaults().setFoldConstants(config.isFoldConstants()));
        Builtins.register(this);
        LOG.fine(() -> "VM created: maxFrames=" + config.getMaxFrames()
                + ", stressGc=" + config.isStressGc() + ", optimize=" + config.isOptimize());
    }

    // ============ 入口 ============

    public InterpretResult interpret(String source) {
        return interpret(source, TinyCompiler.DEFAULT_FILE_NAME);
    }

    /**
     * 编译并执行源码。编译错误与运行时错误都输出到 stderr。
     */
    public InterpretResult interpret(String source, String fileName) {
        resetStacks();
        lastError = null;
        lastValue = Value.NIL;

        CompileResult result;
        gc.pause();
        try {
            result = compiler.compile(source, fileName);
        } finally {
            gc.resume();
        }
        if (!result.isSuccess()) {
            result.getReporter().printTo(stderr);
            return finish(InterpretResult.COMPILE_ERROR);
        }

        ObjFunction script = result.getFunction();
        if (config.isOptimize()) {
            optimizer.optimizeAll(script, heap);
        }
        return execute(script);
    }

    /**
     * 执行文件：{@code .tbc} 按持久化字节码读取，其余按源码编译。
     *
     * @throws IOException 文件无法读取或字节码格式错误
     */
    public InterpretResult interpretFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        if (name.endsWith(BytecodeFormat.FILE_EXTENSION)) {
            return interpretChunk(new BytecodeReader().read(path));
        }
        String source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return interpret(source, name);
    }

    /**
     * 执行一个独立的脚本字节块（例如从 TBC 文件读回的）。
     * 字节块先经过结构校验；校验失败报告为 INVALID_BYTECODE。
     */
    public InterpretResult interpretChunk(Chunk chunk) {
        resetStacks();
        lastError = null;
        lastValue = Value.NIL;
        try {
            chunk.verify();
        } catch (IllegalStateException e) {
            return fail(new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE, e.getMessage(), e));
        }
        ObjFunction script = new ObjFunction(ObjFunction.SCRIPT_NAME, 0, chunk, Collections.<UpvalueDescriptor>emptyList());
        heap.allocate(script);
        return execute(script);
    }

    private InterpretResult execute(ObjFunction script) {
        long start = System.nanoTime();
        long executedBefore = instructionCount;

        // 分配闭包期间脚本函数必须可达
        push(Value.function(script.getHandle()));
        Value closure = heap.allocateClosure(new ObjClosure(script.getHandle(), 0));
        pop();
        frames[frameCount++] = new CallFrame(heap.closure(closure.getHandle()), script, 0);

        try {
            run();
        } catch (TinyRuntimeException e) {
            return fail(e);
        } catch (IllegalStateException | IllegalArgumentException | IndexOutOfBoundsException e) {
            // 损坏的字节码：未知操作码、越界常量、失效句柄
            return fail(new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE, e.getMessage(), e));
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("executed %d instructions in %.2f ms, heap %d objects / %d bytes",
                    instructionCount - executedBefore, (System.nanoTime() - start) / 1e6,
                    heap.getLiveCount(), heap.getBytesInUse()));
        }
        return finish(InterpretResult.OK);
    }

    private InterpretResult fail(TinyRuntimeException e) {
        e.setFrameTrace(captureFrameTrace());
        lastError = e;
        stderr.println("RuntimeError: " + e.getMessage());
        LOG.fine(() -> "runtime error (" + e.getKind() + "): " + e.getRawMessage());
        resetStacks();
        return finish(InterpretResult.RUNTIME_ERROR);
    }

    private InterpretResult finish(InterpretResult result) {
        lastResult = result;
        return result;
    }

    // ============ 执行循环 ============

    private void run() {
        CallFrame frame = frames[frameCount - 1];
        for (;;) {
            Chunk chunk = frame.chunk;
            int offset = frame.ip;
            if (offset >= chunk.count()) {
                throw new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE,
                        "Instruction pointer ran past the end of the chunk.");
            }
            OpCode op = OpCode.fromByte(chunk.byteAt(offset));
            if (op == null) {
                throw new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE,
                        String.format("Unknown opcode 0x%02X at offset %d.", chunk.byteAt(offset) & 0xFF, offset));
            }
            int operand = readOperand(chunk, op, offset);
            frame.ip = offset + op.getLength();
            instructionCount++;

            switch (op) {
                case CONSTANT:
                    push(chunk.getConstant(operand));
                    break;
                case NIL:
                    push(Value.NIL);
                    break;
                case TRUE:
                    push(Value.TRUE);
                    break;
                case FALSE:
                    push(Value.FALSE);
                    break;
                case POP:
                    pop();
                    break;
                case POPN:
                    popN(operand);
                    break;

                case GET_LOCAL:
                    push(stack[frame.base + operand]);
                    break;
                case SET_LOCAL:
                    stack[frame.base + operand] = peek(0);
                    break;
                case DEFINE_GLOBAL:
                    globals.put(nameAt(chunk, operand), peek(0));
                    pop();
                    break;
                case GET_GLOBAL: {
                    String name = nameAt(chunk, operand);
                    Value value = globals.get(name);
                    if (value == null) {
                        throw undefined(name);
                    }
                    push(value);
                    break;
                }
                case SET_GLOBAL: {
                    String name = nameAt(chunk, operand);
                    if (!globals.containsKey(name)) {
                        throw undefined(name);
                    }
                    globals.put(name, peek(0));
                    break;
                }
                case GET_UPVALUE: {
                    UpvalueCell cell = frame.closure.getUpvalues()[operand];
                    push(cell.isOpen() ? stack[cell.getSlot()] : cell.getClosed());
                    break;
                }
                case SET_UPVALUE: {
                    UpvalueCell cell = frame.closure.getUpvalues()[operand];
                    if (cell.isOpen()) {
                        stack[cell.getSlot()] = peek(0);
                    } else {
                        cell.setClosed(peek(0));
                    }
                    break;
                }
                case CLOSE_UPVALUE:
                    closeUpvalues(sp - 1);
                    pop();
                    break;

                case ADD: {
                    Value b = peek(0);
                    Value a = peek(1);
                    Value result;
                    if (a.isNumber() && b.isNumber()) {
                        result = Value.number(a.asNumber() + b.asNumber());
                    } else if (a.isString() && b.isString()) {
                        result = Value.string(a.asString() + b.asString());
                    } else {
                        throw new TinyRuntimeException(RuntimeErrorKind.TYPE_MISMATCH,
                                "Operands must be two numbers or two strings.");
                    }
                    popN(2);
                    push(result);
                    break;
                }
                case SUBTRACT:
                case MULTIPLY:
                case DIVIDE:
                case MODULO:
                    arithmetic(op);
                    break;
                case NEGATE: {
                    Value v = peek(0);
                    if (!v.isNumber()) {
                        throw new TinyRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Operand must be a number.");
                    }
                    pop();
                    push(Value.number(-v.asNumber()));
                    break;
                }
                case NOT:
                    push(Value.bool(!pop().isTruthy()));
                    break;

                case EQUAL: {
                    Value b = pop();
                    Value a = pop();
                    push(Value.bool(a.equals(b)));
                    break;
                }
                case NOT_EQUAL: {
                    Value b = pop();
                    Value a = pop();
                    push(Value.bool(!a.equals(b)));
                    break;
                }
                case LESS:
                case LESS_EQUAL:
                case GREATER:
                case GREATER_EQUAL: {
                    Value b = peek(0);
                    Value a = peek(1);
                    boolean comparable = (a.isNumber() && b.isNumber()) || (a.isString() && b.isString());
                    if (!comparable) {
                        throw new TinyRuntimeException(RuntimeErrorKind.TYPE_MISMATCH,
                                "Operands must be two numbers or two strings.");
                    }
                    popN(2);
                    push(Value.bool(Operators.compare(op, a, b)));
                    break;
                }

                case JUMP:
                case LOOP:
                    frame.ip = chunk.jumpTarget(offset);
                    break;
                case JUMP_IF_FALSE:
                    if (!peek(0).isTruthy()) {
                        frame.ip = chunk.jumpTarget(offset);
                    }
                    break;

                case CALL:
                    callValue(peek(operand), operand);
                    frame = frames[frameCount - 1];
                    break;
                case CLOSURE:
                    makeClosure(frame, chunk.getConstant(operand));
                    break;
                case RETURN: {
                    Value result = pop();
                    closeUpvalues(frame.base);
                    frames[--frameCount] = null;
                    if (frameCount == 0) {
                        sp = 0;
                        lastValue = result;
                        return;
                    }
                    // 丢弃实参和被调用者本身
                    sp = frame.base - 1;
                    push(result);
                    frame = frames[frameCount - 1];
                    break;
                }
                default:
                    throw new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE, "Unhandled opcode " + op);
            }
        }
    }

    private static int readOperand(Chunk chunk, OpCode op, int offset) {
        if (offset + op.getLength() > chunk.count()) {
            throw new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE,
                    "Truncated operand for " + op + " at offset " + offset + ".");
        }
        switch (op.getOperandWidth()) {
            case 1:
                return chunk.readByte(offset + 1);
            case 2:
                return chunk.readShort(offset + 1);
            default:
                return -1;
        }
    }

    private void arithmetic(OpCode op) {
        Value b = peek(0);
        Value a = peek(1);
        if (!a.isNumber() || !b.isNumber()) {
            throw new TinyRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Operands must be numbers.");
        }
        if (b.asNumber() == 0) {
            if (op == OpCode.DIVIDE) {
                throw new TinyRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Division by zero.");
            }
            if (op == OpCode.MODULO) {
                throw new TinyRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Modulo by zero.");
            }
        }
        popN(2);
        push(Value.number(Operators.arithmetic(op, a.asNumber(), b.asNumber())));
    }

    private static String nameAt(Chunk chunk, int index) {
        Value name = chunk.getConstant(index);
        if (!name.isString()) {
            throw new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE,
                    "Constant " + index + " is not a variable name.");
        }
        return name.asString();
    }

    private static TinyRuntimeException undefined(String name) {
        return new TinyRuntimeException(RuntimeErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'.");
    }

    // ============ 调用 ============

    private void callValue(Value callee, int argCount) {
        switch (callee.getKind()) {
            case CLOSURE: {
                ObjClosure closure = heap.closure(callee.getHandle());
                ObjFunction function = heap.function(closure.getFunctionHandle());
                if (argCount != function.getArity()) {
                    throw arityMismatch(function.getArity(), argCount);
                }
                if (frameCount >= frames.length) {
                    throw new TinyRuntimeException(RuntimeErrorKind.STACK_OVERFLOW, "Stack overflow.");
                }
                frames[frameCount++] = new CallFrame(closure, function, sp - argCount);
                return;
            }
            case NATIVE: {
                NativeFunction fn = callee.asNative();
                if (!fn.isVariadic() && argCount != fn.getArity()) {
                    throw arityMismatch(fn.getArity(), argCount);
                }
                Value[] args = Arrays.copyOfRange(stack, sp - argCount, sp);
                Value result = fn.call(args);
                popN(argCount + 1);
                push(result == null ? Value.NIL : result);
                return;
            }
            default:
                throw new TinyRuntimeException(RuntimeErrorKind.TYPE_MISMATCH, "Can only call functions and closures.");
        }
    }

    private static TinyRuntimeException arityMismatch(int expected, int actual) {
        return new TinyRuntimeException(RuntimeErrorKind.ARITY_MISMATCH,
                "Expected " + expected + " arguments but got " + actual + ".");
    }

    private void makeClosure(CallFrame frame, Value functionValue) {
        if (!functionValue.is(Value.Kind.FUNCTION) || !functionValue.isHeapRef()) {
            throw new TinyRuntimeException(RuntimeErrorKind.INVALID_BYTECODE,
                    "CLOSURE operand does not reference a compiled function.");
        }
        ObjFunction function = heap.function(functionValue.getHandle());
        Value value = heap.allocateClosure(new ObjClosure(function.getHandle(), function.getUpvalueCount()));
        push(value);

        ObjClosure closure = heap.closure(value.getHandle());
        UpvalueCell[] cells = closure.getUpvalues();
        List<UpvalueDescriptor> descriptors = function.getUpvalues();
        for (int i = 0; i < cells.length; i++) {
            UpvalueDescriptor descriptor = descriptors.get(i);
            if (descriptor.isLocal()) {
                cells[i] = captureUpvalue(frame.base + descriptor.getIndex());
            } else {
                cells[i] = frame.closure.getUpvalues()[descriptor.getIndex()];
            }
        }
    }

    /** 复用指向同一槽位的打开单元，保证捕获同一变量的闭包共享存储 */
    private UpvalueCell captureUpvalue(int slot) {
        UpvalueCell prev = null;
        UpvalueCell cell = openUpvalues;
        while (cell != null && cell.getSlot() > slot) {
            prev = cell;
            cell = cell.getNext();
        }
        if (cell != null && cell.getSlot() == slot) {
            return cell;
        }

        UpvalueCell created = new UpvalueCell(slot);
        created.setNext(cell);
        if (prev == null) {
            openUpvalues = created;
        } else {
            prev.setNext(created);
        }
        return created;
    }

    /** 关闭槽位不低于 lastSlot 的所有打开单元 */
    private void closeUpvalues(int lastSlot) {
        while (openUpvalues != null && openUpvalues.getSlot() >= lastSlot) {
            UpvalueCell cell = openUpvalues;
            openUpvalues = cell.getNext();
            Value captured = stack[cell.getSlot()];
            cell.close(captured != null ? captured : Value.NIL);
            cell.setNext(null);
        }
    }

    // ============ 栈 ============

    private void push(Value value) {
        if (sp == stack.length) {
            stack = Arrays.copyOf(stack, stack.length * 2);
        }
        stack[sp++] = value;
    }

    private Value pop() {
        if (sp == 0) {
            throw new TinyRuntimeException(RuntimeErrorKind.STACK_UNDERFLOW, "Stack underflow.");
        }
        Value value = stack[--sp];
        stack[sp] = null;
        return value;
    }

    private void popN(int count) {
        if (count > sp) {
            throw new TinyRuntimeException(RuntimeErrorKind.STACK_UNDERFLOW, "Stack underflow.");
        }
        for (int i = 0; i < count; i++) {
            stack[--sp] = null;
        }
    }

    private Value peek(int distance) {
        if (distance >= sp) {
            throw new TinyRuntimeException(RuntimeErrorKind.STACK_UNDERFLOW, "Stack underflow.");
        }
        return stack[sp - 1 - distance];
    }

    /**
     * 清空操作数栈与调用帧。仍打开的 upvalue 先闭合，
     * 逃逸到全局表的闭包因此保留出错时的捕获值，而不是指向失效的栈槽位。
     */
    private void resetStacks() {
        closeUpvalues(0);
        Arrays.fill(stack, 0, sp, null);
        sp = 0;
        Arrays.fill(frames, 0, frameCount, null);
        frameCount = 0;
        openUpvalues = null;
    }

    /** 最内层在前的调用帧跟踪 */
    private String captureFrameTrace() {
        StringBuilder sb = new StringBuilder();
        for (int i = frameCount - 1; i >= 0; i--) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(frames[i].describe());
        }
        return sb.toString();
    }

    // ============ 回收根 ============

    @Override
    public void markRoots(GarbageCollector collector) {
        for (int i = 0; i < sp; i++) {
            collector.markValue(stack[i]);
        }
        for (int i = 0; i < frameCount; i++) {
            collector.markHandle(frames[i].closure.getHandle());
        }
        for (Value value : globals.values()) {
            collector.markValue(value);
        }
        for (UpvalueCell cell = openUpvalues; cell != null; cell = cell.getNext()) {
            collector.markCell(cell);
        }
        // 顶层 return 的值交给宿主，保留到下一次 interpret
        collector.markValue(lastValue);
    }

    public int collectGarbage() {
        return gc.collect();
    }

    public void registerRoot(Value value) {
        gc.registerRoot(value);
    }

    public boolean unregisterRoot(Value value) {
        return gc.unregisterRoot(value);
    }

    // ============ 全局表 ============

    /** 注册内置函数 */
    public void defineNative(NativeFunction function) {
        globals.put(function.getName(), Value.nativeFunction(function));
    }

    public void defineGlobal(String name, Value value) {
        globals.put(name, value);
    }

    /** 清空全局表并重新注册内置函数 */
    public void resetGlobals() {
        globals.clear();
        Builtins.register(this);
    }

    // ============ 内省 ============

    /** 值的文本形式（函数与闭包显示名称） */
    public String display(Value value) {
        return heap.display(value);
    }

    public long getInstructionCount() {
        return instructionCount;
    }

    public long getMemoryUsage() {
        return heap.getBytesInUse();
    }

    public int getLiveObjectCount() {
        return heap.getLiveCount();
    }

    public List<Value> stackSnapshot() {
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(stack).subList(0, sp)));
    }

    public Map<String, Value> globalsSnapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(globals));
    }

    public InterpretResult getLastResult() {
        return lastResult;
    }

    /** 最近一次运行时错误；最近一次调用成功或为编译错误时为 null */
    public TinyRuntimeException getLastError() {
        return lastError;
    }

    /** 最近一次成功执行的脚本返回值（顶层 return 的值，默认 nil） */
    public Value getLastValue() {
        return lastValue;
    }

    public Heap getHeap() {
        return heap;
    }

    public GarbageCollector getCollector() {
        return gc;
    }

    public VmConfig getConfig() {
        return config;
    }

    /** VM 创建以来经过的秒数 */
    public double getElapsedSeconds() {
        return (System.nanoTime() - startNanos) / 1e9;
    }

    public PrintStream getStdout() {
        return stdout;
    }

    public void setStdout(PrintStream stdout) {
        this.stdout = stdout;
    }

    public PrintStream getStderr() {
        return stderr;
    }

    public void setStderr(PrintStream stderr) {
        this.stderr = stderr;
    }
}
