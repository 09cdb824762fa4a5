package com.tinylang.compiler;

import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.compiler.ast.Program;
import com.tinylang.compiler.codegen.BytecodeCompiler;
import com.tinylang.compiler.codegen.CompilerOptions;
import com.tinylang.compiler.diagnostic.ErrorReporter;
import com.tinylang.compiler.lexer.Lexer;
import com.tinylang.compiler.lexer.Token;
import com.tinylang.compiler.parser.Parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 编译管线入口：源码 → Token → AST → 字节码。
 *
 * 三个阶段共用一个 {@link ErrorReporter}，任何阶段有错误都不产出函数。
 * 函数对象分配在调用方提供的堆上，编译期间调用方应暂停回收。
 */
public class TinyCompiler {

    private static final Logger LOG = Logger.getLogger(TinyCompiler.class.getName());

    public static final String DEFAULT_FILE_NAME = "<script>";

    private final Heap heap;
    private final CompilerOptions options;

    public TinyCompiler(Heap heap) {
        this(heap, CompilerOptions.defaults());
    }

    public TinyCompiler(Heap heap, CompilerOptions options) {
        this.heap = heap;
        this.options = options;
    }

    public CompileResult compile(String source) {
        return compile(source, DEFAULT_FILE_NAME);
    }

    public CompileResult compile(String source, String fileName) {
        long start = System.nanoTime();
        ErrorReporter reporter = new ErrorReporter(fileName, source);

        List<Token> tokens = new Lexer(source, reporter).scanTokens();
        Program program = new Parser(tokens, reporter).parse();
        if (reporter.hasErrors()) {
            LOG.fine(() -> fileName + ": " + reporter.getErrorCount() + " error(s) before code generation");
            return new CompileResult(null, reporter);
        }

        ObjFunction script = new BytecodeCompiler(heap, reporter, options).compile(program);
        if (reporter.hasErrors()) {
            // 生成失败的函数不可执行，交给回收器处理
            LOG.fine(() -> fileName + ": " + reporter.getErrorCount() + " error(s) during code generation");
            return new CompileResult(null, reporter);
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("compiled %s: %d tokens, %d statements, %d bytes in %.2f ms",
                    fileName, tokens.size(), program.getStatements().size(),
                    script.getChunk().count(), (System.nanoTime() - start) / 1e6));
        }
        return new CompileResult(script, reporter);
    }
}
