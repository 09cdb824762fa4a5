package com.tinylang.cli;

import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.Heap;
import com.tinylang.bytecode.ObjFunction;
import com.tinylang.bytecode.Value;
import com.tinylang.bytecode.io.BytecodeFormat;
import com.tinylang.bytecode.io.BytecodeWriter;
import com.tinylang.bytecode.io.Disassembler;
import com.tinylang.bytecode.pass.OptimizationStats;
import com.tinylang.bytecode.pass.PeepholeOptimizer;
import com.tinylang.compiler.CompileResult;
import com.tinylang.compiler.TinyCompiler;
import com.tinylang.compiler.codegen.CompilerOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * picocli compile 子命令：源码编译为 .tbc 字节码文件
 */
@Command(name = "compile", description = "编译源文件为 .tbc 字节码")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(CompileCommand.class.getName());

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "源文件")
    Path source;

    @Option(names = {"-o", "--output"}, description = "输出路径（默认与源文件同名，扩展名 .tbc）")
    Path output;

    @Option(names = "-O0", description = "关闭窥孔优化与常量折叠")
    boolean noOptimize;

    @Option(names = {"-d", "--disassemble"}, description = "同时输出反汇编")
    boolean disassemble;

    @Option(names = {"-v", "--verbose"}, description = "输出编译与优化日志")
    boolean verbose;

    @Override
    public Integer call() {
        PrintStream out = parent.out;
        PrintStream err = parent.err;
        if (verbose) {
            Main.enableVerboseLogging(err);
        }

        if (!Files.exists(source)) {
            err.println("错误: 文件不存在 - " + source);
            return Main.EXIT_IO_ERROR;
        }

        String text;
        try {
            text = new String(Files.readAllBytes(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + source + ": " + e.getMessage());
            return Main.EXIT_IO_ERROR;
        }

        Heap heap = new Heap();
        CompilerOptions options = CompilerOptions.defaults().setFoldConstants(!noOptimize);
        CompileResult result = new TinyCompiler(heap, options)
                .compile(text, source.getFileName().toString());
        if (!result.isSuccess()) {
            result.getReporter().printTo(err);
            return Main.EXIT_COMPILE_ERROR;
        }

        ObjFunction script = result.getFunction();
        if (!noOptimize) {
            OptimizationStats stats = PeepholeOptimizer.createDefault().optimizeAll(script, heap);
            LOG.fine(() -> "optimized " + source + ": " + stats);
        }

        Chunk chunk = script.getChunk();
        if (hasNestedFunctions(chunk)) {
            err.println("警告: .tbc 只保存顶层字节块，函数定义在运行时不可调用");
        }

        Path target = output != null ? output : defaultOutput(source);
        try {
            new BytecodeWriter().write(chunk, target);
        } catch (IOException e) {
            err.println("错误: 无法写入 - " + target + ": " + e.getMessage());
            return Main.EXIT_IO_ERROR;
        }
        out.println("已生成: " + target);

        if (disassemble) {
            out.print(new Disassembler(heap).disassemble(chunk, script.getName()));
        }
        return Main.EXIT_OK;
    }

    static Path defaultOutput(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(base + BytecodeFormat.FILE_EXTENSION);
    }

    private static boolean hasNestedFunctions(Chunk chunk) {
        for (Value constant : chunk.getConstants()) {
            if (constant.is(Value.Kind.FUNCTION)) {
                return true;
            }
        }
        return false;
    }
}
