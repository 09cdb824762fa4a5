package com.tinylang.cli;

import com.tinylang.bytecode.io.BytecodeFormatException;
import tinylang.runtime.vm.InterpretResult;
import tinylang.runtime.vm.VirtualMachine;
import tinylang.runtime.vm.VmConfig;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 脚本和表达式执行器
 *
 * 编译错误与运行时错误由虚拟机写入 stderr，这里只负责映射退出码。
 */
public class ScriptRunner {

    private final VmConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public ScriptRunner(VmConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 执行脚本文件，扩展名为 .tbc 时按字节码读取
     */
    public int runScript(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return Main.EXIT_IO_ERROR;
        }
        if (!Files.isReadable(path)) {
            err.println("错误: 无法读取文件 - " + filePath);
            return Main.EXIT_IO_ERROR;
        }

        VirtualMachine vm = newVm();
        try {
            return exitCode(vm.interpretFile(path));
        } catch (BytecodeFormatException e) {
            err.println("错误: 字节码格式无效 - " + e.getMessage());
            return Main.EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return Main.EXIT_IO_ERROR;
        }
    }

    /**
     * 执行一段源码；顶层 return 的值会被打印
     */
    public int runExpression(String source) {
        VirtualMachine vm = newVm();
        InterpretResult result = vm.interpret(source, "<cmdline>");
        if (result == InterpretResult.OK && !vm.getLastValue().isNil()) {
            out.println(vm.display(vm.getLastValue()));
        }
        return exitCode(result);
    }

    private VirtualMachine newVm() {
        VirtualMachine vm = new VirtualMachine(config);
        vm.setStdout(out);
        vm.setStderr(err);
        return vm;
    }

    static int exitCode(InterpretResult result) {
        switch (result) {
            case OK:            return Main.EXIT_OK;
            case COMPILE_ERROR: return Main.EXIT_COMPILE_ERROR;
            default:            return Main.EXIT_RUNTIME_ERROR;
        }
    }
}
