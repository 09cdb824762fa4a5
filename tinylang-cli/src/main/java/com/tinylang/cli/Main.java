package com.tinylang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;
import tinylang.runtime.vm.VirtualMachine;
import tinylang.runtime.vm.VmConfig;

import java.io.PrintStream;
import java.util.concurrent.Callable;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import java.util.logging.StreamHandler;

/**
 * TinyLang CLI 入口点（picocli）
 *
 * <pre>
 * tinylang script.tl          执行脚本或 .tbc 字节码
 * tinylang -e "print 1 + 2;"  执行一段源码
 * tinylang                    进入 REPL
 * tinylang compile script.tl  编译为 .tbc
 * tinylang disasm script.tbc  反汇编 .tbc
 * </pre>
 */
@Command(name = "tinylang", version = "TinyLang v" + Main.VERSION,
         mixinStandardHelpOptions = true,
         subcommands = {CompileCommand.class, DisasmCommand.class})
public class Main implements Callable<Integer> {

    static final String VERSION = "0.1.0";

    // 退出码（沿用 sysexits 约定）
    public static final int EXIT_OK = 0;
    public static final int EXIT_COMPILE_ERROR = 65;
    public static final int EXIT_RUNTIME_ERROR = 70;
    public static final int EXIT_IO_ERROR = 74;

    // 持有引用，避免 Logger 被回收后级别丢失
    private static final Logger[] PROJECT_LOGGERS = {
            Logger.getLogger("com.tinylang"),
            Logger.getLogger("tinylang")
    };

    @Spec
    CommandSpec spec;

    @Option(names = "-e", description = "执行一段源码")
    String expression;

    @Option(names = "--no-optimize", description = "关闭窥孔优化与常量折叠")
    boolean noOptimize;

    @Option(names = "--stress-gc", description = "每次分配前都执行垃圾回收")
    boolean stressGc;

    @Option(names = "--max-frames", description = "调用帧上限（默认 ${DEFAULT-VALUE}）",
            defaultValue = "" + VmConfig.DEFAULT_MAX_FRAMES)
    int maxFrames;

    @Option(names = {"-v", "--verbose"}, description = "输出虚拟机、优化器与回收器日志")
    boolean verbose;

    @Parameters(arity = "0..1", description = "脚本文件（.tl 源码或 .tbc 字节码）")
    String script;

    final PrintStream out;
    final PrintStream err;

    public Main() {
        this(System.out, System.err);
    }

    public Main(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging(err);
        }
        VmConfig config = buildConfig();

        if (expression != null) {
            return new ScriptRunner(config, out, err).runExpression(expression);
        }
        if (script != null) {
            return new ScriptRunner(config, out, err).runScript(script);
        }
        VirtualMachine vm = new VirtualMachine(config);
        return new ReplRunner(vm, out, err).run();
    }

    /**
     * 系统属性作为基础配置，命令行选项覆盖其上
     */
    VmConfig buildConfig() {
        try {
            VmConfig config = VmConfig.fromSystemProperties();
            config.setMaxFrames(maxFrames);
            if (noOptimize) {
                config.setOptimize(false).setFoldConstants(false);
            }
            if (stressGc) {
                config.setStressGc(true);
            }
            return config;
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    /**
     * 日志输出到 stderr，不干扰脚本的 stdout
     */
    static void enableVerboseLogging(PrintStream stream) {
        Logger rootLogger = Logger.getLogger("");
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }
        Handler stderrHandler = new StreamHandler(stream, new SimpleFormatter()) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        stderrHandler.setLevel(Level.FINE);
        rootLogger.addHandler(stderrHandler);
        for (Logger logger : PROJECT_LOGGERS) {
            logger.setLevel(Level.FINE);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
