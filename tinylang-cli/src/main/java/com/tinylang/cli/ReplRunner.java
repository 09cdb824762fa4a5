package com.tinylang.cli;

import com.tinylang.bytecode.Value;
import com.tinylang.compiler.lexer.Lexer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import tinylang.runtime.vm.InterpretResult;
import tinylang.runtime.vm.VirtualMachine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * jline REPL 交互模式
 *
 * 所有输入在同一个虚拟机中执行，全局变量跨行保留。
 */
public class ReplRunner {

    private static final String PROMPT = "tiny> ";
    private static final String CONTINUATION_PROMPT = "... ";
    private static final List<String> COMMANDS = Arrays.asList(
            ":help", ":quit", ":globals", ":stack", ":gc", ":stats", ":reset");

    private final VirtualMachine vm;
    private final PrintStream out;
    private final PrintStream err;

    private final StringBuilder pending = new StringBuilder();

    public ReplRunner(VirtualMachine vm, PrintStream out, PrintStream err) {
        this.vm = vm;
        this.out = out;
        this.err = err;
        vm.setStdout(out);
        vm.setStderr(err);
    }

    /**
     * 启动 REPL，返回退出码
     */
    public int run() {
        out.println("TinyLang v" + Main.VERSION + " - 字节码虚拟机");
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            List<String> words = new ArrayList<>(Lexer.getKeywords());
            words.addAll(COMMANDS);
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .completer(new StringsCompleter(words))
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, CONTINUATION_PROMPT)
                    .build();
            runLoop(reader);
        } catch (IOException e) {
            err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println();
        out.println("再见！");
        return Main.EXIT_OK;
    }

    private void runLoop(LineReader reader) {
        while (true) {
            try {
                String line = reader.readLine(currentPrompt());
                if (line == null || !accept(line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 丢弃未完成的输入
                pending.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        while (true) {
            out.print(currentPrompt());
            out.flush();
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
            if (line == null || !accept(line)) break;
        }
    }

    private String currentPrompt() {
        return pending.length() > 0 ? CONTINUATION_PROMPT : PROMPT;
    }

    /**
     * 处理一行输入
     *
     * @return true 继续循环，false 退出
     */
    boolean accept(String line) {
        if (pending.length() == 0 && line.trim().startsWith(":")) {
            return handleCommand(line.trim());
        }

        // 反斜杠续行
        if (line.endsWith("\\")) {
            pending.append(line, 0, line.length() - 1).append('\n');
            return true;
        }

        pending.append(line);
        String source = pending.toString();
        if (hasUnclosedBrackets(source)) {
            pending.append('\n');
            return true;
        }
        pending.setLength(0);

        if (!source.trim().isEmpty()) {
            evaluate(source);
        }
        return true;
    }

    private void evaluate(String source) {
        InterpretResult result = vm.interpret(source, "<repl>");
        if (result == InterpretResult.OK && !vm.getLastValue().isNil()) {
            out.println(vm.display(vm.getLastValue()));
        }
    }

    /**
     * 未闭合的括号或字符串时继续读取下一行
     */
    static boolean hasUnclosedBrackets(String text) {
        int braces = 0;
        int parens = 0;
        boolean inString = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"': inString = true; break;
                case '{': braces++; break;
                case '}': braces--; break;
                case '(': parens++; break;
                case ')': parens--; break;
                default: break;
            }
        }
        return inString || braces > 0 || parens > 0;
    }

    private boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;
            case ":help":
            case ":h":
                printHelp();
                return true;
            case ":globals":
                printGlobals();
                return true;
            case ":stack":
                printStack();
                return true;
            case ":gc": {
                long before = vm.getMemoryUsage();
                int freed = vm.collectGarbage();
                out.println("回收 " + freed + " 个对象，" + (before - vm.getMemoryUsage()) + " 字节；存活 "
                        + vm.getLiveObjectCount() + " 个对象");
                return true;
            }
            case ":stats":
                out.println("已执行指令: " + vm.getInstructionCount());
                out.println("堆占用: " + vm.getMemoryUsage() + " 字节，" + vm.getLiveObjectCount() + " 个对象");
                out.println("回收次数: " + vm.getCollector().getCollectionCount());
                return true;
            case ":reset":
                vm.resetGlobals();
                out.println("全局变量已重置");
                return true;
            default:
                out.println("未知命令: " + command);
                out.println("输入 :help 获取帮助");
                return true;
        }
    }

    private void printGlobals() {
        boolean any = false;
        for (Map.Entry<String, Value> entry : vm.globalsSnapshot().entrySet()) {
            // 内置函数不列出
            if (entry.getValue().is(Value.Kind.NATIVE)) continue;
            out.println(entry.getKey() + " = " + vm.display(entry.getValue()));
            any = true;
        }
        if (!any) {
            out.println("（无全局变量）");
        }
    }

    private void printStack() {
        List<Value> stack = vm.stackSnapshot();
        if (stack.isEmpty()) {
            out.println("[]");
            return;
        }
        StringBuilder sb = new StringBuilder();
        for (Value value : stack) {
            sb.append("[ ").append(vm.display(value)).append(" ]");
        }
        out.println(sb);
    }

    private void printHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h         显示此帮助");
        out.println("  :quit, :q, :exit  退出 REPL");
        out.println("  :globals          显示全局变量");
        out.println("  :stack            显示操作数栈");
        out.println("  :gc               立即执行垃圾回收");
        out.println("  :stats            显示执行统计");
        out.println("  :reset            清空全局变量");
        out.println();
        out.println("示例:");
        out.println("  let x = 42;                  定义变量");
        out.println("  print x + 1;                 打印结果");
        out.println("  fn add(a, b) { return a + b; }");
        out.println("  return add(1, 2);            顶层 return 的值会被打印");
        out.println();
        out.println("提示:");
        out.println("  - 行尾使用 \\ 可以输入多行");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
