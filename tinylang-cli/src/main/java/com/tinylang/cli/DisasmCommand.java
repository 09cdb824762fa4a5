package com.tinylang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.tinylang.bytecode.Chunk;
import com.tinylang.bytecode.OpCode;
import com.tinylang.bytecode.Value;
import com.tinylang.bytecode.io.BytecodeFormat;
import com.tinylang.bytecode.io.BytecodeFormatException;
import com.tinylang.bytecode.io.BytecodeReader;
import com.tinylang.bytecode.io.Disassembler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * picocli disasm 子命令：反汇编 .tbc 字节码文件
 */
@Command(name = "disasm", description = "反汇编 .tbc 字节码文件")
public class DisasmCommand implements Callable<Integer> {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = ".tbc 文件")
    Path file;

    @Option(names = "--json", description = "以 JSON 输出")
    boolean json;

    @Option(names = {"-s", "--stats"}, description = "附加操作码统计")
    boolean stats;

    @Override
    public Integer call() {
        PrintStream out = parent.out;
        PrintStream err = parent.err;

        if (!Files.exists(file)) {
            err.println("错误: 文件不存在 - " + file);
            return Main.EXIT_IO_ERROR;
        }

        Chunk chunk;
        try {
            chunk = new BytecodeReader().read(file);
        } catch (BytecodeFormatException e) {
            err.println("错误: 字节码格式无效 - " + e.getMessage());
            return Main.EXIT_COMPILE_ERROR;
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + file + ": " + e.getMessage());
            return Main.EXIT_IO_ERROR;
        }

        Disassembler disassembler = new Disassembler();
        String name = file.getFileName().toString();
        if (json) {
            out.println(GSON.toJson(toJson(name, chunk, disassembler)));
            return Main.EXIT_OK;
        }

        out.print(disassembler.disassemble(chunk, name));
        if (stats) {
            out.println();
            for (Map.Entry<OpCode, Integer> entry : disassembler.opcodeStatistics(chunk).entrySet()) {
                out.println(String.format("%-16s %5d", entry.getKey().name(), entry.getValue()));
            }
        }
        return Main.EXIT_OK;
    }

    private JsonObject toJson(String name, Chunk chunk, Disassembler disassembler) {
        JsonObject root = new JsonObject();
        root.addProperty("file", name);
        root.addProperty("version", BytecodeFormat.VERSION);
        root.addProperty("codeSize", chunk.count());

        JsonArray constants = new JsonArray();
        for (Value constant : chunk.getConstants()) {
            JsonObject c = new JsonObject();
            c.addProperty("kind", constant.getKind().name());
            c.addProperty("text", constant.toString());
            constants.add(c);
        }
        root.add("constants", constants);

        JsonArray instructions = new JsonArray();
        for (Disassembler.Instruction insn : disassembler.decode(chunk)) {
            JsonObject i = new JsonObject();
            i.addProperty("offset", insn.getOffset());
            i.addProperty("line", insn.getLine());
            i.addProperty("op", insn.getOp().name());
            if (insn.getOperand() >= 0) {
                i.addProperty("operand", insn.getOperand());
            }
            if (insn.getDetail() != null) {
                i.addProperty("detail", insn.getDetail());
            }
            instructions.add(i);
        }
        root.add("instructions", instructions);

        if (stats) {
            JsonObject statistics = new JsonObject();
            for (Map.Entry<OpCode, Integer> entry : disassembler.opcodeStatistics(chunk).entrySet()) {
                statistics.addProperty(entry.getKey().name(), entry.getValue());
            }
            root.add("statistics", statistics);
        }
        return root;
    }
}
