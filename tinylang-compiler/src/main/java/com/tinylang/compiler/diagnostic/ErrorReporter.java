package com.tinylang.compiler.diagnostic;

import com.tinylang.compiler.ast.SourceLocation;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译期错误收集器。词法、语法与语义错误走同一通道，
 * 编译结束后统一输出，不在第一个错误处停止。
 */
public class ErrorReporter {

    private final String fileName;
    private final String[] sourceLines;
    private final List<CompileError> errors = new ArrayList<>();

    public ErrorReporter(String fileName, String source) {
        this.fileName = fileName;
        this.sourceLines = source != null ? source.split("\r?\n", -1) : new String[0];
    }

    public String getFileName() {
        return fileName;
    }

    public void report(CompileError.ErrorType type, String message, SourceLocation location) {
        errors.add(new CompileError(type, message, location));
    }

    public void report(CompileError.ErrorType type, String message, int line, int column, int length) {
        report(type, message, new SourceLocation(fileName, line, column, length));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public List<CompileError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /** 指定行号的源代码（从 1 开始），越界返回 null */
    public String getSourceLine(int line) {
        if (line < 1 || line > sourceLines.length) return null;
        return sourceLines[line - 1];
    }

    /**
     * 格式化单个错误
     *
     * 输出格式类似:
     * [SYNTAX ERROR] script.tl:1:9: Expect expression.
     * 1 | print 1 +;
     *   |         ^
     */
    public String format(CompileError error) {
        StringBuilder sb = new StringBuilder();
        SourceLocation loc = error.getLocation();
        sb.append('[').append(error.getType().getLabel()).append("] ");
        if (loc.getLine() > 0) {
            sb.append(fileName).append(':').append(loc.getLine()).append(':').append(loc.getColumn()).append(": ");
        }
        sb.append(error.getMessage());

        String sourceLine = getSourceLine(loc.getLine());
        if (sourceLine != null) {
            String lineNum = String.valueOf(loc.getLine());
            String padding = repeat(" ", lineNum.length());
            sb.append('\n').append(lineNum).append(" | ").append(sourceLine);
            sb.append('\n').append(padding).append(" | ");
            sb.append(repeat(" ", Math.max(0, loc.getColumn() - 1)));
            sb.append(repeat("^", Math.max(1, loc.getLength())));
        }
        return sb.toString();
    }

    /** 输出全部错误 */
    public void printTo(PrintStream out) {
        for (CompileError error : errors) {
            out.println(format(error));
        }
    }

    private static String repeat(String s, int count) {
        if (count <= 0) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count; i++) {
            sb.append(s);
        }
        return sb.toString();
    }
}
