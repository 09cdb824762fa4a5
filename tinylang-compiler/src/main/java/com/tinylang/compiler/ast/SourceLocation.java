package com.tinylang.compiler.ast;

/**
 * 源码位置：文件、行、列（均从 1 开始）与高亮长度
 */
public final class SourceLocation {

    /** 行号为 0，格式化时不输出位置 */
    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int length;

    public SourceLocation(String file, int line, int column, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.length = length;
    }

    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public int getLength() { return length; }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
