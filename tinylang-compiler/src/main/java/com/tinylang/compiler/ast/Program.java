package com.tinylang.compiler.ast;

import com.tinylang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 程序根节点：顶层语句序列
 */
public final class Program {
    private final String fileName;
    private final List<Statement> statements;

    public Program(String fileName, List<Statement> statements) {
        this.fileName = fileName;
        this.statements = Collections.unmodifiableList(statements);
    }

    public String getFileName() {
        return fileName;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
