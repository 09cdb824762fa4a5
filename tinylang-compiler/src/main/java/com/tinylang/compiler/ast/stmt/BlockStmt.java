package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 块 { ... }，引入新的词法作用域
 */
public final class BlockStmt extends Statement {
    private final List<Statement> statements;

    public BlockStmt(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public Kind getKind() {
        return Kind.BLOCK;
    }
}
