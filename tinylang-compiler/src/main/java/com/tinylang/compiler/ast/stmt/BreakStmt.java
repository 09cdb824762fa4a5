package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * break
 */
public final class BreakStmt extends Statement {
    public BreakStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public Kind getKind() {
        return Kind.BREAK;
    }
}
