package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * continue
 */
public final class ContinueStmt extends Statement {
    public ContinueStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public Kind getKind() {
        return Kind.CONTINUE;
    }
}
