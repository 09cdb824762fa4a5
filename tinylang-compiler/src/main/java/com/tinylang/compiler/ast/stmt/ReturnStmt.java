package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.Expression;

/**
 * return [value]（value 可为 null）
 */
public final class ReturnStmt extends Statement {
    private final Expression value;

    public ReturnStmt(SourceLocation location, Expression value) {
        super(location);
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.RETURN;
    }
}
