package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.Expression;

/**
 * 变量声明 let / var name = initializer（initializer 可为 null）
 */
public final class VarStmt extends Statement {
    private final String name;
    private final boolean mutable;
    private final Expression initializer;

    public VarStmt(SourceLocation location, String name, boolean mutable, Expression initializer) {
        super(location);
        this.name = name;
        this.mutable = mutable;
        this.initializer = initializer;
    }

    public String getName() {
        return name;
    }

    public boolean isMutable() {
        return mutable;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public Kind getKind() {
        return Kind.VAR;
    }
}
