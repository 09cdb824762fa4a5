package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.Expression;

/**
 * if / else（elseBranch 可为 null）
 */
public final class IfStmt extends Statement {
    private final Expression condition;
    private final Statement thenBranch;
    private final Statement elseBranch;

    public IfStmt(SourceLocation location, Expression condition, Statement thenBranch, Statement elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    public Expression getCondition() {
        return condition;
    }

    public Statement getThenBranch() {
        return thenBranch;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }
}
