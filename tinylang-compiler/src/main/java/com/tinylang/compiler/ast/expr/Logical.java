package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * 短路逻辑表达式 && / ||
 */
public final class Logical extends Expression {
    private final Expression left;
    private final boolean and;
    private final Expression right;

    public Logical(SourceLocation location, Expression left, boolean and, Expression right) {
        super(location);
        this.left = left;
        this.and = and;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    /** true 为 &&，false 为 || */
    public boolean isAnd() {
        return and;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public Kind getKind() {
        return Kind.LOGICAL;
    }
}
