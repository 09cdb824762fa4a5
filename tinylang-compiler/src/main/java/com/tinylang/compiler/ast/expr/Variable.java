package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * 变量引用
 */
public final class Variable extends Expression {
    private final String name;

    public Variable(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Kind getKind() {
        return Kind.VARIABLE;
    }
}
