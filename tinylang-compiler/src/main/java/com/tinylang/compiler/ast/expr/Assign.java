package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * 赋值表达式 name = value
 */
public final class Assign extends Expression {
    private final String name;
    private final Expression value;

    public Assign(SourceLocation location, String name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGN;
    }
}
