package com.tinylang.compiler.ast.expr;

import com.tinylang.bytecode.Value;
import com.tinylang.compiler.ast.SourceLocation;

/**
 * 字面量：数值、字符串、true / false / nil
 */
public final class Literal extends Expression {
    private final Value value;

    public Literal(SourceLocation location, Value value) {
        super(location);
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
    }
}
