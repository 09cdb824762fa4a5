package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数调用
 */
public final class Call extends Expression {
    private final Expression callee;
    private final List<Expression> arguments;

    public Call(SourceLocation location, Expression callee, List<Expression> arguments) {
        super(location);
        this.callee = callee;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }
}
