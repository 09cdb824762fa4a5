package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.stmt.Statement;

import java.util.Collections;
import java.util.List;

/**
 * 匿名函数 fn (params) { body }
 */
public final class FunctionExpr extends Expression {
    private final List<String> params;
    private final List<Statement> body;

    public FunctionExpr(SourceLocation location, List<String> params, List<Statement> body) {
        super(location);
        this.params = Collections.unmodifiableList(params);
        this.body = Collections.unmodifiableList(body);
    }

    public List<String> getParams() {
        return params;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION;
    }
}
