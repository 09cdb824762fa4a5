package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * 函数声明 fn name(params) { body }
 */
public final class FunctionStmt extends Statement {
    private final String name;
    private final List<String> params;
    private final List<Statement> body;

    public FunctionStmt(SourceLocation location, String name, List<String> params, List<Statement> body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = Collections.unmodifiableList(body);
    }

    public String getName() {
        return name;
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
