package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.Expression;

/**
 * for (init; cond; incr) 循环，三部分均可为 null
 */
public final class ForStmt extends Statement {
    private final Statement initializer;
    private final Expression condition;
    private final Expression increment;
    private final Statement body;

    public ForStmt(SourceLocation location, Statement initializer, Expression condition, Expression increment, Statement body) {
        super(location);
        this.initializer = initializer;
        this.condition = condition;
        this.increment = increment;
        this.body = body;
    }

    public Statement getInitializer() {
        return initializer;
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getIncrement() {
        return increment;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.FOR;
    }
}
