package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.Expression;

/**
 * 表达式语句
 */
public final class ExpressionStmt extends Statement {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public Kind getKind() {
        return Kind.EXPRESSION;
    }
}
