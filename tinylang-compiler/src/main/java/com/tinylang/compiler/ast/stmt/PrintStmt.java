package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.SourceLocation;
import com.tinylang.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.List;

/**
 * print 语句，参数以空格分隔输出
 */
public final class PrintStmt extends Statement {
    private final List<Expression> arguments;

    public PrintStmt(SourceLocation location, List<Expression> arguments) {
        super(location);
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public Kind getKind() {
        return Kind.PRINT;
    }
}
