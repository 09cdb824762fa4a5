package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.AstNode;
import com.tinylang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    public enum Kind {
        LITERAL, VARIABLE, UNARY, BINARY, LOGICAL, CALL, ASSIGN, FUNCTION
    }

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract Kind getKind();
}
