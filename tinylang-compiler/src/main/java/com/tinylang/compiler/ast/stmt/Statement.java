package com.tinylang.compiler.ast.stmt;

import com.tinylang.compiler.ast.AstNode;
import com.tinylang.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    public enum Kind {
        EXPRESSION, VAR, BLOCK, IF, WHILE, FOR, BREAK, CONTINUE, RETURN, FUNCTION, PRINT
    }

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract Kind getKind();
}
