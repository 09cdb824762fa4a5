package com.tinylang.compiler.ast;

/**
 * AST 节点基类
 *
 * 节点是封闭的变体集合，消费方按 getKind() 分派，不使用访问者。
 */
public abstract class AstNode {
    protected final SourceLocation location;

    protected AstNode(SourceLocation location) {
        this.location = location;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }
}
