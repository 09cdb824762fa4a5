package com.tinylang.compiler.ast.expr;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public final class Unary extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public Unary(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public Kind getKind() {
        return Kind.UNARY;
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NEG("-"),
        NOT("!");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }
}
