package com.tinylang.compiler.diagnostic;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * 编译期错误（词法 / 语法 / 语义）。
 */
public final class CompileError {

    public enum ErrorType {
        LEXICAL("LEXICAL ERROR"),
        SYNTAX("SYNTAX ERROR"),
        SEMANTIC("SEMANTIC ERROR");

        private final String label;

        ErrorType(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final ErrorType type;
    private final String message;
    private final SourceLocation location;

    public CompileError(ErrorType type, String message, SourceLocation location) {
        this.type = type;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public ErrorType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public int getLine() {
        return location.getLine();
    }

    public int getColumn() {
        return location.getColumn();
    }

    @Override
    public String toString() {
        return "[" + type.getLabel() + "] " + location + ": " + message;
    }
}
