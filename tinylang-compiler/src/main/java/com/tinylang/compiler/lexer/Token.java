package com.tinylang.compiler.lexer;

import com.tinylang.compiler.ast.SourceLocation;

/**
 * 词法单元
 *
 * literal 对数字为 {@link Double}，对字符串为转义后的内容，对标识符为驻留后的名称，
 * 对 ERROR 为错误消息，其余为 null。
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final Object literal;
    private final int line;
    private final int column;

    public Token(TokenType type, String lexeme, Object literal, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() { return type; }
    public String getLexeme() { return lexeme; }
    public Object getLiteral() { return literal; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    /** 源码位置，长度取词素长度 */
    public SourceLocation getLocation(String file) {
        return new SourceLocation(file, line, column, lexeme.length());
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + line + ":" + column;
    }
}
