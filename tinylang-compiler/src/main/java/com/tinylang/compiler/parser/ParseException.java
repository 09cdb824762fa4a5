package com.tinylang.compiler.parser;

import com.tinylang.compiler.lexer.Token;
import com.tinylang.compiler.lexer.TokenType;

/**
 * 解析异常
 *
 * 在递归下降中抛出，由语句级恢复点捕获并转成 SYNTAX 错误。
 */
public class ParseException extends RuntimeException {
    private final Token token;

    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }

    /** 不含位置信息的消息（位置由 ErrorReporter 单独输出） */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            if (token.getType() == TokenType.EOF) {
                sb.append(" (found end of input)");
            } else {
                sb.append(" (found '").append(token.getLexeme()).append("')");
            }
        }
        return sb.toString();
    }
}
