package com.tinylang.compiler.lexer;

/**
 * Token 类型
 */
public enum TokenType {
    // 字面量
    NUMBER_LITERAL,
    STRING_LITERAL,
    IDENTIFIER,

    // 关键词
    KW_LET,
    KW_VAR,
    KW_FN,
    KW_IF,
    KW_ELSE,
    KW_WHILE,
    KW_FOR,
    KW_BREAK,
    KW_CONTINUE,
    KW_RETURN,
    KW_TRUE,
    KW_FALSE,
    KW_NIL,
    KW_PRINT,

    // 运算符
    PLUS,           // +
    MINUS,          // -
    MUL,            // *
    DIV,            // /
    MOD,            // %
    NOT,            // !
    AND,            // &&
    OR,             // ||
    EQ,             // ==
    NE,             // !=
    LT,             // <
    LE,             // <=
    GT,             // >
    GE,             // >=
    ASSIGN,         // =

    // 分隔符
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    COMMA,
    SEMICOLON,

    // 特殊
    ERROR,
    EOF
}
