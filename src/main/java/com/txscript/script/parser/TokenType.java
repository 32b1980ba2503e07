package com.txscript.script.parser;

public enum TokenType {
    // Literals
    NUMBER,
    HEX_NUMBER,
    FLOAT_NUMBER,
    STRING,

    // Identifiers & keywords
    IDENTIFIER,
    VAR,
    SEND,
    DELAY,
    REPEAT,
    LOOP,
    IF,
    ELSE,
    WAIT_FOR,
    RANDOM,
    RANDOM_BYTES,
    FUNCTION,
    RETURN,
    ON_RECEIVE,
    ON_INTERVAL,
    BREAK,
    CONTINUE,
    PRINT,
    EXT,
    TIMEOUT,
    DATA,
    TRUE,
    FALSE,

    // Operators
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    AMPERSAND,
    PIPE,
    CARET,
    TILDE,
    SHL,
    SHR,
    EQUAL_EQUAL,
    BANG_EQUAL,
    LESS,
    LESS_EQUAL,
    GREATER,
    GREATER_EQUAL,
    AND_AND,
    OR_OR,
    BANG,
    EQUAL,
    QUESTION,

    // Delimiters
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    COLON,
    DOT,
    SEMICOLON,

    // Special
    NEWLINE,
    ERROR,
    EOF
}
