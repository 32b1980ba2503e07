package com.txscript.script.parser;

public class Token {
    public final TokenType type;
    public final String text;
    public final Object literal;
    public final int line;
    public final int column;

    public Token(TokenType type, String text, Object literal, int line, int column) {
        this.type = type;
        this.text = text;
        this.literal = literal;
        this.line = line;
        this.column = column;
    }

    @Override
    public String toString() {
        return "Token(" + type + ", '" + text + "', " + line + ":" + column + ")";
    }
}
