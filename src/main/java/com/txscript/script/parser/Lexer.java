package com.txscript.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.txscript.script.error.ScriptError;

/**
 * Turns TxScript source text into tokens.
 *
 * The lexer never throws. Malformed input produces an ERROR token and a LEX diagnostic,
 * then scanning carries on, so every problem in a script is reported in one pass.
 *
 * Positions: lines and columns are 1-based. Every character advances the column by one
 * (tabs included, also inside strings and comments); a newline moves to column 1 of the
 * next line. A token is positioned at its first character.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<ScriptError> errors = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("var", TokenType.VAR);
        map.put("send", TokenType.SEND);
        map.put("delay", TokenType.DELAY);
        map.put("repeat", TokenType.REPEAT);
        map.put("loop", TokenType.LOOP);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("wait_for", TokenType.WAIT_FOR);
        map.put("random", TokenType.RANDOM);
        map.put("random_bytes", TokenType.RANDOM_BYTES);
        map.put("function", TokenType.FUNCTION);
        map.put("return", TokenType.RETURN);
        map.put("on_receive", TokenType.ON_RECEIVE);
        map.put("on_interval", TokenType.ON_INTERVAL);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("print", TokenType.PRINT);
        map.put("ext", TokenType.EXT);
        map.put("timeout", TokenType.TIMEOUT);
        map.put("data", TokenType.DATA);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public LexResult tokenize() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        return new LexResult(tokens, errors);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ':': addToken(TokenType.COLON); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '~': addToken(TokenType.TILDE); break;
            case '?': addToken(TokenType.QUESTION); break;

            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<':
                if (match('<')) addToken(TokenType.SHL);
                else addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                break;
            case '>':
                if (match('>')) addToken(TokenType.SHR);
                else addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
                break;
            case '&': addToken(match('&') ? TokenType.AND_AND : TokenType.AMPERSAND); break;
            case '|': addToken(match('|') ? TokenType.OR_OR : TokenType.PIPE); break;

            case ' ': case '\r': case '\t':
                break;
            case '\n':
                addToken(TokenType.NEWLINE);
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) number(c);
                else if (isAlpha(c)) identifier();
                else error("Unexpected character: '" + c + "'");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        addToken(type);
    }

    private void number(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X')) {
            advance(); // x
            int digitsStart = current;
            while (isHexDigit(peek())) advance();
            if (current == digitsStart) {
                error("Hex literal needs at least one digit after '0x'");
                return;
            }
            try {
                long value = Long.parseUnsignedLong(source.substring(digitsStart, current), 16);
                addToken(TokenType.HEX_NUMBER, value);
            } catch (NumberFormatException e) {
                error("Hex literal out of range: " + source.substring(start, current));
            }
            return;
        }

        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // .
            while (isDigit(peek())) advance();
            addToken(TokenType.FLOAT_NUMBER, Double.parseDouble(source.substring(start, current)));
            return;
        }

        String digits = source.substring(start, current);
        boolean seconds = false;
        if (peek() == 's' && !isAlphaNumeric(peekNext())) {
            advance(); // s
            seconds = true;
        }

        try {
            long value = Long.parseLong(digits);
            if (seconds) value = Math.multiplyExact(value, 1000L);
            addToken(TokenType.NUMBER, value);
        } catch (NumberFormatException | ArithmeticException e) {
            error("Integer literal out of range: " + source.substring(start, current));
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != '"') {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                char e = advance();
                switch (e) {
                    case 'n': value.append('\n'); break;
                    case 't': value.append('\t'); break;
                    case '"': value.append('"'); break;
                    case '\\': value.append('\\'); break;
                    default: value.append('\\').append(e); break;
                }
            } else {
                value.append(c);
            }
        }
        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }
        advance(); // closing "
        addToken(TokenType.STRING, value.toString());
    }

    private void blockComment() {
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        if (depth > 0) error("Unterminated block comment");
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
    private boolean isAlpha(char c) { return Character.isLetter(c) || c == '_'; }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private void error(String msg) {
        errors.add(ScriptError.lex(startLine, startColumn, msg));
        addToken(TokenType.ERROR);
    }
}
