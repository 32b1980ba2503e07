package com.txscript.script.error;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One diagnostic with its source position. Immutable.
 * A line of 0 means the error has no source position (e.g. a bus failure outside a statement).
 */
@JsonPropertyOrder({"phase", "kind", "line", "column", "message", "timestamp"})
public final class ScriptError {
    private final int line;
    private final int column;
    private final String message;
    private final ErrorPhase phase;
    private final ErrorKind kind;
    private final long timestamp;

    public ScriptError(int line, int column, String message, ErrorPhase phase, ErrorKind kind, long timestamp) {
        this.line = line;
        this.column = column;
        this.message = Objects.requireNonNull(message, "message");
        this.phase = Objects.requireNonNull(phase, "phase");
        this.kind = (kind == null) ? ErrorKind.GENERAL : kind;
        this.timestamp = timestamp;
    }

    public static ScriptError lex(int line, int column, String message) {
        return new ScriptError(line, column, message, ErrorPhase.LEX, ErrorKind.SYNTAX, System.currentTimeMillis());
    }

    public static ScriptError parse(int line, int column, String message) {
        return new ScriptError(line, column, message, ErrorPhase.PARSE, ErrorKind.SYNTAX, System.currentTimeMillis());
    }

    public static ScriptError runtime(int line, int column, ErrorKind kind, String message) {
        return new ScriptError(line, column, message, ErrorPhase.RUNTIME, kind, System.currentTimeMillis());
    }

    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getMessage() { return message; }
    public ErrorPhase getPhase() { return phase; }
    public ErrorKind getKind() { return kind; }
    public long getTimestamp() { return timestamp; }

    @JsonIgnore
    public String getLocation() {
        if (line <= 0) return "-";
        return (column > 0) ? ("Line " + line + ":" + column) : ("Line " + line);
    }

    @Override
    public String toString() {
        return "[" + phase + "/" + kind + "] " + getLocation() + " " + message;
    }
}
