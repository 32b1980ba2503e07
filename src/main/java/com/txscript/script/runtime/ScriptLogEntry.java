package com.txscript.script.runtime;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One line of the run log shown to the user. */
@JsonPropertyOrder({"timestamp", "type", "line", "message"})
public final class ScriptLogEntry {

    public enum Type { INFO, DEBUG, WARN, ERROR, SEND, RECEIVE, STATE }

    private final long timestamp;
    private final Type type;
    private final String message;
    private final int line;

    public ScriptLogEntry(long timestamp, Type type, String message, int line) {
        this.timestamp = timestamp;
        this.type = type;
        this.message = message;
        this.line = line;
    }

    /** Wall-clock milliseconds. */
    public long getTimestamp() { return timestamp; }
    public Type getType() { return type; }
    public String getMessage() { return message; }
    /** Source line, 0 when the entry is not tied to a statement. */
    public int getLine() { return line; }

    @Override
    public String toString() {
        return "[" + type + "]" + (line > 0 ? " L" + line : "") + " " + message;
    }
}
