package com.txscript.script.runtime;

import com.txscript.script.error.ErrorKind;
import com.txscript.script.error.ScriptError;
import com.txscript.script.parser.Token;

/**
 * Raised while evaluating or executing script code. Never escapes to the host: the
 * executor turns it into a RUNTIME {@link ScriptError}.
 *
 * An exception thrown without a position (e.g. by a type conversion) is positioned at
 * the statement being executed when it is reported.
 */
public class ScriptRuntimeException extends RuntimeException {
    private final ErrorKind kind;
    private final int line;
    private final int column;

    public ScriptRuntimeException(ErrorKind kind, String message) {
        this(kind, message, 0, 0);
    }

    public ScriptRuntimeException(ErrorKind kind, String message, Token at) {
        this(kind, message, at == null ? 0 : at.line, at == null ? 0 : at.column);
    }

    private ScriptRuntimeException(ErrorKind kind, String message, int line, int column) {
        super(message);
        this.kind = kind;
        this.line = line;
        this.column = column;
    }

    public ErrorKind getKind() { return kind; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public boolean hasPosition() { return line > 0; }

    /** Same error, positioned at {@code at} unless it already carries a position. */
    public ScriptRuntimeException at(Token at) {
        if (hasPosition() || at == null) return this;
        ScriptRuntimeException positioned = new ScriptRuntimeException(kind, getMessage(), at.line, at.column);
        positioned.setStackTrace(getStackTrace());
        return positioned;
    }

    public ScriptError toScriptError() {
        return ScriptError.runtime(line, column, kind, getMessage());
    }
}
