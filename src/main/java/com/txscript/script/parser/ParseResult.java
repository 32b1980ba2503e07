package com.txscript.script.parser;

import java.util.List;

import com.txscript.script.error.ScriptError;

/**
 * Outcome of a parse. The program is always present, even when errors were found,
 * so tooling can inspect what was recognised; an executor refuses to start it.
 */
public final class ParseResult {
    private final Program program;
    private final List<ScriptError> errors;

    public ParseResult(Program program, List<ScriptError> errors) {
        this.program = program;
        this.errors = List.copyOf(errors);
    }

    public Program program() { return program; }
    public List<ScriptError> errors() { return errors; }
    public boolean hasErrors() { return !errors.isEmpty(); }
}
