package com.txscript.script.parser;

import java.util.List;

import com.txscript.script.error.ScriptError;

/** Tokens plus the LEX diagnostics found while producing them. The token list always ends in EOF. */
public final class LexResult {
    private final List<Token> tokens;
    private final List<ScriptError> errors;

    LexResult(List<Token> tokens, List<ScriptError> errors) {
        this.tokens = List.copyOf(tokens);
        this.errors = List.copyOf(errors);
    }

    public List<Token> tokens() { return tokens; }
    public List<ScriptError> errors() { return errors; }
    public boolean hasErrors() { return !errors.isEmpty(); }
}
