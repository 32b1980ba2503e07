package com.txscript.script.error;

/** Which pass produced a diagnostic. */
public enum ErrorPhase {
    LEX,
    PARSE,
    RUNTIME
}
