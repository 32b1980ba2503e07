package com.txscript.script.error;

/** Finer classification of a diagnostic, mostly useful for RUNTIME errors. */
public enum ErrorKind {
    SYNTAX,
    UNDEFINED_VARIABLE,
    UNDEFINED_FUNCTION,
    TYPE_ERROR,
    ARITY_MISMATCH,
    NOT_CALLABLE,
    INVALID_ARGUMENT,
    TIMEOUT,
    SEND_ERROR,
    GENERAL
}
