package com.txscript.debug;

/** Pluggable debug output target (SLF4J, stdout, a UI console, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
