package com.txscript.script.runtime;

/**
 * Lifecycle of a {@link ScriptExecutor}.
 *
 * IDLE -> RUNNING <-> PAUSED; RUNNING -> STOPPED when the script ends by itself;
 * a rejected script leaves ERROR; stop() returns any state to IDLE.
 */
public enum ExecutionState {
    IDLE,
    RUNNING,
    PAUSED,
    STOPPED,
    ERROR
}
