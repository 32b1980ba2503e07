package com.txscript.script.runtime;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Point-in-time view of an executor, for progress displays. */
@JsonPropertyOrder({"state", "currentLine", "loopIteration", "framesSent", "framesReceived", "errorCount", "elapsedMillis"})
public final class ExecutionSnapshot {
    private final ExecutionState state;
    private final int currentLine;
    private final long loopIteration;
    private final long framesSent;
    private final long framesReceived;
    private final int errorCount;
    private final long elapsedMillis;

    public ExecutionSnapshot(ExecutionState state, int currentLine, long loopIteration,
                             long framesSent, long framesReceived, int errorCount, long elapsedMillis) {
        this.state = state;
        this.currentLine = currentLine;
        this.loopIteration = loopIteration;
        this.framesSent = framesSent;
        this.framesReceived = framesReceived;
        this.errorCount = errorCount;
        this.elapsedMillis = elapsedMillis;
    }

    public ExecutionState getState() { return state; }
    /** Line of the main sequence statement last started, 0 before the first one. */
    public int getCurrentLine() { return currentLine; }
    public long getLoopIteration() { return loopIteration; }
    public long getFramesSent() { return framesSent; }
    public long getFramesReceived() { return framesReceived; }
    public int getErrorCount() { return errorCount; }
    /** Running time of the current or last run; paused intervals are not counted. */
    public long getElapsedMillis() { return elapsedMillis; }

    @Override
    public String toString() {
        return "ExecutionSnapshot{" + state + ", line " + currentLine + ", iteration " + loopIteration
                + ", sent " + framesSent + ", received " + framesReceived + ", errors " + errorCount
                + ", " + elapsedMillis + "ms}";
    }
}
