package com.txscript.script;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Tunables for lexing, parsing and execution. Bindable from JSON; unknown keys are ignored
 * so option files can carry settings for other tools.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TxScriptOptions {

    private static final ObjectMapper om = new ObjectMapper();

    private int maxCallDepth = 64;
    private int maxErrors = 1000;
    private int maxLogEntries = 500;
    private int stepBudget = 1000;
    private int maxDataLength = 64;
    private List<Integer> defaultPorts = new ArrayList<>(List.of(1));
    private long stopTimeoutMillis = 1000;

    public static TxScriptOptions load(Path file) throws IOException {
        TxScriptOptions options = om.readValue(file.toFile(), TxScriptOptions.class);
        options.validate();
        return options;
    }

    public static TxScriptOptions fromJson(String json) throws IOException {
        TxScriptOptions options = om.readValue(json, TxScriptOptions.class);
        options.validate();
        return options;
    }

    /** @throws IllegalArgumentException if a limit is not positive or no default port is set */
    public void validate() {
        requirePositive("maxCallDepth", maxCallDepth);
        requirePositive("maxErrors", maxErrors);
        requirePositive("maxLogEntries", maxLogEntries);
        requirePositive("stepBudget", stepBudget);
        requirePositive("maxDataLength", maxDataLength);
        if (stopTimeoutMillis < 0) throw new IllegalArgumentException("stopTimeoutMillis must be >= 0");
        if (defaultPorts == null || defaultPorts.isEmpty()) {
            throw new IllegalArgumentException("defaultPorts must name at least one port");
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) throw new IllegalArgumentException(name + " must be > 0, got " + value);
    }

    public int getMaxCallDepth() { return maxCallDepth; }
    public void setMaxCallDepth(int maxCallDepth) { this.maxCallDepth = maxCallDepth; }

    public int getMaxErrors() { return maxErrors; }
    public void setMaxErrors(int maxErrors) { this.maxErrors = maxErrors; }

    public int getMaxLogEntries() { return maxLogEntries; }
    public void setMaxLogEntries(int maxLogEntries) { this.maxLogEntries = maxLogEntries; }

    /** Statements a task runs before yielding to the scheduler. */
    public int getStepBudget() { return stepBudget; }
    public void setStepBudget(int stepBudget) { this.stepBudget = stepBudget; }

    public int getMaxDataLength() { return maxDataLength; }
    public void setMaxDataLength(int maxDataLength) { this.maxDataLength = maxDataLength; }

    /** Ports used by {@code start(source)} when the caller names none. */
    public List<Integer> getDefaultPorts() { return defaultPorts; }
    public void setDefaultPorts(List<Integer> defaultPorts) { this.defaultPorts = (defaultPorts == null) ? null : new ArrayList<>(defaultPorts); }

    /** How long {@code stop()} waits for the statement in flight before warning. */
    public long getStopTimeoutMillis() { return stopTimeoutMillis; }
    public void setStopTimeoutMillis(long stopTimeoutMillis) { this.stopTimeoutMillis = stopTimeoutMillis; }
}
