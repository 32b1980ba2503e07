package com.txscript.script.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.txscript.debug.Debug;

/**
 * Append-only, thread-safe collection of diagnostics for one executor.
 *
 * The log is capped: once {@code capacity} entries are stored, further errors are
 * counted in {@link #droppedCount()} and logged, but not kept.
 */
public final class ScriptErrorLog {

    private static final String TAG = "txscript.errors";
    private static final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final List<ScriptError> errors = new ArrayList<>();
    private final List<Consumer<ScriptError>> listeners = new CopyOnWriteArrayList<>();
    private final int capacity;
    private int dropped = 0;

    public ScriptErrorLog(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    public void add(ScriptError error) {
        boolean stored;
        synchronized (errors) {
            stored = errors.size() < capacity;
            if (stored) errors.add(error);
            else dropped++;
        }
        if (!stored) {
            Debug.get().w(TAG, "error log full, dropping: " + error);
            return;
        }
        Debug.get().d(TAG, error.toString());
        for (Consumer<ScriptError> l : listeners) {
            try {
                l.accept(error);
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "error listener failed", e);
            }
        }
    }

    /** Drop all stored errors and reset the dropped count. Listeners stay registered. */
    public void clear() {
        synchronized (errors) {
            errors.clear();
            dropped = 0;
        }
    }

    public void addAll(List<ScriptError> list) {
        for (ScriptError e : list) add(e);
    }

    /** Snapshot of the stored errors in arrival order. */
    public List<ScriptError> snapshot() {
        synchronized (errors) {
            return Collections.unmodifiableList(new ArrayList<>(errors));
        }
    }

    public int size() {
        synchronized (errors) {
            return errors.size();
        }
    }

    public int droppedCount() {
        synchronized (errors) {
            return dropped;
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public List<ScriptError> byPhase(ErrorPhase phase) {
        List<ScriptError> out = new ArrayList<>();
        for (ScriptError e : snapshot()) {
            if (e.getPhase() == phase) out.add(e);
        }
        return out;
    }

    public void addListener(Consumer<ScriptError> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ScriptError> listener) {
        listeners.remove(listener);
    }

    /** JSON array of all stored errors, for hosts that render diagnostics out of process. */
    public String toJson() {
        return toJson(snapshot());
    }

    public static String toJson(List<ScriptError> errors) {
        ArrayNode arr = om.valueToTree(errors);
        try {
            return om.writeValueAsString(arr);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize error log", e);
        }
    }
}
