package com.txscript.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.txscript.debug.Debug;

/**
 * Bounded, thread-safe run log: print output, frames sent and received, errors and
 * state changes. When full, the oldest entry is discarded.
 */
public final class ScriptLog {
    private static final String TAG = "txscript.log";

    private final Deque<ScriptLogEntry> entries = new ArrayDeque<>();
    private final List<Consumer<ScriptLogEntry>> listeners = new CopyOnWriteArrayList<>();
    private final int capacity;

    public ScriptLog(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    public void add(ScriptLogEntry.Type type, String message, int line) {
        ScriptLogEntry entry = new ScriptLogEntry(System.currentTimeMillis(), type, message, line);
        synchronized (entries) {
            if (entries.size() == capacity) entries.removeFirst();
            entries.addLast(entry);
        }
        for (Consumer<ScriptLogEntry> l : listeners) {
            try {
                l.accept(entry);
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "log listener failed", e);
            }
        }
    }

    public List<ScriptLogEntry> entries() {
        synchronized (entries) {
            return Collections.unmodifiableList(new ArrayList<>(entries));
        }
    }

    public List<ScriptLogEntry> entries(ScriptLogEntry.Type type) {
        List<ScriptLogEntry> out = new ArrayList<>();
        for (ScriptLogEntry e : entries()) {
            if (e.getType() == type) out.add(e);
        }
        return out;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    public void addListener(Consumer<ScriptLogEntry> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ScriptLogEntry> listener) {
        listeners.remove(listener);
    }
}
