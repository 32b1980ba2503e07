package com.txscript.script.runtime;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import com.txscript.bus.CanBus;
import com.txscript.bus.PortWriters;
import com.txscript.debug.Debug;
import com.txscript.script.TxScript;
import com.txscript.script.TxScriptOptions;
import com.txscript.script.error.ScriptError;
import com.txscript.script.error.ScriptErrorLog;
import com.txscript.script.parser.ParseResult;
import com.txscript.script.time.MonotonicClock;
import com.txscript.script.time.MonotonicScheduler;

/**
 * Runs TxScript programs against a {@link CanBus}.
 *
 * <pre>
 *   IDLE/STOPPED --start--> RUNNING <--pause/resume--> PAUSED
 *   RUNNING/PAUSED --stop()--> IDLE
 *   RUNNING --main ends, no handlers / stop() builtin--> STOPPED
 *   IDLE/STOPPED --start with LEX/PARSE errors--> ERROR
 * </pre>
 *
 * Control methods may be called from any thread. Script code runs on the scheduler's
 * threads, one statement at a time under a single run lock; {@link #stop()} returns only
 * after the statement in flight has finished, and nothing of the run executes afterwards.
 */
public class ScriptExecutor {

    /** Notified after every state change, on the thread that caused it. */
    @FunctionalInterface
    public interface StateListener {
        void onStateChanged(ExecutionState previous, ExecutionState current);
    }

    /** Builtins provided by the executor itself rather than by {@link Builtins#standard()}. */
    public static final Set<String> RUNTIME_BUILTINS = Set.of("now", "stop");

    private static final String TAG = "txscript.executor";

    private final CanBus bus;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final TxScriptOptions options;
    private final Builtins builtins;
    private final PortWriters.ExecutorFactory writerFactory;

    private final ReentrantLock runLock = new ReentrantLock();
    private final ScriptErrorLog errors;
    private final ScriptLog log;
    private final List<StateListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ExecutionState state = ExecutionState.IDLE;
    private volatile RunContext run;

    public ScriptExecutor(CanBus bus, MonotonicScheduler scheduler, MonotonicClock clock) {
        this(bus, scheduler, clock, new TxScriptOptions(), Builtins.standard(), PortWriters.SINGLE_THREAD_PER_PORT);
    }

    public ScriptExecutor(CanBus bus, MonotonicScheduler scheduler, MonotonicClock clock, TxScriptOptions options,
                          Builtins builtins, PortWriters.ExecutorFactory writerFactory) {
        this.bus = Objects.requireNonNull(bus, "bus");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.options = Objects.requireNonNull(options, "options");
        this.writerFactory = Objects.requireNonNull(writerFactory, "writerFactory");
        options.validate();
        this.errors = new ScriptErrorLog(options.getMaxErrors());
        this.log = new ScriptLog(options.getMaxLogEntries());

        this.builtins = builtins.copy();
        this.builtins.register("now", args -> {
            Builtins.requireArgCount("now", args, 0);
            RunContext r = run;
            return Value.integer(r == null ? 0 : r.runMillis());
        });
        this.builtins.register("stop", args -> {
            Builtins.requireArgCount("stop", args, 0);
            stopFromScript();
            return Value.voidValue();
        });
    }

    // -------------------------
    // Control
    // -------------------------

    /** Start {@code source} on the default ports. */
    public boolean start(String source) {
        return start(source, options.getDefaultPorts());
    }

    public boolean start(String source, List<Integer> ports) {
        runLock.lock();
        try {
            if (!canStart()) return false;
            return startLocked(TxScript.compile(source, builtins.names()), ports);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Start an already compiled program. The result must have been produced against this
     * executor's builtin names, e.g. by {@link TxScript#parse}.
     */
    public boolean start(ParseResult compiled, List<Integer> ports) {
        runLock.lock();
        try {
            if (!canStart()) return false;
            return startLocked(compiled, ports);
        } finally {
            runLock.unlock();
        }
    }

    private boolean canStart() {
        if (state == ExecutionState.IDLE || state == ExecutionState.STOPPED) return true;
        Debug.get().w(TAG, "start() ignored in state " + state);
        return false;
    }

    private boolean startLocked(ParseResult compiled, List<Integer> ports) {
        // each start begins with empty logs
        errors.clear();
        log.clear();
        if (compiled.hasErrors()) {
            for (ScriptError e : compiled.errors()) {
                reportError(e);
            }
            Debug.get().w(TAG, "script rejected with " + compiled.errors().size() + " error(s)");
            setState(ExecutionState.ERROR);
            return false;
        }
        List<Integer> targets = (ports == null || ports.isEmpty()) ? options.getDefaultPorts() : ports;
        RunContext next = new RunContext(this, runLock, compiled.program(), builtins, bus, targets,
                new PortWriters(bus, writerFactory), scheduler, clock, options);
        run = next;
        setState(ExecutionState.RUNNING);
        next.begin();
        return true;
    }

    public boolean pause() {
        runLock.lock();
        try {
            if (state != ExecutionState.RUNNING) return false;
            run.pause();
            setState(ExecutionState.PAUSED);
            return true;
        } finally {
            runLock.unlock();
        }
    }

    public boolean resume() {
        runLock.lock();
        try {
            if (state != ExecutionState.PAUSED) return false;
            setState(ExecutionState.RUNNING);
            run.resume();
            return true;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Abort the run and release its timers, subscriptions and port writers. Waits for the
     * statement in flight; no script code runs after this returns. Idempotent.
     */
    public void stop() {
        RunContext r = run;
        if (r != null) r.kill();

        boolean locked = false;
        try {
            locked = runLock.tryLock(options.getStopTimeoutMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!locked) {
            Debug.get().w(TAG, "stop() still waiting for the statement in flight after "
                    + options.getStopTimeoutMillis() + " ms");
            runLock.lock();
        }
        try {
            if (state == ExecutionState.IDLE) return;
            if (run != null) run.shutdown(false);
            setState(ExecutionState.IDLE);
        } finally {
            runLock.unlock();
        }
    }

    /** The stop() builtin: always called from script code, so the lock is held. */
    private void stopFromScript() {
        RunContext r = run;
        if (r == null || !r.isLive()) return;
        Debug.get().i(TAG, "script called stop()");
        r.shutdown(true);
        setState(ExecutionState.STOPPED);
    }

    /** Main sequence ended with no handlers registered. */
    void runCompleted(RunContext r) {
        if (r != run || !r.isLive()) return;
        r.shutdown(true);
        setState(ExecutionState.STOPPED);
    }

    // -------------------------
    // Observation
    // -------------------------

    public ExecutionState getState() {
        return state;
    }

    /** Errors of the current (or last) start, oldest first. Cleared by the next start. */
    public ScriptErrorLog errors() {
        return errors;
    }

    public ScriptLog log() {
        return log;
    }

    public ExecutionSnapshot snapshot() {
        runLock.lock();
        try {
            RunContext r = run;
            if (r == null) return new ExecutionSnapshot(state, 0, 0, 0, 0, errors.size(), 0);
            return new ExecutionSnapshot(state, r.mainLine(), r.mainIteration(), r.framesSent(),
                    r.framesReceived(), errors.size(), r.runMillis());
        } finally {
            runLock.unlock();
        }
    }

    /** Global variables of the current (or last) run. */
    public Map<String, Value> globals() {
        runLock.lock();
        try {
            RunContext r = run;
            return (r == null) ? Collections.emptyMap() : r.env.globals();
        } finally {
            runLock.unlock();
        }
    }

    public void addStateListener(StateListener listener) {
        listeners.add(listener);
    }

    public void removeStateListener(StateListener listener) {
        listeners.remove(listener);
    }

    // -------------------------
    // Internal
    // -------------------------

    void reportError(ScriptError error) {
        errors.add(error);
        log.add(ScriptLogEntry.Type.ERROR, error.toString(), error.getLine());
    }

    private void setState(ExecutionState next) {
        ExecutionState previous = state;
        if (previous == next) return;
        state = next;
        log.add(ScriptLogEntry.Type.STATE, previous + " -> " + next, 0);
        Debug.get().i(TAG, "state " + previous + " -> " + next);
        for (StateListener l : listeners) {
            try {
                l.onStateChanged(previous, next);
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "state listener failed", e);
            }
        }
    }
}
