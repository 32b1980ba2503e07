package com.txscript.script.runtime;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantLock;

import com.txscript.bus.CanBus;
import com.txscript.bus.CanFrame;
import com.txscript.bus.PortWriters;
import com.txscript.debug.Debug;
import com.txscript.script.TxScriptOptions;
import com.txscript.script.error.ErrorKind;
import com.txscript.script.error.ScriptError;
import com.txscript.script.parser.Expr;
import com.txscript.script.parser.Program;
import com.txscript.script.parser.Statement;
import com.txscript.script.parser.Statement.FunctionDecl;
import com.txscript.script.parser.Token;
import com.txscript.script.time.Cancellable;
import com.txscript.script.time.MonotonicClock;
import com.txscript.script.time.MonotonicScheduler;

/**
 * Everything that belongs to one run of a program: environment, tasks, timers, pending
 * wait_for statements, handlers and bus subscriptions.
 *
 * All mutable state is guarded by the executor's run lock. Callbacks from the scheduler,
 * the bus and the port writers enter through {@link #guarded}, which takes the lock and
 * drops the callback once the run is dead.
 */
final class RunContext implements Interpreter.Host {
    private static final String TAG = "txscript.executor";

    private static final class Waiter {
        final Activation activation;
        final Statement.WaitFor stmt;
        final int scope;
        SuspendTimer timer;

        Waiter(Activation activation, Statement.WaitFor stmt, int scope) {
            this.activation = activation;
            this.stmt = stmt;
            this.scope = scope;
        }
    }

    /** A delay or timeout that can be frozen by pause() and re-armed by resume(). */
    static final class SuspendTimer {
        final Runnable onExpire;
        long deadlineNanos;
        long remainingNanos;
        int generation;
        Cancellable handle;

        SuspendTimer(Runnable onExpire) {
            this.onExpire = onExpire;
        }
    }

    private static final class ReceiveHandler {
        final Statement.OnReceive decl;
        boolean enabled = true;

        ReceiveHandler(Statement.OnReceive decl) {
            this.decl = decl;
        }
    }

    private static final class IntervalHandler {
        final Statement.OnInterval decl;
        final long periodNanos;
        long nextDeadline;
        Cancellable handle;
        Activation active;

        IntervalHandler(Statement.OnInterval decl, long periodNanos) {
            this.decl = decl;
            this.periodNanos = periodNanos;
        }
    }

    final Program program;
    final Environment env = new Environment();
    final Interpreter interpreter;
    final TxScriptOptions options;

    private final ScriptExecutor executor;
    private final ReentrantLock lock;
    private final CanBus bus;
    private final List<Integer> ports;
    private final PortWriters writers;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Random random = new Random();

    private volatile boolean live = true;
    private boolean paused = false;
    private Activation current;
    private Activation main;

    private final Set<Activation> parked = new LinkedHashSet<>();
    private final List<Waiter> waiters = new ArrayList<>();
    private final Set<SuspendTimer> timers = new LinkedHashSet<>();
    private final List<ReceiveHandler> receivers = new ArrayList<>();
    private final List<IntervalHandler> intervals = new ArrayList<>();
    private final List<CanBus.Subscription> subscriptions = new ArrayList<>();

    private long framesSent;
    private long framesReceived;
    private int mainLine;

    private final long startNanos;
    private long pausedNanos;
    private long pauseStartNanos;
    private long endNanos = -1;

    RunContext(ScriptExecutor executor, ReentrantLock lock, Program program, Builtins builtins, CanBus bus,
               List<Integer> ports, PortWriters writers, MonotonicScheduler scheduler, MonotonicClock clock,
               TxScriptOptions options) {
        this.executor = executor;
        this.lock = lock;
        this.program = program;
        this.bus = bus;
        this.ports = List.copyOf(ports);
        this.writers = writers;
        this.scheduler = scheduler;
        this.clock = clock;
        this.options = options;
        this.interpreter = new Interpreter(env, program, builtins, this, options.getMaxDataLength());
        this.startNanos = clock.nowNanos();
    }

    // -------------------------
    // Lifecycle
    // -------------------------

    /** Register handlers, subscribe to the ports and queue the main task. Caller holds the lock. */
    void begin() {
        for (Statement.OnReceive decl : program.receiveHandlers()) {
            receivers.add(new ReceiveHandler(decl));
        }
        for (Statement.OnInterval decl : program.intervalHandlers()) {
            registerInterval(decl);
        }
        for (int port : ports) {
            subscriptions.add(bus.subscribe(port, this::onFrame));
        }

        main = new Activation(this, Activation.Kind.MAIN, "main", 0);
        main.pushRoot(program.statements(), Environment.GLOBAL, false);
        scheduleSlice(main);

        Debug.get().i(TAG, "run started on ports " + ports + " with " + receivers.size()
                + " receive handler(s) and " + intervals.size() + " interval handler(s)");
    }

    private void registerInterval(Statement.OnInterval decl) {
        long period;
        try {
            period = Interpreter.requireInt(interpreter.evaluate(decl.period, Environment.GLOBAL),
                    decl.period.position(), "Interval period");
            if (period <= 0) {
                throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT,
                        "Interval period must be > 0, got " + period, decl.period.position());
            }
        } catch (ScriptRuntimeException e) {
            report(e.at(decl.keyword));
            Debug.get().w(TAG, "on_interval at line " + decl.keyword.line + " disabled: " + e.getMessage());
            return;
        }
        IntervalHandler h = new IntervalHandler(decl, period * 1_000_000L);
        h.nextDeadline = clock.nowNanos() + h.periodNanos;
        intervals.add(h);
        armInterval(h);
    }

    boolean isLive() { return live; }
    boolean isPaused() { return paused; }

    /** Mark the run dead without the lock; pending callbacks become no-ops. */
    void kill() {
        live = false;
    }

    /**
     * Release everything the run holds. Caller holds the lock.
     *
     * @param graceful let queued port writes finish instead of interrupting them
     */
    void shutdown(boolean graceful) {
        live = false;
        long now = clock.nowNanos();
        if (endNanos < 0) {
            if (paused) pausedNanos += now - pauseStartNanos;
            endNanos = now;
        }
        paused = false;
        for (SuspendTimer t : timers) {
            if (t.handle != null) t.handle.cancel();
        }
        timers.clear();
        for (IntervalHandler h : intervals) {
            if (h.handle != null) h.handle.cancel();
        }
        for (CanBus.Subscription s : subscriptions) {
            s.close();
        }
        subscriptions.clear();
        if (graceful) writers.shutdown();
        else writers.close();
        waiters.clear();
        parked.clear();
        Debug.get().d(TAG, "run released: " + framesSent + " sent, " + framesReceived + " received");
    }

    void pause() {
        paused = true;
        long now = clock.nowNanos();
        pauseStartNanos = now;
        for (SuspendTimer t : timers) {
            t.generation++;
            if (t.handle != null) t.handle.cancel();
            t.handle = null;
            t.remainingNanos = Math.max(0, t.deadlineNanos - now);
        }
    }

    void resume() {
        long now = clock.nowNanos();
        pausedNanos += now - pauseStartNanos;
        paused = false;
        for (SuspendTimer t : new ArrayList<>(timers)) {
            arm(t, now + t.remainingNanos);
        }
        List<Activation> ready = new ArrayList<>(parked);
        parked.clear();
        for (Activation a : ready) {
            scheduleSlice(a);
        }
    }

    /** Running time in ms, excluding paused time. */
    long runMillis() {
        long end = (endNanos >= 0) ? endNanos : clock.nowNanos();
        long pausedTotal = pausedNanos;
        if (paused && endNanos < 0) pausedTotal += end - pauseStartNanos;
        return Math.max(0, end - startNanos - pausedTotal) / 1_000_000L;
    }

    long framesSent() { return framesSent; }
    long framesReceived() { return framesReceived; }
    int mainLine() { return mainLine; }
    long mainIteration() { return (main == null) ? 0 : main.iteration(); }

    // -------------------------
    // Task plumbing
    // -------------------------

    /** Take the run lock and run {@code task} unless the run has died. */
    void guarded(Runnable task) {
        lock.lock();
        try {
            if (!live) return;
            task.run();
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "internal error in script task", e);
            executor.reportError(ScriptError.runtime(0, 0, ErrorKind.GENERAL, "Internal error: " + e));
        } finally {
            lock.unlock();
        }
    }

    void scheduleSlice(Activation a) {
        if (a.sliceScheduled || a.isDone()) return;
        a.sliceScheduled = true;
        scheduler.scheduleAtNanos(clock.nowNanos(), () -> guarded(() -> {
            a.sliceScheduled = false;
            if (a.isDone() || a.isSuspended()) return;
            if (paused) {
                parked.add(a);
                return;
            }
            a.runSlice(options.getStepBudget());
        }));
    }

    void park(Activation a) {
        parked.add(a);
    }

    Activation enter(Activation a) {
        Activation previous = current;
        current = a;
        return previous;
    }

    void exit(Activation previous) {
        current = previous;
    }

    void activationEnded(Activation a) {
        parked.remove(a);
        if (a != main) return;
        Debug.get().d(TAG, "main sequence finished");
        if (receivers.isEmpty() && intervals.isEmpty()) {
            executor.runCompleted(this);
        }
    }

    void onMainStatement(int line) {
        mainLine = line;
    }

    // -------------------------
    // Timers
    // -------------------------

    SuspendTimer startTimer(long millis, Runnable onExpire) {
        SuspendTimer t = new SuspendTimer(onExpire);
        timers.add(t);
        if (paused) {
            t.remainingNanos = millis * 1_000_000L;
        } else {
            arm(t, clock.nowNanos() + millis * 1_000_000L);
        }
        return t;
    }

    private void arm(SuspendTimer t, long deadlineNanos) {
        t.deadlineNanos = deadlineNanos;
        int generation = ++t.generation;
        t.handle = scheduler.scheduleAtNanos(deadlineNanos, () -> guarded(() -> {
            // stale after pause() or cancel
            if (t.generation != generation || paused || !timers.remove(t)) return;
            t.onExpire.run();
        }));
    }

    private void cancelTimer(SuspendTimer t) {
        if (t == null) return;
        timers.remove(t);
        t.generation++;
        if (t.handle != null) t.handle.cancel();
    }

    // -------------------------
    // wait_for
    // -------------------------

    void startWait(Activation a, Statement.WaitFor stmt, int scope, long timeoutMillis) {
        Waiter w = new Waiter(a, stmt, scope);
        waiters.add(w);
        w.timer = startTimer(timeoutMillis, () -> {
            waiters.remove(w);
            Debug.get().d(TAG, "wait_for at line " + stmt.keyword.line + " timed out in " + a.label);
            a.waitTimedOut(stmt, scope);
        });
    }

    private void offerToWaiters(CanFrame frame) {
        for (Waiter w : new ArrayList<>(waiters)) {
            if (!waiters.contains(w)) continue;
            boolean matched;
            try {
                matched = matches(w.stmt.predicate, w.scope, frame);
            } catch (ScriptRuntimeException e) {
                waiters.remove(w);
                cancelTimer(w.timer);
                ScriptRuntimeException err = e.at(w.stmt.keyword);
                w.activation.wake(() -> {
                    throw err;
                });
                continue;
            }
            if (matched) {
                waiters.remove(w);
                cancelTimer(w.timer);
                env.bind(w.scope, "response", Value.frame(frame));
                w.activation.wake(null);
            }
        }
    }

    /** Evaluate a predicate in a throwaway scope holding the frame fields. */
    private boolean matches(Expr.ExprInterface predicate, int parent, CanFrame frame) {
        int scope = env.push(parent);
        try {
            bindFrameFields(scope, frame);
            Value v = interpreter.evaluate(predicate, scope);
            if (v.getType() == Value.Type.BOOL) return v.asBool();
            if (v.getType() == Value.Type.INT) return frame.id() == v.asInt();
            throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR,
                    "Predicate must be a bool or a frame id, got " + v.typeName(), predicate.position());
        } finally {
            env.release(scope);
        }
    }

    private void bindFrameFields(int scope, CanFrame frame) {
        for (String field : new String[] { "id", "data", "ext", "port", "timestamp", "dlc" }) {
            env.bind(scope, field, Interpreter.frameField(frame, field));
        }
    }

    // -------------------------
    // Inbound frames and handlers
    // -------------------------

    private void onFrame(CanFrame frame) {
        if (!live) return;
        guarded(() -> {
            framesReceived++;
            executor.log().add(ScriptLogEntry.Type.RECEIVE, "port " + frame.port() + " " + frame, 0);
            offerToWaiters(frame);
            if (paused) return;
            for (ReceiveHandler h : receivers) {
                if (h.enabled) dispatch(h, frame);
            }
        });
    }

    private void dispatch(ReceiveHandler h, CanFrame frame) {
        boolean matched;
        try {
            matched = matches(h.decl.predicate, Environment.GLOBAL, frame);
        } catch (ScriptRuntimeException e) {
            h.enabled = false;
            report(e.at(h.decl.keyword));
            Debug.get().w(TAG, "on_receive at line " + h.decl.keyword.line + " disabled: " + e.getMessage());
            return;
        }
        if (!matched) return;

        Activation a = new Activation(this, Activation.Kind.RECEIVE, "on_receive@" + h.decl.keyword.line, 0);
        int root = env.push(Environment.GLOBAL);
        bindFrameFields(root, frame);
        env.bind(root, "response", Value.frame(frame));
        a.pushRoot(h.decl.body.statements, root, true);
        scheduleSlice(a);
    }

    private void armInterval(IntervalHandler h) {
        h.handle = scheduler.scheduleAtNanos(h.nextDeadline, () -> guarded(() -> tick(h)));
    }

    private void tick(IntervalHandler h) {
        long now = clock.nowNanos();
        h.nextDeadline += h.periodNanos;
        if (h.nextDeadline <= now) h.nextDeadline = now + h.periodNanos;
        armInterval(h);

        if (paused) return;
        if (h.active != null && !h.active.isDone()) {
            Debug.get().t(TAG, "on_interval at line " + h.decl.keyword.line + " still running, tick skipped");
            return;
        }
        Activation a = new Activation(this, Activation.Kind.INTERVAL, "on_interval@" + h.decl.keyword.line, 0);
        a.pushRoot(h.decl.body.statements, env.push(Environment.GLOBAL), true);
        h.active = a;
        scheduleSlice(a);
    }

    // -------------------------
    // send
    // -------------------------

    void send(Activation a, Token at, long id, byte[] data, boolean extended) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(ports.size());
        for (int port : ports) {
            futures.add(writers.write(port, id, data, extended));
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        if (all.isDone()) {
            sendCompleted(futures, at, id, data, extended);
            return;
        }
        if (a.kind == Activation.Kind.CALL) {
            // inside an expression: results are reported when they arrive
            all.whenComplete((r, e) -> guarded(() -> sendCompleted(futures, at, id, data, extended)));
            return;
        }
        a.suspend(at, "send");
        all.whenComplete((r, e) -> guarded(() -> {
            sendCompleted(futures, at, id, data, extended);
            a.wake(null);
        }));
    }

    private void sendCompleted(List<CompletableFuture<Boolean>> futures, Token at, long id, byte[] data, boolean extended) {
        String frameText = CanFrame.formatId(id, extended) + " [" + CanFrame.hex(data) + "]";
        for (int i = 0; i < futures.size(); i++) {
            int port = ports.get(i);
            String failure;
            try {
                if (futures.get(i).join()) {
                    framesSent++;
                    executor.log().add(ScriptLogEntry.Type.SEND, "port " + port + " " + frameText, at.line);
                    continue;
                }
                failure = "port " + port + " rejected frame " + frameText;
            } catch (CompletionException | CancellationException e) {
                Throwable cause = (e.getCause() != null) ? e.getCause() : e;
                failure = "port " + port + " failed to send " + frameText + ": " + cause.getMessage();
            }
            Debug.get().w(TAG, failure);
            report(new ScriptRuntimeException(ErrorKind.SEND_ERROR, failure, at));
        }
    }

    // -------------------------
    // Output and errors
    // -------------------------

    void print(String text, int line) {
        executor.log().add(ScriptLogEntry.Type.INFO, text, line);
        Debug.get().i("txscript.print", text);
    }

    void report(ScriptRuntimeException e) {
        executor.reportError(e.toScriptError());
    }

    void debug(String message) {
        Debug.get().d(TAG, message);
    }

    // -------------------------
    // Interpreter.Host
    // -------------------------

    @Override
    public Value callFunction(FunctionDecl fn, List<Value> args, Token at) {
        int depth = (current == null) ? 0 : current.callDepth();
        Activation call = new Activation(this, Activation.Kind.CALL, fn.name.text, depth);
        Value[] result = { Value.voidValue() };
        call.pushCall(fn, args, at, v -> result[0] = v);
        call.runToCompletion();
        return result[0];
    }

    @Override
    public Random random() {
        return random;
    }
}
