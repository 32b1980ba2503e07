package com.txscript.script.runtime;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

import com.txscript.bus.CanFrame;
import com.txscript.script.error.ErrorKind;
import com.txscript.script.parser.Expr;
import com.txscript.script.parser.Statement;
import com.txscript.script.parser.Statement.Block;
import com.txscript.script.parser.Statement.FunctionDecl;
import com.txscript.script.parser.Statement.Stmt;
import com.txscript.script.parser.Token;

/**
 * One running instance of the main sequence, a handler body, or a function called from
 * inside an expression.
 *
 * Execution state lives in an explicit frame stack rather than on the Java stack, so an
 * activation can stop in the middle of a loop or a function call, wait for a timer or a
 * frame, and carry on later from a scheduler callback. Each call to {@link #runSlice}
 * executes statements until the activation suspends, finishes, or uses up its budget.
 */
final class Activation implements Statement.StmtVisitor {

    enum Kind {
        MAIN,
        RECEIVE,
        INTERVAL,
        /** Function called from inside an expression: runs to completion and cannot suspend. */
        CALL
    }

    // -------------------------
    // Frames
    // -------------------------

    abstract static class Frame {
        /** Scope the statements of this frame execute in. */
        final int scope;
        boolean finished;

        Frame(int scope) {
            this.scope = scope;
        }

        /** Next statement to run, or null after pushing a frame or finishing. */
        abstract Stmt step(Activation a);

        void exit(Environment env) {}

        boolean isLoop() { return false; }
    }

    static final class BlockFrame extends Frame {
        private final List<Stmt> statements;
        private final boolean ownsScope;
        private int index = 0;

        BlockFrame(List<Stmt> statements, int scope, boolean ownsScope) {
            super(scope);
            this.statements = statements;
            this.ownsScope = ownsScope;
        }

        @Override
        Stmt step(Activation a) {
            if (index < statements.size()) return statements.get(index++);
            finished = true;
            return null;
        }

        @Override
        void exit(Environment env) {
            if (ownsScope) env.release(scope);
        }
    }

    /** repeat(N) and loop; {@code count < 0} means unbounded. */
    static final class LoopFrame extends Frame {
        private final Block body;
        private final long count;
        private long iteration = 0;

        LoopFrame(int scope, Block body, long count) {
            super(scope);
            this.body = body;
            this.count = count;
        }

        @Override
        Stmt step(Activation a) {
            if (count >= 0 && iteration >= count) {
                finished = true;
                return null;
            }
            a.enterIteration(this, body, iteration++);
            return null;
        }

        @Override
        boolean isLoop() { return true; }
    }

    static final class CallFrame extends Frame {
        private final FunctionDecl function;
        private final Token callSite;
        private final Consumer<Value> onReturn;
        private boolean entered = false;
        private Value result = Value.voidValue();

        CallFrame(int scope, FunctionDecl function, Token callSite, Consumer<Value> onReturn) {
            super(scope);
            this.function = function;
            this.callSite = callSite;
            this.onReturn = onReturn;
        }

        @Override
        Stmt step(Activation a) {
            if (!entered) {
                entered = true;
                a.push(new BlockFrame(function.body.statements, scope, false));
                return null;
            }
            // fell off the end of the body
            finished = true;
            return null;
        }

        @Override
        void exit(Environment env) {
            env.release(scope);
        }
    }

    // -------------------------
    // State
    // -------------------------

    final RunContext run;
    final Kind kind;
    final String label;
    private final Environment env;
    private final Interpreter interpreter;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private int callDepth;
    private boolean suspended = false;
    private boolean done = false;
    private Runnable resumeAction;
    private Token position;
    private long iteration = 0;

    /** Guarded by the run lock; set while a slice is queued on the scheduler. */
    boolean sliceScheduled = false;

    Activation(RunContext run, Kind kind, String label, int callDepth) {
        this.run = run;
        this.kind = kind;
        this.label = label;
        this.env = run.env;
        this.interpreter = run.interpreter;
        this.callDepth = callDepth;
    }

    void pushRoot(List<Stmt> statements, int scope, boolean ownsScope) {
        push(new BlockFrame(statements, scope, ownsScope));
    }

    void push(Frame frame) {
        stack.push(frame);
    }

    boolean isDone() { return done; }
    boolean isSuspended() { return suspended; }
    int callDepth() { return callDepth; }
    long iteration() { return iteration; }
    Token position() { return position; }

    private int scope() {
        return stack.peek().scope;
    }

    // -------------------------
    // Driving
    // -------------------------

    /** Run until suspended, finished, paused or out of budget. Caller holds the run lock. */
    void runSlice(int budget) {
        Activation previous = run.enter(this);
        try {
            if (resumeAction != null) {
                Runnable action = resumeAction;
                resumeAction = null;
                try {
                    action.run();
                } catch (ScriptRuntimeException e) {
                    fail(e.at(position));
                }
            }
            while (!done && !suspended && run.isLive()) {
                if (stack.isEmpty()) {
                    complete();
                    return;
                }
                if (run.isPaused()) {
                    run.park(this);
                    return;
                }
                if (budget-- <= 0) {
                    run.scheduleSlice(this);
                    return;
                }
                step();
            }
        } finally {
            run.exit(previous);
        }
    }

    /** Synchronous execution for {@link Kind#CALL}; errors propagate to the caller. */
    void runToCompletion() {
        Activation previous = run.enter(this);
        try {
            while (!stack.isEmpty() && run.isLive()) {
                step();
            }
            done = true;
        } finally {
            run.exit(previous);
        }
    }

    private void step() {
        Frame top = stack.peek();
        Stmt stmt = null;
        try {
            if (!top.finished) stmt = top.step(this);
            if (top.finished) {
                popFinished(top);
            } else if (stmt != null) {
                execute(stmt);
            }
        } catch (ScriptRuntimeException e) {
            fail(e.at(stmt != null ? stmt.position() : position));
        }
    }

    private void execute(Stmt stmt) {
        position = stmt.position();
        if (kind == Kind.MAIN) run.onMainStatement(position.line);
        stmt.accept(this);
    }

    private void popFinished(Frame top) {
        stack.pop();
        top.exit(env);
        if (top instanceof CallFrame) {
            CallFrame call = (CallFrame) top;
            callDepth--;
            try {
                call.onReturn.accept(call.result);
            } catch (ScriptRuntimeException e) {
                throw e.at(call.callSite);
            }
        }
    }

    private void fail(ScriptRuntimeException e) {
        if (kind == Kind.CALL) {
            unwindAll();
            throw e;
        }
        run.report(e);
        if (kind != Kind.MAIN) {
            run.debug(label + " abandoned after error: " + e.getMessage());
            unwindAll();
            complete();
        }
    }

    private void complete() {
        if (done) return;
        done = true;
        run.activationEnded(this);
    }

    /** Drop every frame, releasing the scopes they own. */
    void unwindAll() {
        while (!stack.isEmpty()) {
            stack.pop().exit(env);
        }
    }

    void suspend(Token at, String what) {
        if (kind == Kind.CALL) {
            throw new ScriptRuntimeException(ErrorKind.GENERAL,
                    what + " cannot run in a function called from inside an expression; call it as a statement", at);
        }
        suspended = true;
    }

    /** Continue after a suspension; {@code action} runs first, inside the next slice. */
    void wake(Runnable action) {
        if (done) return;
        suspended = false;
        resumeAction = action;
        run.scheduleSlice(this);
    }

    void enterIteration(LoopFrame loop, Block body, long i) {
        int s = env.push(loop.scope);
        env.bind(s, "iteration", Value.integer(i));
        iteration = i;
        push(new BlockFrame(body.statements, s, true));
    }

    void pushCall(FunctionDecl fn, List<Value> args, Token at, Consumer<Value> onReturn) {
        if (callDepth + 1 > run.options.getMaxCallDepth()) {
            throw new ScriptRuntimeException(ErrorKind.GENERAL,
                    "Maximum call depth exceeded (" + run.options.getMaxCallDepth() + ")", at);
        }
        int s = env.push(Environment.GLOBAL);
        for (int i = 0; i < fn.params.size(); i++) {
            env.bind(s, fn.params.get(i).text, args.get(i));
        }
        callDepth++;
        push(new CallFrame(s, fn, at, onReturn));
    }

    /** A call in statement position: user functions run on this stack and may suspend. */
    private void startCall(Expr.Call call, Consumer<Value> onReturn) {
        Interpreter.PreparedCall prepared = interpreter.prepareCall(call, scope());
        if (prepared.isUserFunction()) {
            pushCall(prepared.function, prepared.args, prepared.at, onReturn);
        } else {
            onReturn.accept(interpreter.invokeBuiltin(prepared));
        }
    }

    private Value eval(Expr.ExprInterface expr) {
        return interpreter.evaluate(expr, scope());
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public void visitVarDecl(Statement.VarDecl stmt) {
        int s = scope();
        String name = stmt.name.text;
        if (stmt.initializer instanceof Expr.Call) {
            startCall((Expr.Call) stmt.initializer, v -> define(s, stmt.name, v));
            return;
        }
        Value value = (stmt.initializer == null) ? Value.voidValue() : eval(stmt.initializer);
        define(s, stmt.name, value);
    }

    private void define(int s, Token name, Value value) {
        try {
            env.define(s, name.text, value);
        } catch (ScriptRuntimeException e) {
            throw e.at(name);
        }
    }

    @Override
    public void visitAssign(Statement.Assign stmt) {
        int s = scope();
        if (stmt.value instanceof Expr.Call) {
            startCall((Expr.Call) stmt.value, v -> assign(s, stmt.name, v));
            return;
        }
        assign(s, stmt.name, eval(stmt.value));
    }

    private void assign(int s, Token name, Value value) {
        if (!env.assign(s, name.text, value)) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name.text + "'", name);
        }
    }

    @Override
    public void visitIndexAssign(Statement.IndexAssign stmt) {
        int s = scope();
        Value current = env.lookup(s, stmt.name.text);
        if (current == null) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + stmt.name.text + "'", stmt.name);
        }
        if (current.getType() != Value.Type.BYTES) {
            throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR,
                    "Cannot index-assign a value of type " + current.typeName(), stmt.name);
        }
        long i = Interpreter.requireInt(eval(stmt.index), stmt.index.position(), "Index");
        byte b = Interpreter.toByte(eval(stmt.value), stmt.value.position());
        byte[] copy = current.asBytes().clone();
        Interpreter.checkIndex(i, copy.length, stmt.index.position());
        copy[(int) i] = b;
        assign(s, stmt.name, Value.bytes(copy));
    }

    @Override
    public void visitSend(Statement.Send stmt) {
        long id = Interpreter.requireInt(eval(stmt.id), stmt.id.position(), "Frame id");
        byte[] data = payload(eval(stmt.data), stmt.data.position());
        boolean extended = stmt.extended != null
                && Interpreter.requireBool(eval(stmt.extended), stmt.extended.position(), "Extended flag");

        long maxId = extended ? CanFrame.MAX_EXTENDED_ID : CanFrame.MAX_STANDARD_ID;
        if (id < 0 || id > maxId) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT,
                    String.format("Frame id 0x%X out of range for %s frame (max 0x%X)",
                            id, extended ? "an extended" : "a standard", maxId), stmt.id.position());
        }
        if (data.length > run.options.getMaxDataLength()) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT,
                    "Frame data too long: " + data.length + " bytes (max " + run.options.getMaxDataLength() + ")",
                    stmt.data.position());
        }
        run.send(this, stmt.keyword, id, data, extended);
    }

    /** BYTES as-is; an INT 0..255 is a one-byte payload. */
    private static byte[] payload(Value v, Token at) {
        if (v.getType() == Value.Type.BYTES) return v.asBytes();
        if (v.getType() == Value.Type.INT) return new byte[] { Interpreter.toByte(v, at) };
        throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, "Frame data must be bytes, got " + v.typeName(), at);
    }

    @Override
    public void visitDelay(Statement.Delay stmt) {
        long ms = millis(eval(stmt.duration), stmt.duration.position(), "Delay");
        suspend(stmt.keyword, "delay");
        run.startTimer(ms, () -> wake(null));
    }

    private static long millis(Value v, Token at, String what) {
        long ms;
        if (v.getType() == Value.Type.FLOAT) ms = Math.round(v.asDouble());
        else ms = Interpreter.requireInt(v, at, what);
        if (ms < 0) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, what + " must not be negative: " + ms, at);
        }
        return ms;
    }

    @Override
    public void visitRepeat(Statement.Repeat stmt) {
        long count = Interpreter.requireInt(eval(stmt.count), stmt.count.position(), "Repeat count");
        if (count < 0) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "Repeat count must not be negative: " + count,
                    stmt.count.position());
        }
        push(new LoopFrame(scope(), stmt.body, count));
    }

    @Override
    public void visitLoop(Statement.Loop stmt) {
        push(new LoopFrame(scope(), stmt.body, -1));
    }

    @Override
    public void visitIf(Statement.If stmt) {
        boolean cond = interpreter.evaluateCondition(stmt.condition, scope());
        Stmt branch = cond ? stmt.thenBranch : stmt.elseBranch;
        if (branch != null) {
            position = branch.position();
            branch.accept(this);
        }
    }

    @Override
    public void visitWaitFor(Statement.WaitFor stmt) {
        long timeout = millis(eval(stmt.timeout), stmt.timeout.position(), "Timeout");
        suspend(stmt.keyword, "wait_for");
        run.startWait(this, stmt, scope(), timeout);
    }

    /** Timeout path of wait_for: run the fallback block, or fail with TIMEOUT. */
    void waitTimedOut(Statement.WaitFor stmt, int s) {
        if (stmt.fallback != null) {
            wake(() -> push(new BlockFrame(stmt.fallback.statements, env.push(s), true)));
        } else {
            wake(() -> {
                throw new ScriptRuntimeException(ErrorKind.TIMEOUT, "wait_for timed out", stmt.keyword);
            });
        }
    }

    @Override
    public void visitFunctionDecl(FunctionDecl stmt) {
        // hoisted into the program by the parser
    }

    @Override
    public void visitOnReceive(Statement.OnReceive stmt) {
        // registered at start
    }

    @Override
    public void visitOnInterval(Statement.OnInterval stmt) {
        // registered at start
    }

    @Override
    public void visitReturn(Statement.Return stmt) {
        if (stmt.value instanceof Expr.Call) {
            startCall((Expr.Call) stmt.value, this::doReturn);
            return;
        }
        doReturn(stmt.value == null ? Value.voidValue() : eval(stmt.value));
    }

    /** Unwind to the innermost call frame; outside any call the activation ends. */
    private void doReturn(Value value) {
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            if (f instanceof CallFrame) {
                ((CallFrame) f).result = value;
                f.finished = true;
                return;
            }
            stack.pop().exit(env);
        }
    }

    @Override
    public void visitBreak(Statement.Break stmt) {
        unwindToLoop(stmt.keyword);
        stack.pop().exit(env);
    }

    @Override
    public void visitContinue(Statement.Continue stmt) {
        unwindToLoop(stmt.keyword);
    }

    private void unwindToLoop(Token at) {
        while (!stack.isEmpty() && !stack.peek().isLoop()) {
            if (stack.peek() instanceof CallFrame) break;
            stack.pop().exit(env);
        }
        if (stack.isEmpty() || !stack.peek().isLoop()) {
            throw new ScriptRuntimeException(ErrorKind.GENERAL, "'" + at.text + "' outside of a loop", at);
        }
    }

    @Override
    public void visitPrint(Statement.Print stmt) {
        StringBuilder sb = new StringBuilder();
        for (Expr.ExprInterface e : stmt.values) {
            sb.append(eval(e).display());
        }
        run.print(sb.toString(), stmt.keyword.line);
    }

    @Override
    public void visitExprStmt(Statement.ExprStmt stmt) {
        if (stmt.expression instanceof Expr.Call) {
            startCall((Expr.Call) stmt.expression, v -> { });
            return;
        }
        eval(stmt.expression);
    }

    @Override
    public void visitBlock(Block stmt) {
        push(new BlockFrame(stmt.statements, env.push(scope()), true));
    }
}
