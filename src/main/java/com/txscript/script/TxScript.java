package com.txscript.script;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.txscript.bus.CanBus;
import com.txscript.bus.PortWriters;
import com.txscript.script.error.ScriptError;
import com.txscript.script.parser.LexResult;
import com.txscript.script.parser.Lexer;
import com.txscript.script.parser.ParseResult;
import com.txscript.script.parser.Parser;
import com.txscript.script.runtime.Builtins;
import com.txscript.script.runtime.ScriptExecutor;
import com.txscript.script.time.MonotonicClock;
import com.txscript.script.time.MonotonicScheduler;

/**
 * TxScript engine entry point.
 *
 * - Line-oriented DSL for CAN bus tests: send / delay / wait_for / repeat / loop / if
 * - Types: int, float, bool, string, bytes, frame, function
 * - Event handlers: on_receive(predicate) { ... }, on_interval(ms) { ... }
 * - Built-ins: abs min max len hex str int float, plus now() and stop() from the executor
 *
 * Host code registers extra built-ins with {@link #registerFunction} before creating an
 * executor; every executor gets its own copy of the table.
 */
public class TxScript {

    private final TxScriptOptions options;
    private final Builtins builtins = Builtins.standard();

    public TxScript() {
        this(new TxScriptOptions());
    }

    public TxScript(TxScriptOptions options) {
        options.validate();
        this.options = options;
    }

    public TxScriptOptions options() { return options; }

    public void registerFunction(String name, Builtins.BuiltinFunction fn) {
        if (ScriptExecutor.RUNTIME_BUILTINS.contains(name)) {
            throw new IllegalArgumentException("'" + name + "' is reserved by the executor");
        }
        builtins.register(name, fn);
    }

    /** Names a script may not reuse for its own functions. */
    public Set<String> builtinNames() {
        Set<String> names = new HashSet<>(builtins.names());
        names.addAll(ScriptExecutor.RUNTIME_BUILTINS);
        return names;
    }

    public LexResult tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    /** Lex and parse; LEX and PARSE errors of the whole source are merged, in source order. */
    public ParseResult parse(String source) {
        return compile(source, builtinNames());
    }

    public static ParseResult compile(String source, Set<String> builtinNames) {
        LexResult lexed = new Lexer(source).tokenize();
        ParseResult parsed = new Parser(lexed.tokens(), builtinNames).parse();
        if (!lexed.hasErrors()) return parsed;

        List<ScriptError> all = new ArrayList<>(lexed.errors());
        all.addAll(parsed.errors());
        all.sort((a, b) -> (a.getLine() != b.getLine())
                ? Integer.compare(a.getLine(), b.getLine())
                : Integer.compare(a.getColumn(), b.getColumn()));
        return new ParseResult(parsed.program(), all);
    }

    public ScriptExecutor newExecutor(CanBus bus, MonotonicScheduler scheduler, MonotonicClock clock) {
        return new ScriptExecutor(bus, scheduler, clock, options, builtins, PortWriters.SINGLE_THREAD_PER_PORT);
    }

    public ScriptExecutor newExecutor(CanBus bus, MonotonicScheduler scheduler, MonotonicClock clock,
                                      PortWriters.ExecutorFactory writerFactory) {
        return new ScriptExecutor(bus, scheduler, clock, options, builtins, writerFactory);
    }
}
