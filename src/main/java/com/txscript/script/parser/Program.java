package com.txscript.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.txscript.script.parser.Statement.FunctionDecl;
import com.txscript.script.parser.Statement.OnInterval;
import com.txscript.script.parser.Statement.OnReceive;
import com.txscript.script.parser.Statement.Stmt;

/**
 * A parsed script: the top-level statements of the main sequence, the user functions
 * and the event handlers, in declaration order.
 */
public final class Program {
    private final Map<String, FunctionDecl> functions;
    private final List<OnReceive> receiveHandlers;
    private final List<OnInterval> intervalHandlers;
    private final List<Stmt> statements;
    private final int totalLines;

    Program(Map<String, FunctionDecl> functions,
            List<OnReceive> receiveHandlers,
            List<OnInterval> intervalHandlers,
            List<Stmt> statements,
            int totalLines) {
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.receiveHandlers = List.copyOf(receiveHandlers);
        this.intervalHandlers = List.copyOf(intervalHandlers);
        this.statements = List.copyOf(statements);
        this.totalLines = totalLines;
    }

    public Map<String, FunctionDecl> functions() { return functions; }
    public FunctionDecl function(String name) { return functions.get(name); }
    public List<OnReceive> receiveHandlers() { return receiveHandlers; }
    public List<OnInterval> intervalHandlers() { return intervalHandlers; }
    public List<Stmt> statements() { return statements; }
    public int totalLines() { return totalLines; }

    public boolean hasHandlers() {
        return !receiveHandlers.isEmpty() || !intervalHandlers.isEmpty();
    }
}
