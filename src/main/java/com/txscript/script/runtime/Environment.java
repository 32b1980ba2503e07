package com.txscript.script.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.txscript.script.error.ErrorKind;

/**
 * Variable storage for one run: an arena of scope records addressed by index.
 * Index {@link #GLOBAL} is the global scope; every other scope names its parent.
 *
 * Scopes are pushed per block execution and per function call and released when the
 * block or call ends; released slots are reused. Not thread-safe: the executor's run
 * lock is the only writer.
 */
public final class Environment {
    public static final int GLOBAL = 0;

    private static final class Scope {
        final Map<String, Value> vars = new LinkedHashMap<>();
        int parent;
        boolean live;

        Scope(int parent) {
            this.parent = parent;
            this.live = true;
        }
    }

    private final List<Scope> scopes = new ArrayList<>();
    private final Deque<Integer> free = new ArrayDeque<>();

    public Environment() {
        scopes.add(new Scope(-1));
    }

    /** Allocate a child scope of {@code parent} and return its index. */
    public int push(int parent) {
        checkLive(parent);
        Integer slot = free.pollFirst();
        if (slot == null) {
            scopes.add(new Scope(parent));
            return scopes.size() - 1;
        }
        Scope s = scopes.get(slot);
        s.vars.clear();
        s.parent = parent;
        s.live = true;
        return slot;
    }

    public void release(int scope) {
        if (scope == GLOBAL) throw new IllegalArgumentException("cannot release the global scope");
        Scope s = scopes.get(scope);
        if (!s.live) return;
        s.live = false;
        s.vars.clear();
        free.addLast(scope);
    }

    /** Declare a new variable; redeclaring a name in the same scope is an error. */
    public void define(int scope, String name, Value value) {
        Scope s = checkLive(scope);
        if (s.vars.containsKey(name)) {
            throw new ScriptRuntimeException(ErrorKind.GENERAL, "Variable '" + name + "' is already declared in this scope");
        }
        s.vars.put(name, value);
    }

    /** Bind a name in a scope, replacing any earlier binding there (frame fields, iteration, response). */
    public void bind(int scope, String name, Value value) {
        checkLive(scope).vars.put(name, value);
    }

    /** Nearest binding of {@code name} walking outwards, or null. */
    public Value lookup(int scope, String name) {
        for (int i = scope; i >= 0; i = scopes.get(i).parent) {
            Value v = scopes.get(i).vars.get(name);
            if (v != null) return v;
        }
        return null;
    }

    /** Update the nearest existing binding. Returns false when the name is not declared. */
    public boolean assign(int scope, String name, Value value) {
        for (int i = scope; i >= 0; i = scopes.get(i).parent) {
            Map<String, Value> vars = scopes.get(i).vars;
            if (vars.containsKey(name)) {
                vars.put(name, value);
                return true;
            }
        }
        return false;
    }

    public Map<String, Value> globals() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(scopes.get(GLOBAL).vars));
    }

    public int liveScopes() {
        return scopes.size() - free.size();
    }

    private Scope checkLive(int scope) {
        Scope s = scopes.get(scope);
        if (!s.live) throw new IllegalStateException("scope " + scope + " was released");
        return s;
    }
}
