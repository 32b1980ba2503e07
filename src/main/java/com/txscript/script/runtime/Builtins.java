package com.txscript.script.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.txscript.bus.CanFrame;
import com.txscript.script.error.ErrorKind;

/**
 * Registry of host functions callable from scripts.
 *
 * {@link #standard()} holds the pure builtins (abs, min, max, len, hex, str, int, float).
 * The executor adds the run-bound ones ({@code now}, {@code stop}) to its own copy.
 */
public final class Builtins {

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();

    public static Builtins standard() {
        Builtins b = new Builtins();
        b.registerCore();
        return b;
    }

    public Builtins copy() {
        Builtins b = new Builtins();
        b.functions.putAll(functions);
        return b;
    }

    public void register(String name, BuiltinFunction fn) {
        functions.put(name, fn);
    }

    public BuiltinFunction get(String name) {
        return functions.get(name);
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    private void registerCore() {
        register("abs", args -> {
            requireArgCount("abs", args, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.INT) return Value.integer(Math.abs(v.asInt()));
            return Value.floating(Math.abs(v.asDouble()));
        });

        register("min", args -> extreme("min", args, true));
        register("max", args -> extreme("max", args, false));

        register("len", args -> {
            requireArgCount("len", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case STRING: return Value.integer(v.asString().length());
                case BYTES: return Value.integer(v.asBytes().length);
                case FRAME: return Value.integer(v.asFrame().dlc());
                default:
                    throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, "len() not supported for type: " + v.typeName());
            }
        });

        register("hex", args -> {
            requireArgCount("hex", args, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.BYTES) return Value.string(CanFrame.hex(v.asBytes()));
            return Value.string(String.format("0x%X", v.asInt()));
        });

        register("str", args -> {
            requireArgCount("str", args, 1);
            return Value.string(args.get(0).display());
        });

        register("int", args -> {
            requireArgCount("int", args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case INT: return v;
                case FLOAT: return Value.integer((long) v.asDouble());
                case BOOL: return Value.integer(v.asBool() ? 1 : 0);
                case STRING: return Value.integer(parseInt(v.asString()));
                default:
                    throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, "int() not supported for type: " + v.typeName());
            }
        });

        register("float", args -> {
            requireArgCount("float", args, 1);
            Value v = args.get(0);
            if (v.getType() == Value.Type.STRING) {
                try {
                    return Value.floating(Double.parseDouble(v.asString().trim()));
                } catch (NumberFormatException e) {
                    throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "float() cannot parse '" + v.asString() + "'");
                }
            }
            return Value.floating(v.asDouble());
        });
    }

    private static Value extreme(String name, List<Value> args, boolean min) {
        if (args.isEmpty()) {
            throw new ScriptRuntimeException(ErrorKind.ARITY_MISMATCH, name + "() expects at least 1 argument");
        }
        boolean allInts = true;
        for (Value v : args) {
            if (!v.isNumeric()) {
                throw new ScriptRuntimeException(ErrorKind.TYPE_ERROR, name + "() expects numbers, got " + v.typeName());
            }
            allInts &= v.getType() == Value.Type.INT;
        }
        if (allInts) {
            long m = args.get(0).asInt();
            for (int i = 1; i < args.size(); i++) {
                long l = args.get(i).asInt();
                m = min ? Math.min(m, l) : Math.max(m, l);
            }
            return Value.integer(m);
        }
        double m = args.get(0).asDouble();
        for (int i = 1; i < args.size(); i++) {
            double d = args.get(i).asDouble();
            m = min ? Math.min(m, d) : Math.max(m, d);
        }
        return Value.floating(m);
    }

    private static long parseInt(String s) {
        String t = s.trim();
        try {
            if (t.startsWith("0x") || t.startsWith("0X")) return Long.parseLong(t.substring(2), 16);
            return Long.parseLong(t);
        } catch (NumberFormatException e) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "int() cannot parse '" + s + "'");
        }
    }

    static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new ScriptRuntimeException(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + expected + " argument" + (expected == 1 ? "" : "s") + ", got " + args.size());
        }
    }
}
