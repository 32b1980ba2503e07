package com.txscript.script.runtime;

import java.util.Arrays;
import java.util.Objects;

import com.txscript.bus.CanFrame;
import com.txscript.script.error.ErrorKind;

/**
 * Tagged script value. Immutable: byte arrays are never modified in place, an index
 * assignment binds a modified copy.
 */
public class Value {
    public enum Type { INT, FLOAT, BOOL, STRING, BYTES, FRAME, FUNC, VOID }

    private static final Value VOID = new Value(Type.VOID, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value bytes(byte[] b) { return new Value(Type.BYTES, Objects.requireNonNull(b)); }
    public static Value frame(CanFrame f) { return new Value(Type.FRAME, Objects.requireNonNull(f)); }
    /** Reference to a user function or builtin by name. */
    public static Value func(String name) { return new Value(Type.FUNC, Objects.requireNonNull(name)); }
    public static Value voidValue() { return VOID; }

    public Type getType() { return type; }

    public boolean isNumeric() { return type == Type.INT || type == Type.FLOAT; }

    public long asInt() {
        if (type != Type.INT) throw typeError("int");
        return (long) value;
    }

    /** INT or FLOAT widened to double. */
    public double asDouble() {
        if (type == Type.INT) return (long) value;
        if (type == Type.FLOAT) return (double) value;
        throw typeError("number");
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw typeError("bool");
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw typeError("string");
        return (String) value;
    }

    /** The backing array; callers must not modify it. */
    public byte[] asBytes() {
        if (type != Type.BYTES) throw typeError("bytes");
        return (byte[]) value;
    }

    public CanFrame asFrame() {
        if (type != Type.FRAME) throw typeError("frame");
        return (CanFrame) value;
    }

    public String asFunc() {
        if (type != Type.FUNC) throw typeError("function");
        return (String) value;
    }

    private ScriptRuntimeException typeError(String expected) {
        return new ScriptRuntimeException(ErrorKind.TYPE_ERROR, "Expected " + expected + ", got " + typeName());
    }

    public String typeName() {
        return type.name().toLowerCase();
    }

    /** Text used by print and str(): strings unquoted, bytes as "[02 01 0C]". */
    public String display() {
        switch (type) {
            case INT: return Long.toString((long) value);
            case FLOAT: return Double.toString((double) value);
            case BOOL: return Boolean.toString((boolean) value);
            case STRING: return (String) value;
            case BYTES: return "[" + CanFrame.hex((byte[]) value) + "]";
            case FRAME: {
                CanFrame f = (CanFrame) value;
                return CanFrame.formatId(f.id(), f.extended()) + " [" + CanFrame.hex(f.data()) + "]";
            }
            case FUNC: return "<function " + value + ">";
            case VOID: return "void";
            default: return String.valueOf(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.BYTES) return Arrays.equals((byte[]) value, (byte[]) other.value);
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.BYTES) return 31 * type.hashCode() + Arrays.hashCode((byte[]) value);
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING: return '"' + (String) value + '"';
            case VOID: return "void";
            default: return typeName() + "(" + display() + ")";
        }
    }
}
