package com.txscript.script.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.txscript.bus.CanFrame;
import com.txscript.script.error.ErrorKind;
import com.txscript.script.parser.Expr;
import com.txscript.script.parser.Expr.Binary;
import com.txscript.script.parser.Expr.ByteArray;
import com.txscript.script.parser.Expr.Call;
import com.txscript.script.parser.Expr.Identifier;
import com.txscript.script.parser.Expr.Index;
import com.txscript.script.parser.Expr.Literal;
import com.txscript.script.parser.Expr.Logical;
import com.txscript.script.parser.Expr.Member;
import com.txscript.script.parser.Expr.RandomBytesCall;
import com.txscript.script.parser.Expr.RandomCall;
import com.txscript.script.parser.Expr.Ternary;
import com.txscript.script.parser.Expr.Unary;
import com.txscript.script.parser.Program;
import com.txscript.script.parser.Statement.FunctionDecl;
import com.txscript.script.parser.Token;
import com.txscript.script.parser.TokenType;

/**
 * Evaluates expressions against an {@link Environment}.
 *
 * Typing rules:
 * - INT op INT stays INT; mixing INT and FLOAT promotes to FLOAT
 * - '+' concatenates when either side is a string, and joins two byte arrays
 * - bitwise operators and shifts take INT only
 * - conditions, '!', '&&' and '||' take BOOL only
 * - '==' across unrelated types is false; INT and FLOAT compare numerically
 *
 * User function calls nested inside an expression are delegated to the {@link Host},
 * which runs them to completion before evaluation continues.
 */
public class Interpreter implements Expr.ExprVisitor<Value> {

    /** What evaluation needs from the run it belongs to. */
    public interface Host {
        Value callFunction(FunctionDecl fn, List<Value> args, Token at);
        Random random();
    }

    /** A call whose target is resolved and whose arguments are evaluated, not yet invoked. */
    public static final class PreparedCall {
        public final String name;
        public final FunctionDecl function;
        public final Builtins.BuiltinFunction builtin;
        public final List<Value> args;
        public final Token at;

        PreparedCall(String name, FunctionDecl function, Builtins.BuiltinFunction builtin, List<Value> args, Token at) {
            this.name = name;
            this.function = function;
            this.builtin = builtin;
            this.args = args;
            this.at = at;
        }

        public boolean isUserFunction() { return function != null; }
    }

    private final Environment env;
    private final Program program;
    private final Builtins builtins;
    private final Host host;
    private final int maxDataLength;
    private int scope = Environment.GLOBAL;

    public Interpreter(Environment env, Program program, Builtins builtins, Host host, int maxDataLength) {
        this.env = env;
        this.program = program;
        this.builtins = builtins;
        this.host = host;
        this.maxDataLength = maxDataLength;
    }

    public Value evaluate(Expr.ExprInterface expr, int scope) {
        int saved = this.scope;
        this.scope = scope;
        try {
            return eval(expr);
        } finally {
            this.scope = saved;
        }
    }

    public boolean evaluateCondition(Expr.ExprInterface expr, int scope) {
        return requireBool(evaluate(expr, scope), expr.position(), "Condition");
    }

    /** Resolve the callee and evaluate the arguments of a call, without invoking it. */
    public PreparedCall prepareCall(Call expr, int scope) {
        int saved = this.scope;
        this.scope = scope;
        try {
            return prepare(expr);
        } catch (ScriptRuntimeException e) {
            throw e.at(expr.position());
        } finally {
            this.scope = saved;
        }
    }

    /** Invoke a prepared builtin. */
    public Value invokeBuiltin(PreparedCall call) {
        try {
            Value result = call.builtin.call(call.args);
            return (result == null) ? Value.voidValue() : result;
        } catch (ScriptRuntimeException e) {
            throw e.at(call.at);
        } catch (RuntimeException e) {
            throw new ScriptRuntimeException(ErrorKind.GENERAL, call.name + "() failed: " + e.getMessage(), call.at);
        }
    }

    private Value eval(Expr.ExprInterface expr) {
        try {
            return expr.accept(this);
        } catch (ScriptRuntimeException e) {
            throw e.at(expr.position());
        }
    }

    // -------------------------
    // Leaves
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v instanceof Long) return Value.integer((Long) v);
        if (v instanceof Double) return Value.floating((Double) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof String) return Value.string((String) v);
        throw new ScriptRuntimeException(ErrorKind.GENERAL, "Unsupported literal: " + expr.token.text, expr.token);
    }

    @Override
    public Value visitByteArrayExpr(ByteArray expr) {
        byte[] out = new byte[expr.elements.size()];
        for (int i = 0; i < out.length; i++) {
            Expr.ExprInterface element = expr.elements.get(i);
            out[i] = toByte(eval(element), element.position());
        }
        return Value.bytes(out);
    }

    @Override
    public Value visitIdentifierExpr(Identifier expr) {
        String name = expr.name();
        Value v = env.lookup(scope, name);
        if (v != null) return v;
        if (program.function(name) != null || builtins.contains(name)) return Value.func(name);
        throw new ScriptRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", expr.name);
    }

    // -------------------------
    // Operators
    // -------------------------

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS: {
                if (left.getType() == Value.Type.STRING || right.getType() == Value.Type.STRING) {
                    return Value.string(left.display() + right.display());
                }
                if (left.getType() == Value.Type.BYTES && right.getType() == Value.Type.BYTES) {
                    byte[] a = left.asBytes();
                    byte[] b = right.asBytes();
                    byte[] joined = new byte[a.length + b.length];
                    System.arraycopy(a, 0, joined, 0, a.length);
                    System.arraycopy(b, 0, joined, a.length, b.length);
                    return Value.bytes(joined);
                }
                requireNumbers(left, right, op);
                if (bothInts(left, right)) return Value.integer(left.asInt() + right.asInt());
                return Value.floating(left.asDouble() + right.asDouble());
            }
            case MINUS:
                requireNumbers(left, right, op);
                if (bothInts(left, right)) return Value.integer(left.asInt() - right.asInt());
                return Value.floating(left.asDouble() - right.asDouble());
            case STAR:
                requireNumbers(left, right, op);
                if (bothInts(left, right)) return Value.integer(left.asInt() * right.asInt());
                return Value.floating(left.asDouble() * right.asDouble());
            case SLASH:
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                if (bothInts(left, right)) return Value.integer(left.asInt() / right.asInt());
                return Value.floating(left.asDouble() / right.asDouble());
            case PERCENT:
                requireNumbers(left, right, op);
                requireNonZero(right, op);
                if (bothInts(left, right)) return Value.integer(left.asInt() % right.asInt());
                return Value.floating(left.asDouble() % right.asDouble());

            case GREATER: return Value.bool(compare(left, right, op) > 0);
            case GREATER_EQUAL: return Value.bool(compare(left, right, op) >= 0);
            case LESS: return Value.bool(compare(left, right, op) < 0);
            case LESS_EQUAL: return Value.bool(compare(left, right, op) <= 0);

            case EQUAL_EQUAL: return Value.bool(isEqual(left, right));
            case BANG_EQUAL: return Value.bool(!isEqual(left, right));

            case AMPERSAND:
                requireInts(left, right, op);
                return Value.integer(left.asInt() & right.asInt());
            case PIPE:
                requireInts(left, right, op);
                return Value.integer(left.asInt() | right.asInt());
            case CARET:
                requireInts(left, right, op);
                return Value.integer(left.asInt() ^ right.asInt());
            case SHL:
                requireInts(left, right, op);
                return Value.integer(left.asInt() << shiftCount(right, op));
            case SHR:
                requireInts(left, right, op);
                return Value.integer(left.asInt() >> shiftCount(right, op));

            default:
                throw new ScriptRuntimeException(ErrorKind.GENERAL, "Unsupported binary operator: " + op.text, op);
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        boolean left = requireBool(eval(expr.left), expr.operator, "Left operand of '" + expr.operator.text + "'");
        if (expr.operator.type == TokenType.OR_OR) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(requireBool(eval(expr.right), expr.operator, "Right operand of '" + expr.operator.text + "'"));
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!requireBool(right, expr.operator, "Operand of '!'"));
            case MINUS:
                if (right.getType() == Value.Type.INT) return Value.integer(-right.asInt());
                if (right.getType() == Value.Type.FLOAT) return Value.floating(-right.asDouble());
                throw typeError("Operand of '-' must be a number, got " + right.typeName(), expr.operator);
            case TILDE:
                if (right.getType() == Value.Type.INT) return Value.integer(~right.asInt());
                throw typeError("Operand of '~' must be an int, got " + right.typeName(), expr.operator);
            default:
                throw new ScriptRuntimeException(ErrorKind.GENERAL, "Unsupported unary operator: " + expr.operator.text, expr.operator);
        }
    }

    @Override
    public Value visitTernaryExpr(Ternary expr) {
        boolean cond = requireBool(eval(expr.condition), expr.question, "Condition of '?:'");
        return cond ? eval(expr.thenExpr) : eval(expr.elseExpr);
    }

    // -------------------------
    // Calls
    // -------------------------

    @Override
    public Value visitCallExpr(Call expr) {
        PreparedCall call = prepare(expr);
        if (call.isUserFunction()) {
            return host.callFunction(call.function, call.args, call.at);
        }
        return invokeBuiltin(call);
    }

    private PreparedCall prepare(Call expr) {
        String name;
        if (expr.callee instanceof Identifier) {
            Identifier id = (Identifier) expr.callee;
            Value bound = env.lookup(scope, id.name());
            if (bound == null) {
                name = id.name();
            } else if (bound.getType() == Value.Type.FUNC) {
                name = bound.asFunc();
            } else {
                throw new ScriptRuntimeException(ErrorKind.NOT_CALLABLE,
                        "'" + id.name() + "' is a " + bound.typeName() + ", not a function", id.name);
            }
        } else {
            Value callee = eval(expr.callee);
            if (callee.getType() != Value.Type.FUNC) {
                throw new ScriptRuntimeException(ErrorKind.NOT_CALLABLE,
                        "Cannot call a value of type " + callee.typeName(), expr.callee.position());
            }
            name = callee.asFunc();
        }

        Token at = expr.callee.position();
        FunctionDecl fn = program.function(name);
        Builtins.BuiltinFunction builtin = (fn == null) ? builtins.get(name) : null;
        if (fn == null && builtin == null) {
            throw new ScriptRuntimeException(ErrorKind.UNDEFINED_FUNCTION, "Undefined function '" + name + "'", at);
        }
        if (fn != null && fn.arity() != expr.arguments.size()) {
            throw new ScriptRuntimeException(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + fn.arity() + " argument" + (fn.arity() == 1 ? "" : "s")
                            + ", got " + expr.arguments.size(), at);
        }

        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface arg : expr.arguments) {
            args.add(eval(arg));
        }
        return new PreparedCall(name, fn, builtin, args, at);
    }

    @Override
    public Value visitRandomExpr(RandomCall expr) {
        long min = requireInt(eval(expr.min), expr.min.position(), "random() lower bound");
        long max = requireInt(eval(expr.max), expr.max.position(), "random() upper bound");
        if (min > max) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT,
                    "random() lower bound " + min + " is greater than upper bound " + max, expr.keyword);
        }
        if (max == Long.MAX_VALUE) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "random() upper bound too large", expr.keyword);
        }
        return Value.integer(host.random().nextLong(min, max + 1));
    }

    @Override
    public Value visitRandomBytesExpr(RandomBytesCall expr) {
        long n = requireInt(eval(expr.length), expr.length.position(), "random_bytes() length");
        if (n < 0 || n > maxDataLength) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT,
                    "random_bytes() length must be 0.." + maxDataLength + ", got " + n, expr.keyword);
        }
        byte[] out = new byte[(int) n];
        host.random().nextBytes(out);
        return Value.bytes(out);
    }

    // -------------------------
    // Access
    // -------------------------

    @Override
    public Value visitMemberExpr(Member expr) {
        Value object = eval(expr.object);
        String member = expr.name.text;
        if (object.getType() == Value.Type.FRAME) {
            Value v = frameField(object.asFrame(), member);
            if (v != null) return v;
        } else if (member.equals("length")
                && (object.getType() == Value.Type.BYTES || object.getType() == Value.Type.STRING)) {
            return Value.integer(object.getType() == Value.Type.BYTES ? object.asBytes().length : object.asString().length());
        }
        throw typeError("No member '" + member + "' on " + object.typeName(), expr.name);
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = eval(expr.target);
        long i = requireInt(eval(expr.index), expr.index.position(), "Index");
        switch (target.getType()) {
            case BYTES: {
                byte[] b = target.asBytes();
                checkIndex(i, b.length, expr.bracket);
                return Value.integer(b[(int) i] & 0xFF);
            }
            case STRING: {
                String s = target.asString();
                checkIndex(i, s.length(), expr.bracket);
                return Value.string(String.valueOf(s.charAt((int) i)));
            }
            case FRAME: {
                byte[] b = target.asFrame().data();
                checkIndex(i, b.length, expr.bracket);
                return Value.integer(b[(int) i] & 0xFF);
            }
            default:
                throw typeError("Cannot index a value of type " + target.typeName(), expr.bracket);
        }
    }

    /** Value of a frame field by name, or null for an unknown name. */
    public static Value frameField(CanFrame frame, String name) {
        switch (name) {
            case "id": return Value.integer(frame.id());
            case "data": return Value.bytes(frame.data());
            case "ext": return Value.bool(frame.extended());
            case "port": return Value.integer(frame.port());
            case "timestamp": return Value.integer(frame.timestamp());
            case "dlc": return Value.integer(frame.dlc());
            default: return null;
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    public static boolean isEqual(Value a, Value b) {
        if (a.isNumeric() && b.isNumeric()) {
            if (bothInts(a, b)) return a.asInt() == b.asInt();
            return a.asDouble() == b.asDouble();
        }
        return a.equals(b);
    }

    static void checkIndex(long i, int length, Token at) {
        if (i < 0 || i >= length) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT,
                    "Index " + i + " out of range for length " + length, at);
        }
    }

    static byte toByte(Value v, Token at) {
        long l = requireInt(v, at, "Byte value");
        if (l < 0 || l > 255) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "Byte value out of range 0..255: " + l, at);
        }
        return (byte) l;
    }

    static long requireInt(Value v, Token at, String what) {
        if (v.getType() != Value.Type.INT) {
            throw typeError(what + " must be an int, got " + v.typeName(), at);
        }
        return v.asInt();
    }

    static boolean requireBool(Value v, Token at, String what) {
        if (v.getType() != Value.Type.BOOL) {
            throw typeError(what + " must be a bool, got " + v.typeName(), at);
        }
        return v.asBool();
    }

    private static boolean bothInts(Value a, Value b) {
        return a.getType() == Value.Type.INT && b.getType() == Value.Type.INT;
    }

    private static void requireNumbers(Value a, Value b, Token op) {
        if (!a.isNumeric() || !b.isNumeric()) {
            throw typeError("Unsupported operand types for '" + op.text + "': " + a.typeName() + ", " + b.typeName(), op);
        }
    }

    private static void requireInts(Value a, Value b, Token op) {
        if (!bothInts(a, b)) {
            throw typeError("Operands of '" + op.text + "' must be ints, got " + a.typeName() + ", " + b.typeName(), op);
        }
    }

    private static void requireNonZero(Value divisor, Token op) {
        if (divisor.asDouble() == 0.0) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "Division by zero", op);
        }
    }

    private static int shiftCount(Value v, Token op) {
        long n = v.asInt();
        if (n < 0 || n > 63) {
            throw new ScriptRuntimeException(ErrorKind.INVALID_ARGUMENT, "Shift count out of range 0..63: " + n, op);
        }
        return (int) n;
    }

    private static int compare(Value a, Value b, Token op) {
        if (a.getType() == Value.Type.STRING && b.getType() == Value.Type.STRING) {
            return a.asString().compareTo(b.asString());
        }
        requireNumbers(a, b, op);
        if (bothInts(a, b)) return Long.compare(a.asInt(), b.asInt());
        return Double.compare(a.asDouble(), b.asDouble());
    }

    private static ScriptRuntimeException typeError(String message, Token at) {
        return new ScriptRuntimeException(ErrorKind.TYPE_ERROR, message, at);
    }
}
