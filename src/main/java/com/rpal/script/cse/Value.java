package com.rpal.script.cse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.rpal.script.RpalRuntimeException;
import com.rpal.script.RpalScript.BuiltinFunction;

public class Value {
    public enum Type { INTEGER, TRUTH, STRING, TUPLE, LAMBDA, ETA, DUMMY, YSTAR, BUILTIN }

    private static final Value TRUE = new Value(Type.TRUTH, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.TRUTH, Boolean.FALSE);
    private static final Value NIL = new Value(Type.TUPLE, Collections.<Value>emptyList());
    private static final Value DUMMY = new Value(Type.DUMMY, null);
    private static final Value YSTAR = new Value(Type.YSTAR, null);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long n) { return new Value(Type.INTEGER, n); }
    public static Value truth(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value tuple(List<Value> items) {
        return items.isEmpty() ? NIL : new Value(Type.TUPLE, Collections.unmodifiableList(new ArrayList<>(items)));
    }
    public static Value nil() { return NIL; }
    public static Value dummy() { return DUMMY; }
    public static Value ystar() { return YSTAR; }
    public static Value lambda(Lambda l) { return new Value(Type.LAMBDA, l); }
    public static Value eta(Eta e) { return new Value(Type.ETA, e); }
    public static Value builtin(Builtin b) { return new Value(Type.BUILTIN, b); }

    /**
     * Closure over a lambda body. {@code params} holds one name, or the ordered names of a tuple
     * pattern when {@code tuplePattern} is set (empty for {@code ()}).
     */
    public static final class Lambda {
        public final List<String> params;
        public final boolean tuplePattern;
        public final int block;
        public final Environment env;

        public Lambda(List<String> params, boolean tuplePattern, int block, Environment env) {
            this.params = params;
            this.tuplePattern = tuplePattern;
            this.block = block;
            this.env = env;
        }

        public String paramSpec() {
            return String.join(",", params);
        }
    }

    /**
     * Result of applying Y* to a lambda. Holds no reference to itself; the machine binds the
     * recursive name to this eta afresh on every application.
     */
    public static final class Eta {
        public final Lambda lambda;

        public Eta(Lambda lambda) {
            this.lambda = lambda;
        }
    }

    /** A host function, possibly partially applied. */
    public static final class Builtin {
        public final String name;
        public final int arity;
        public final BuiltinFunction fn;
        public final List<Value> collected;

        public Builtin(String name, int arity, BuiltinFunction fn) {
            this(name, arity, fn, Collections.<Value>emptyList());
        }

        private Builtin(String name, int arity, BuiltinFunction fn, List<Value> collected) {
            this.name = name;
            this.arity = arity;
            this.fn = fn;
            this.collected = collected;
        }

        /** Supplies one more argument; runs the function once all {@code arity} are present. */
        public Value apply(Value arg) {
            List<Value> args = new ArrayList<>(collected.size() + 1);
            args.addAll(collected);
            args.add(arg);
            if (args.size() < arity) {
                return Value.builtin(new Builtin(name, arity, fn, Collections.unmodifiableList(args)));
            }
            return fn.call(Collections.unmodifiableList(args));
        }
    }

    public Type getType() { return type; }

    public long asInteger() {
        if (type != Type.INTEGER) throw RpalRuntimeException.type("Expected integer, got " + type);
        return (long) value;
    }

    public boolean asTruth() {
        if (type != Type.TRUTH) throw RpalRuntimeException.type("Expected truth value, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw RpalRuntimeException.type("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asTuple() {
        if (type != Type.TUPLE) throw RpalRuntimeException.type("Expected tuple, got " + type);
        return (List<Value>) value;
    }

    public Lambda asLambda() {
        if (type != Type.LAMBDA) throw RpalRuntimeException.type("Expected lambda closure, got " + type);
        return (Lambda) value;
    }

    public Eta asEta() {
        if (type != Type.ETA) throw RpalRuntimeException.type("Expected eta closure, got " + type);
        return (Eta) value;
    }

    public Builtin asBuiltin() {
        if (type != Type.BUILTIN) throw RpalRuntimeException.type("Expected built-in function, got " + type);
        return (Builtin) value;
    }

    public boolean isFunction() {
        return type == Type.LAMBDA || type == Type.ETA || type == Type.BUILTIN;
    }

    /**
     * Display form: decimal integers, lowercase truth values, strings verbatim, tuples as
     * {@code (a, b)} with the empty tuple shown as {@code nil}, dummy as the empty string.
     */
    @Override
    public String toString() {
        switch (type) {
            case INTEGER:
                return Long.toString(asInteger());
            case TRUTH:
                return Boolean.toString(asTruth());
            case STRING:
                return asString();
            case TUPLE: {
                List<Value> items = asTuple();
                if (items.isEmpty()) return "nil";
                StringBuilder sb = new StringBuilder("(");
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(items.get(i));
                }
                return sb.append(')').toString();
            }
            case LAMBDA: {
                Lambda l = asLambda();
                return "[lambda closure: " + l.paramSpec() + ": " + l.block + "]";
            }
            case ETA: {
                Lambda l = asEta().lambda;
                return "[eta closure: " + l.paramSpec() + ": " + l.block + "]";
            }
            case YSTAR:
                return "Y*";
            case BUILTIN:
                return asBuiltin().name;
            default:
                return "";
        }
    }
}
