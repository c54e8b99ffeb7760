package com.rpal.script.cse;

import java.util.ArrayList;
import java.util.List;

import com.rpal.script.RpalRuntimeException;

/** Binary and unary primitives reduced by the machine (rules 7 and 8). */
public final class Operators {

    private Operators() {}

    public static Value binary(String op, Value left, Value right) {
        switch (op) {
            case "+":
                if (left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
                    return Value.string(left.asString() + right.asString());
                }
                if (left.type == Value.Type.TUPLE && right.type == Value.Type.TUPLE) {
                    List<Value> joined = new ArrayList<>(left.asTuple());
                    joined.addAll(right.asTuple());
                    return Value.tuple(joined);
                }
                requireIntegers(op, left, right);
                try {
                    return Value.integer(Math.addExact(left.asInteger(), right.asInteger()));
                } catch (ArithmeticException e) {
                    throw overflow(op);
                }
            case "-":
                requireIntegers(op, left, right);
                try {
                    return Value.integer(Math.subtractExact(left.asInteger(), right.asInteger()));
                } catch (ArithmeticException e) {
                    throw overflow(op);
                }
            case "*":
                requireIntegers(op, left, right);
                try {
                    return Value.integer(Math.multiplyExact(left.asInteger(), right.asInteger()));
                } catch (ArithmeticException e) {
                    throw overflow(op);
                }
            case "/": {
                requireIntegers(op, left, right);
                long d = right.asInteger();
                if (d == 0) throw RpalRuntimeException.arithmetic("Division by zero");
                long n = left.asInteger();
                if (n == Long.MIN_VALUE && d == -1) throw overflow(op);
                return Value.integer(n / d);
            }
            case "**":
                requireIntegers(op, left, right);
                return Value.integer(power(left.asInteger(), right.asInteger()));

            case "gr":
                requireIntegers(op, left, right);
                return Value.truth(left.asInteger() > right.asInteger());
            case "ge":
                requireIntegers(op, left, right);
                return Value.truth(left.asInteger() >= right.asInteger());
            case "ls":
                requireIntegers(op, left, right);
                return Value.truth(left.asInteger() < right.asInteger());
            case "le":
                requireIntegers(op, left, right);
                return Value.truth(left.asInteger() <= right.asInteger());

            case "eq":
                return Value.truth(isEqual(op, left, right));
            case "ne":
                return Value.truth(!isEqual(op, left, right));

            case "&":
                requireTruths(op, left, right);
                return Value.truth(left.asTruth() && right.asTruth());
            case "or":
                requireTruths(op, left, right);
                return Value.truth(left.asTruth() || right.asTruth());

            case "aug": {
                if (left.type != Value.Type.TUPLE) {
                    throw RpalRuntimeException.type("'aug' expects a tuple on the left, got " + left.type);
                }
                List<Value> out = new ArrayList<>(left.asTuple());
                if (right.type == Value.Type.TUPLE) out.addAll(right.asTuple());
                else out.add(right);
                return Value.tuple(out);
            }

            default:
                throw RpalRuntimeException.type("Unsupported binary operator: " + op);
        }
    }

    public static Value unary(String op, Value operand) {
        switch (op) {
            case "not":
                if (operand.type != Value.Type.TRUTH) {
                    throw RpalRuntimeException.type("'not' expects a truth value, got " + operand.type);
                }
                return Value.truth(!operand.asTruth());
            case "neg":
                if (operand.type != Value.Type.INTEGER) {
                    throw RpalRuntimeException.type("'neg' expects an integer, got " + operand.type);
                }
                try {
                    return Value.integer(Math.negateExact(operand.asInteger()));
                } catch (ArithmeticException e) {
                    throw overflow(op);
                }
            default:
                throw RpalRuntimeException.type("Unsupported unary operator: " + op);
        }
    }

    /**
     * Structural equality for integers, truth values, strings, dummy and tuples of those.
     * Values of different types are unequal; function values cannot be compared.
     */
    public static boolean isEqual(String op, Value left, Value right) {
        if (!isComparable(left) || !isComparable(right)) {
            throw RpalRuntimeException.type("Values of type " + (isComparable(left) ? right.type : left.type)
                    + " are not comparable with '" + op + "'");
        }
        if (left.type != right.type) return false;
        switch (left.type) {
            case INTEGER: return left.asInteger() == right.asInteger();
            case TRUTH:   return left.asTruth() == right.asTruth();
            case STRING:  return left.asString().equals(right.asString());
            case DUMMY:   return true;
            case TUPLE: {
                List<Value> a = left.asTuple();
                List<Value> b = right.asTuple();
                if (a.size() != b.size()) return false;
                for (int i = 0; i < a.size(); i++) {
                    if (!isEqual(op, a.get(i), b.get(i))) return false;
                }
                return true;
            }
            default:
                throw RpalRuntimeException.type("Values of type " + left.type + " are not comparable");
        }
    }

    private static boolean isComparable(Value v) {
        return !v.isFunction() && v.type != Value.Type.YSTAR;
    }

    // integer power; negative exponents truncate toward zero like '/'
    private static long power(long base, long exp) {
        if (exp < 0) {
            if (base == 0) throw RpalRuntimeException.arithmetic("Division by zero");
            if (base == 1) return 1;
            if (base == -1) return (exp % 2 == 0) ? 1 : -1;
            return 0;
        }
        long result = 1;
        long b = base;
        long e = exp;
        try {
            while (e > 0) {
                if ((e & 1) == 1) result = Math.multiplyExact(result, b);
                e >>= 1;
                if (e > 0) b = Math.multiplyExact(b, b);
            }
        } catch (ArithmeticException ex) {
            throw overflow("**");
        }
        return result;
    }

    private static void requireIntegers(String op, Value left, Value right) {
        if (left.type != Value.Type.INTEGER || right.type != Value.Type.INTEGER) {
            throw RpalRuntimeException.type("Unsupported operand types for '" + op + "': " + left.type + ", " + right.type);
        }
    }

    private static void requireTruths(String op, Value left, Value right) {
        if (left.type != Value.Type.TRUTH || right.type != Value.Type.TRUTH) {
            throw RpalRuntimeException.type("Unsupported operand types for '" + op + "': " + left.type + ", " + right.type);
        }
    }

    private static RpalRuntimeException overflow(String op) {
        return RpalRuntimeException.arithmetic("Integer overflow in '" + op + "'");
    }
}
