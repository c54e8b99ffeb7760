package com.rpal.script.cse;

import java.util.Collections;
import java.util.List;

/**
 * One entry of a control block. The machine dispatches on {@link #kind}; only the fields
 * meaningful for that kind are set.
 */
public final class Instruction {

    public enum Kind {
        LITERAL,
        IDENTIFIER,
        LAMBDA,
        GAMMA,
        YSTAR,
        TAU,
        CONDITIONAL,
        BINARY_OP,
        UNARY_OP,
        ENV_RESTORE
    }

    private static final Instruction GAMMA = new Instruction(Kind.GAMMA, null, "gamma", null, false, -1, -1, 0);
    private static final Instruction YSTAR = new Instruction(Kind.YSTAR, null, "Y*", null, false, -1, -1, 0);

    public final Kind kind;
    /** LITERAL payload. */
    public final Value literal;
    /** Identifier name, operator tag or environment name. */
    public final String name;
    /** LAMBDA parameter names. */
    public final List<String> params;
    public final boolean tuplePattern;
    /** LAMBDA body block, or CONDITIONAL then-block. */
    public final int block;
    /** CONDITIONAL else-block. */
    public final int elseBlock;
    /** TAU element count. */
    public final int arity;

    private Instruction(Kind kind, Value literal, String name, List<String> params, boolean tuplePattern,
                        int block, int elseBlock, int arity) {
        this.kind = kind;
        this.literal = literal;
        this.name = name;
        this.params = params;
        this.tuplePattern = tuplePattern;
        this.block = block;
        this.elseBlock = elseBlock;
        this.arity = arity;
    }

    public static Instruction literal(Value v) {
        return new Instruction(Kind.LITERAL, v, null, null, false, -1, -1, 0);
    }

    public static Instruction identifier(String name) {
        return new Instruction(Kind.IDENTIFIER, null, name, null, false, -1, -1, 0);
    }

    public static Instruction lambda(List<String> params, boolean tuplePattern, int block) {
        return new Instruction(Kind.LAMBDA, null, null, Collections.unmodifiableList(params), tuplePattern, block, -1, 0);
    }

    public static Instruction gamma() { return GAMMA; }

    public static Instruction ystar() { return YSTAR; }

    public static Instruction tau(int n) {
        return new Instruction(Kind.TAU, null, null, null, false, -1, -1, n);
    }

    public static Instruction conditional(int thenBlock, int elseBlock) {
        return new Instruction(Kind.CONDITIONAL, null, null, null, false, thenBlock, elseBlock, 0);
    }

    public static Instruction binary(String op) {
        return new Instruction(Kind.BINARY_OP, null, op, null, false, -1, -1, 2);
    }

    public static Instruction unary(String op) {
        return new Instruction(Kind.UNARY_OP, null, op, null, false, -1, -1, 1);
    }

    public static Instruction envRestore(Environment env) {
        return new Instruction(Kind.ENV_RESTORE, null, env.name, null, false, -1, -1, 0);
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                switch (literal.type) {
                    case INTEGER: return "<INT:" + literal + ">";
                    case STRING:  return "<STR:'" + literal + "'>";
                    case TUPLE:   return "<nil>";
                    case DUMMY:   return "<dummy>";
                    default:      return "<" + literal + ">";
                }
            case IDENTIFIER:
                return "<ID:" + name + ">";
            case LAMBDA:
                return "lambda_" + block + "^" + String.join(",", params);
            case TAU:
                return "tau_" + arity;
            case CONDITIONAL:
                return "beta_" + block + "_" + elseBlock;
            default:
                return name;
        }
    }
}
