package com.rpal.script.parser;

/**
 * Node tags shared by raw and standardized trees. Leaf tags carry their payload in
 * {@link TreeNode#value}; every other tag is an operator whose arity the parser fixes.
 */
public enum NodeType {
    // leaves
    IDENTIFIER("ID"),
    INTEGER("INT"),
    STRING("STR"),
    TRUE("true"),
    FALSE("false"),
    NIL("nil"),
    DUMMY("dummy"),
    YSTAR("Y*"),
    EMPTY_PARAMS("()"),

    // definitions and binders
    LET("let"),
    WHERE("where"),
    LAMBDA("lambda"),
    WITHIN("within"),
    AND("and"),
    REC("rec"),
    EQUAL("="),
    FCN_FORM("function_form"),
    COMMA(","),

    // expressions
    GAMMA("gamma"),
    TAU("tau"),
    CONDITIONAL("->"),
    AT("@"),
    AUG("aug"),
    OR("or"),
    AMP("&"),
    NOT("not"),
    GR("gr"),
    GE("ge"),
    LS("ls"),
    LE("le"),
    EQ("eq"),
    NE("ne"),
    PLUS("+"),
    MINUS("-"),
    NEG("neg"),
    MULT("*"),
    DIV("/"),
    EXP("**");

    public final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    public boolean isLeaf() {
        return ordinal() <= EMPTY_PARAMS.ordinal();
    }

    public boolean isBinaryOperator() {
        switch (this) {
            case AUG: case OR: case AMP:
            case GR: case GE: case LS: case LE: case EQ: case NE:
            case PLUS: case MINUS: case MULT: case DIV: case EXP:
                return true;
            default:
                return false;
        }
    }

    /** Child counts the grammar can produce for this tag. */
    public boolean acceptsArity(int n) {
        switch (this) {
            case LAMBDA: case AND: case COMMA: case TAU:
                return n >= 2;
            case FCN_FORM:
                return n >= 3;
            case REC: case NOT: case NEG:
                return n == 1;
            case CONDITIONAL: case AT:
                return n == 3;
            default:
                return isLeaf() ? n == 0 : n == 2;
        }
    }

    public boolean isUnaryOperator() {
        return this == NOT || this == NEG;
    }

    /** Operator tags as written in source (and, for relations, their canonical spelling). */
    public static NodeType forOperator(String lexeme) {
        switch (lexeme) {
            case "gr": case ">":  return GR;
            case "ge": case ">=": return GE;
            case "ls": case "<":  return LS;
            case "le": case "<=": return LE;
            case "eq": return EQ;
            case "ne": return NE;
            case "+":  return PLUS;
            case "-":  return MINUS;
            case "*":  return MULT;
            case "/":  return DIV;
            case "**": return EXP;
            case "&":  return AMP;
            case "or": return OR;
            case "aug": return AUG;
            default: return null;
        }
    }
}
