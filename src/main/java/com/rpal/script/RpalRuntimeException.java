package com.rpal.script;

/**
 * The single failure type of the interpreter. Nothing inside the lexer, parser or machine
 * catches it; it aborts the run and reaches the host with its {@link ErrorKind}.
 */
public class RpalRuntimeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public RpalRuntimeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static RpalRuntimeException syntax(int line, String message) {
        return new RpalRuntimeException(ErrorKind.SYNTAX, "[line " + line + "] " + message);
    }

    public static RpalRuntimeException lookup(String name) {
        return new RpalRuntimeException(ErrorKind.LOOKUP, "Undeclared identifier: " + name);
    }

    public static RpalRuntimeException arity(String message) {
        return new RpalRuntimeException(ErrorKind.ARITY, message);
    }

    public static RpalRuntimeException type(String message) {
        return new RpalRuntimeException(ErrorKind.TYPE, message);
    }

    public static RpalRuntimeException arithmetic(String message) {
        return new RpalRuntimeException(ErrorKind.ARITHMETIC, message);
    }
}
