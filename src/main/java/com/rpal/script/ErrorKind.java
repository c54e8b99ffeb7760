package com.rpal.script;

/** Classification carried by every {@link RpalRuntimeException}. */
public enum ErrorKind {
    /** Lexer or parser rejected the source. */
    SYNTAX,
    /** Identifier not bound anywhere in the environment chain. */
    LOOKUP,
    /** Tuple destructuring or selection with a mismatched count or index. */
    ARITY,
    /** Operator, built-in or application on the wrong kind of value. */
    TYPE,
    /** Division by zero or integer overflow. */
    ARITHMETIC,
    /** Control ran out with a stack depth other than one. */
    MACHINE_CONSISTENCY,
    /** The configured reduction budget was exhausted. */
    STEP_LIMIT
}
