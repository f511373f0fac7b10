package com.plotlab.expr.parser;

/**
 * Raised when text cannot be turned into an expression tree. Nothing that fails
 * here is ever evaluated.
 */
public class ExpressionException extends RuntimeException {

    public enum ErrorKind {
        /** Blank input: no expression at all. */
        EMPTY,
        /** Malformed token (bad character, second decimal point). */
        LEXICAL,
        /** Grammar violation: unexpected token, unmatched parenthesis, trailing input. */
        SYNTAX,
        /** Identifier that is neither {@code x} nor a registered function or constant. */
        UNKNOWN_IDENTIFIER,
        /** Registered function called with the wrong number of arguments. */
        ARITY_MISMATCH
    }

    private final ErrorKind kind;
    private final int offset;

    public ExpressionException(ErrorKind kind, int offset, String message) {
        super("[col " + offset + "] " + message);
        this.kind = kind;
        this.offset = offset;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** Zero-based character offset of the offending input. */
    public int getOffset() {
        return offset;
    }
}
