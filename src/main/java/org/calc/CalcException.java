package org.calc;

/**
 * Failure that aborts parsing or evaluation of a whole expression.
 * A text that simply matches no grammar rule is not an error; the parser reports it as an empty result.
 */
public final class CalcException extends RuntimeException {

    public enum ErrorKind {
        /** Parenthesis counter went negative or did not end at zero. */
        INVALID_PARENTHESES,
        UNDEFINED_VARIABLE,
        /** A function read an argument position beyond the supplied arguments. */
        ARITY_ERROR,
        /** Left-hand side of {@code =} is an expression rather than a bare name. */
        ASSIGNMENT_TO_NON_IDENTIFIER
    }

    private final ErrorKind kind;

    public CalcException(ErrorKind kind, String detail) {
        super(kind + ": " + detail);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
