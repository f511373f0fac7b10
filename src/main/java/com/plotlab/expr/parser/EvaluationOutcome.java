package com.plotlab.expr.parser;

import java.util.Objects;

/**
 * Result of evaluating an expression at one value of {@code x}: either a
 * finite real value or a failure reason.
 */
public final class EvaluationOutcome {

    public enum Failure {
        PARSE_ERROR,
        UNKNOWN_IDENTIFIER,
        ARITY_MISMATCH,
        DOMAIN_ERROR,
        NON_FINITE,
        /** Reserved for a real-part policy; the standard functions report DOMAIN_ERROR instead. */
        COMPLEX_RESULT
    }

    private final double value;
    private final Failure failure;
    private final String message;

    private EvaluationOutcome(double value, Failure failure, String message) {
        this.value = value;
        this.failure = failure;
        this.message = message;
    }

    public static EvaluationOutcome success(double value) {
        if (!Double.isFinite(value)) {
            return failed(Failure.NON_FINITE, "Result is " + value);
        }
        return new EvaluationOutcome(value, null, null);
    }

    public static EvaluationOutcome failed(Failure failure, String message) {
        return new EvaluationOutcome(Double.NaN, Objects.requireNonNull(failure, "failure"), message);
    }

    /** Maps a compile-time error onto the outcome taxonomy. */
    public static EvaluationOutcome fromParseError(ExpressionException e) {
        switch (e.getKind()) {
            case UNKNOWN_IDENTIFIER:
                return failed(Failure.UNKNOWN_IDENTIFIER, e.getMessage());
            case ARITY_MISMATCH:
                return failed(Failure.ARITY_MISMATCH, e.getMessage());
            default:
                return failed(Failure.PARSE_ERROR, e.getMessage());
        }
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /** The value; only meaningful when {@link #isSuccess()}. */
    public double getValue() {
        if (failure != null) throw new IllegalStateException("No value: " + failure + " (" + message + ")");
        return value;
    }

    public Failure getFailure() {
        return failure;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EvaluationOutcome)) return false;
        EvaluationOutcome other = (EvaluationOutcome) o;
        if (failure != other.failure) return false;
        if (failure != null) return Objects.equals(message, other.message);
        return Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return failure == null ? Double.hashCode(value) : Objects.hash(failure, message);
    }

    @Override
    public String toString() {
        return failure == null ? "ok(" + value + ")" : failure + "(" + message + ")";
    }
}
