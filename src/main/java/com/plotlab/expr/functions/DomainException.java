package com.plotlab.expr.functions;

/**
 * Signals that an operation has no real result for its arguments
 * (log of a non-positive number, division by zero, ...). Raised per
 * evaluation and turned into a failed outcome by the evaluator.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message, null, false, false);
    }
}
