package org.astroller.dsl;

/**
 * Exception thrown when a syntactically valid roll carries out-of-range
 * values (zero dice, zero sides, keeping more dice than rolled, ...).
 * Raised while building the expression tree, before any dice are rolled.
 */
public class RollSemanticException extends RollException {

    public RollSemanticException(String message) {
        super(message);
    }

    public RollSemanticException(String message, Throwable cause) {
        super(message, cause);
    }
}
