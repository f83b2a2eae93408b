package org.astroller.dsl;

/**
 * Base class for every failure raised while parsing, transforming or
 * evaluating a roll. A roll either fully succeeds or fails with one of
 * the subclasses.
 */
public class RollException extends RuntimeException {

    public RollException(String message) {
        super(message);
    }

    public RollException(String message, Throwable cause) {
        super(message, cause);
    }
}
