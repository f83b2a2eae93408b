package org.astroller.dsl;

/**
 * Exception thrown when evaluation fails at runtime, e.g. division by an
 * operand that rolled to zero.
 */
public class RollEvaluationException extends RollException {

    public RollEvaluationException(String message) {
        super(message);
    }

    public RollEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
