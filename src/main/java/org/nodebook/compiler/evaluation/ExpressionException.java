package org.nodebook.compiler.evaluation;

/**
 * Thrown when a function expression cannot be parsed or evaluated.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
