package dev.macros.expr;

/**
 * Syntax or evaluation failure of a script expression.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
