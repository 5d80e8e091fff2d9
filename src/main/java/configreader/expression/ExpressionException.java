package configreader.expression;

/**
 * Base of every failure raised while parsing or evaluating an expression.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
