package configreader.expression;

/**
 * Runtime failure of a whitelisted operation: division by zero, operand type
 * mismatch, overflow, bad function arguments.
 */
public class EvaluationException extends ExpressionException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
