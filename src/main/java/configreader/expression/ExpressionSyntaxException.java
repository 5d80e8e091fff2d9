package configreader.expression;

import lombok.Getter;

/**
 * The text is not an expression at all.
 */
@Getter
public class ExpressionSyntaxException extends ExpressionException {

    private final String expression;
    private final int position;

    public ExpressionSyntaxException(String expression, int position, String reason) {
        super(String.format("Invalid expression '%s' at position %d: %s", expression, position, reason));
        this.expression = expression;
        this.position = position;
    }
}
