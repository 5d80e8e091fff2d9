package configreader.expression;

import lombok.Getter;

/**
 * A boolean combinator received fewer than two operands.
 */
@Getter
public class ArityException extends ExpressionException {

    private final String operator;
    private final int operandCount;

    public ArityException(String operator, int operandCount) {
        super(String.format("Insufficient number of arguments for boolean operation '%s': %d", operator, operandCount));
        this.operator = operator;
        this.operandCount = operandCount;
    }
}
