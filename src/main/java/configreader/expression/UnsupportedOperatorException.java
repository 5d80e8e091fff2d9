package configreader.expression;

import lombok.Getter;

@Getter
public class UnsupportedOperatorException extends ExpressionException {

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Unhandled operator " + operator);
        this.operator = operator;
    }
}
