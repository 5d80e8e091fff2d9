package configreader.expression;

import lombok.Getter;

@Getter
public class UnknownFunctionException extends ExpressionException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown function " + functionName);
        this.functionName = functionName;
    }
}
