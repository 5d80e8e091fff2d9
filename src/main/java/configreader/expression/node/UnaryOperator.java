package configreader.expression.node;

public enum UnaryOperator {
    PLUS("+"),
    MINUS("-"),
    NOT("not"),
    INVERT("~");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
