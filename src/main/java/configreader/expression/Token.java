package configreader.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
final class Token {

    private final TokenType type;
    private final String text;
    private final int position;
    /** Long, Double or String payload of literal tokens. */
    private final Object literal;
    /** Lower-cased string prefix ("", "r", "b", "f", "rb", ...). */
    private final String prefix;

    static Token of(TokenType type, String text, int position) {
        return new Token(type, text, position, null, "");
    }

    boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    boolean isOperator(String symbol) {
        return is(TokenType.OPERATOR, symbol);
    }

    boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    boolean isStatementEnd() {
        return type == TokenType.END || type == TokenType.NEWLINE || isOperator(";");
    }

    @Override
    public String toString() {
        return type == TokenType.END ? "end of input" : "'" + text + "'";
    }
}
