package configreader.expression;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits expression text into tokens. Newlines are significant only outside
 * brackets, where they separate statements; {@code #} starts a comment.
 */
final class ExpressionLexer {

    static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    // longest first
    private static final String[] OPERATORS = {
            "**=", "//=", ">>=", "<<=", "...",
            "**", "//", "<<", ">>", "<=", ">=", "==", "!=", ":=", "->",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
            "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };

    private final String text;
    private int pos;
    private int depth;

    ExpressionLexer(String text) {
        this.text = text;
    }

    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipBlanks();
            if (pos >= text.length()) {
                tokens.add(Token.of(TokenType.END, "", pos));
                return tokens;
            }
            char c = text.charAt(pos);
            if (c == '\n' || c == '\r') {
                int start = pos++;
                if (depth == 0) {
                    tokens.add(Token.of(TokenType.NEWLINE, "\n", start));
                }
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && pos + 1 < text.length() && isLineBreak(text.charAt(pos + 1))) {
                pos += 2;
            } else if (isStringStart()) {
                tokens.add(readString());
            } else if (isDigit(c) || (c == '.' && pos + 1 < text.length()
                    && isDigit(text.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (isIdentifierStart(c)) {
                tokens.add(readIdentifier());
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipBlanks() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f' || (depth > 0 && isLineBreak(c))) {
                pos++;
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
            pos++;
        }
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        String word = text.substring(start, pos);
        TokenType type = KEYWORDS.contains(word) ? TokenType.KEYWORD : TokenType.NAME;
        return Token.of(type, word, start);
    }

    private Token readNumber() {
        int start = pos;
        if (text.charAt(pos) == '0' && pos + 1 < text.length()) {
            char radixChar = Character.toLowerCase(text.charAt(pos + 1));
            int radix = radixChar == 'x' ? 16 : radixChar == 'o' ? 8 : radixChar == 'b' ? 2 : 0;
            if (radix != 0) {
                pos += 2;
                int digitsStart = pos;
                while (pos < text.length() && (isDigit(text.charAt(pos), radix) || text.charAt(pos) == '_')) {
                    pos++;
                }
                String digits = text.substring(digitsStart, pos).replace("_", "");
                if (digits.isEmpty()) {
                    throw error(start, "invalid number literal");
                }
                return integerToken(start, digits, radix);
            }
        }
        boolean floating = false;
        readDigits();
        if (pos < text.length() && text.charAt(pos) == '.') {
            floating = true;
            pos++;
            readDigits();
        }
        if (pos < text.length() && Character.toLowerCase(text.charAt(pos)) == 'e') {
            int mark = pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && isDigit(text.charAt(pos))) {
                floating = true;
                readDigits();
            } else {
                pos = mark;
            }
        }
        if (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            throw error(pos, "invalid number literal");
        }
        String literal = text.substring(start, pos).replace("_", "");
        if (floating) {
            return new Token(TokenType.FLOAT, text.substring(start, pos), start, Double.parseDouble(literal), "");
        }
        if (literal.length() > 1 && literal.charAt(0) == '0' && literal.chars().anyMatch(ch -> ch != '0')) {
            throw error(start, "leading zeros in decimal integer literals are not permitted");
        }
        return integerToken(start, literal, 10);
    }

    private Token integerToken(int start, String digits, int radix) {
        try {
            return new Token(TokenType.INTEGER, text.substring(start, pos), start, Long.parseLong(digits, radix), "");
        } catch (NumberFormatException e) {
            throw new EvaluationException("Integer literal out of range: " + text.substring(start, pos), e);
        }
    }

    private void readDigits() {
        while (pos < text.length() && (isDigit(text.charAt(pos)) || text.charAt(pos) == '_')) {
            pos++;
        }
    }

    private boolean isStringStart() {
        int i = pos;
        while (i < text.length() && i - pos < 2 && "rRbBfFuU".indexOf(text.charAt(i)) >= 0) {
            i++;
        }
        return i < text.length() && (text.charAt(i) == '\'' || text.charAt(i) == '"');
    }

    private Token readString() {
        int start = pos;
        StringBuilder prefix = new StringBuilder();
        while (text.charAt(pos) != '\'' && text.charAt(pos) != '"') {
            prefix.append(Character.toLowerCase(text.charAt(pos++)));
        }
        boolean raw = prefix.indexOf("r") >= 0;
        char quote = text.charAt(pos);
        boolean triple = text.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw error(start, "unterminated string literal");
            }
            char c = text.charAt(pos);
            if (c == quote && (!triple || text.startsWith(String.valueOf(quote).repeat(3), pos))) {
                pos += triple ? 3 : 1;
                break;
            }
            if (!triple && isLineBreak(c)) {
                throw error(start, "unterminated string literal");
            }
            if (c == '\\' && pos + 1 < text.length()) {
                if (raw) {
                    value.append(c).append(text.charAt(pos + 1));
                    pos += 2;
                } else {
                    readEscape(value);
                }
                continue;
            }
            value.append(c);
            pos++;
        }
        return new Token(TokenType.STRING, text.substring(start, pos), start, value.toString(), prefix.toString());
    }

    private void readEscape(StringBuilder value) {
        int start = pos;
        char e = text.charAt(pos + 1);
        pos += 2;
        switch (e) {
            case '\n':
                break;
            case '\\':
            case '\'':
            case '"':
                value.append(e);
                break;
            case 'n':
                value.append('\n');
                break;
            case 'r':
                value.append('\r');
                break;
            case 't':
                value.append('\t');
                break;
            case 'a':
                value.append('\u0007');
                break;
            case 'b':
                value.append('\b');
                break;
            case 'f':
                value.append('\f');
                break;
            case 'v':
                value.append('\u000b');
                break;
            case '0':
                value.append('\0');
                break;
            case 'x':
                value.append(readHex(start, 2));
                break;
            case 'u':
                value.append(readHex(start, 4));
                break;
            default:
                // unknown escapes keep their backslash
                value.append('\\').append(e);
                break;
        }
    }

    private char readHex(int start, int length) {
        if (pos + length > text.length()) {
            throw error(start, "truncated escape sequence");
        }
        try {
            char c = (char) Integer.parseInt(text.substring(pos, pos + length), 16);
            pos += length;
            return c;
        } catch (NumberFormatException e) {
            throw error(start, "invalid escape sequence");
        }
    }

    private Token readOperator() {
        for (String op : OPERATORS) {
            if (text.startsWith(op, pos)) {
                int start = pos;
                pos += op.length();
                if ("([{".contains(op)) {
                    depth++;
                } else if (")]}".contains(op) && depth > 0) {
                    depth--;
                }
                return Token.of(TokenType.OPERATOR, op, start);
            }
        }
        throw error(pos, "unexpected character '" + text.charAt(pos) + "'");
    }

    private ExpressionSyntaxException error(int position, String reason) {
        return new ExpressionSyntaxException(text, position, reason);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    // ASCII only: other Unicode digits are not part of number literals
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isDigit(char c, int radix) {
        return c < 128 && Character.digit(c, radix) >= 0;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
