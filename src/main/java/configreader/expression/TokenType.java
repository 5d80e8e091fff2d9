package configreader.expression;

enum TokenType {
    INTEGER,
    FLOAT,
    STRING,
    NAME,
    KEYWORD,
    OPERATOR,
    NEWLINE,
    END
}
