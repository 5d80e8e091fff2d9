package configreader.expression.node;

/**
 * Every syntax form the parser recognises. Only some of them are evaluable;
 * the evaluator decides which.
 */
public enum NodeKind {
    INTEGER("integer literal"),
    FLOAT("float literal"),
    BOOLEAN("boolean literal"),
    STRING("string literal"),
    NONE("None literal"),
    BYTES("bytes literal"),
    FORMATTED_STRING("formatted string literal"),
    ELLIPSIS("ellipsis"),
    NAME("name"),
    BINARY_OPERATION("binary operation"),
    UNARY_OPERATION("unary operation"),
    BOOLEAN_OPERATION("boolean operation"),
    COMPARISON("comparison"),
    LIST("list display"),
    TUPLE("tuple display"),
    SET("set display"),
    DICT("dict display"),
    CALL("call"),
    STATEMENTS("statement list"),
    ATTRIBUTE("attribute access"),
    SUBSCRIPT("subscript"),
    LAMBDA("lambda"),
    CONDITIONAL("conditional expression"),
    COMPREHENSION("comprehension"),
    STARRED("starred expression"),
    DOUBLE_STARRED("double-starred expression"),
    NAMED_EXPRESSION("assignment expression"),
    ASSIGNMENT("assignment"),
    IMPORT("import"),
    STATEMENT("statement");

    private final String description;

    NodeKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
