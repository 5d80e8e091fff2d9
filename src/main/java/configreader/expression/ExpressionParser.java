package configreader.expression;

import configreader.expression.node.BinaryOpNode;
import configreader.expression.node.BinaryOperator;
import configreader.expression.node.BoolOpNode;
import configreader.expression.node.BoolOperator;
import configreader.expression.node.CallNode;
import configreader.expression.node.CollectionNode;
import configreader.expression.node.CompareNode;
import configreader.expression.node.CompareOperator;
import configreader.expression.node.DictNode;
import configreader.expression.node.ExpressionNode;
import configreader.expression.node.KeywordArgument;
import configreader.expression.node.LiteralNode;
import configreader.expression.node.NameNode;
import configreader.expression.node.NodeKind;
import configreader.expression.node.StatementsNode;
import configreader.expression.node.UnaryOpNode;
import configreader.expression.node.UnaryOperator;
import configreader.expression.node.UnsupportedNode;
import configreader.value.BoolValue;
import configreader.value.FloatValue;
import configreader.value.IntValue;
import configreader.value.StrValue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive descent parser for configuration value expressions. It
 * recognises more than the evaluator accepts: forbidden forms are kept as
 * {@link UnsupportedNode}s so that rejection happens in exactly one place.
 */
public final class ExpressionParser {

    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else",
            "except", "finally", "for", "global", "if", "nonlocal", "pass", "raise", "return", "try",
            "while", "with", "yield");

    private static final Map<String, CompareOperator> COMPARE_SYMBOLS = Map.of(
            "==", CompareOperator.EQUAL,
            "!=", CompareOperator.NOT_EQUAL,
            "<", CompareOperator.LESS,
            "<=", CompareOperator.LESS_OR_EQUAL,
            ">", CompareOperator.GREATER,
            ">=", CompareOperator.GREATER_OR_EQUAL);

    // precedence levels, loosest first
    private static final String[][] BINARY_LEVELS = {
            {"|"},
            {"^"},
            {"&"},
            {"<<", ">>"},
            {"+", "-"},
            {"*", "/", "//", "%", "@"}
    };

    /**
     * Deepest syntax tree {@link #parse(String)} returns.
     */
    public static final int MAX_DEPTH = 1000;

    private static final int MAX_NESTING = 200;

    private final String text;
    private final List<Token> tokens;
    private int index;
    private int nesting;

    private ExpressionParser(String text) {
        this.text = text;
        this.tokens = new ExpressionLexer(text).tokenize();
    }

    public static StatementsNode parse(String text) {
        return new ExpressionParser(text).parseStatements();
    }

    private StatementsNode parseStatements() {
        List<ExpressionNode> statements = new ArrayList<>();
        while (peek().getType() != TokenType.END) {
            if (peek().isStatementEnd()) {
                next();
                continue;
            }
            ExpressionNode statement = parseStatement();
            if (statement.getDepth() > MAX_DEPTH) {
                throw new ExpressionSyntaxException(text, statement.getPosition(), "expression too deeply nested");
            }
            statements.add(statement);
            if (!peek().isStatementEnd()) {
                throw error(peek(), "unexpected " + peek());
            }
        }
        return new StatementsNode(statements);
    }

    private ExpressionNode parseStatement() {
        Token first = peek();
        if (first.isKeyword("import") || first.isKeyword("from")) {
            return skipStatement(NodeKind.IMPORT);
        }
        if (first.getType() == TokenType.KEYWORD && STATEMENT_KEYWORDS.contains(first.getText())) {
            return skipStatement(NodeKind.STATEMENT);
        }
        ExpressionNode expression = parseStarredOrTest();
        Token token = peek();
        if (token.isOperator("=") || token.isOperator(":") || isAugmentedAssignment(token)) {
            skipStatement(NodeKind.ASSIGNMENT);
            return unsupported(NodeKind.ASSIGNMENT, first, previous());
        }
        if (token.isOperator(",")) {
            return parseTupleTail(expression, first);
        }
        return expression;
    }

    private UnsupportedNode skipStatement(NodeKind kind) {
        Token first = peek();
        int depth = 0;
        while (peek().getType() != TokenType.END && (depth > 0 || !peek().isStatementEnd())) {
            Token token = next();
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
            }
        }
        return unsupported(kind, first, previous());
    }

    // bare "a, b" at statement level is a tuple
    private ExpressionNode parseTupleTail(ExpressionNode head, Token first) {
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(head);
        while (accept(",")) {
            if (peek().isStatementEnd() || peek().isOperator("=")) {
                break;
            }
            elements.add(parseStarredOrTest());
        }
        if (peek().isOperator("=")) {
            skipStatement(NodeKind.ASSIGNMENT);
            return unsupported(NodeKind.ASSIGNMENT, first, previous());
        }
        return new CollectionNode(NodeKind.TUPLE, first.getPosition(), elements);
    }

    private ExpressionNode parseStarredOrTest() {
        Token token = peek();
        if (token.isOperator("*")) {
            next();
            parseOr();
            return unsupported(NodeKind.STARRED, token, previous());
        }
        return parseTest();
    }

    private ExpressionNode parseTest() {
        enter(peek());
        try {
            return parseTestBody();
        } finally {
            nesting--;
        }
    }

    private ExpressionNode parseTestBody() {
        Token first = peek();
        if (first.isKeyword("lambda")) {
            next();
            skipUntilColon();
            expectOperator(":");
            parseTest();
            return unsupported(NodeKind.LAMBDA, first, previous());
        }
        ExpressionNode expression = parseOr();
        if (peek().isKeyword("if")) {
            next();
            parseOr();
            expectKeyword("else");
            parseTest();
            return unsupported(NodeKind.CONDITIONAL, first, previous());
        }
        if (peek().isOperator(":=")) {
            next();
            parseTest();
            return unsupported(NodeKind.NAMED_EXPRESSION, first, previous());
        }
        return expression;
    }

    private ExpressionNode parseOr() {
        Token first = peek();
        List<ExpressionNode> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (acceptKeyword("or")) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new BoolOpNode(first.getPosition(), BoolOperator.OR, operands);
    }

    private ExpressionNode parseAnd() {
        Token first = peek();
        List<ExpressionNode> operands = new ArrayList<>();
        operands.add(parseNot());
        while (acceptKeyword("and")) {
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new BoolOpNode(first.getPosition(), BoolOperator.AND, operands);
    }

    private ExpressionNode parseNot() {
        Token token = peek();
        if (token.isKeyword("not")) {
            next();
            enter(token);
            try {
                return new UnaryOpNode(token.getPosition(), UnaryOperator.NOT, parseNot());
            } finally {
                nesting--;
            }
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        Token first = peek();
        ExpressionNode left = parseBinary(0);
        List<CompareOperator> operators = new ArrayList<>();
        List<ExpressionNode> comparators = new ArrayList<>();
        while (true) {
            CompareOperator operator = acceptCompareOperator();
            if (operator == null) {
                break;
            }
            operators.add(operator);
            comparators.add(parseBinary(0));
        }
        if (operators.isEmpty()) {
            return left;
        }
        return new CompareNode(first.getPosition(), left, operators, comparators);
    }

    private CompareOperator acceptCompareOperator() {
        Token token = peek();
        if (token.getType() == TokenType.OPERATOR && COMPARE_SYMBOLS.containsKey(token.getText())) {
            next();
            return COMPARE_SYMBOLS.get(token.getText());
        }
        if (token.isKeyword("in")) {
            next();
            return CompareOperator.IN;
        }
        if (token.isKeyword("not") && peekAt(1).isKeyword("in")) {
            next();
            next();
            return CompareOperator.NOT_IN;
        }
        if (token.isKeyword("is")) {
            next();
            return acceptKeyword("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
        }
        return null;
    }

    private ExpressionNode parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseFactor();
        }
        ExpressionNode left = parseBinary(level + 1);
        while (true) {
            Token token = peek();
            String symbol = matchOperator(token, BINARY_LEVELS[level]);
            if (symbol == null) {
                return left;
            }
            next();
            ExpressionNode right = parseBinary(level + 1);
            left = new BinaryOpNode(token.getPosition(), BinaryOperator.fromSymbol(symbol), left, right);
        }
    }

    private ExpressionNode parseFactor() {
        Token token = peek();
        UnaryOperator operator = null;
        if (token.isOperator("+")) {
            operator = UnaryOperator.PLUS;
        } else if (token.isOperator("-")) {
            operator = UnaryOperator.MINUS;
        } else if (token.isOperator("~")) {
            operator = UnaryOperator.INVERT;
        }
        if (operator != null) {
            next();
            enter(token);
            try {
                return new UnaryOpNode(token.getPosition(), operator, parseFactor());
            } finally {
                nesting--;
            }
        }
        return parsePower();
    }

    private ExpressionNode parsePower() {
        ExpressionNode base = parsePrimary();
        Token token = peek();
        if (token.isOperator("**")) {
            next();
            enter(token);
            try {
                return new BinaryOpNode(token.getPosition(), BinaryOperator.POWER, base, parseFactor());
            } finally {
                nesting--;
            }
        }
        return base;
    }

    private ExpressionNode parsePrimary() {
        Token first = peek();
        ExpressionNode node = parseAtom();
        while (true) {
            Token token = peek();
            if (token.isOperator("(")) {
                next();
                node = parseCall(node, first);
            } else if (token.isOperator("[")) {
                next();
                skipBalanced("]");
                node = unsupported(NodeKind.SUBSCRIPT, first, previous());
            } else if (token.isOperator(".")) {
                next();
                expectName();
                node = unsupported(NodeKind.ATTRIBUTE, first, previous());
            } else {
                return node;
            }
        }
    }

    private ExpressionNode parseCall(ExpressionNode function, Token first) {
        List<ExpressionNode> arguments = new ArrayList<>();
        List<KeywordArgument> keywords = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        while (!peek().isOperator(")")) {
            Token token = peek();
            if (token.isOperator("**")) {
                next();
                parseTest();
                keywords.add(new KeywordArgument(null, unsupported(NodeKind.DOUBLE_STARRED, token, previous())));
            } else if (token.getType() == TokenType.NAME && peekAt(1).isOperator("=")) {
                next();
                next();
                if (!seen.add(token.getText())) {
                    throw error(token, "keyword argument repeated: " + token.getText());
                }
                keywords.add(new KeywordArgument(token.getText(), parseTest()));
            } else {
                if (!keywords.isEmpty()) {
                    throw error(token, "positional argument follows keyword argument");
                }
                ExpressionNode argument = parseStarredOrTest();
                if (peek().isKeyword("for")) {
                    skipBalanced(")");
                    return unsupported(NodeKind.COMPREHENSION, first, previous());
                }
                arguments.add(argument);
            }
            if (!accept(",")) {
                break;
            }
        }
        expectOperator(")");
        return new CallNode(first.getPosition(), function, arguments, keywords);
    }

    private ExpressionNode parseAtom() {
        Token token = next();
        switch (token.getType()) {
            case INTEGER:
                return new LiteralNode(NodeKind.INTEGER, token.getPosition(), IntValue.of((Long) token.getLiteral()));
            case FLOAT:
                return new LiteralNode(NodeKind.FLOAT, token.getPosition(), FloatValue.of((Double) token.getLiteral()));
            case STRING:
                return parseStringLiteral(token);
            case NAME:
                return new NameNode(token.getPosition(), token.getText());
            case KEYWORD:
                return parseKeywordAtom(token);
            case OPERATOR:
                return parseBracketAtom(token);
            default:
                throw error(token, "unexpected " + token);
        }
    }

    private ExpressionNode parseKeywordAtom(Token token) {
        switch (token.getText()) {
            case "True":
                return new LiteralNode(NodeKind.BOOLEAN, token.getPosition(), BoolValue.TRUE);
            case "False":
                return new LiteralNode(NodeKind.BOOLEAN, token.getPosition(), BoolValue.FALSE);
            case "None":
                return new LiteralNode(NodeKind.NONE, token.getPosition(), null);
            case "and":
            case "or":
                // prefix form: and(a, b, ...)
                if (peek().isOperator("(")) {
                    next();
                    List<ExpressionNode> operands = parseElements(")");
                    BoolOperator operator = "and".equals(token.getText()) ? BoolOperator.AND : BoolOperator.OR;
                    return new BoolOpNode(token.getPosition(), operator, operands);
                }
                throw error(token, "unexpected " + token);
            case "await":
            case "yield":
                parseTest();
                return unsupported(NodeKind.STATEMENT, token, previous());
            default:
                throw error(token, "unexpected " + token);
        }
    }

    private ExpressionNode parseBracketAtom(Token token) {
        switch (token.getText()) {
            case "(":
                return parseParenthesized(token);
            case "[":
                return parseCollection(token, NodeKind.LIST, "]");
            case "{":
                return parseBrace(token);
            case "...":
                return unsupported(NodeKind.ELLIPSIS, token, token);
            default:
                throw error(token, "unexpected " + token);
        }
    }

    private ExpressionNode parseParenthesized(Token open) {
        if (accept(")")) {
            return new CollectionNode(NodeKind.TUPLE, open.getPosition(), List.of());
        }
        ExpressionNode first = parseStarredOrTest();
        if (peek().isKeyword("for")) {
            skipBalanced(")");
            return unsupported(NodeKind.COMPREHENSION, open, previous());
        }
        if (accept(")")) {
            return first;
        }
        expectOperator(",");
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        elements.addAll(parseElements(")"));
        return new CollectionNode(NodeKind.TUPLE, open.getPosition(), elements);
    }

    private ExpressionNode parseCollection(Token open, NodeKind kind, String close) {
        if (accept(close)) {
            return new CollectionNode(kind, open.getPosition(), List.of());
        }
        ExpressionNode first = parseStarredOrTest();
        if (peek().isKeyword("for")) {
            skipBalanced(close);
            return unsupported(NodeKind.COMPREHENSION, open, previous());
        }
        List<ExpressionNode> elements = new ArrayList<>();
        elements.add(first);
        if (!accept(close)) {
            expectOperator(",");
            elements.addAll(parseElements(close));
        }
        return new CollectionNode(kind, open.getPosition(), elements);
    }

    private ExpressionNode parseBrace(Token open) {
        if (accept("}")) {
            return new DictNode(open.getPosition(), List.of(), List.of());
        }
        if (peek().isOperator("*")) {
            return parseCollection(open, NodeKind.SET, "}");
        }
        if (!peek().isOperator("**")) {
            int mark = index;
            parseTest();
            boolean isDict = peek().isOperator(":");
            index = mark;
            if (!isDict) {
                return parseCollection(open, NodeKind.SET, "}");
            }
        }
        List<ExpressionNode> keys = new ArrayList<>();
        List<ExpressionNode> values = new ArrayList<>();
        do {
            if (peek().isOperator("}")) {
                break;
            }
            Token entry = peek();
            if (accept("**")) {
                parseBinary(0);
                UnsupportedNode spread = unsupported(NodeKind.DOUBLE_STARRED, entry, previous());
                keys.add(spread);
                values.add(spread);
                continue;
            }
            keys.add(parseTest());
            expectOperator(":");
            values.add(parseTest());
            if (peek().isKeyword("for")) {
                skipBalanced("}");
                return unsupported(NodeKind.COMPREHENSION, open, previous());
            }
        } while (accept(","));
        expectOperator("}");
        return new DictNode(open.getPosition(), keys, values);
    }

    // comma separated elements up to and including the closing token
    private List<ExpressionNode> parseElements(String close) {
        List<ExpressionNode> elements = new ArrayList<>();
        while (!peek().isOperator(close)) {
            elements.add(parseStarredOrTest());
            if (!accept(",")) {
                break;
            }
        }
        expectOperator(close);
        return elements;
    }

    private ExpressionNode parseStringLiteral(Token token) {
        StringBuilder value = new StringBuilder();
        Token last = token;
        boolean bytes = false;
        boolean formatted = false;
        Token current = token;
        while (true) {
            value.append((String) current.getLiteral());
            bytes |= current.getPrefix().contains("b");
            formatted |= current.getPrefix().contains("f");
            last = current;
            if (peek().getType() != TokenType.STRING) {
                break;
            }
            current = next();
        }
        if (formatted) {
            return unsupported(NodeKind.FORMATTED_STRING, token, last);
        }
        if (bytes) {
            return unsupported(NodeKind.BYTES, token, last);
        }
        return new LiteralNode(NodeKind.STRING, token.getPosition(), StrValue.of(value.toString()));
    }

    private void skipBalanced(String close) {
        int depth = 0;
        while (true) {
            Token token = peek();
            if (token.getType() == TokenType.END) {
                throw error(token, "expected '" + close + "'");
            }
            next();
            if (depth == 0 && token.isOperator(close)) {
                return;
            }
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
            }
        }
    }

    private void skipUntilColon() {
        int depth = 0;
        while (peek().getType() != TokenType.END) {
            Token token = peek();
            if (depth == 0 && token.isOperator(":")) {
                return;
            }
            if (isOpening(token)) {
                depth++;
            } else if (isClosing(token)) {
                depth--;
            }
            next();
        }
    }

    private UnsupportedNode unsupported(NodeKind kind, Token first, Token last) {
        int end = Math.min(text.length(), Math.max(first.getPosition(), last.getPosition() + last.getText().length()));
        return new UnsupportedNode(kind, first.getPosition(), text.substring(first.getPosition(), end));
    }

    private static String matchOperator(Token token, String[] symbols) {
        if (token.getType() != TokenType.OPERATOR) {
            return null;
        }
        for (String symbol : symbols) {
            if (token.getText().equals(symbol)) {
                return symbol;
            }
        }
        return null;
    }

    private static boolean isAugmentedAssignment(Token token) {
        return token.getType() == TokenType.OPERATOR && token.getText().length() >= 2
                && token.getText().endsWith("=") && !COMPARE_SYMBOLS.containsKey(token.getText())
                && !token.getText().equals(":=");
    }

    private static boolean isOpening(Token token) {
        return token.isOperator("(") || token.isOperator("[") || token.isOperator("{");
    }

    private static boolean isClosing(Token token) {
        return token.isOperator(")") || token.isOperator("]") || token.isOperator("}");
    }

    // bounds the recursion of the descent, not the size of the tree
    private void enter(Token token) {
        if (++nesting > MAX_NESTING) {
            throw error(token, "too many nested expressions (limit " + MAX_NESTING + ")");
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(0, index - 1));
    }

    private Token next() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }

    private boolean accept(String symbol) {
        if (peek().isOperator(symbol)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            next();
            return true;
        }
        return false;
    }

    private void expectOperator(String symbol) {
        if (!accept(symbol)) {
            throw error(peek(), "expected '" + symbol + "' but found " + peek());
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error(peek(), "expected '" + keyword + "' but found " + peek());
        }
    }

    private void expectName() {
        if (peek().getType() != TokenType.NAME && peek().getType() != TokenType.KEYWORD) {
            throw error(peek(), "expected a name but found " + peek());
        }
        next();
    }

    private ExpressionSyntaxException error(Token token, String reason) {
        return new ExpressionSyntaxException(text, token.getPosition(), reason);
    }
}
