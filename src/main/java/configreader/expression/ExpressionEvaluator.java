package configreader.expression;

import configreader.expression.node.BinaryOpNode;
import configreader.expression.node.BoolOpNode;
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
import configreader.value.BoolValue;
import configreader.value.ListValue;
import configreader.value.MapValue;
import configreader.value.SequenceValue;
import configreader.value.SetValue;
import configreader.value.StrValue;
import configreader.value.Value;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Restricted interpreter for configuration values.
 * <p>
 * Accepted: int, float, bool and string literals; names; the arithmetic
 * operators {@code + - * / // % **}; unary {@code + - not ~}; {@code and} /
 * {@code or}; chained comparisons; list, set, dict and tuple displays; calls
 * of registered functions by bare name. Every other form is rejected with
 * {@link UnsupportedSyntaxException} before anything is executed.
 * <p>
 * Names and string literals that equal a registered constant evaluate to the
 * constant. Any other name evaluates to its own spelling as a string.
 * Tuple displays yield a lazy, single-pass {@link SequenceValue}.
 * <pre>
 * ExpressionEvaluator evaluator = new ExpressionEvaluator();
 * evaluator.evaluate("1 + 1");               // 2
 * evaluator.evaluate("sin(2 * pi)");         // -2.4492935982947064e-16
 * evaluator.evaluate("{'foo': 'bar'}");      // {'foo': 'bar'}
 * </pre>
 */
@Slf4j
public class ExpressionEvaluator {

    @Getter
    private final ExpressionRegistry registry;

    public ExpressionEvaluator() {
        this(ExpressionRegistry.withDefaults());
    }

    public ExpressionEvaluator(ExpressionRegistry registry) {
        this.registry = registry;
    }

    public ExpressionEvaluator registerConstant(String name, Value value) {
        registry.registerConstant(name, value);
        return this;
    }

    public ExpressionEvaluator registerFunction(String name, ConfigFunction function) {
        registry.registerFunction(name, function);
        return this;
    }

    /**
     * Parses and evaluates {@code text}. A single statement yields its value;
     * several statements (separated by {@code ;} or newlines) yield a list of
     * their values, and empty text yields the empty list.
     */
    public Value evaluate(String text) {
        StatementsNode tree = ExpressionParser.parse(text);
        Value value = evaluate(tree);
        log.trace("Evaluated '{}' -> {}", text, value);
        return value;
    }

    /**
     * Evaluates an already parsed tree.
     *
     * @throws EvaluationException when the tree is deeper than
     *                             {@link ExpressionParser#MAX_DEPTH}
     */
    public Value evaluate(ExpressionNode node) {
        if (node.getDepth() > ExpressionParser.MAX_DEPTH) {
            throw new EvaluationException("expression too deeply nested: depth " + node.getDepth());
        }
        return evaluateNode(node);
    }

    private Value evaluateNode(ExpressionNode node) {
        switch (node.getKind()) {
            case INTEGER:
            case FLOAT:
            case BOOLEAN:
                return ((LiteralNode) node).getValue();
            case STRING:
                return evaluateString((LiteralNode) node);
            case NAME:
                return evaluateName((NameNode) node);
            case BINARY_OPERATION:
                return evaluateBinary((BinaryOpNode) node);
            case UNARY_OPERATION:
                return evaluateUnary((UnaryOpNode) node);
            case BOOLEAN_OPERATION:
                return evaluateBoolean((BoolOpNode) node);
            case COMPARISON:
                return evaluateComparison((CompareNode) node);
            case LIST:
                return ListValue.of(evaluateAll(((CollectionNode) node).getElements()));
            case SET:
                return evaluateSet((CollectionNode) node);
            case DICT:
                return evaluateDict((DictNode) node);
            case TUPLE:
                return evaluateTuple((CollectionNode) node);
            case CALL:
                return evaluateCall((CallNode) node);
            case STATEMENTS:
                return evaluateStatements((StatementsNode) node);
            default:
                throw new UnsupportedSyntaxException(node.getKind());
        }
    }

    private Value evaluateString(LiteralNode node) {
        Value literal = node.getValue();
        Value constant = registry.getConstant(((StrValue) literal).getValue());
        return constant != null ? constant : literal;
    }

    private Value evaluateName(NameNode node) {
        Value constant = registry.getConstant(node.getIdentifier());
        return constant != null ? constant : StrValue.of(node.getIdentifier());
    }

    private Value evaluateBinary(BinaryOpNode node) {
        Value left = evaluateNode(node.getLeft());
        Value right = evaluateNode(node.getRight());
        switch (node.getOperator()) {
            case ADD:
                return Operators.add(left, right);
            case SUBTRACT:
                return Operators.subtract(left, right);
            case MULTIPLY:
                return Operators.multiply(left, right);
            case DIVIDE:
                return Operators.divide(left, right);
            case FLOOR_DIVIDE:
                return Operators.floorDivide(left, right);
            case MODULO:
                return Operators.modulo(left, right);
            case POWER:
                return Operators.power(left, right);
            default:
                throw new UnsupportedOperatorException(node.getOperator().getSymbol());
        }
    }

    private Value evaluateUnary(UnaryOpNode node) {
        Value operand = evaluateNode(node.getOperand());
        switch (node.getOperator()) {
            case PLUS:
                return Operators.plus(operand);
            case MINUS:
                return Operators.minus(operand);
            case NOT:
                return Operators.not(operand);
            case INVERT:
                return Operators.invert(operand);
            default:
                throw new UnsupportedOperatorException(node.getOperator().getSymbol());
        }
    }

    // every operand is evaluated; no short circuit
    private Value evaluateBoolean(BoolOpNode node) {
        if (node.getOperands().size() < 2) {
            throw new ArityException(node.getOperator().getSymbol(), node.getOperands().size());
        }
        List<Value> operands = evaluateAll(node.getOperands());
        switch (node.getOperator()) {
            case AND:
                return BoolValue.of(operands.stream().allMatch(Value::isTruthy));
            case OR:
                return BoolValue.of(operands.stream().anyMatch(Value::isTruthy));
            default:
                throw new UnsupportedOperatorException(node.getOperator().getSymbol());
        }
    }

    private Value evaluateComparison(CompareNode node) {
        Value previous = evaluateNode(node.getLeft());
        boolean result = true;
        for (int i = 0; i < node.getOperators().size(); i++) {
            Value next = evaluateNode(node.getComparators().get(i));
            result &= compare(node.getOperators().get(i), previous, next);
            previous = next;
        }
        return BoolValue.of(result);
    }

    private boolean compare(CompareOperator operator, Value left, Value right) {
        switch (operator) {
            case EQUAL:
                return Operators.equal(left, right);
            case NOT_EQUAL:
                return !Operators.equal(left, right);
            case LESS:
            case LESS_OR_EQUAL:
            case GREATER:
            case GREATER_OR_EQUAL:
                return Operators.order(operator.getSymbol(), left, right);
            case IS:
                return Operators.identical(left, right);
            case IS_NOT:
                return !Operators.identical(left, right);
            case IN:
                return Operators.contains(right, left);
            case NOT_IN:
                return !Operators.contains(right, left);
            default:
                throw new UnsupportedOperatorException(operator.getSymbol());
        }
    }

    private Value evaluateSet(CollectionNode node) {
        List<Value> elements = evaluateAll(node.getElements());
        for (Value element : elements) {
            requireHashable(element);
        }
        return SetValue.of(elements);
    }

    // keys first, then values
    private Value evaluateDict(DictNode node) {
        List<Value> keys = evaluateAll(node.getKeys());
        List<Value> values = evaluateAll(node.getValues());
        Map<Value, Value> entries = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            entries.put(requireHashable(keys.get(i)), values.get(i));
        }
        return MapValue.of(entries);
    }

    private Value evaluateTuple(CollectionNode node) {
        List<Supplier<Value>> elements = new ArrayList<>();
        for (ExpressionNode element : node.getElements()) {
            if (element.getKind() == NodeKind.STARRED) {
                throw new UnsupportedSyntaxException(NodeKind.STARRED);
            }
            elements.add(() -> evaluateNode(element));
        }
        return SequenceValue.lazy(elements);
    }

    private Value evaluateCall(CallNode node) {
        if (node.getFunction().getKind() != NodeKind.NAME) {
            throw new UnsupportedSyntaxException(NodeKind.CALL,
                    "Forbidden call target: " + node.getFunction().getKind().getDescription());
        }
        for (ExpressionNode argument : node.getArguments()) {
            if (argument.getKind() == NodeKind.STARRED) {
                throw new UnsupportedSyntaxException(NodeKind.STARRED, "Forbidden argument unpacking in call");
            }
        }
        for (KeywordArgument keyword : node.getKeywords()) {
            if (keyword.getName() == null) {
                throw new UnsupportedSyntaxException(NodeKind.DOUBLE_STARRED, "Forbidden keyword unpacking in call");
            }
        }
        String name = ((NameNode) node.getFunction()).getIdentifier();
        ConfigFunction function = registry.getFunction(name);
        if (function == null) {
            throw new UnknownFunctionException(name);
        }
        List<Value> arguments = evaluateAll(node.getArguments());
        Map<String, Value> keywords = new LinkedHashMap<>();
        for (KeywordArgument keyword : node.getKeywords()) {
            keywords.put(keyword.getName(), evaluateNode(keyword.getValue()));
        }
        try {
            return function.apply(arguments, keywords);
        } catch (ExpressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Function " + name + " failed: " + e.getMessage(), e);
        }
    }

    private Value evaluateStatements(StatementsNode node) {
        List<ExpressionNode> statements = node.getStatements();
        if (statements.size() == 1) {
            return evaluateNode(statements.get(0));
        }
        return ListValue.of(evaluateAll(statements));
    }

    private List<Value> evaluateAll(List<ExpressionNode> nodes) {
        List<Value> values = new ArrayList<>(nodes.size());
        for (ExpressionNode node : nodes) {
            values.add(evaluateNode(node));
        }
        return values;
    }

    private static Value requireHashable(Value value) {
        if (!value.isHashable()) {
            throw new EvaluationException("unhashable type: '" + value.getTypeName() + "'");
        }
        return value;
    }
}
