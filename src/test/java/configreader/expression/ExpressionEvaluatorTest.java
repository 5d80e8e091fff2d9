package configreader.expression;

import configreader.expression.node.ExpressionNode;
import configreader.expression.node.LiteralNode;
import configreader.expression.node.NodeKind;
import configreader.expression.node.UnaryOpNode;
import configreader.expression.node.UnaryOperator;
import configreader.value.BoolValue;
import configreader.value.FloatValue;
import configreader.value.IntValue;
import configreader.value.ListValue;
import configreader.value.MapValue;
import configreader.value.SequenceValue;
import configreader.value.SetValue;
import configreader.value.StrValue;
import configreader.value.Value;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    @Test
    void evaluate_arithmetic() {
        assertEquals(IntValue.of(2), evaluator.evaluate("1 + 1"));
        assertEquals(IntValue.of(300000000), evaluator.evaluate("3 * 10 ** 8"));
        assertEquals(FloatValue.of(3.5), evaluator.evaluate("7 / 2"));
        assertEquals(IntValue.of(-4), evaluator.evaluate("-7 // 2"));
        assertEquals(IntValue.of(2), evaluator.evaluate("-7 % 3"));
        assertEquals(IntValue.of(-4), evaluator.evaluate("-2 ** 2"));
        assertEquals(FloatValue.of(0.5), evaluator.evaluate("2 ** -1"));
        assertEquals(IntValue.of(2), evaluator.evaluate("True + 1"));
        assertEquals(StrValue.of("ab"), evaluator.evaluate("'a' + 'b'"));
        assertEquals(ListValue.of(IntValue.of(1), IntValue.of(1)), evaluator.evaluate("[1] * 2"));
    }

    @Test
    void evaluate_unaryOperators() {
        assertEquals(IntValue.of(-3), evaluator.evaluate("-3"));
        assertEquals(IntValue.of(1), evaluator.evaluate("+True"));
        assertEquals(BoolValue.FALSE, evaluator.evaluate("not 1"));
        assertEquals(IntValue.of(-6), evaluator.evaluate("~5"));
    }

    @Test
    void evaluate_numericErrorsAreEvaluationErrors() {
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("1 / 0"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("1 % 0"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("9223372036854775807 + 1"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("'a' - 1"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("~1.5"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("[1, 2, 3] * 1000000000"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("'ab' * 2000000000"));
    }

    @Test
    void evaluate_rejectsTreesDeeperThanTheParserLimit() {
        ExpressionNode node = new LiteralNode(NodeKind.INTEGER, 0, IntValue.of(1));
        for (int i = 0; i < ExpressionParser.MAX_DEPTH; i++) {
            node = new UnaryOpNode(0, UnaryOperator.MINUS, node);
        }
        ExpressionNode tooDeep = node;

        assertThrows(EvaluationException.class, () -> evaluator.evaluate(tooDeep));
        assertThrows(ExpressionSyntaxException.class,
                () -> evaluator.evaluate("(".repeat(20000) + "1" + ")".repeat(20000)));
    }

    @Test
    void evaluate_chainedComparison() {
        assertEquals(BoolValue.TRUE, evaluator.evaluate("1 < 2 < 3"));
        assertEquals(BoolValue.FALSE, evaluator.evaluate("1 < 3 < 2"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("1 == 1.0 != 2"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("2 in [1, 2]"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("'x' not in 'abc'"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("1 is 1"));
        assertEquals(BoolValue.FALSE, evaluator.evaluate("1 is 1.0"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("{1} < {1, 2}"));
    }

    @Test
    void evaluate_orderingAcrossUnrelatedTypesFails() {
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("1 < 'a'"));
    }

    @Test
    void evaluate_booleanCombinatorsReturnBooleans() {
        assertEquals(BoolValue.FALSE, evaluator.evaluate("True and 0"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("0 or 'x'"));
        assertEquals(BoolValue.FALSE, evaluator.evaluate("and(True, False)"));
        assertEquals(BoolValue.TRUE, evaluator.evaluate("or(False, 0, 1)"));
    }

    @Test
    void evaluate_booleanCombinatorNeedsTwoOperands() {
        var error = assertThrows(ArityException.class, () -> evaluator.evaluate("and(True)"));
        assertEquals(1, error.getOperandCount());
        assertThrows(ArityException.class, () -> evaluator.evaluate("or()"));
    }

    @Test
    void evaluate_stringLiteralNamingConstantIsReplaced() {
        evaluator.registerConstant("c", IntValue.of(5));

        assertEquals(IntValue.of(5), evaluator.evaluate("'c'"));
        assertEquals(IntValue.of(5), evaluator.evaluate("c"));
        assertEquals(IntValue.of(6), evaluator.evaluate("c + 1"));
    }

    @Test
    void evaluate_unknownNameIsItsOwnSpelling() {
        assertEquals(StrValue.of("custom"), evaluator.evaluate("custom"));
        assertEquals(FloatValue.of(Math.PI), evaluator.evaluate("pi"));
        assertEquals(FloatValue.of(Math.E), evaluator.evaluate("E"));
    }

    @Test
    void evaluate_registeredFunctions() {
        assertEquals(IntValue.of(0), evaluator.evaluate("sin(0)"));
        assertEquals(FloatValue.of(4.0), evaluator.evaluate("sqrt(16)"));
        assertEquals(FloatValue.of(4.0), evaluator.evaluate("root(16)"));
        assertEquals(IntValue.of(6), evaluator.evaluate("sum([1, 2, 3])"));
        assertEquals(IntValue.of(16), evaluator.evaluate("sum([1, 2, 3], start=10)"));
    }

    @Test
    void evaluate_unknownFunctionIsRejected() {
        var error = assertThrows(UnknownFunctionException.class, () -> evaluator.evaluate("undefined_fn(1)"));
        assertEquals("undefined_fn", error.getFunctionName());
    }

    @Test
    void evaluate_customFunctionReceivesArguments() {
        evaluator.registerFunction("pick", (arguments, keywords) ->
                keywords.getOrDefault("fallback", arguments.get(0)));

        assertEquals(IntValue.of(1), evaluator.evaluate("pick(1)"));
        assertEquals(StrValue.of("b"), evaluator.evaluate("pick(1, fallback='b')"));
    }

    @Test
    void evaluate_functionFailureBecomesEvaluationError() {
        evaluator.registerFunction("boom", (arguments, keywords) -> {
            throw new IllegalStateException("broken");
        });

        var error = assertThrows(EvaluationException.class, () -> evaluator.evaluate("boom()"));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void evaluate_rejectsEverythingOutsideTheWhitelist() {
        Map<String, NodeKind> forbidden = new LinkedHashMap<>();
        forbidden.put("a.b", NodeKind.ATTRIBUTE);
        forbidden.put("x[0]", NodeKind.SUBSCRIPT);
        forbidden.put("lambda x: x", NodeKind.LAMBDA);
        forbidden.put("x = 1", NodeKind.ASSIGNMENT);
        forbidden.put("x += 1", NodeKind.ASSIGNMENT);
        forbidden.put("import os", NodeKind.IMPORT);
        forbidden.put("from os import path", NodeKind.IMPORT);
        forbidden.put("del x", NodeKind.STATEMENT);
        forbidden.put("1 if True else 2", NodeKind.CONDITIONAL);
        forbidden.put("[x for x in y]", NodeKind.COMPREHENSION);
        forbidden.put("(y := 1)", NodeKind.NAMED_EXPRESSION);
        forbidden.put("None", NodeKind.NONE);
        forbidden.put("b'raw'", NodeKind.BYTES);
        forbidden.put("f'{x}'", NodeKind.FORMATTED_STRING);
        forbidden.put("...", NodeKind.ELLIPSIS);
        forbidden.put("os.system('ls')", NodeKind.CALL);
        forbidden.put("__import__('os').system('ls')", NodeKind.CALL);
        forbidden.put("sum(*values)", NodeKind.STARRED);
        forbidden.put("sum(**options)", NodeKind.DOUBLE_STARRED);

        forbidden.forEach((text, kind) -> {
            var error = assertThrows(UnsupportedSyntaxException.class, () -> evaluator.evaluate(text), text);
            assertEquals(kind, error.getKind(), text);
        });
    }

    @Test
    void evaluate_forbiddenFormNeverRunsItsOperands() {
        AtomicInteger calls = new AtomicInteger();
        evaluator.registerFunction("counter", (arguments, keywords) -> IntValue.of(calls.incrementAndGet()));

        assertThrows(UnsupportedSyntaxException.class, () -> evaluator.evaluate("counter().real"));
        assertThrows(UnsupportedSyntaxException.class, () -> evaluator.evaluate("[counter()][0]"));
        assertEquals(0, calls.get());
    }

    @Test
    void evaluate_operatorsOutsideTheTableAreRejected() {
        var error = assertThrows(UnsupportedOperatorException.class, () -> evaluator.evaluate("1 << 2"));
        assertEquals("<<", error.getOperator());
        assertThrows(UnsupportedOperatorException.class, () -> evaluator.evaluate("1 | 2"));
        assertThrows(UnsupportedOperatorException.class, () -> evaluator.evaluate("a @ b"));
    }

    @Test
    void evaluate_collections() {
        assertEquals(ListValue.of(IntValue.of(1), StrValue.of("a")), evaluator.evaluate("[1, 'a']"));
        assertEquals(SetValue.of(IntValue.of(1), IntValue.of(2)), evaluator.evaluate("{1, 2, 2}"));
        assertEquals(MapValue.of(Map.of(IntValue.of(1), StrValue.of("b"))), evaluator.evaluate("{1: 'a', 1: 'b'}"));
        assertEquals(MapValue.of(Map.of()), evaluator.evaluate("{}"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("{[1], 2}"));
        assertThrows(EvaluationException.class, () -> evaluator.evaluate("{[1]: 2}"));
    }

    @Test
    void evaluate_tupleIsLazySinglePassSequence() {
        Value value = evaluator.evaluate("(1, 1 / 0)");

        SequenceValue sequence = assertInstanceOf(SequenceValue.class, value);
        var iterator = sequence.iterator();
        assertEquals(IntValue.of(1), iterator.next());
        assertThrows(EvaluationException.class, iterator::next);
        assertTrue(sequence.isExhausted());
    }

    @Test
    void evaluate_tupleForms() {
        assertEquals(List.of(IntValue.of(1), IntValue.of(2)),
                assertInstanceOf(SequenceValue.class, evaluator.evaluate("1, 2")).consume());
        assertEquals(List.of(), assertInstanceOf(SequenceValue.class, evaluator.evaluate("()")).consume());
        assertEquals(IntValue.of(1), evaluator.evaluate("(1)"));
        assertEquals(IntValue.of(6), evaluator.evaluate("sum((1, 2, 3))"));
    }

    @Test
    void evaluate_statementsBecomeList() {
        assertEquals(ListValue.of(IntValue.of(1), IntValue.of(2)), evaluator.evaluate("1; 2"));
        assertEquals(ListValue.of(IntValue.of(10), IntValue.of(20)), evaluator.evaluate("\n10\n20"));
        assertEquals(ListValue.of(), evaluator.evaluate(""));
        assertEquals(ListValue.of(), evaluator.evaluate("# nothing here"));
    }

    @Test
    void evaluate_malformedTextIsSyntaxError() {
        assertThrows(ExpressionSyntaxException.class, () -> evaluator.evaluate("1 +"));
        assertThrows(ExpressionSyntaxException.class, () -> evaluator.evaluate("(1"));
        assertThrows(ExpressionSyntaxException.class, () -> evaluator.evaluate("'open"));
        assertThrows(ExpressionSyntaxException.class, () -> evaluator.evaluate("1 2"));
    }

    @Test
    void evaluate_renderedValuesEvaluateBack() {
        List<Value> values = List.of(
                IntValue.of(-5),
                FloatValue.of(0.1),
                FloatValue.of(1e20),
                FloatValue.of(-2.5e-7),
                BoolValue.TRUE,
                StrValue.of("it's\n\"quoted\"\t"),
                ListValue.of(IntValue.of(1), StrValue.of("a"), ListValue.of(FloatValue.of(2.5))),
                SetValue.of(IntValue.of(1), StrValue.of("x")),
                MapValue.of(Map.of(StrValue.of("k"), ListValue.of(BoolValue.FALSE))));

        for (Value value : values) {
            assertEquals(value, evaluator.evaluate(value.render()), value.render());
        }
    }
}
