package configreader.expression;

import configreader.value.BoolValue;
import configreader.value.FloatValue;
import configreader.value.IntValue;
import configreader.value.ListValue;
import configreader.value.MapValue;
import configreader.value.NumberValue;
import configreader.value.SequenceValue;
import configreader.value.SetValue;
import configreader.value.StrValue;
import configreader.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongSupplier;

/**
 * Semantics of the whitelisted operators. {@code bool}, {@code int} and
 * {@code float} share one numeric tower; integers are 64-bit and overflow is
 * an error.
 */
final class Operators {

    // largest array length the JVM hands out
    private static final long MAX_REPEATED_LENGTH = Integer.MAX_VALUE - 8;

    private Operators() {
    }

    static Value add(Value left, Value right) {
        if (bothNumbers(left, right)) {
            NumberValue a = (NumberValue) left;
            NumberValue b = (NumberValue) right;
            if (a.isIntegral() && b.isIntegral()) {
                return IntValue.of(exact(() -> Math.addExact(a.longValue(), b.longValue())));
            }
            return checkedFloat(a.doubleValue() + b.doubleValue(), a, b);
        }
        if (left instanceof StrValue && right instanceof StrValue) {
            return StrValue.of(((StrValue) left).getValue() + ((StrValue) right).getValue());
        }
        if (left instanceof ListValue && right instanceof ListValue) {
            List<Value> joined = new ArrayList<>(((ListValue) left).getElements());
            joined.addAll(((ListValue) right).getElements());
            return ListValue.of(joined);
        }
        throw unsupportedOperands("+", left, right);
    }

    static Value subtract(Value left, Value right) {
        if (bothNumbers(left, right)) {
            NumberValue a = (NumberValue) left;
            NumberValue b = (NumberValue) right;
            if (a.isIntegral() && b.isIntegral()) {
                return IntValue.of(exact(() -> Math.subtractExact(a.longValue(), b.longValue())));
            }
            return checkedFloat(a.doubleValue() - b.doubleValue(), a, b);
        }
        if (left instanceof SetValue && right instanceof SetValue) {
            Set<Value> difference = new LinkedHashSet<>(((SetValue) left).getElements());
            difference.removeAll(((SetValue) right).getElements());
            return SetValue.of(difference);
        }
        throw unsupportedOperands("-", left, right);
    }

    static Value multiply(Value left, Value right) {
        if (bothNumbers(left, right)) {
            NumberValue a = (NumberValue) left;
            NumberValue b = (NumberValue) right;
            if (a.isIntegral() && b.isIntegral()) {
                return IntValue.of(exact(() -> Math.multiplyExact(a.longValue(), b.longValue())));
            }
            return checkedFloat(a.doubleValue() * b.doubleValue(), a, b);
        }
        if (isIntegral(right) && (left instanceof StrValue || left instanceof ListValue)) {
            return repeat(left, ((NumberValue) right).longValue());
        }
        if (isIntegral(left) && (right instanceof StrValue || right instanceof ListValue)) {
            return repeat(right, ((NumberValue) left).longValue());
        }
        throw unsupportedOperands("*", left, right);
    }

    static Value divide(Value left, Value right) {
        NumberValue[] operands = numbers("/", left, right);
        double divisor = operands[1].doubleValue();
        if (divisor == 0.0) {
            throw new EvaluationException("division by zero");
        }
        return checkedFloat(operands[0].doubleValue() / divisor, operands[0], operands[1]);
    }

    static Value floorDivide(Value left, Value right) {
        NumberValue[] operands = numbers("//", left, right);
        NumberValue a = operands[0];
        NumberValue b = operands[1];
        if (a.isIntegral() && b.isIntegral()) {
            if (b.longValue() == 0) {
                throw new EvaluationException("integer division or modulo by zero");
            }
            if (a.longValue() == Long.MIN_VALUE && b.longValue() == -1) {
                throw new EvaluationException("integer overflow");
            }
            return IntValue.of(Math.floorDiv(a.longValue(), b.longValue()));
        }
        if (b.doubleValue() == 0.0) {
            throw new EvaluationException("float floor division by zero");
        }
        return FloatValue.of(Math.floor(a.doubleValue() / b.doubleValue()));
    }

    static Value modulo(Value left, Value right) {
        NumberValue[] operands = numbers("%", left, right);
        NumberValue a = operands[0];
        NumberValue b = operands[1];
        if (a.isIntegral() && b.isIntegral()) {
            if (b.longValue() == 0) {
                throw new EvaluationException("integer division or modulo by zero");
            }
            return IntValue.of(Math.floorMod(a.longValue(), b.longValue()));
        }
        double divisor = b.doubleValue();
        if (divisor == 0.0) {
            throw new EvaluationException("float modulo");
        }
        double remainder = a.doubleValue() % divisor;
        // result takes the sign of the divisor
        if (remainder != 0.0 && (remainder < 0) != (divisor < 0)) {
            remainder += divisor;
        }
        return FloatValue.of(remainder);
    }

    static Value power(Value left, Value right) {
        NumberValue[] operands = numbers("**", left, right);
        NumberValue base = operands[0];
        NumberValue exponent = operands[1];
        if (base.isIntegral() && exponent.isIntegral() && exponent.longValue() >= 0) {
            return IntValue.of(integerPower(base.longValue(), exponent.longValue()));
        }
        double b = base.doubleValue();
        double e = exponent.doubleValue();
        if (b == 0.0 && e < 0) {
            throw new EvaluationException("0.0 cannot be raised to a negative power");
        }
        if (b < 0 && e != Math.rint(e)) {
            throw new EvaluationException("negative number cannot be raised to a fractional power");
        }
        return checkedFloat(Math.pow(b, e), base, exponent);
    }

    static Value plus(Value operand) {
        if (operand instanceof BoolValue) {
            return IntValue.of(((BoolValue) operand).longValue());
        }
        if (operand instanceof NumberValue) {
            return operand;
        }
        throw unsupportedOperand("unary +", operand);
    }

    static Value minus(Value operand) {
        if (operand instanceof NumberValue) {
            NumberValue number = (NumberValue) operand;
            if (number.isIntegral()) {
                return IntValue.of(exact(() -> Math.negateExact(number.longValue())));
            }
            return FloatValue.of(-number.doubleValue());
        }
        throw unsupportedOperand("unary -", operand);
    }

    static Value not(Value operand) {
        return BoolValue.of(!operand.isTruthy());
    }

    static Value invert(Value operand) {
        if (isIntegral(operand)) {
            return IntValue.of(~((NumberValue) operand).longValue());
        }
        throw unsupportedOperand("unary ~", operand);
    }

    static boolean equal(Value left, Value right) {
        return left.equals(right);
    }

    static boolean identical(Value left, Value right) {
        if (left instanceof SequenceValue || right instanceof SequenceValue) {
            return left == right;
        }
        return left.getType() == right.getType() && left.equals(right);
    }

    /**
     * Ordering comparison; {@code symbol} is one of {@code < <= > >=}.
     */
    static boolean order(String symbol, Value left, Value right) {
        if (bothNumbers(left, right)) {
            NumberValue a = (NumberValue) left;
            NumberValue b = (NumberValue) right;
            if (Double.isNaN(a.doubleValue()) || Double.isNaN(b.doubleValue())) {
                return false;
            }
            return test(symbol, compareNumbers(a, b));
        }
        if (left instanceof StrValue && right instanceof StrValue) {
            return test(symbol, ((StrValue) left).getValue().compareTo(((StrValue) right).getValue()));
        }
        if (left instanceof ListValue && right instanceof ListValue) {
            return orderLists(symbol, ((ListValue) left).getElements(), ((ListValue) right).getElements());
        }
        if (left instanceof SetValue && right instanceof SetValue) {
            return orderSets(symbol, ((SetValue) left).getElements(), ((SetValue) right).getElements());
        }
        throw new EvaluationException(String.format("'%s' not supported between instances of '%s' and '%s'",
                symbol, left.getTypeName(), right.getTypeName()));
    }

    static boolean contains(Value container, Value element) {
        if (container instanceof ListValue) {
            return ((ListValue) container).getElements().contains(element);
        }
        if (container instanceof SetValue) {
            return element.isHashable() && ((SetValue) container).contains(element);
        }
        if (container instanceof MapValue) {
            return element.isHashable() && ((MapValue) container).containsKey(element);
        }
        if (container instanceof StrValue) {
            if (!(element instanceof StrValue)) {
                throw new EvaluationException("'in <string>' requires string as left operand, not "
                        + element.getTypeName());
            }
            return ((StrValue) container).getValue().contains(((StrValue) element).getValue());
        }
        if (container instanceof SequenceValue) {
            for (Value value : (SequenceValue) container) {
                if (value.equals(element)) {
                    return true;
                }
            }
            return false;
        }
        throw new EvaluationException("argument of type '" + container.getTypeName() + "' is not iterable");
    }

    /**
     * Elements of any iterable value; consumes sequences.
     */
    static List<Value> iterate(Value value) {
        if (value instanceof ListValue) {
            return ((ListValue) value).getElements();
        }
        if (value instanceof SetValue) {
            return new ArrayList<>(((SetValue) value).getElements());
        }
        if (value instanceof MapValue) {
            return new ArrayList<>(((MapValue) value).getEntries().keySet());
        }
        if (value instanceof SequenceValue) {
            return ((SequenceValue) value).consume();
        }
        if (value instanceof StrValue) {
            List<Value> chars = new ArrayList<>();
            ((StrValue) value).getValue().codePoints()
                    .forEach(cp -> chars.add(StrValue.of(new String(Character.toChars(cp)))));
            return chars;
        }
        throw new EvaluationException("'" + value.getTypeName() + "' object is not iterable");
    }

    private static int compareNumbers(NumberValue a, NumberValue b) {
        if (a.isIntegral() && b.isIntegral()) {
            return Long.compare(a.longValue(), b.longValue());
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        return x < y ? -1 : (x > y ? 1 : 0);
    }

    private static boolean orderLists(String symbol, List<Value> left, List<Value> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            if (!left.get(i).equals(right.get(i))) {
                return order(symbol, left.get(i), right.get(i));
            }
        }
        return test(symbol, Integer.compare(left.size(), right.size()));
    }

    private static boolean orderSets(String symbol, Set<Value> left, Set<Value> right) {
        switch (symbol) {
            case "<":
                return left.size() < right.size() && right.containsAll(left);
            case "<=":
                return right.containsAll(left);
            case ">":
                return left.size() > right.size() && left.containsAll(right);
            default:
                return left.containsAll(right);
        }
    }

    private static boolean test(String symbol, int comparison) {
        switch (symbol) {
            case "<":
                return comparison < 0;
            case "<=":
                return comparison <= 0;
            case ">":
                return comparison > 0;
            case ">=":
                return comparison >= 0;
            default:
                throw new UnsupportedOperatorException(symbol);
        }
    }

    private static long integerPower(long base, long exponent) {
        long result = 1;
        long factor = base;
        long remaining = exponent;
        try {
            while (remaining > 0) {
                if ((remaining & 1) == 1) {
                    result = Math.multiplyExact(result, factor);
                }
                remaining >>= 1;
                if (remaining > 0) {
                    factor = Math.multiplyExact(factor, factor);
                }
            }
        } catch (ArithmeticException e) {
            throw new EvaluationException("integer overflow in " + base + " ** " + exponent, e);
        }
        return result;
    }

    private static Value repeat(Value sequence, long times) {
        if (times > Integer.MAX_VALUE) {
            throw new EvaluationException("repeat count too large: " + times);
        }
        int count = (int) Math.max(0, times);
        if (sequence instanceof StrValue) {
            String text = ((StrValue) sequence).getValue();
            checkRepeatedLength((long) text.length() * count);
            return StrValue.of(text.repeat(count));
        }
        List<Value> elements = ((ListValue) sequence).getElements();
        checkRepeatedLength((long) elements.size() * count);
        List<Value> repeated = new ArrayList<>(elements.size() * count);
        for (int i = 0; i < count; i++) {
            repeated.addAll(elements);
        }
        return ListValue.of(repeated);
    }

    private static void checkRepeatedLength(long length) {
        if (length > MAX_REPEATED_LENGTH) {
            throw new EvaluationException("repeated sequence too long: " + length);
        }
    }

    private static Value checkedFloat(double result, NumberValue a, NumberValue b) {
        if (Double.isInfinite(result) && !Double.isInfinite(a.doubleValue()) && !Double.isInfinite(b.doubleValue())) {
            throw new EvaluationException("numerical result out of range");
        }
        return FloatValue.of(result);
    }

    private static long exact(LongSupplier operation) {
        try {
            return operation.getAsLong();
        } catch (ArithmeticException e) {
            throw new EvaluationException("integer overflow", e);
        }
    }

    private static NumberValue[] numbers(String symbol, Value left, Value right) {
        if (!bothNumbers(left, right)) {
            throw unsupportedOperands(symbol, left, right);
        }
        return new NumberValue[]{(NumberValue) left, (NumberValue) right};
    }

    private static boolean bothNumbers(Value left, Value right) {
        return left instanceof NumberValue && right instanceof NumberValue;
    }

    private static boolean isIntegral(Value value) {
        return value instanceof NumberValue && ((NumberValue) value).isIntegral();
    }

    private static EvaluationException unsupportedOperands(String symbol, Value left, Value right) {
        return new EvaluationException(String.format("unsupported operand type(s) for %s: '%s' and '%s'",
                symbol, left.getTypeName(), right.getTypeName()));
    }

    private static EvaluationException unsupportedOperand(String operation, Value operand) {
        return new EvaluationException(String.format("bad operand type for %s: '%s'",
                operation, operand.getTypeName()));
    }
}
