package configreader.expression;

import configreader.value.BoolValue;
import configreader.value.FloatValue;
import configreader.value.IntValue;
import configreader.value.NumberValue;
import configreader.value.StrValue;
import configreader.value.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Pattern;

/**
 * The functions every default registry starts with: trigonometry,
 * {@code exp}, {@code sqrt} (also as {@code root}), {@code sum} and the
 * conversions {@code int}, {@code float}, {@code bool}, {@code str}.
 */
final class StandardFunctions {

    private static final Pattern FLOAT_TEXT = Pattern.compile(
            "[+-]?((\\d[\\d_]*)?\\.?\\d[\\d_]*([eE][+-]?\\d+)?|\\d[\\d_]*\\.)");

    private StandardFunctions() {
    }

    static void registerAll(ExpressionRegistry registry) {
        registry.registerFunction("sin", math("sin", Math::sin));
        registry.registerFunction("cos", math("cos", Math::cos));
        registry.registerFunction("tan", math("tan", Math::tan));
        registry.registerFunction("exp", math("exp", Math::exp));
        ConfigFunction sqrt = math("sqrt", Math::sqrt);
        registry.registerFunction("sqrt", sqrt);
        registry.registerFunction("root", sqrt);
        registry.registerFunction("sum", StandardFunctions::sum);
        registry.registerFunction("int", StandardFunctions::toInt);
        registry.registerFunction("float", StandardFunctions::toFloat);
        registry.registerFunction("bool", StandardFunctions::toBool);
        registry.registerFunction("str", StandardFunctions::toStr);
    }

    private static ConfigFunction math(String name, DoubleUnaryOperator operation) {
        return (arguments, keywords) -> {
            checkArguments(name, arguments, keywords, 1, 1, Set.of());
            double x = number(name, arguments.get(0)).doubleValue();
            double result = operation.applyAsDouble(x);
            if (Double.isNaN(result) && !Double.isNaN(x)) {
                throw new EvaluationException("math domain error in " + name + "(" + arguments.get(0).render() + ")");
            }
            if (Double.isInfinite(result) && !Double.isInfinite(x)) {
                throw new EvaluationException("math range error in " + name + "(" + arguments.get(0).render() + ")");
            }
            return FloatValue.of(result);
        };
    }

    private static Value sum(List<Value> arguments, Map<String, Value> keywords) {
        checkArguments("sum", arguments, keywords, 1, 2, Set.of("start"));
        Value total = arguments.size() > 1 ? arguments.get(1) : keywords.getOrDefault("start", IntValue.of(0));
        if (total instanceof StrValue) {
            throw new EvaluationException("sum() can't sum strings");
        }
        for (Value element : Operators.iterate(arguments.get(0))) {
            total = Operators.add(total, element);
        }
        return total;
    }

    private static Value toInt(List<Value> arguments, Map<String, Value> keywords) {
        checkArguments("int", arguments, keywords, 0, 2, Set.of("base"));
        if (arguments.isEmpty()) {
            return IntValue.of(0);
        }
        Value x = arguments.get(0);
        Value base = arguments.size() > 1 ? arguments.get(1) : keywords.get("base");
        if (base != null) {
            if (!(x instanceof StrValue)) {
                throw new EvaluationException("int() can't convert non-string with explicit base");
            }
            return parseInt(((StrValue) x).getValue(), (int) number("int", base).longValue());
        }
        if (x instanceof StrValue) {
            return parseInt(((StrValue) x).getValue(), 10);
        }
        NumberValue n = number("int", x);
        if (n.isIntegral()) {
            return IntValue.of(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new EvaluationException("cannot convert float " + x + " to integer");
        }
        if (d >= 0x1p63 || d < -0x1p63) {
            throw new EvaluationException("integer overflow converting " + x);
        }
        return IntValue.of((long) d);
    }

    private static Value parseInt(String text, int base) {
        String digits = StringUtils.strip(text).replace("_", "");
        if (base < 2 || base > 36) {
            throw new EvaluationException("int() base must be >= 2 and <= 36");
        }
        try {
            return IntValue.of(Long.parseLong(digits, base));
        } catch (NumberFormatException e) {
            throw new EvaluationException("invalid literal for int() with base " + base + ": '" + text + "'", e);
        }
    }

    private static Value toFloat(List<Value> arguments, Map<String, Value> keywords) {
        checkArguments("float", arguments, keywords, 0, 1, Set.of());
        if (arguments.isEmpty()) {
            return FloatValue.of(0.0);
        }
        Value x = arguments.get(0);
        if (x instanceof StrValue) {
            String text = StringUtils.strip(((StrValue) x).getValue());
            String special = StringUtils.removeStart(StringUtils.removeStart(text.toLowerCase(), "+"), "-");
            boolean negative = text.startsWith("-");
            if ("inf".equals(special) || "infinity".equals(special)) {
                return FloatValue.of(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY);
            }
            if ("nan".equals(special)) {
                return FloatValue.of(Double.NaN);
            }
            if (!FLOAT_TEXT.matcher(text).matches()) {
                throw new EvaluationException("could not convert string to float: '" + ((StrValue) x).getValue() + "'");
            }
            return FloatValue.of(Double.parseDouble(text.replace("_", "")));
        }
        return FloatValue.of(number("float", x).doubleValue());
    }

    private static Value toBool(List<Value> arguments, Map<String, Value> keywords) {
        checkArguments("bool", arguments, keywords, 0, 1, Set.of());
        return BoolValue.of(!arguments.isEmpty() && arguments.get(0).isTruthy());
    }

    private static Value toStr(List<Value> arguments, Map<String, Value> keywords) {
        checkArguments("str", arguments, keywords, 0, 1, Set.of());
        return StrValue.of(arguments.isEmpty() ? "" : arguments.get(0).toString());
    }

    private static NumberValue number(String function, Value value) {
        if (!(value instanceof NumberValue)) {
            throw new EvaluationException(function + "() argument must be a number, not '" + value.getTypeName() + "'");
        }
        return (NumberValue) value;
    }

    private static void checkArguments(String function, List<Value> arguments, Map<String, Value> keywords,
                                       int min, int max, Set<String> allowedKeywords) {
        for (String keyword : keywords.keySet()) {
            if (!allowedKeywords.contains(keyword)) {
                throw new EvaluationException(function + "() got an unexpected keyword argument '" + keyword + "'");
            }
        }
        if (arguments.size() < min || arguments.size() > max) {
            String expected = min == max ? "exactly " + min : "from " + min + " to " + max;
            throw new EvaluationException(String.format("%s() takes %s argument(s) (%d given)",
                    function, expected, arguments.size()));
        }
    }
}
