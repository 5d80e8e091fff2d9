package configreader.expression;

import configreader.value.Value;

import java.util.List;
import java.util.Map;

/**
 * A function callable from expressions by its registered name. Implementations
 * report bad arguments with {@link EvaluationException}.
 */
@FunctionalInterface
public interface ConfigFunction {

    Value apply(List<Value> arguments, Map<String, Value> keywords);
}
