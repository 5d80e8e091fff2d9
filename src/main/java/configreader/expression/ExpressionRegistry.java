package configreader.expression;

import configreader.value.FloatValue;
import configreader.value.Value;
import org.apache.commons.lang3.Validate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named constants and functions visible to an evaluator. Populate it before
 * evaluating and {@link #freeze()} it once loading is done; it is not safe to
 * register while another thread evaluates.
 */
public class ExpressionRegistry {

    private final Map<String, Value> constants = new LinkedHashMap<>();
    private final Map<String, ConfigFunction> functions = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Registry with the standard functions and the constants {@code pi},
     * {@code Pi}, {@code PI}, {@code e} and {@code E}.
     */
    public static ExpressionRegistry withDefaults() {
        ExpressionRegistry registry = new ExpressionRegistry();
        StandardFunctions.registerAll(registry);
        Value pi = FloatValue.of(Math.PI);
        Value e = FloatValue.of(Math.E);
        registry.registerConstant("pi", pi);
        registry.registerConstant("Pi", pi);
        registry.registerConstant("PI", pi);
        registry.registerConstant("e", e);
        registry.registerConstant("E", e);
        return registry;
    }

    public static ExpressionRegistry empty() {
        return new ExpressionRegistry();
    }

    /**
     * Registers or silently replaces a constant.
     */
    public ExpressionRegistry registerConstant(String name, Value value) {
        checkMutable();
        Validate.notEmpty(name, "constant name must not be empty");
        Validate.notNull(value, "constant value must not be null");
        constants.put(name, value);
        return this;
    }

    /**
     * Registers or silently replaces a function.
     */
    public ExpressionRegistry registerFunction(String name, ConfigFunction function) {
        checkMutable();
        Validate.notEmpty(name, "function name must not be empty");
        Validate.notNull(function, "function must not be null");
        functions.put(name, function);
        return this;
    }

    public Value getConstant(String name) {
        return constants.get(name);
    }

    public ConfigFunction getFunction(String name) {
        return functions.get(name);
    }

    public Map<String, Value> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    public Map<String, ConfigFunction> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Mutable copy, so a shared template registry is never written to.
     */
    public ExpressionRegistry copy() {
        ExpressionRegistry copy = new ExpressionRegistry();
        copy.constants.putAll(constants);
        copy.functions.putAll(functions);
        return copy;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; register constants and functions before loading");
        }
    }
}
