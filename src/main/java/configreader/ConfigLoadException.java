package configreader;

import lombok.Getter;

/**
 * A value of the configuration could not be evaluated. The evaluator's
 * exception is the cause.
 */
@Getter
public class ConfigLoadException extends RuntimeException {

    private final String section;
    private final String key;
    private final String expression;

    public ConfigLoadException(String section, String key, String expression, RuntimeException cause) {
        super("Cannot evaluate [" + section + "] " + key + " = " + expression + ": " + cause.getMessage(), cause);
        this.section = section;
        this.key = key;
        this.expression = expression;
    }
}
