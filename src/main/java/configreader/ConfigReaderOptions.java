package configreader;

import configreader.expression.ExpressionRegistry;
import configreader.section.LookupPolicy;
import configreader.section.Section;
import lombok.Builder;
import lombok.Getter;

/**
 * Settings for {@link ConfigReader#read(ConfigReaderOptions, ConfigSource...)}.
 * The registry is copied before loading, so one options instance can be
 * shared by several readers.
 */
@Getter
@Builder(toBuilder = true)
public class ConfigReaderOptions {

    /**
     * Name of the root section.
     */
    @Builder.Default
    private final String name = "toplevel";

    @Builder.Default
    private final String separator = Section.DEFAULT_SEPARATOR;

    /**
     * Section whose entries become constants of every later expression,
     * {@code null} to disable.
     */
    @Builder.Default
    private final String constantsSection = "Constants";

    @Builder.Default
    private final boolean lowercaseKeys = true;

    @Builder.Default
    private final LookupPolicy lookupPolicy = LookupPolicy.DIRECT_CHILD_PREFERENCE;

    @Builder.Default
    private final ExpressionRegistry registry = ExpressionRegistry.withDefaults();

    public static ConfigReaderOptions defaults() {
        return builder().build();
    }
}
