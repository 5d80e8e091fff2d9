package configreader;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import configreader.expression.ExpressionEvaluator;
import configreader.expression.UnsupportedSyntaxException;
import configreader.ini.IniParser;
import configreader.section.Section;
import configreader.value.IntValue;
import configreader.value.StrValue;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {

    private static final String EXAMPLE_INI = "src/test/resources/config/example.ini";
    private static final String BROKEN_VALUE_INI = "src/test/resources/config/broken_value.ini";

    private static Section load(ConfigReaderOptions options, String text) {
        var document = new IniParser(options.isLowercaseKeys()).parse("inline", text);
        return new ConfigLoader(options).load(document, new ExpressionEvaluator(options.getRegistry()));
    }

    @Test
    void load_headersAreRelativeToPreviousSection() {
        Section root = load(ConfigReaderOptions.defaults(), "[a]\n[/b]\n[/c]\n[d]\n[/e/f]\n");

        assertEquals(List.of("a", "d"), root.sections());
        assertEquals(List.of("b", "c"), root.getSection("a").sections());
        assertEquals("toplevel/d/e/f", root.getSection("f").getFullPath());
    }

    @Test
    void load_constantsSeeEarlierConstants() {
        Section root = load(ConfigReaderOptions.defaults(),
                "[Run]\nsteps = double + 1\n[Constants]\nbase = 10\ndouble = base * 2\n");

        assertEquals(IntValue.of(21), root.getValue("steps"));
        assertEquals(IntValue.of(20), root.getValue("Constants/double"));
    }

    @Test
    void load_constantsCanBeDisabled() {
        var options = ConfigReaderOptions.builder().constantsSection(null).build();
        Section root = load(options, "[Constants]\nc = 5\n[Run]\nvalue = c\n");

        assertEquals(StrValue.of("c"), root.getValue("value"));
        assertEquals(IntValue.of(5), root.getValue("Constants/c"));
    }

    @Test
    void load_usesConfiguredRootAndSeparator() {
        var options = ConfigReaderOptions.builder().name("cfg").separator(".").build();
        Section root = load(options, "[a]\nx = 1\n[.b]\ny = 2\n");

        assertEquals(IntValue.of(2), root.get("cfg.a.b.y"));
        assertEquals(IntValue.of(1), root.getValue("x"));
    }

    @Test
    void load_wrapsEvaluationFailures() throws Exception {
        var options = ConfigReaderOptions.defaults();
        var loader = new ConfigLoader(options);
        var sources = List.of(ConfigSource.ofPath(Paths.get(BROKEN_VALUE_INI)));

        var error = assertThrows(ConfigLoadException.class,
                () -> loader.load(sources, new ExpressionEvaluator(options.getRegistry())));
        assertEquals("Run", error.getSection());
        assertEquals("bad", error.getKey());
        assertEquals("os.system('ls')", error.getExpression());
        assertInstanceOf(UnsupportedSyntaxException.class, error.getCause());
    }

    @Test
    void load_logsSummaryAndAssignments() throws Exception {
        Logger logger = (Logger) LoggerFactory.getLogger(ConfigLoader.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        Level originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);

        try {
            var options = ConfigReaderOptions.defaults();
            new ConfigLoader(options).load(List.of(ConfigSource.ofPath(Paths.get(EXAMPLE_INI))),
                    new ExpressionEvaluator(options.getRegistry()));
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(originalLevel);
            appender.stop();
        }

        List<ILoggingEvent> events = appender.list;
        ILoggingEvent summary = events.get(events.size() - 1);
        assertEquals(Level.INFO, summary.getLevel());
        assertTrue(summary.getFormattedMessage().contains("7 section(s), 1 constant(s)"));
        assertTrue(events.stream().anyMatch(e -> e.getLevel() == Level.DEBUG
                && e.getFormattedMessage().equals("toplevel/Sampler/parameter2/max = 150000000.0")));
        assertFalse(events.stream().anyMatch(e -> e.getLevel().isGreaterOrEqual(Level.WARN)));
    }
}
