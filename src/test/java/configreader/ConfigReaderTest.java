package configreader;

import configreader.expression.EvaluationException;
import configreader.expression.ExpressionRegistry;
import configreader.section.AmbiguousKeyException;
import configreader.section.KeyNotFoundException;
import configreader.section.LookupPolicy;
import configreader.section.MissingSubsectionException;
import configreader.value.BoolValue;
import configreader.value.FloatValue;
import configreader.value.IntValue;
import configreader.value.ListValue;
import configreader.value.MapValue;
import configreader.value.SequenceValue;
import configreader.value.SetValue;
import configreader.value.StrValue;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigReaderTest {

    private static final String EXAMPLE_INI = "src/test/resources/config/example.ini";
    private static final String EXAMPLE_TREE = "src/test/resources/config/example_tree.txt";
    private static final String OVERRIDE_INI = "src/test/resources/config/override.ini";
    private static final String FEATURES_INI = "src/test/resources/config/features.ini";

    @Test
    void read_buildsTreeFromFile() throws Exception {
        var config = ConfigReader.read(EXAMPLE_INI);

        assertEquals(Files.readString(Paths.get(EXAMPLE_TREE)), config.toString());
        assertEquals(List.of("Constants", "detectors", "Sampler"), config.sections());
    }

    @Test
    void getValue_byBareKeyOrPath() throws Exception {
        var config = ConfigReader.read(EXAMPLE_INI);

        assertEquals(StrValue.of("custom"), config.getValue("sampler_name"));
        assertEquals(StrValue.of("custom"), config.getValue("Sampler/sampler_name"));
        assertEquals(FloatValue.of(1.5), config.getValue("detectors/det1/height"));
        assertEquals(IntValue.of(0), config.getValue("Sampler/parameter1/min"));
        assertEquals(IntValue.of(0), config.getSection("Sampler").getSection("parameter1").getValue("min"));
        assertEquals(FloatValue.of(1.5e8), config.getValue("toplevel/Sampler/parameter2/max"));
        assertEquals(IntValue.of(300000000), config.getValue("c"));
    }

    @Test
    void getValue_reportsAmbiguityWithCandidatePaths() throws Exception {
        var config = ConfigReader.read(EXAMPLE_INI);

        var error = assertThrows(AmbiguousKeyException.class, () -> config.getValue("height"));
        assertEquals(List.of("toplevel/detectors/det1/height", "toplevel/detectors/det2/height"),
                error.getCandidates());
        assertThrows(KeyNotFoundException.class, () -> config.getValue("missing"));
        assertFalse(config.contains("missing"));
    }

    @Test
    void findValues_listsEveryContainer() throws Exception {
        var config = ConfigReader.read(EXAMPLE_INI);

        assertEquals(Map.of("toplevel/Sampler/parameter1", IntValue.of(0),
                "toplevel/Sampler/parameter2", IntValue.of(-1)), config.findValues("min"));
        assertEquals(IntValue.of(2), config.findValue("width"));
        assertEquals(List.of("toplevel/detectors/det1"), config.findSubsections("det1"));
        assertEquals(9, config.flatten().size());
    }

    @Test
    void read_laterSourcesOverrideEarlierOnes() throws Exception {
        var config = ConfigReader.read(EXAMPLE_INI, OVERRIDE_INI);

        assertEquals(StrValue.of("replaced"), config.getValue("sampler_name"));
        assertEquals(IntValue.of(42), config.getValue("seed"));
        assertEquals(IntValue.of(2), config.getValue("width"));
    }

    @Test
    void read_inlineTextAndStreams() throws Exception {
        var inline = ConfigReader.read("[s]\nx = 1 + 1\n");
        assertEquals(IntValue.of(2), inline.getValue("x"));

        var options = ConfigReaderOptions.builder().name("cfg").build();
        var fromStreams = ConfigReader.read(options,
                ConfigSource.ofReader("reader", new StringReader("[a]\nx = 1\n")),
                ConfigSource.ofStream("stream", new ByteArrayInputStream("[b]\ny = 'ü'\n".getBytes(StandardCharsets.UTF_8))));
        assertEquals("cfg", fromStreams.getName());
        assertEquals(IntValue.of(1), fromStreams.getValue("cfg/a/x"));
        assertEquals(StrValue.of("ü"), fromStreams.getValue("y"));
    }

    @Test
    void read_evaluatesEveryValueType() throws Exception {
        var config = ConfigReader.read(FEATURES_INI);

        assertEquals(IntValue.of(21), config.getValue("steps"));
        assertEquals(FloatValue.of(2.5), config.getValue("ratio"));
        assertEquals(ListValue.of(StrValue.of("a"), StrValue.of("b")), config.getValue("labels"));
        assertEquals(MapValue.of(Map.of(StrValue.of("low"), IntValue.of(-10), StrValue.of("high"), IntValue.of(10))),
                config.getValue("limits"));
        assertEquals(SetValue.of(IntValue.of(8080), IntValue.of(8081)), config.getValue("ports"));
        assertEquals(List.of(IntValue.of(1), IntValue.of(2)),
                assertInstanceOf(SequenceValue.class, config.getValue("pair")).consume());
        assertEquals(ListValue.of(IntValue.of(10), IntValue.of(20)), config.getValue("phases"));
        assertEquals(BoolValue.FALSE, config.getValue("Run/enabled"));
        assertEquals(BoolValue.TRUE, config.getValue("Constants/enabled"));
    }

    @Test
    void read_leavesOptionsRegistryUntouchedAndFreezesItsOwn() throws Exception {
        var registry = ExpressionRegistry.withDefaults();
        var options = ConfigReaderOptions.builder().registry(registry).build();

        var config = ConfigReader.read(options, ConfigSource.ofString("[Constants]\nk = 3\n"));

        assertNull(registry.getConstant("k"));
        assertEquals(IntValue.of(3), config.getRegistry().getConstant("k"));
        assertTrue(config.getRegistry().isFrozen());
        assertThrows(IllegalStateException.class,
                () -> config.getRegistry().registerConstant("late", IntValue.of(1)));
    }

    @Test
    void read_withStrictLookup() throws Exception {
        var options = ConfigReaderOptions.builder().lookupPolicy(LookupPolicy.STRICT).build();
        var config = ConfigReader.read(options, ConfigSource.ofString("[a]\nname = 1\n[/b]\n[//name]\n"));

        assertThrows(AmbiguousKeyException.class, () -> config.getSection("a").get("name"));
    }

    @Test
    void set_overridesAfterLoad() throws Exception {
        var config = ConfigReader.read(EXAMPLE_INI);

        config.set("Sampler/sampler_name", StrValue.of("manual"));
        assertEquals(StrValue.of("manual"), config.getValue("sampler_name"));

        assertEquals(FloatValue.of(4.5e8), config.setExpression("detectors/limit", "c * 1.5"));
        assertEquals(FloatValue.of(4.5e8), config.getValue("limit"));

        assertThrows(MissingSubsectionException.class, () -> config.set("detectors/det3/height", IntValue.of(1)));
    }

    @Test
    void read_wrapsOversizedRepetition() {
        var error = assertThrows(ConfigLoadException.class,
                () -> ConfigReader.read("[a]\nx = [1, 2, 3] * 1000000000\n"));

        assertEquals("a", error.getSection());
        assertEquals("x", error.getKey());
        assertInstanceOf(EvaluationException.class, error.getCause());
    }

    @Test
    void toMapAndYaml() throws Exception {
        var config = ConfigReader.read("[s]\nx = 1\n[/inner]\ny = 'text'\n");

        assertEquals(Map.of("s", Map.of("x", 1L, "inner", Map.of("y", "text"))), config.toMap());
        assertEquals("s:\n  x: 1\n  inner:\n    y: text\n", config.toYaml());
    }
}
