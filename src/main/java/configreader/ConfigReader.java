package configreader;

import configreader.expression.ExpressionEvaluator;
import configreader.expression.ExpressionRegistry;
import configreader.section.Section;
import configreader.section.SectionYaml;
import configreader.section.TreeElement;
import configreader.value.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * A loaded configuration. Values are looked up by bare key, which is searched
 * for in the whole tree, or by path:
 * <pre>
 * ConfigReader config = ConfigReader.read("config.ini");
 * config.getValue("sampler_name");             // 'custom'
 * config.getValue("Sampler/parameter1/min");   // 0
 * config.getSection("Sampler").getValue("min"); // ambiguous: parameter1 and parameter2
 * </pre>
 * Lookups and {@link #set(String, Value)} may be called from several threads.
 * Sections returned by {@link #getSection(String)} are live views of the tree
 * and are not guarded.
 */
@Slf4j
public class ConfigReader {

    private final Section root;
    private final ExpressionEvaluator evaluator;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    ConfigReader(Section root, ExpressionEvaluator evaluator) {
        this.root = root;
        this.evaluator = evaluator;
    }

    /**
     * Reads files, or inline INI text for arguments that are not existing files.
     */
    public static ConfigReader read(String... sources) throws IOException {
        List<ConfigSource> list = new ArrayList<>();
        for (String source : sources) {
            list.add(ConfigSource.of(source));
        }
        return read(ConfigReaderOptions.defaults(), list);
    }

    public static ConfigReader read(ConfigReaderOptions options, ConfigSource... sources) throws IOException {
        return read(options, Arrays.asList(sources));
    }

    public static ConfigReader read(ConfigReaderOptions options, List<ConfigSource> sources) throws IOException {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(options.getRegistry().copy());
        Section root = new ConfigLoader(options).load(sources, evaluator);
        evaluator.getRegistry().freeze();
        return new ConfigReader(root, evaluator);
    }

    public String getName() {
        return root.getName();
    }

    public Section getRoot() {
        return root;
    }

    /**
     * The constants and functions the configuration was evaluated with. Frozen.
     */
    public ExpressionRegistry getRegistry() {
        return evaluator.getRegistry();
    }

    public TreeElement get(String key) {
        return withReadLock(() -> root.get(key));
    }

    public Value getValue(String key) {
        return withReadLock(() -> root.getValue(key));
    }

    public Section getSection(String key) {
        return withReadLock(() -> root.getSection(key));
    }

    public boolean contains(String key) {
        return withReadLock(() -> root.contains(key));
    }

    public List<String> sections() {
        return withReadLock(root::sections);
    }

    public Map<String, Value> findValues(String key) {
        return withReadLock(() -> root.findValues(key));
    }

    public Value findValue(String key) {
        return withReadLock(() -> root.findValue(key));
    }

    public List<String> findSubsections(String name) {
        return withReadLock(() -> root.findSubsections(name));
    }

    public Map<String, Value> flatten() {
        return withReadLock(root::flatten);
    }

    public void set(String key, Value value) {
        lock.writeLock().lock();
        try {
            root.set(key, value);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Set {} = {}", key, value);
    }

    /**
     * Evaluates {@code expression} with the configuration's constants and
     * stores the result.
     */
    public Value setExpression(String key, String expression) {
        Value value = evaluator.evaluate(expression);
        set(key, value);
        return value;
    }

    public Map<String, Object> toMap() {
        return withReadLock(() -> root.toMap(false));
    }

    public String toYaml() {
        return withReadLock(() -> new SectionYaml().dump(root));
    }

    @Override
    public String toString() {
        return withReadLock(root::toString);
    }

    private <T> T withReadLock(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
