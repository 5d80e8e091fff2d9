package configreader;

import configreader.expression.ExpressionEvaluator;
import configreader.expression.ExpressionException;
import configreader.ini.IniDocument;
import configreader.ini.IniParser;
import configreader.section.Section;
import configreader.value.Value;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a section tree from INI sources.
 * <p>
 * Entries of the constants section are evaluated first, in file order, and
 * registered as constants, so each one can use those before it and every
 * other section can use all of them. The constants section also stays in
 * the tree.
 * <p>
 * Section headers are relative to the section loaded before them:
 * <pre>
 * [detectors]      toplevel/detectors
 * [/det1]          toplevel/detectors/det1
 * [/det2]          toplevel/detectors/det2
 * [Sampler]        toplevel/Sampler
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class ConfigLoader {

    private final ConfigReaderOptions options;

    public Section load(List<ConfigSource> sources, ExpressionEvaluator evaluator) throws IOException {
        IniParser parser = new IniParser(options.isLowercaseKeys());
        IniDocument document = new IniDocument();
        for (ConfigSource source : sources) {
            parser.parseInto(document, source.getName(), source.read());
        }
        Section root = load(document, evaluator);
        log.info("Loaded configuration '{}' from {}: {} section(s), {} constant(s)",
                root.getName(), sources, document.getSectionNames().size(),
                countConstants(document));
        return root;
    }

    /**
     * @throws ConfigLoadException when a value cannot be evaluated
     */
    public Section load(IniDocument document, ExpressionEvaluator evaluator) {
        String separator = options.getSeparator();
        Section root = Section.createRoot(options.getName(), separator, options.getLookupPolicy());
        Map<String, Value> constants = registerConstants(document, evaluator);

        Section current = root;
        for (String sectionName : document.getSectionNames()) {
            current = current.ensurePath(separator + sectionName);
            log.debug("Loading [{}] into {}", sectionName, current.getFullPath());
            boolean isConstants = sectionName.equals(options.getConstantsSection());
            for (Map.Entry<String, String> entry : document.getEntries(sectionName).entrySet()) {
                Value value = isConstants
                        ? constants.get(entry.getKey())
                        : evaluate(evaluator, sectionName, entry.getKey(), entry.getValue());
                current.set(entry.getKey(), value);
                log.debug("{}{}{} = {}", current.getFullPath(), separator, entry.getKey(), value);
            }
        }
        return root;
    }

    private Map<String, Value> registerConstants(IniDocument document, ExpressionEvaluator evaluator) {
        Map<String, Value> constants = new LinkedHashMap<>();
        String sectionName = options.getConstantsSection();
        if (sectionName == null || !document.hasSection(sectionName)) {
            return constants;
        }
        for (Map.Entry<String, String> entry : document.getEntries(sectionName).entrySet()) {
            Value value = evaluate(evaluator, sectionName, entry.getKey(), entry.getValue());
            evaluator.registerConstant(entry.getKey(), value);
            constants.put(entry.getKey(), value);
        }
        return constants;
    }

    private static Value evaluate(ExpressionEvaluator evaluator, String section, String key, String expression) {
        try {
            return evaluator.evaluate(expression);
        } catch (ExpressionException e) {
            throw new ConfigLoadException(section, key, expression, e);
        }
    }

    private int countConstants(IniDocument document) {
        String sectionName = options.getConstantsSection();
        return sectionName != null && document.hasSection(sectionName)
                ? document.getEntries(sectionName).size()
                : 0;
    }
}
