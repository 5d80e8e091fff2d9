package configreader.ini;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.HashSet;
import java.util.Set;

/**
 * Reads INI text into an {@link IniDocument}.
 * <ul>
 * <li>{@code [name]} starts a section, {@code [DEFAULT]} holds entries every
 * section inherits.</li>
 * <li>{@code key = value} or {@code key: value}, the first delimiter wins.
 * Keys and values are stripped; keys are lower-cased unless disabled.</li>
 * <li>Lines starting with {@code #} or {@code ;} are comments.</li>
 * <li>A line indented deeper than its key continues the value; the parts are
 * joined with newlines. An empty line ends the value.</li>
 * </ul>
 * A section or key may occur only once per source. Parsing several sources
 * into the same document merges them: later values replace earlier ones.
 * Values are kept verbatim, there is no interpolation.
 */
@Slf4j
public class IniParser {

    public static final String DEFAULT_SECTION = "DEFAULT";

    private final boolean lowercaseKeys;

    public IniParser() {
        this(true);
    }

    public IniParser(boolean lowercaseKeys) {
        this.lowercaseKeys = lowercaseKeys;
    }

    public IniDocument parse(String sourceName, String text) {
        IniDocument document = new IniDocument();
        parseInto(document, sourceName, text);
        return document;
    }

    public void parseInto(IniDocument document, String sourceName, String text) {
        ParseContext ctx = new ParseContext(document, sourceName);
        for (String line : StringUtils.defaultString(text).split("\\r\\n|\\r|\\n", -1)) {
            ctx.accept(line);
        }
        log.debug("Parsed {} section(s) from {}", ctx.sectionsSeen.size(), sourceName);
    }

    private final class ParseContext {
        final IniDocument document;
        final String sourceName;
        final Set<String> sectionsSeen = new HashSet<>();
        final Set<String> keysSeen = new HashSet<>();
        int lineNumber;
        String currentSection;
        String currentKey;
        int keyIndent;
        StringBuilder currentValue;

        ParseContext(IniDocument document, String sourceName) {
            this.document = document;
            this.sourceName = sourceName;
        }

        void accept(String line) {
            lineNumber++;
            String trimmed = line.trim();

            if (trimmed.isEmpty()) {
                onEmpty();
                return;
            }

            if (trimmed.startsWith("#") || trimmed.startsWith(";")) {
                return;
            }

            int indent = line.length() - StringUtils.stripStart(line, null).length();
            if (currentKey != null && indent > keyIndent) {
                onContinuation(trimmed);
                return;
            }

            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                onSection(trimmed.substring(1, trimmed.length() - 1));
                return;
            }

            onValue(trimmed, indent);
        }

        private void onEmpty() {
            currentKey = null;
        }

        private void onContinuation(String trimmed) {
            currentValue.append('\n').append(trimmed);
            store(currentKey, currentValue.toString());
        }

        private void onSection(String name) {
            if (name.isEmpty()) {
                throw error("empty section name");
            }
            if (!sectionsSeen.add(name)) {
                throw error("section [" + name + "] already exists in this source");
            }
            currentSection = name;
            currentKey = null;
            keysSeen.clear();
            if (!DEFAULT_SECTION.equals(name)) {
                document.section(name);
            }
        }

        private void onValue(String trimmed, int indent) {
            if (currentSection == null) {
                throw error("key outside of any section: " + trimmed);
            }
            int delimiter = StringUtils.indexOfAny(trimmed, '=', ':');
            if (delimiter < 0) {
                throw error("expected 'key = value': " + trimmed);
            }
            String key = trimmed.substring(0, delimiter).trim();
            if (key.isEmpty()) {
                throw error("empty key");
            }
            if (lowercaseKeys) {
                key = key.toLowerCase();
            }
            if (!keysSeen.add(key)) {
                throw error("key '" + key + "' already exists in section [" + currentSection + "]");
            }
            currentKey = key;
            keyIndent = indent;
            currentValue = new StringBuilder(trimmed.substring(delimiter + 1).trim());
            store(key, currentValue.toString());
        }

        private void store(String key, String value) {
            if (DEFAULT_SECTION.equals(currentSection)) {
                document.putDefault(key, value);
            } else {
                document.section(currentSection).put(key, value);
            }
        }

        private IniFormatException error(String message) {
            return new IniFormatException(sourceName, lineNumber, message);
        }
    }
}
