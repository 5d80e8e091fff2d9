package configreader.ini;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sections and raw values read from one or more INI sources, in the order
 * they first appeared. Entries of the {@code DEFAULT} section are not a
 * section of their own; every section inherits them.
 */
public class IniDocument {

    private final Map<String, String> defaults = new LinkedHashMap<>();
    private final Map<String, IniSection> sections = new LinkedHashMap<>();

    public List<String> getSectionNames() {
        return new ArrayList<>(sections.keySet());
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    public Map<String, String> getDefaults() {
        return Collections.unmodifiableMap(defaults);
    }

    /**
     * Raw values of {@code name} including inherited defaults. Defaults come
     * first unless the section overrides them.
     */
    public Map<String, String> getEntries(String name) {
        IniSection section = sections.get(name);
        if (section == null) {
            throw new IllegalArgumentException("No section " + name);
        }
        Map<String, String> entries = new LinkedHashMap<>(defaults);
        entries.putAll(section.getEntries());
        return entries;
    }

    void putDefault(String key, String value) {
        defaults.put(key, value);
    }

    IniSection section(String name) {
        return sections.computeIfAbsent(name, IniSection::new);
    }
}
