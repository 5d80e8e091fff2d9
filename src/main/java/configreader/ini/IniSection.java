package configreader.ini;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@RequiredArgsConstructor
public class IniSection {

    private final String name;
    private final Map<String, String> entries = new LinkedHashMap<>();

    public Map<String, String> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    void put(String key, String value) {
        entries.put(key, value);
    }
}
