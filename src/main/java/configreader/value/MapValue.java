package configreader.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Key to value mapping. A later entry with a key equal to an earlier one
 * replaces its value.
 */
public final class MapValue extends Value {

    private final Map<Value, Value> entries;

    private MapValue(Map<Value, Value> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static MapValue of(Map<? extends Value, ? extends Value> entries) {
        Map<Value, Value> map = new LinkedHashMap<>();
        for (Map.Entry<? extends Value, ? extends Value> entry : entries.entrySet()) {
            if (!entry.getKey().isHashable()) {
                throw new IllegalArgumentException("unhashable type: '" + entry.getKey().getTypeName() + "'");
            }
            map.put(entry.getKey(), entry.getValue());
        }
        return new MapValue(map);
    }

    public Map<Value, Value> getEntries() {
        return entries;
    }

    public Value get(Value key) {
        return entries.get(key);
    }

    public boolean containsKey(Value key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public ValueType getType() {
        return ValueType.MAP;
    }

    @Override
    public boolean isTruthy() {
        return !entries.isEmpty();
    }

    @Override
    public boolean isHashable() {
        return false;
    }

    @Override
    public String render() {
        return entries.entrySet().stream()
                .map(e -> e.getKey().render() + ": " + e.getValue().render())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public Object toJava() {
        Map<Object, Object> out = new LinkedHashMap<>();
        for (Map.Entry<Value, Value> entry : entries.entrySet()) {
            out.put(entry.getKey().toJava(), entry.getValue().toJava());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MapValue && ((MapValue) o).entries.equals(entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
