package configreader.value;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deduplicated by value equality; the first of several equal elements is kept.
 * Iteration follows first insertion so rendering stays deterministic.
 */
public final class SetValue extends Value {

    private final Set<Value> elements;

    private SetValue(Set<Value> elements) {
        this.elements = Collections.unmodifiableSet(elements);
    }

    public static SetValue of(Collection<? extends Value> elements) {
        Set<Value> set = new LinkedHashSet<>();
        for (Value element : elements) {
            if (!element.isHashable()) {
                throw new IllegalArgumentException("unhashable type: '" + element.getTypeName() + "'");
            }
            set.add(element);
        }
        return new SetValue(set);
    }

    public static SetValue of(Value... elements) {
        return of(Arrays.asList(elements));
    }

    public Set<Value> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean contains(Value value) {
        return elements.contains(value);
    }

    @Override
    public ValueType getType() {
        return ValueType.SET;
    }

    @Override
    public boolean isTruthy() {
        return !elements.isEmpty();
    }

    @Override
    public boolean isHashable() {
        return false;
    }

    @Override
    public String render() {
        if (elements.isEmpty()) {
            return "set()";
        }
        return elements.stream().map(Value::render).collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public Object toJava() {
        Set<Object> out = new LinkedHashSet<>();
        for (Value element : elements) {
            out.add(element.toJava());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SetValue && ((SetValue) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
