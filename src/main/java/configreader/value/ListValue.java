package configreader.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class ListValue extends Value {

    private final List<Value> elements;

    private ListValue(List<Value> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static ListValue of(List<? extends Value> elements) {
        return new ListValue(new ArrayList<>(elements));
    }

    public static ListValue of(Value... elements) {
        return new ListValue(List.of(elements));
    }

    public List<Value> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public Value get(int index) {
        return elements.get(index);
    }

    @Override
    public ValueType getType() {
        return ValueType.LIST;
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
        return elements.stream().map(Value::render).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public Object toJava() {
        List<Object> out = new ArrayList<>(elements.size());
        for (Value element : elements) {
            out.add(element.toJava());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListValue && ((ListValue) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
