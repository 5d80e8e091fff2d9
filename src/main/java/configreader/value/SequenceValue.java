package configreader.value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Lazy, single-pass sequence produced by a tuple literal. Elements are computed
 * when first reached; every iterator shares one cursor, so once consumed the
 * sequence stays empty. Equality is identity.
 */
public final class SequenceValue extends Value implements Iterable<Value> {

    private final List<Supplier<Value>> elements;
    private int cursor;

    private SequenceValue(List<Supplier<Value>> elements) {
        this.elements = elements;
    }

    public static SequenceValue lazy(List<Supplier<Value>> elements) {
        return new SequenceValue(new ArrayList<>(elements));
    }

    public static SequenceValue of(Value... values) {
        List<Supplier<Value>> elements = new ArrayList<>(values.length);
        for (Value value : values) {
            elements.add(() -> value);
        }
        return new SequenceValue(elements);
    }

    public boolean isExhausted() {
        return cursor >= elements.size();
    }

    @Override
    public Iterator<Value> iterator() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return cursor < elements.size();
            }

            @Override
            public Value next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                // advance first: a failing element is not retried
                return elements.get(cursor++).get();
            }
        };
    }

    /**
     * Drains the remaining elements.
     */
    public List<Value> consume() {
        List<Value> out = new ArrayList<>();
        for (Value value : this) {
            out.add(value);
        }
        return out;
    }

    @Override
    public ValueType getType() {
        return ValueType.SEQUENCE;
    }

    @Override
    public String render() {
        return "<sequence>";
    }

    @Override
    public Object toJava() {
        return render();
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }
}
