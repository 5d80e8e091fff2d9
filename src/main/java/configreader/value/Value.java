package configreader.value;

import configreader.section.TreeElement;

/**
 * A dynamically typed configuration value. The set of subclasses is closed:
 * every value carries one of the {@link ValueType} tags.
 */
public abstract class Value implements TreeElement {

    Value() {
    }

    public abstract ValueType getType();

    /**
     * Expression text that evaluates back to an equal value. Lazy sequences
     * and empty sets have no such text.
     */
    public abstract String render();

    /**
     * Plain Java representation used by the export surfaces.
     */
    public abstract Object toJava();

    public boolean isTruthy() {
        return true;
    }

    /**
     * Lists, sets and maps cannot be set elements or map keys.
     */
    public boolean isHashable() {
        return true;
    }

    public String getTypeName() {
        return getType().getTypeName();
    }

    @Override
    public String toString() {
        return render();
    }
}
