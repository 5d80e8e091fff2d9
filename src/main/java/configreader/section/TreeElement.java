package configreader.section;

/**
 * Anything a lookup in a {@link Section} can return: a stored value or a section.
 */
public interface TreeElement {

    default boolean isSection() {
        return false;
    }
}
