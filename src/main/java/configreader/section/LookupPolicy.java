package configreader.section;

/**
 * How a bare-key search treats several matches.
 */
public enum LookupPolicy {
    /**
     * A single match stored directly in the searched section (a content entry
     * or a direct child section) wins over deeper matches.
     */
    DIRECT_CHILD_PREFERENCE,
    /**
     * Any second match is an ambiguity.
     */
    STRICT
}
