package configreader.section;

import lombok.Getter;

import java.util.List;

/**
 * A bare key matched more than one value or section. The full path of every
 * candidate is kept so the caller can retry with an exact path.
 */
@Getter
public class AmbiguousKeyException extends SectionException {

    private final String key;
    private final List<String> candidates;

    public AmbiguousKeyException(String key, List<String> candidates) {
        super("Key '" + key + "' is ambiguous, candidates: " + String.join(", ", candidates));
        this.key = key;
        this.candidates = List.copyOf(candidates);
    }
}
