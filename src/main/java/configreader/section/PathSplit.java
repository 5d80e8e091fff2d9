package configreader.section;

import lombok.Data;

import java.util.List;

/**
 * A normalized path cut into the segments that already exist, starting with
 * the root name, and the segments still to be created.
 */
@Data
public class PathSplit {

    private final List<String> existing;
    private final List<String> missing;

    public PathSplit(List<String> existing, List<String> missing) {
        this.existing = List.copyOf(existing);
        this.missing = List.copyOf(missing);
    }

    public boolean isComplete() {
        return missing.isEmpty();
    }
}
