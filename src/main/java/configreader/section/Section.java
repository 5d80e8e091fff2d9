package configreader.section;

import configreader.value.Value;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A named node of the configuration tree. Each section owns its content
 * (key to value) and its child sections, both kept in insertion order. The
 * separator and the lookup policy are fixed when the root is created and
 * shared by every descendant.
 * <p>
 * Keys passed to the lookup and assignment methods are either bare keys
 * without a separator, which are searched for in the subtree, or paths. A path
 * is normalized with {@link #expand(String)} before it is used:
 * <pre>
 * toplevel
 *  └─sub1
 *     └─sub2
 *
 * sub2.expand("sub3")    // toplevel/sub1/sub2/sub3
 * sub2.expand("/x")      // toplevel/x
 * sub2.expand("//y")     // toplevel/sub1/y
 * </pre>
 * Sections are created only through {@link #ensurePath(String)} or
 * {@link #addSubsections(String)}. Instances are not thread-safe.
 */
@Getter
public class Section implements TreeElement {

    public static final String DEFAULT_SEPARATOR = "/";

    private final String name;
    private final String separator;
    private final LookupPolicy lookupPolicy;
    private final Section parent;
    private final Map<String, Value> content = new LinkedHashMap<>();
    private final Map<String, Section> children = new LinkedHashMap<>();

    private Section(String name, Section parent, String separator, LookupPolicy lookupPolicy) {
        this.name = name;
        this.parent = parent;
        this.separator = separator;
        this.lookupPolicy = lookupPolicy;
    }

    public static Section createRoot(String name) {
        return createRoot(name, DEFAULT_SEPARATOR, LookupPolicy.DIRECT_CHILD_PREFERENCE);
    }

    public static Section createRoot(String name, String separator) {
        return createRoot(name, separator, LookupPolicy.DIRECT_CHILD_PREFERENCE);
    }

    public static Section createRoot(String name, String separator, LookupPolicy lookupPolicy) {
        Validate.notEmpty(separator, "separator must not be empty");
        Validate.notEmpty(name, "section name must not be empty");
        Validate.isTrue(!name.contains(separator), "section name '%s' contains the separator", name);
        Validate.notNull(lookupPolicy, "lookupPolicy");
        return new Section(name, null, separator, lookupPolicy);
    }

    @Override
    public boolean isSection() {
        return true;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Section getRoot() {
        Section section = this;
        while (section.parent != null) {
            section = section.parent;
        }
        return section;
    }

    public String getFullPath() {
        return String.join(separator, getPathSegments());
    }

    /**
     * Names from the root down to this section.
     */
    public List<String> getPathSegments() {
        List<String> segments = new ArrayList<>();
        for (Section section = this; section != null; section = section.parent) {
            segments.add(section.name);
        }
        Collections.reverse(segments);
        return segments;
    }

    public Map<String, Value> getContent() {
        return Collections.unmodifiableMap(content);
    }

    public Map<String, Section> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public Section getChild(String childName) {
        return children.get(childName);
    }

    /**
     * Names of the direct child sections in insertion order.
     */
    public List<String> sections() {
        return new ArrayList<>(children.keySet());
    }

    /**
     * Normalizes {@code key} to a full path.
     * <ul>
     * <li>A key without separator names an entry of this section.</li>
     * <li>A key starting with {@code k} separators keeps the first {@code k}
     * segments of this section's path and appends the rest of the key.</li>
     * <li>A key whose first segment is a direct child of this section is a
     * path below this section, also when this section is not the root:
     * {@code sub1.expand("sub2/z")} is {@code top/sub1/sub2/z}, not
     * {@code top/sub2/z}.</li>
     * <li>Any other key is already a full path.</li>
     * </ul>
     *
     * @throws InvalidPathException when there are more leading separators than
     *                              segments in this section's path
     */
    public String expand(String key) {
        Validate.notNull(key, "key");
        if (!key.contains(separator)) {
            return getFullPath() + separator + key;
        }
        int leading = 0;
        while (key.startsWith(separator, leading * separator.length())) {
            leading++;
        }
        if (leading == 0) {
            String first = StringUtils.substringBefore(key, separator);
            return children.containsKey(first) ? getFullPath() + separator + key : key;
        }
        List<String> own = getPathSegments();
        if (leading > own.size()) {
            throw new InvalidPathException(key, leading + " leading separators but " + getFullPath()
                    + " is only " + own.size() + " level(s) deep");
        }
        String prefix = String.join(separator, own.subList(0, leading));
        String rest = key.substring(leading * separator.length());
        return rest.isEmpty() ? prefix : prefix + separator + rest;
    }

    /**
     * Normalizes {@code key} and splits it into the sections that exist and
     * the names still missing below them.
     */
    public PathSplit splitExisting(String key) {
        String path = expand(key);
        List<String> segments = sectionSegments(path);
        Section section = getRoot();
        int matched = 1;
        while (matched < segments.size() && section.children.containsKey(segments.get(matched))) {
            section = section.children.get(segments.get(matched));
            matched++;
        }
        return new PathSplit(segments.subList(0, matched), segments.subList(matched, segments.size()));
    }

    /**
     * Creates every missing section on the path of {@code key} and returns the
     * section at its end. Calling it again with the same key creates nothing.
     */
    public Section ensurePath(String key) {
        return create(splitExisting(key), new ArrayList<>());
    }

    /**
     * Like {@link #ensurePath(String)}, but returns the sections that were
     * created, outermost first. The list is empty when the path already existed.
     */
    public List<Section> addSubsections(String key) {
        List<Section> created = new ArrayList<>();
        create(splitExisting(key), created);
        return created;
    }

    private Section create(PathSplit split, List<Section> created) {
        Section section = getRoot();
        for (String segment : split.getExisting().subList(1, split.getExisting().size())) {
            section = section.children.get(segment);
        }
        for (String segment : split.getMissing()) {
            Section child = new Section(segment, section, separator, lookupPolicy);
            section.children.put(segment, child);
            created.add(child);
            section = child;
        }
        return section;
    }

    /**
     * Stores {@code value} under the last segment of {@code key}. Never
     * creates sections.
     *
     * @throws MissingSubsectionException when a section on the path does not exist
     */
    public void set(String key, Value value) {
        Validate.notNull(value, "value");
        String path = expand(key);
        List<String> segments = split(path);
        String valueKey = segments.get(segments.size() - 1);
        if (valueKey.isEmpty()) {
            throw new InvalidPathException(path, "no key name after the last separator");
        }
        Section root = getRoot();
        if (!segments.get(0).equals(root.name)) {
            throw new MissingSubsectionException(path, segments.get(0));
        }
        Section section = root;
        for (String segment : segments.subList(1, segments.size() - 1)) {
            if (segment.isEmpty()) {
                throw new InvalidPathException(path, "empty section name");
            }
            Section child = section.children.get(segment);
            if (child == null) {
                throw new MissingSubsectionException(path, segment);
            }
            section = child;
        }
        section.content.put(valueKey, value);
    }

    /**
     * Resolves a full path starting with the root name. The last segment names
     * a value of the enclosing section, or a child section when no value has
     * that name. A trailing separator or the bare root name selects a section.
     */
    public TreeElement resolve(String path) {
        List<String> segments = split(path);
        Section section = getRoot();
        if (!segments.get(0).equals(section.name)) {
            throw new InvalidPathException(path, "does not start with the root section '" + section.name + "'");
        }
        for (int i = 1; i < segments.size(); i++) {
            String segment = segments.get(i);
            if (i == segments.size() - 1) {
                if (segment.isEmpty()) {
                    return section;
                }
                if (section.content.containsKey(segment)) {
                    return section.content.get(segment);
                }
            }
            Section child = section.children.get(segment);
            if (child == null) {
                throw new KeyNotFoundException(path, "Path " + path + " not found");
            }
            section = child;
        }
        return section;
    }

    /**
     * Looks up a value or section. A bare key is searched for in this
     * section's subtree, any other key is expanded and resolved as a path.
     *
     * @throws KeyNotFoundException  when nothing matches
     * @throws AmbiguousKeyException when a bare key matches more than once and
     *                               the lookup policy cannot pick one
     */
    public TreeElement get(String key) {
        Validate.notNull(key, "key");
        if (key.contains(separator)) {
            return resolve(expand(key));
        }
        return search(key);
    }

    public Value getValue(String key) {
        TreeElement element = get(key);
        if (element.isSection()) {
            throw new KeyNotFoundException(key, "Key " + key + " names a section, not a value");
        }
        return (Value) element;
    }

    public Section getSection(String key) {
        TreeElement element = get(key);
        if (!element.isSection()) {
            throw new KeyNotFoundException(key, "Key " + key + " names a value, not a section");
        }
        return (Section) element;
    }

    public boolean contains(String key) {
        try {
            get(key);
            return true;
        } catch (KeyNotFoundException | InvalidPathException e) {
            return false;
        }
    }

    private TreeElement search(String key) {
        List<Candidate> candidates = new ArrayList<>();
        Deque<Section> queue = new ArrayDeque<>();
        queue.add(this);
        while (!queue.isEmpty()) {
            Section section = queue.poll();
            Value value = section.content.get(key);
            if (value != null) {
                candidates.add(new Candidate(value, section.getFullPath() + separator + key, section == this));
            }
            for (Section child : section.children.values()) {
                if (child.name.equals(key)) {
                    candidates.add(new Candidate(child, child.getFullPath(), section == this));
                }
                queue.add(child);
            }
        }
        if (candidates.isEmpty()) {
            throw new KeyNotFoundException(key, "No value or section with key " + key + " in " + getFullPath());
        }
        if (candidates.size() == 1) {
            return candidates.get(0).getElement();
        }
        if (lookupPolicy == LookupPolicy.DIRECT_CHILD_PREFERENCE) {
            List<Candidate> direct = new ArrayList<>();
            for (Candidate candidate : candidates) {
                if (candidate.isDirect()) {
                    direct.add(candidate);
                }
            }
            if (direct.size() == 1) {
                return direct.get(0).getElement();
            }
        }
        List<String> paths = new ArrayList<>();
        for (Candidate candidate : candidates) {
            paths.add(candidate.getPath());
        }
        throw new AmbiguousKeyException(key, paths);
    }

    /**
     * Every value named {@code key} in this subtree, keyed by the full path of
     * the section holding it.
     */
    public Map<String, Value> findValues(String key) {
        Map<String, Value> found = new LinkedHashMap<>();
        collectValues(key, found);
        return found;
    }

    private void collectValues(String key, Map<String, Value> found) {
        if (content.containsKey(key)) {
            found.put(getFullPath(), content.get(key));
        }
        for (Section child : children.values()) {
            child.collectValues(key, found);
        }
    }

    /**
     * The only value named {@code key} in this subtree. Sections are ignored
     * and there is no preference for direct entries.
     */
    public Value findValue(String key) {
        Map<String, Value> found = findValues(key);
        if (found.isEmpty()) {
            throw new KeyNotFoundException(key, "No value with key " + key + " in " + getFullPath());
        }
        if (found.size() > 1) {
            List<String> paths = new ArrayList<>();
            for (String container : found.keySet()) {
                paths.add(container + separator + key);
            }
            throw new AmbiguousKeyException(key, paths);
        }
        return found.values().iterator().next();
    }

    /**
     * Full paths of every descendant section called {@code sectionName}.
     */
    public List<String> findSubsections(String sectionName) {
        List<String> found = new ArrayList<>();
        for (Section child : children.values()) {
            if (child.name.equals(sectionName)) {
                found.add(child.getFullPath());
            }
            found.addAll(child.findSubsections(sectionName));
        }
        return found;
    }

    /**
     * Every value of this subtree keyed by its full path.
     */
    public Map<String, Value> flatten() {
        Map<String, Value> flat = new LinkedHashMap<>();
        collectFlat(flat);
        return flat;
    }

    private void collectFlat(Map<String, Value> flat) {
        String prefix = getFullPath() + separator;
        content.forEach((key, value) -> flat.put(prefix + key, value));
        for (Section child : children.values()) {
            child.collectFlat(flat);
        }
    }

    /**
     * Nested plain-Java dump of this section: content values first, then one
     * map per child section. A child replaces a value of the same name.
     *
     * @param fromRoot dump the whole tree instead of this subtree
     */
    public Map<String, Object> toMap(boolean fromRoot) {
        if (fromRoot) {
            return getRoot().toMap(false);
        }
        Map<String, Object> map = new LinkedHashMap<>();
        content.forEach((key, value) -> map.put(key, value.toJava()));
        children.forEach((childName, child) -> map.put(childName, child.toMap(false)));
        return map;
    }

    @Override
    public String toString() {
        return SectionPrinter.print(this);
    }

    private List<String> split(String path) {
        return Arrays.asList(path.split(Pattern.quote(separator), -1));
    }

    // segments naming sections only: a single trailing separator is allowed
    private List<String> sectionSegments(String path) {
        List<String> segments = new ArrayList<>(split(path));
        if (!segments.get(0).equals(getRoot().name)) {
            throw new InvalidPathException(path, "does not start with the root section '" + getRoot().name + "'");
        }
        if (segments.size() > 1 && segments.get(segments.size() - 1).isEmpty()) {
            segments.remove(segments.size() - 1);
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new InvalidPathException(path, "empty section name");
            }
        }
        return segments;
    }

    @Getter
    @RequiredArgsConstructor
    private static final class Candidate {
        private final TreeElement element;
        private final String path;
        private final boolean direct;
    }
}
