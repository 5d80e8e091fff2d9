package configreader.section;

import lombok.Getter;

@Getter
public class InvalidPathException extends SectionException {

    private final String path;

    public InvalidPathException(String path, String reason) {
        super("Invalid path '" + path + "': " + reason);
        this.path = path;
    }
}
