package configreader.section;

import lombok.Getter;

@Getter
public class KeyNotFoundException extends SectionException {

    private final String key;

    public KeyNotFoundException(String key, String message) {
        super(message);
        this.key = key;
    }
}
