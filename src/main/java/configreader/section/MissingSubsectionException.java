package configreader.section;

import lombok.Getter;

@Getter
public class MissingSubsectionException extends SectionException {

    private final String path;
    private final String subsection;

    public MissingSubsectionException(String path, String subsection) {
        super("Cannot set " + path + ": subsection '" + subsection + "' does not exist");
        this.path = path;
        this.subsection = subsection;
    }
}
