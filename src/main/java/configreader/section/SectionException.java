package configreader.section;

public class SectionException extends RuntimeException {

    public SectionException(String message) {
        super(message);
    }
}
