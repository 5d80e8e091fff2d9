package configreader.ini;

import lombok.Getter;

/**
 * INI text that cannot be read, with the source and line it was found on.
 */
@Getter
public class IniFormatException extends RuntimeException {

    private final String source;
    private final int lineNumber;

    public IniFormatException(String source, int lineNumber, String message) {
        super(source + ":" + lineNumber + ": " + message);
        this.source = source;
        this.lineNumber = lineNumber;
    }
}
