package configreader;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where INI text comes from: a file, an open reader or stream, or the text
 * itself. Readers and streams are read once and not closed.
 */
@Slf4j
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConfigSource {

    @Getter
    private final String name;
    private final TextSupplier supplier;

    public String read() throws IOException {
        return supplier.get();
    }

    public static ConfigSource ofPath(Path path) {
        return new ConfigSource(path.toString(), () -> Files.readString(path));
    }

    public static ConfigSource ofReader(String name, Reader reader) {
        return new ConfigSource(name, () -> {
            StringWriter out = new StringWriter();
            reader.transferTo(out);
            return out.toString();
        });
    }

    public static ConfigSource ofStream(String name, InputStream stream) {
        return new ConfigSource(name, () -> new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    }

    public static ConfigSource ofString(String text) {
        return new ConfigSource("<string>", () -> text);
    }

    /**
     * A file if {@code pathOrText} names an existing one, inline text otherwise.
     */
    public static ConfigSource of(String pathOrText) {
        try {
            Path path = Paths.get(pathOrText);
            if (Files.isRegularFile(path)) {
                return ofPath(path);
            }
        } catch (InvalidPathException e) {
            log.debug("Source is not a valid path, reading it as inline text: {}", e.getMessage());
        }
        return ofString(pathOrText);
    }

    @Override
    public String toString() {
        return name;
    }

    @FunctionalInterface
    private interface TextSupplier {
        String get() throws IOException;
    }
}
