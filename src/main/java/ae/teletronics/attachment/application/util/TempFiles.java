package ae.teletronics.attachment.application.util;

import ae.teletronics.attachment.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Creates uniquely named temp files in one directory and removes them again.
 */
public class TempFiles {

    private static final Logger log = LoggerFactory.getLogger(TempFiles.class);
    private static final String DEFAULT_BASE_NAME = "attachment";

    private final Path directory;

    public TempFiles(Path directory) throws IOException {
        this.directory = Objects.requireNonNull(directory, "directory");
        Files.createDirectories(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    /** Writes the given bytes to a new temp file and returns its path. */
    public Path write(byte[] data, String baseName) throws IOException {
        Path tmp = newTempFile(baseName);
        try {
            Files.write(tmp, data);
        } catch (IOException e) {
            delete(tmp);
            throw e;
        }
        return tmp;
    }

    /** Streams the source into a new temp file and returns its path. */
    public Path copy(StreamSource source, String baseName) throws IOException {
        Path tmp = newTempFile(baseName);
        try (InputStream in = source.openStream()) {
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            delete(tmp);
            throw e;
        }
        return tmp;
    }

    /** Copies an existing file into a new temp file. */
    public Path copy(Path file, String baseName) throws IOException {
        return copy(() -> Files.newInputStream(file), baseName);
    }

    /**
     * Removes a temp file. Failures are logged, not thrown: a leftover temp file must not fail a save.
     */
    public boolean delete(Path tmp) {
        try {
            return Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}", tmp, e);
            return false;
        }
    }

    private Path newTempFile(String baseName) throws IOException {
        String suffix = "-" + (baseName == null || baseName.isBlank() ? DEFAULT_BASE_NAME : baseName);
        return Files.createTempFile(directory, "upload", suffix);
    }
}
