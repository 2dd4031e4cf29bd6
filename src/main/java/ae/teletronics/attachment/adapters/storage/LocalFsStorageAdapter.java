package ae.teletronics.attachment.adapters.storage;

import ae.teletronics.attachment.ports.StoragePort;
import ae.teletronics.attachment.ports.StreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.util.Objects;

/**
 * Filesystem backend: storage keys are relative paths below a root directory.
 */
public class LocalFsStorageAdapter implements StoragePort {

    private static final Logger log = LoggerFactory.getLogger(LocalFsStorageAdapter.class);

    private final Path rootDir;
    private final boolean fsyncOnWrite;

    public LocalFsStorageAdapter(Path rootDir, boolean fsyncOnWrite) {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toAbsolutePath().normalize();
        this.fsyncOnWrite = fsyncOnWrite;
    }

    @Override
    public StorageSaveResult save(StreamSource source, String key) throws IOException {
        Objects.requireNonNull(source, "source");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Storage key is required");
        }

        String safeKey = sanitizeKey(key);
        Path target = resolve(safeKey);
        Files.createDirectories(target.getParent());

        // Write next to the target and move into place so readers never see a partial file
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        long total = 0L;
        try (InputStream in = source.openStream();
             OutputStream out = Files.newOutputStream(partial, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
            byte[] buf = new byte[8192];
            int r;
            while ((r = in.read(buf)) != -1) {
                out.write(buf, 0, r);
                total += r;
            }
        } catch (IOException e) {
            Files.deleteIfExists(partial);
            throw e;
        }

        if (fsyncOnWrite) {
            try (FileChannel ch = FileChannel.open(partial, StandardOpenOption.WRITE)) {
                ch.force(true); // flush content + metadata
            } catch (IOException e) {
                log.warn("fsync failed for {}, continuing", safeKey, e);
            }
        }
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);

        return new StorageSaveResult(safeKey, total);
    }

    @Override
    public StoredObject load(String storageKey) throws IOException {
        Path p = resolve(sanitizeKey(storageKey));
        if (!Files.isRegularFile(p)) throw new NoSuchFileException(storageKey);
        long size = Files.size(p);
        StreamSource source = () -> Files.newInputStream(p, StandardOpenOption.READ);
        return new StoredObject(storageKey, size, source);
    }

    @Override
    public void delete(String storageKey) throws IOException {
        Path p = resolve(sanitizeKey(storageKey));
        try {
            Files.deleteIfExists(p);
            // prune the now empty partition directories, never the root itself
            Path parent = p.getParent();
            while (parent != null && !parent.equals(rootDir) && parent.startsWith(rootDir)) {
                try {
                    Files.delete(parent);
                    parent = parent.getParent();
                } catch (DirectoryNotEmptyException | NoSuchFileException ex) {
                    break;
                }
            }
        } catch (SecurityException se) {
            throw new IOException("Failed to delete: " + storageKey, se);
        }
    }

    /* helpers */

    private Path resolve(String safeKey) throws IOException {
        Path p = rootDir.resolve(safeKey).normalize();
        if (!p.startsWith(rootDir) || p.equals(rootDir)) {
            throw new IOException("Refusing to escape root directory: " + safeKey);
        }
        return p;
    }

    private static String sanitizeKey(String input) {
        String trimmed = input.trim().replace("\\", "/");
        while (trimmed.startsWith("/")) trimmed = trimmed.substring(1);
        return trimmed;
    }
}
