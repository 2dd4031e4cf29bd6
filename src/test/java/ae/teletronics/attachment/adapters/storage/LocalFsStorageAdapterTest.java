package ae.teletronics.attachment.adapters.storage;

import ae.teletronics.attachment.ports.StoragePort;
import ae.teletronics.attachment.ports.StreamSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class LocalFsStorageAdapterTest {

    @TempDir
    Path tempRoot;

    private StoragePort newAdapter(boolean fsyncOnWrite) {
        return new LocalFsStorageAdapter(tempRoot, fsyncOnWrite);
    }

    private static StreamSource fromBytes(byte[] data) {
        return () -> new ByteArrayInputStream(data);
    }

    private static byte[] randomBytes(int size) {
        byte[] data = new byte[size];
        new Random(42).nextBytes(data);
        return data;
    }

    @Test
    void save_then_load_roundtrip_ok() throws Exception {
        StoragePort storage = newAdapter(false);
        byte[] data = randomBytes(16 * 1024);
        String key = "attachments/ab/cd/abcd1234/photo.png";

        StoragePort.StorageSaveResult res = storage.save(fromBytes(data), key);

        assertThat(res.storageKey()).isEqualTo(key);
        assertThat(res.size()).isEqualTo(data.length);
        assertThat(Files.size(tempRoot.resolve(key))).isEqualTo(data.length);

        StoragePort.StoredObject obj = storage.load(key);
        assertThat(obj.size()).isEqualTo(data.length);
        try (InputStream in = obj.source().openStream()) {
            assertThat(in.readAllBytes()).containsExactly(data);
        }
    }

    @Test
    void save_overwrites_existing_object_and_leaves_no_partial_file() throws Exception {
        StoragePort storage = newAdapter(true);
        String key = "attachments/x/file.txt";

        storage.save(fromBytes("first version".getBytes()), key);
        storage.save(fromBytes("second".getBytes()), key);

        Path file = tempRoot.resolve(key);
        assertThat(Files.readString(file)).isEqualTo("second");
        try (var siblings = Files.list(file.getParent())) {
            assertThat(siblings).containsExactly(file);
        }
    }

    @Test
    void save_failing_source_leaves_nothing_behind() {
        StoragePort storage = newAdapter(false);
        StreamSource broken = () -> { throw new IOException("client went away"); };

        assertThatThrownBy(() -> storage.save(broken, "attachments/y/file.txt"))
                .isInstanceOf(IOException.class)
                .hasMessage("client went away");
        assertThat(tempRoot.resolve("attachments/y/file.txt")).doesNotExist();
        assertThat(tempRoot.resolve("attachments/y/file.txt.part")).doesNotExist();
    }

    @Test
    void save_normalizes_backslashes_and_leading_slashes() throws Exception {
        StoragePort storage = newAdapter(false);

        StoragePort.StorageSaveResult res = storage.save(fromBytes("x".getBytes()), "\\attachments\\a\\b.txt");

        assertThat(res.storageKey()).isEqualTo("attachments/a/b.txt");
        assertThat(tempRoot.resolve("attachments/a/b.txt")).exists();
    }

    @Test
    void delete_removes_file_prunes_empty_dirs_and_is_idempotent() throws Exception {
        StoragePort storage = newAdapter(false);
        String key = "attachments/ab/cd/abcd/file.txt";
        storage.save(fromBytes("bye".getBytes()), key);
        storage.save(fromBytes("stay".getBytes()), "attachments/other.txt");

        storage.delete(key);

        assertThat(tempRoot.resolve(key)).doesNotExist();
        assertThat(tempRoot.resolve("attachments/ab")).doesNotExist();
        assertThat(tempRoot.resolve("attachments/other.txt")).exists();
        assertThat(tempRoot).exists();

        // second call should not throw
        assertThatCode(() -> storage.delete(key)).doesNotThrowAnyException();
    }

    @Test
    void load_nonExistingKey_throws_NoSuchFile() {
        StoragePort storage = newAdapter(false);
        assertThatThrownBy(() -> storage.load("no/such/file.bin"))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void save_rejects_escaping_root() {
        StoragePort storage = newAdapter(false);
        assertThatThrownBy(() -> storage.save(fromBytes("x".getBytes()), "../../etc/passwd"))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> storage.save(fromBytes("x".getBytes()), "/../../etc/passwd"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void save_requires_key() {
        StoragePort storage = newAdapter(false);
        assertThatThrownBy(() -> storage.save(fromBytes("x".getBytes()), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
