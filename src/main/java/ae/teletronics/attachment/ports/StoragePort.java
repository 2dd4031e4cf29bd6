package ae.teletronics.attachment.ports;

import java.io.IOException;
import java.util.Objects;

/**
 * Durable backend for confirmed attachment bytes (local FS, object store, etc.).
 * Objects are addressed by an opaque storage key chosen by the caller.
 */
public interface StoragePort {

    /**
     * Persist the binary stream under the given key, replacing any previous object.
     *
     * @param source  re-openable stream source
     * @param key     destination key; backends may normalize it and report the effective key back
     */
    StorageSaveResult save(StreamSource source, String key) throws IOException;

    /**
     * Open the stored object for reading and get its metadata.
     */
    StoredObject load(String storageKey) throws IOException;

    /**
     * Delete the stored object. Should be idempotent: no error if the object doesn't exist.
     */
    void delete(String storageKey) throws IOException;

    /**
     * Effective storage key + size (in bytes) returned on save.
     */
    record StorageSaveResult(String storageKey, long size) {
        public StorageSaveResult {
            Objects.requireNonNull(storageKey, "storageKey");
        }
    }

    /**
     * Object metadata + a source you can open for reading.
     */
    record StoredObject(String storageKey, long size, StreamSource source) {
        public StoredObject {
            Objects.requireNonNull(storageKey, "storageKey");
            Objects.requireNonNull(source, "source");
        }
    }
}
