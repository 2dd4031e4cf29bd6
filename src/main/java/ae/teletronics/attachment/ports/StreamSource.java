package ae.teletronics.attachment.ports;

import java.io.IOException;
import java.io.InputStream;

/**
 * Supplier of re-openable InputStreams.
 * Each call returns a fresh stream so staging, type detection and the storage write
 * can all read the same bytes without holding them in memory.
 */
@FunctionalInterface
public interface StreamSource {
    InputStream openStream() throws IOException;
}
