package ae.teletronics.attachment.ports;

import java.io.IOException;
import java.util.Optional;

/**
 * Determines the media type (e.g., "image/png") of an upload whose declared type is not useful.
 * Should not assume the stream supports mark/reset; always use the provided StreamSource.
 */
public interface FileTypeDetector {

    /**
     * @param source        re-openable source to inspect for a known signature
     * @param filenameHint  optional filename; its extension wins over the signature when it is known
     * @return Optional content type (RFC 2046, e.g., "application/pdf"), empty when nothing specific was found
     */
    Optional<String> detect(StreamSource source, String filenameHint) throws IOException;
}
