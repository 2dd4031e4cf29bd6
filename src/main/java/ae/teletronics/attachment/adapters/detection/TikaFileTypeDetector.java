package ae.teletronics.attachment.adapters.detection;

import ae.teletronics.attachment.ports.FileTypeDetector;
import ae.teletronics.attachment.ports.StreamSource;
import org.apache.tika.config.TikaConfig;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.mime.MediaType;
import org.apache.tika.mime.MimeTypes;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Apache Tika-based file type detector.
 * The filename extension is consulted first; the magic bytes of the content only when the name is unknown.
 */
public class TikaFileTypeDetector implements FileTypeDetector {

    private final MimeTypes mimeTypes;
    private final DefaultDetector detector;

    public TikaFileTypeDetector() {
        this.mimeTypes = TikaConfig.getDefaultConfig().getMimeRepository();
        this.detector = new DefaultDetector(mimeTypes);
    }

    @Override
    public Optional<String> detect(StreamSource source, String filenameHint) throws IOException {
        if (filenameHint != null && !filenameHint.isBlank()) {
            Metadata byName = new Metadata();
            byName.set(TikaCoreProperties.RESOURCE_NAME_KEY, filenameHint);
            // a null stream makes Tika look at the name only
            Optional<String> named = specific(mimeTypes.detect(null, byName));
            if (named.isPresent()) return named;
        }
        if (source == null) return Optional.empty();

        try (InputStream in = TikaInputStream.get(source.openStream())) {
            return specific(detector.detect(in, new Metadata()));
        }
    }

    // Tika returns "application/octet-stream" for unknowns
    private static Optional<String> specific(MediaType mediaType) {
        if (mediaType == null || MediaType.OCTET_STREAM.equals(mediaType)) {
            return Optional.empty();
        }
        return Optional.of(mediaType.toString());
    }
}
