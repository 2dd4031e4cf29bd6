package ae.teletronics.attachment.application.dto;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;

/**
 * Dictionary-style upload: size, content type, filename and a file holding the bytes.
 * The content type is taken as given, no detection is applied.
 */
public record RawUpload(Long size, String contentType, String filename, Path tempfile) implements UploadInput {

    public static final String SIZE = "size";
    public static final String CONTENT_TYPE = "content_type";
    public static final String FILENAME = "filename";
    public static final String TEMPFILE = "tempfile";

    /**
     * Reads the {@code size}, {@code content_type}, {@code filename} and {@code tempfile} entries.
     * Returns null for a null or empty map.
     */
    public static RawUpload fromMap(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) return null;
        return new RawUpload(
                toSize(fields.get(SIZE)),
                toText(fields.get(CONTENT_TYPE)),
                toText(fields.get(FILENAME)),
                toPath(fields.get(TEMPFILE)));
    }

    public boolean isEmpty() {
        return size != null && size == 0L;
    }

    private static Long toSize(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(v.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("size must be numeric: " + v, e);
        }
    }

    private static String toText(Object v) {
        return v == null ? null : v.toString();
    }

    private static Path toPath(Object v) {
        if (v == null) return null;
        if (v instanceof Path p) return p;
        if (v instanceof File f) return f.toPath();
        return Path.of(v.toString());
    }
}
