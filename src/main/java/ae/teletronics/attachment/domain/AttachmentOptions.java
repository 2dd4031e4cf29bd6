package ae.teletronics.attachment.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Constraint set and storage settings for one kind of attachment.
 * Immutable; build it with {@link #builder()}.
 *
 * <ul>
 *   <li>content types: allowed types, all allowed when empty. {@link #IMAGE} expands to {@link #IMAGE_CONTENT_TYPES}</li>
 *   <li>size: an explicit range overrides min/max, which default to 1 byte and 1 MiB</li>
 *   <li>path prefix: storage key namespace, without a leading slash</li>
 *   <li>storage: backend selector, {@code file_system} by default</li>
 * </ul>
 */
public final class AttachmentOptions {

    public static final String IMAGE = "image";
    public static final String FILE_SYSTEM = "file_system";
    public static final long DEFAULT_MIN_SIZE = 1L;
    public static final long DEFAULT_MAX_SIZE = 1024L * 1024L;
    public static final String DEFAULT_PATH_PREFIX = "attachments";

    /** Content types recognized as images, including the non-standard aliases browsers send. */
    public static final List<String> IMAGE_CONTENT_TYPES = List.of(
            "image/jpeg",
            "image/pjpeg",
            "image/jpg",
            "image/gif",
            "image/png",
            "image/x-png",
            "image/x-ms-bmp",
            "image/bmp",
            "image/x-bmp",
            "image/x-bitmap",
            "image/x-xbitmap",
            "image/x-win-bitmap",
            "image/x-windows-bmp",
            "image/ms-bmp",
            "application/bmp",
            "application/x-bmp",
            "application/x-win-bitmap",
            "application/preview",
            "image/jp_",
            "application/jpg",
            "application/x-jpg",
            "image/pipeg",
            "image/vnd.swiftview-jpeg",
            "application/png",
            "application/x-png",
            "image/gi_",
            "image/x-citrix-pjpeg"
    );

    private final Set<String> contentTypes;
    private final SizeRange size;
    private final String pathPrefix;
    private final String storage;

    private AttachmentOptions(Builder b) {
        this.contentTypes = Collections.unmodifiableSet(expand(b.contentTypes));
        this.size = b.size != null
                ? b.size
                : new SizeRange(b.minSize != null ? b.minSize : DEFAULT_MIN_SIZE,
                                b.maxSize != null ? b.maxSize : DEFAULT_MAX_SIZE);
        this.pathPrefix = normalizePrefix(b.pathPrefix);
        this.storage = b.storage == null || b.storage.isBlank() ? FILE_SYSTEM : b.storage.strip();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AttachmentOptions defaults() {
        return builder().build();
    }

    /** Returns true if the given content type is one of the known image types. */
    public static boolean isImage(String contentType) {
        return contentType != null && IMAGE_CONTENT_TYPES.contains(contentType);
    }

    /** Allowed content types; empty means any. */
    public Set<String> getContentTypes() { return contentTypes; }

    public SizeRange getSize() { return size; }

    public String getPathPrefix() { return pathPrefix; }

    public String getStorage() { return storage; }

    public boolean restrictsContentType() {
        return !contentTypes.isEmpty();
    }

    private static Set<String> expand(List<String> requested) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : requested) {
            if (t == null || t.isBlank()) continue;
            String nt = t.strip();
            if (IMAGE.equals(nt)) {
                out.addAll(IMAGE_CONTENT_TYPES);
            } else {
                out.add(nt);
            }
        }
        return out;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) return DEFAULT_PATH_PREFIX;
        String p = prefix.strip();
        if (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p.isEmpty() ? DEFAULT_PATH_PREFIX : p;
    }

    @Override
    public String toString() {
        return "AttachmentOptions{" +
                "contentTypes=" + contentTypes +
                ", size=" + size +
                ", pathPrefix='" + pathPrefix + '\'' +
                ", storage='" + storage + '\'' +
                '}';
    }

    public static final class Builder {
        private final List<String> contentTypes = new ArrayList<>();
        private Long minSize;
        private Long maxSize;
        private SizeRange size;
        private String pathPrefix;
        private String storage;

        private Builder() { }

        public Builder contentType(String... types) {
            Collections.addAll(contentTypes, types);
            return this;
        }

        public Builder contentTypes(Collection<String> types) {
            if (types != null) contentTypes.addAll(types);
            return this;
        }

        public Builder minSize(long minSize) {
            this.minSize = minSize;
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder size(SizeRange size) {
            this.size = size;
            return this;
        }

        public Builder size(long min, long max) {
            return size(new SizeRange(min, max));
        }

        public Builder pathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
            return this;
        }

        public Builder storage(String storage) {
            this.storage = storage;
            return this;
        }

        public AttachmentOptions build() {
            return new AttachmentOptions(this);
        }
    }
}
