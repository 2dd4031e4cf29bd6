package ae.teletronics.attachment.domain.model;

import ae.teletronics.attachment.domain.Filenames;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * Mongo document describing an attachment.
 * The bytes themselves live in a StoragePort backend under {@link #storageKey}.
 */
@Document(collection = "attachments")
public class Attachment {

    @Id
    private String id;

    /** Sanitized filename, safe to use as the last segment of a storage key. */
    private String filename;

    /** Trimmed content type, possibly detected when the upload declared application/octet-stream. */
    private String contentType;

    /** File size in bytes; null until data has been staged. */
    private Long size;

    /**
     * Storage object key of the persisted bytes.
     * Null for a record whose data was never saved.
     */
    private String storageKey;

    /** Pixel dimensions, filled for decodable images only. */
    private Integer width;
    private Integer height;

    @CreatedDate
    private Instant createdAt;

    @LastModifiedDate
    private Instant updatedAt;

    @Version
    private Long version;

    public Attachment() { }

    public Attachment(String id) {
        this.id = id;
    }

    /* -------------------- Normalization helpers -------------------- */

    public void setFilename(String filename) {
        this.filename = Filenames.sanitize(filename);
    }

    public void setContentType(String contentType) {
        this.contentType = contentType == null ? null : contentType.strip();
    }

    public boolean isNew() {
        return version == null;
    }

    /* -------------------- Getters & setters -------------------- */

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getFilename() { return filename; }

    public String getContentType() { return contentType; }

    public Long getSize() { return size; }
    public void setSize(Long size) { this.size = size; }

    public String getStorageKey() { return storageKey; }
    public void setStorageKey(String storageKey) { this.storageKey = storageKey; }

    public Integer getWidth() { return width; }
    public void setWidth(Integer width) { this.width = width; }

    public Integer getHeight() { return height; }
    public void setHeight(Integer height) { this.height = height; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }

    /* -------------------- Equality by id -------------------- */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attachment)) return false;
        Attachment that = (Attachment) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() { return Objects.hash(id); }

    @Override
    public String toString() {
        return "Attachment{" +
                "id='" + id + '\'' +
                ", filename='" + filename + '\'' +
                ", contentType='" + contentType + '\'' +
                ", size=" + size +
                ", storageKey='" + storageKey + '\'' +
                '}';
    }
}
