package ae.teletronics.attachment.application.dto;

/**
 * Upload whose bytes are already in memory.
 */
public record BufferUpload(String contentType, String filename, byte[] data) implements UploadInput {

    public long size() {
        return data == null ? 0L : data.length;
    }
}
