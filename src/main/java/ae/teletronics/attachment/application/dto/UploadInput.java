package ae.teletronics.attachment.application.dto;

/**
 * Upload data handed to the lifecycle: {@link UploadedFile}, {@link BufferUpload} or {@link RawUpload}.
 */
public interface UploadInput {
}
