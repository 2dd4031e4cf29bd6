package ae.teletronics.attachment.application.dto;

import ae.teletronics.attachment.ports.StreamSource;

/**
 * Structured file upload, typically a multipart part.
 */
public record UploadedFile(
        String contentType,       // may be null or "application/octet-stream"
        String originalFilename,
        long size,
        StreamSource source
) implements UploadInput {}
