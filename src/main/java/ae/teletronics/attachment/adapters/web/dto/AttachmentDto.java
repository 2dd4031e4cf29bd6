package ae.teletronics.attachment.adapters.web.dto;

import ae.teletronics.attachment.domain.model.Attachment;

import java.time.Instant;

public record AttachmentDto(
        String id,
        String filename,
        String contentType,
        Long size,
        Integer width,
        Integer height,
        Instant createdAt,
        Instant updatedAt
) {
    public static AttachmentDto from(Attachment a) {
        return new AttachmentDto(
                a.getId(),
                a.getFilename(),
                a.getContentType(),
                a.getSize(),
                a.getWidth(),
                a.getHeight(),
                a.getCreatedAt(),
                a.getUpdatedAt()
        );
    }
}
