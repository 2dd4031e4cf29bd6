package ae.teletronics.attachment.application.dto;

import ae.teletronics.attachment.domain.model.Attachment;
import ae.teletronics.attachment.ports.StoragePort;

import java.util.Objects;

/** A record together with its opened stored object. */
public record AttachmentContent(Attachment record, StoragePort.StoredObject data) {

    public AttachmentContent {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(data, "data");
    }
}
