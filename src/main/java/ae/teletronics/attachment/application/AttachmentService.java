package ae.teletronics.attachment.application;

import ae.teletronics.attachment.adapters.persistence.repo.AttachmentRepository;
import ae.teletronics.attachment.application.dto.AttachmentContent;
import ae.teletronics.attachment.application.dto.UploadInput;
import ae.teletronics.attachment.application.exceptions.AttachmentValidationException;
import ae.teletronics.attachment.application.exceptions.NotFoundException;
import ae.teletronics.attachment.domain.LifecycleEvent;
import ae.teletronics.attachment.domain.model.Attachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;

@Service
public class AttachmentService {

    private static final Logger log = LoggerFactory.getLogger(AttachmentService.class);

    private final AttachmentRepository attachments;
    private final AttachmentLifecycle lifecycle;

    public AttachmentService(AttachmentRepository attachments, AttachmentLifecycle lifecycle) {
        this.attachments = attachments;
        this.lifecycle = lifecycle;
    }

    public Attachment create(UploadInput input) throws IOException {
        Attachment record = new Attachment(UUID.randomUUID().toString());
        try (StagedAttachment staged = lifecycle.open(record)) {
            if (!lifecycle.assign(staged, input)) {
                throw new IllegalArgumentException("Upload is empty");
            }
            return saveAndStore(staged);
        }
    }

    public Attachment replace(String id, UploadInput input) throws IOException {
        Attachment record = find(id);
        try (StagedAttachment staged = lifecycle.open(record)) {
            if (!lifecycle.assign(staged, input)) {
                throw new IllegalArgumentException("Upload is empty");
            }
            return saveAndStore(staged);
        }
    }

    public Attachment find(String id) {
        return attachments.findById(id)
                .orElseThrow(() -> new NotFoundException("Attachment not found"));
    }

    public AttachmentContent open(String id) throws IOException {
        Attachment record = find(id);
        return new AttachmentContent(record, lifecycle.retrieve(record));
    }

    public void destroy(String id) throws IOException {
        Attachment record = find(id);

        // Delete bytes first; if it fails, propagate (keeps metadata so the caller can retry)
        try (StagedAttachment staged = lifecycle.open(record)) {
            lifecycle.transition(staged, LifecycleEvent.DESTROY);
        }
        attachments.delete(record);
    }

    private Attachment saveAndStore(StagedAttachment staged) throws IOException {
        TransitionResult result = lifecycle.transition(staged, LifecycleEvent.SAVE);
        if (!result.ok()) {
            throw new AttachmentValidationException(result.errors());
        }

        Attachment record = staged.record();
        Attachment saved;
        try {
            saved = attachments.save(record);
        } catch (RuntimeException e) {
            // Bytes first, metadata after: undo the write so neither object is orphaned
            try {
                lifecycle.rollback(staged);
            } catch (IOException cleanup) {
                log.warn("Could not remove uncommitted object {}", record.getStorageKey(), cleanup);
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        try {
            lifecycle.commit(staged);
        } catch (IOException e) {
            // the record is stored; a leftover previous object does not fail the request
            log.warn("Could not remove previous object of attachment {}", record.getId(), e);
        }
        return saved;
    }
}
