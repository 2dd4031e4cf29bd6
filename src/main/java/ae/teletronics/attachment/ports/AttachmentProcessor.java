package ae.teletronics.attachment.ports;

import ae.teletronics.attachment.application.AttachmentLifecycle;
import ae.teletronics.attachment.application.StagedAttachment;

import java.io.IOException;

/**
 * Hook run on staged data while an attachment is being validated (resizing, metadata extraction, ...).
 * A processor may stage a derived version through the lifecycle; the newest staged file is what gets stored.
 */
public interface AttachmentProcessor {

    void process(StagedAttachment staged, AttachmentLifecycle lifecycle) throws IOException;
}
