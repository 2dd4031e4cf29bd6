package ae.teletronics.attachment.adapters.processing;

import ae.teletronics.attachment.application.AttachmentLifecycle;
import ae.teletronics.attachment.application.StagedAttachment;
import ae.teletronics.attachment.application.exceptions.ThumbnailException;
import ae.teletronics.attachment.domain.AttachmentOptions;
import ae.teletronics.attachment.domain.model.Attachment;
import ae.teletronics.attachment.ports.AttachmentProcessor;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Records width and height of staged images. Non-image uploads are left alone.
 */
public class ImageDimensionsProcessor implements AttachmentProcessor {

    @Override
    public void process(StagedAttachment staged, AttachmentLifecycle lifecycle) throws IOException {
        Attachment record = staged.record();
        if (!AttachmentOptions.isImage(record.getContentType())) {
            record.setWidth(null);
            record.setHeight(null);
            return;
        }
        Path current = staged.tempPath()
                .orElseThrow(() -> new ThumbnailException("No staged image for attachment " + record.getId()));

        BufferedImage image = ImageIO.read(current.toFile());
        if (image == null) {
            throw new ThumbnailException("Unreadable image " + record.getFilename() + " (" + record.getContentType() + ")");
        }
        record.setWidth(image.getWidth());
        record.setHeight(image.getHeight());
    }
}
