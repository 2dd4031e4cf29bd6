package ae.teletronics.attachment.application;

import ae.teletronics.attachment.domain.AttachmentOptions;
import ae.teletronics.attachment.domain.FieldError;
import ae.teletronics.attachment.domain.model.Attachment;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an attachment record against a constraint set.
 * Failures come back as field errors so the caller can re-prompt.
 */
public class AttachmentValidator {

    public static final String SIZE = "size";
    public static final String CONTENT_TYPE = "content_type";
    public static final String FILENAME = "filename";

    public List<FieldError> validate(Attachment attachment, AttachmentOptions options) {
        List<FieldError> errors = new ArrayList<>();

        if (attachment.getSize() == null) {
            errors.add(FieldError.blank(SIZE));
        } else if (!options.getSize().includes(attachment.getSize())) {
            errors.add(FieldError.notIncluded(SIZE, options.getSize().toString()));
        }

        String contentType = attachment.getContentType();
        if (contentType == null || contentType.isBlank()) {
            errors.add(FieldError.blank(CONTENT_TYPE));
        } else if (options.restrictsContentType() && !options.getContentTypes().contains(contentType)) {
            errors.add(FieldError.notIncluded(CONTENT_TYPE, String.join(", ", options.getContentTypes())));
        }

        if (attachment.getFilename() == null || attachment.getFilename().isBlank()) {
            errors.add(FieldError.blank(FILENAME));
        }
        return errors;
    }
}
