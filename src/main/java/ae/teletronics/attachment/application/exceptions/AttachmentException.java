package ae.teletronics.attachment.application.exceptions;

/**
 * Generic attachment processing failure (staging, illegal lifecycle use).
 * Not retried; surfaced to the caller as is.
 */
public class AttachmentException extends RuntimeException {

    public AttachmentException(String message) {
        super(message);
    }

    public AttachmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
