package ae.teletronics.attachment.application.exceptions;

/**
 * Thrown when an image derivative or image metadata cannot be produced from the staged data.
 */
public class ThumbnailException extends RuntimeException {

    public ThumbnailException(String message) {
        super(message);
    }

    public ThumbnailException(String message, Throwable cause) {
        super(message, cause);
    }
}
