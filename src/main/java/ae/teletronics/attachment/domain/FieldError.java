package ae.teletronics.attachment.domain;

import java.util.Objects;

/**
 * Validation failure on a single attribute.
 *
 * @param attribute  "size", "content_type" or "filename"
 * @param message    human readable reason
 * @param allowed    rendering of the accepted values, null when not applicable
 */
public record FieldError(String attribute, String message, String allowed) {

    public static final String BLANK = "can't be blank";
    public static final String NOT_INCLUDED = "is not included in the list";

    public FieldError {
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(message, "message");
    }

    public static FieldError blank(String attribute) {
        return new FieldError(attribute, BLANK, null);
    }

    public static FieldError notIncluded(String attribute, String allowed) {
        return new FieldError(attribute, NOT_INCLUDED, allowed);
    }

    @Override
    public String toString() {
        return allowed == null ? attribute + " " + message : attribute + " " + message + " (" + allowed + ")";
    }
}
