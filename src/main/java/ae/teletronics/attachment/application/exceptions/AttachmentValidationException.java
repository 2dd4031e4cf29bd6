package ae.teletronics.attachment.application.exceptions;

import ae.teletronics.attachment.domain.FieldError;

import java.util.List;
import java.util.stream.Collectors;

public class AttachmentValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public AttachmentValidationException(List<FieldError> errors) {
        super(errors.stream().map(FieldError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<FieldError> getErrors() { return errors; }
}
