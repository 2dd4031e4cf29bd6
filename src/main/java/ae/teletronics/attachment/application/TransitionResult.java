package ae.teletronics.attachment.application;

import ae.teletronics.attachment.domain.AttachmentState;
import ae.teletronics.attachment.domain.FieldError;

import java.util.List;

/**
 * Outcome of a lifecycle transition.
 *
 * @param state           state after the transition
 * @param storageChanged  whether the backend was written to or deleted from
 * @param errors          validation errors; non-empty means the transition was refused
 */
public record TransitionResult(AttachmentState state, boolean storageChanged, List<FieldError> errors) {

    public TransitionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static TransitionResult done(AttachmentState state, boolean storageChanged) {
        return new TransitionResult(state, storageChanged, List.of());
    }

    static TransitionResult rejected(AttachmentState state, List<FieldError> errors) {
        return new TransitionResult(state, false, errors);
    }

    public boolean ok() {
        return errors.isEmpty();
    }
}
