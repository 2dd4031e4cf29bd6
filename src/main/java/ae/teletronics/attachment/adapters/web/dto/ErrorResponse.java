package ae.teletronics.attachment.adapters.web.dto;

import ae.teletronics.attachment.domain.FieldError;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String code, String message, List<FieldError> fields) {

    public ErrorResponse(String code, String message) {
        this(code, message, List.of());
    }
}
