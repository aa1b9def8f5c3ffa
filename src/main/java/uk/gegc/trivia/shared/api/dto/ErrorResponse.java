package uk.gegc.trivia.shared.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import uk.gegc.trivia.shared.exception.ErrorKind;

@Schema(description = "Body returned for every failed request")
public record ErrorResponse(
        @Schema(description = "Always false for errors", example = "false")
        boolean success,

        @Schema(description = "HTTP status code", example = "404")
        int error,

        @Schema(description = "Fixed human-readable message for the status", example = "Resource not found")
        String message
) {

    public static ErrorResponse of(ErrorKind kind) {
        return new ErrorResponse(false, kind.getStatus().value(), kind.getMessage());
    }

    /**
     * Builds the body for a framework-level status. Statuses outside {@link ErrorKind}
     * keep their code and use the reason phrase as message.
     */
    public static ErrorResponse forStatus(HttpStatusCode statusCode) {
        ErrorKind kind = ErrorKind.fromStatus(statusCode.value());
        if (kind != null) {
            return of(kind);
        }
        HttpStatus resolved = HttpStatus.resolve(statusCode.value());
        String message = resolved != null ? resolved.getReasonPhrase() : "Error";
        return new ErrorResponse(false, statusCode.value(), message);
    }
}
