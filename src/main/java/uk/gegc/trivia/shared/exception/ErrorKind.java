package uk.gegc.trivia.shared.exception;

import org.springframework.http.HttpStatus;

/**
 * The closed set of error responses the API produces.
 * Every failure is mapped to exactly one kind at the web boundary.
 */
public enum ErrorKind {

    BAD_REQUEST(HttpStatus.BAD_REQUEST, "Bad request error"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Resource not found"),
    UNPROCESSABLE_ENTITY(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable entity"),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "An error has occured, please try again");

    private final HttpStatus status;
    private final String message;

    ErrorKind(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Resolves the kind for a raw status code.
     *
     * @return the matching kind, or {@code null} when the status is not one of the four API errors
     */
    public static ErrorKind fromStatus(int statusCode) {
        for (ErrorKind kind : values()) {
            if (kind.status.value() == statusCode) {
                return kind;
            }
        }
        return null;
    }
}
