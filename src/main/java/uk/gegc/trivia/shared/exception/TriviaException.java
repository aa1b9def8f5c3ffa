package uk.gegc.trivia.shared.exception;

/**
 * Base unchecked exception for application-level errors.
 *
 * <p>The carried {@link ErrorKind} decides the HTTP status; the message is only logged and never
 * leaves the server.
 */
public class TriviaException extends RuntimeException {

    private final ErrorKind kind;

    public TriviaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TriviaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
