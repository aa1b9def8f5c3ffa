package uk.gegc.trivia.shared.exception;

/**
 * Thrown when a lookup or listing that must produce something comes back empty.
 */
public class ResourceNotFoundException extends TriviaException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
