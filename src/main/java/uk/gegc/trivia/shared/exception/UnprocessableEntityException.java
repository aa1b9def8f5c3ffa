package uk.gegc.trivia.shared.exception;

/**
 * Thrown when a well-formed request cannot be applied to the current data,
 * for example a question that references a category which does not exist.
 */
public class UnprocessableEntityException extends TriviaException {

    public UnprocessableEntityException(String message) {
        super(ErrorKind.UNPROCESSABLE_ENTITY, message);
    }

    public UnprocessableEntityException(String message, Throwable cause) {
        super(ErrorKind.UNPROCESSABLE_ENTITY, message, cause);
    }
}
