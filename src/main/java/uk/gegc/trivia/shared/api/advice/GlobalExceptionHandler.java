package uk.gegc.trivia.shared.api.advice;

import jakarta.persistence.PersistenceException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.trivia.shared.api.dto.ErrorResponse;
import uk.gegc.trivia.shared.exception.ErrorKind;
import uk.gegc.trivia.shared.exception.TriviaException;

/**
 * Maps every failure to the fixed {@code {success:false, error, message}} envelope.
 *
 * <p>Application exceptions carry their {@link ErrorKind}. Data-layer failures and anything
 * unexpected become {@link ErrorKind#UNPROCESSABLE_ENTITY}; the cause is logged here and not
 * exposed to the client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TriviaException.class)
    public ResponseEntity<ErrorResponse> handleTrivia(TriviaException ex, HttpServletRequest request) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.INTERNAL_SERVER_ERROR) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.debug("{} {} rejected with {}: {}", request.getMethod(), request.getRequestURI(), kind, ex.getMessage());
        }
        return respond(kind);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest request) {
        log.debug("{} {} violated constraints: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return respond(ErrorKind.BAD_REQUEST);
    }

    @ExceptionHandler({DataAccessException.class, PersistenceException.class})
    public ResponseEntity<ErrorResponse> handleDataAccess(RuntimeException ex, HttpServletRequest request) {
        log.error("Data access failure on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return respond(ErrorKind.UNPROCESSABLE_ENTITY);
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request
    ) {
        if (log.isDebugEnabled()) {
            ex.getBindingResult().getFieldErrors().forEach(error ->
                    log.debug("Invalid field '{}' (rejected value {}): {}",
                            error.getField(), error.getRejectedValue(), error.getDefaultMessage()));
        }
        return super.handleMethodArgumentNotValid(ex, headers, status, request);
    }

    /**
     * Every Spring MVC exception handled by the base class (unreadable body, type mismatch,
     * unknown route, unsupported method) ends up here; replace its body with the API envelope.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex,
            @Nullable Object body,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode,
            @NonNull WebRequest request
    ) {
        log.debug("Request failed with status {}: {}", statusCode.value(), ex.getMessage());
        return new ResponseEntity<>(ErrorResponse.forStatus(statusCode), headers, statusCode);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllOthers(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception on {} {}: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return respond(ErrorKind.UNPROCESSABLE_ENTITY);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorKind kind) {
        return ResponseEntity.status(kind.getStatus()).body(ErrorResponse.of(kind));
    }
}
