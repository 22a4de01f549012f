package de.jwiegmann.meetinglog.boundary;

import de.jwiegmann.meetinglog.boundary.dto.error.ApiError;
import de.jwiegmann.meetinglog.control.CommitErrorFactory;
import de.jwiegmann.meetinglog.control.exception.StoreException;
import de.jwiegmann.meetinglog.control.exception.StoreRateLimitedException;
import de.jwiegmann.meetinglog.control.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Übersetzt Domain-Fehler in ApiError-Responses. ResponseStatusException läuft über Springs Standard-Handling.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        return ResponseEntity.badRequest().body(CommitErrorFactory.validationFailed(e));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(CommitErrorFactory.requestInvalid(details));
    }

    @ExceptionHandler(StoreRateLimitedException.class)
    public ResponseEntity<ApiError> handleRateLimited(StoreRateLimitedException e) {
        log.warn("Store rate limited: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, e.getRetryAfter().toSeconds())))
                .body(CommitErrorFactory.storeRateLimited(e));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiError> handleStore(StoreException e) {
        log.error("Store {} failed on '{}': {}", e.getOperation(), e.getTable(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(CommitErrorFactory.storeFailed(e));
    }
}
