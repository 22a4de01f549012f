package de.jwiegmann.meetinglog.control;

import de.jwiegmann.meetinglog.boundary.dto.error.ApiError;
import de.jwiegmann.meetinglog.control.exception.RelayException;
import de.jwiegmann.meetinglog.control.exception.StoreException;
import de.jwiegmann.meetinglog.control.exception.StoreRateLimitedException;
import de.jwiegmann.meetinglog.control.exception.ValidationException;

import java.util.Map;

public final class CommitErrorFactory {

    private CommitErrorFactory() {
    }

    public static ApiError validationFailed(ValidationException e) {
        return ApiError.builder()
                .code(e.getErrorCode())
                .message(e.getMessage())
                .build();
    }

    public static ApiError requestInvalid(String details) {
        return ApiError.builder()
                .code("VALIDATION_FAILED")
                .message("Request validation failed: " + details)
                .details(Map.of("details", details))
                .build();
    }

    public static ApiError attachmentUploadFailed(int position, RelayException e) {
        return ApiError.builder()
                .code("ATTACHMENT_" + e.getKind().name())
                .message(e.getMessage())
                .details(Map.of("position", position, "retryable", e.isRetryable()))
                .build();
    }

    public static ApiError storeRateLimited(StoreRateLimitedException e) {
        return ApiError.builder()
                .code("STORE_RATE_LIMITED")
                .message("store quota exhausted, please wait before retrying")
                .details(Map.of(
                        "operation", e.getOperation().name(),
                        "retryAfterSeconds", e.getRetryAfter().toSeconds()))
                .build();
    }

    public static ApiError storeFailed(StoreException e) {
        return ApiError.builder()
                .code(e.getOperation() == StoreException.Operation.READ ? "STORE_READ_FAILED" : "STORE_WRITE_FAILED")
                .message(e.getMessage())
                .details(Map.of("table", e.getTable()))
                .build();
    }

    public static ApiError commitCancelled(int position) {
        return ApiError.builder()
                .code("COMMIT_CANCELLED")
                .message("commit cancelled before item " + position)
                .details(Map.of("position", position))
                .build();
    }

    public static ApiError itemNotAttempted(int position) {
        return ApiError.builder()
                .code("ITEM_NOT_ATTEMPTED")
                .message("item not attempted after batch stop")
                .details(Map.of("position", position))
                .build();
    }
}
