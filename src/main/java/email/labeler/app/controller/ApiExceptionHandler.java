package email.labeler.app.controller;

import email.labeler.app.exception.ApiError;
import email.labeler.app.exception.CacheStorageException;
import email.labeler.app.exception.ConfigurationException;
import email.labeler.app.exception.RemoteCallException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/** Maps service exceptions to JSON error responses. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex, HttpServletRequest request) {
        log.warn("Invalid configuration: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiError.INVALID_CONFIGURATION, ex.getMessage(), ex.getIssues(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleInvalidRequest(Exception ex, HttpServletRequest request) {
        log.warn("Invalid request to {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiError.INVALID_REQUEST, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleRunInProgress(IllegalStateException ex, HttpServletRequest request) {
        log.warn("Rejected request to {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ApiError.RUN_IN_PROGRESS, ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(RemoteCallException.class)
    public ResponseEntity<ApiError> handleRemote(RemoteCallException ex, HttpServletRequest request) {
        log.error("Mail API failure ({}): {}", ex.getErrorKind(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ApiError.REMOTE_FAILURE, ex.getMessage(),
                List.of(String.valueOf(ex.getErrorKind())), request);
    }

    @ExceptionHandler(CacheStorageException.class)
    public ResponseEntity<ApiError> handleCacheStorage(CacheStorageException ex, HttpServletRequest request) {
        log.error("Cache storage failure: {}", ex.getMessage(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ApiError.CACHE_UNAVAILABLE, ex.getMessage(), List.of(), request);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message,
                                                    List<String> details, HttpServletRequest request) {
        return ResponseEntity.status(status)
            .body(ApiError.builder()
                .code(code)
                .message(message)
                .details(details)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
    }
}
