package com.roster.controller.rest;

import com.roster.service.core.ingest.InvalidPlayerDataException;
import com.roster.service.core.ingest.RateLimitExceededException;
import com.roster.service.core.validation.ValidationResult;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ingestion failures to the status codes reporters expect: 429 when throttled, 400 for bad payloads, and a
 * generic 500 that never echoes internal detail.
 */
@RestControllerAdvice(assignableTypes = PlayerController.class)
public class PlayerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PlayerExceptionHandler.class);

    static final String RATE_LIMITED = "Rate limit exceeded";
    static final String INVALID = "Invalid player data";
    static final String INTERNAL = "Internal server error";

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorPayload> handleRateLimited(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(ErrorPayload.of(RATE_LIMITED));
    }

    @ExceptionHandler(InvalidPlayerDataException.class)
    public ResponseEntity<ErrorPayload> handleInvalid(InvalidPlayerDataException ex, HttpServletRequest request) {
        ValidationResult result = ex.getResult();
        log.debug("Player submission rejected: {} (path={})", result.describe(), pathOf(request));
        return ResponseEntity.badRequest()
                .body(new ErrorPayload(INVALID, result.violation().code(), result.field()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Unreadable player submission (path={}): {}", pathOf(request), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorPayload(INVALID, "validation.malformed-body", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorPayload> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Error processing player data (path={})", pathOf(request), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorPayload.of(INTERNAL));
    }

    private static String pathOf(HttpServletRequest request) {
        return request != null ? request.getRequestURI() : "<unknown>";
    }
}
