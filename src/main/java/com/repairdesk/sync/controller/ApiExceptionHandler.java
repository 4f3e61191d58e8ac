package com.repairdesk.sync.controller;

import com.repairdesk.sync.exception.MutationRejectedException;
import com.repairdesk.sync.exception.SessionNotFoundException;
import com.repairdesk.sync.model.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps sync failures to JSON error bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        log.debug("Session not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Session Not Found", ex.getMessage(), request);
    }

    /**
     * 409 when the store refused the write, 502 when it could not be reached.
     */
    @ExceptionHandler(MutationRejectedException.class)
    public ResponseEntity<ErrorResponse> handleMutationRejected(MutationRejectedException ex, HttpServletRequest request) {
        if (ex.isRetryable()) {
            log.error("Store write on {} {} failed: {}", ex.getEntityKind(), ex.getEntityId(), ex.getMessage());
            return respond(HttpStatus.BAD_GATEWAY, "Store Unavailable", ex.getMessage(), request);
        }
        log.warn("Store write on {} {} rejected: {}", ex.getEntityKind(), ex.getEntityId(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, "Mutation Rejected", ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(RuntimeException ex, HttpServletRequest request) {
        log.warn("Bad request to {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Unreadable request body for {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            log.debug("{} on {}: {}", status, request.getRequestURI(), ex.getMessage());
            return respond(status, status.getReasonPhrase(), ex.getMessage(), request);
        }
        log.error("❌ Unexpected error on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(status.value(), error, message, request.getRequestURI()));
    }
}
