package com.repairdesk.sync.model.dto;

import java.time.Instant;

/**
 * Error body returned by the HTTP API.
 */
public record ErrorResponse(Instant timestamp, int status, String error, String message, String path) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
