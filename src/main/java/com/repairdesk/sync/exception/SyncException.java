package com.repairdesk.sync.exception;

/**
 * Base type of all failures raised by the synchronization layer.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
