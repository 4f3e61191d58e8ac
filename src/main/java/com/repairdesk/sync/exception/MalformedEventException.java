package com.repairdesk.sync.exception;

/**
 * A feed payload could not be classified. The payload is logged and dropped.
 */
public class MalformedEventException extends SyncException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
