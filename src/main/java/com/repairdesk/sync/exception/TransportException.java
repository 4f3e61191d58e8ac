package com.repairdesk.sync.exception;

import com.repairdesk.sync.model.domain.EntityKind;

/**
 * The change feed could not be reached or dropped the connection. Recovered locally by
 * reconnecting and resyncing.
 */
public class TransportException extends SyncException {

    private final EntityKind entityKind;

    public TransportException(EntityKind entityKind, String message) {
        super(message);
        this.entityKind = entityKind;
    }

    public TransportException(EntityKind entityKind, String message, Throwable cause) {
        super(message, cause);
        this.entityKind = entityKind;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }
}
