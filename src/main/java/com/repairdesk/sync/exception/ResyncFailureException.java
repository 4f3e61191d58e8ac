package com.repairdesk.sync.exception;

import com.repairdesk.sync.model.domain.EntityKind;

/**
 * A full fetch of one entity kind failed. The affected view is marked stale.
 */
public class ResyncFailureException extends SyncException {

    private final EntityKind entityKind;

    public ResyncFailureException(EntityKind entityKind, String message, Throwable cause) {
        super(message, cause);
        this.entityKind = entityKind;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }
}
