package com.repairdesk.sync.exception;

import com.repairdesk.sync.model.domain.EntityKind;

/**
 * The store refused or failed a write. Nothing was applied to the local cache, so the
 * caller may simply retry or tell the user.
 */
public class MutationRejectedException extends SyncException {

    private final EntityKind entityKind;
    private final String entityId;
    private final boolean retryable;

    public MutationRejectedException(EntityKind entityKind, String entityId, String message, boolean retryable) {
        super(message);
        this.entityKind = entityKind;
        this.entityId = entityId;
        this.retryable = retryable;
    }

    public MutationRejectedException(EntityKind entityKind, String entityId, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.entityKind = entityKind;
        this.entityId = entityId;
        this.retryable = retryable;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * False when the store rejected the request itself (4xx), true for transient failures.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
