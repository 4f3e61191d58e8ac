package com.repairdesk.sync.model.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * A normalized row-level change.
 *
 * Insert carries {@code after} only, Delete carries {@code before} (possibly id-only) and
 * Update carries {@code after} plus {@code before} when the transport supplied it. When
 * {@code beforeKnown} is false the prior state is unknown, which is not the same as absent.
 *
 * @param kind            insert, update or delete
 * @param entityKind      the table the row belongs to
 * @param entityId        id of the changed row, always present
 * @param before          prior row image, may be null
 * @param after           new row image, null for deletes
 * @param beforeKnown     whether {@code before} reflects the actual prior state
 * @param commitTimestamp commit time reported by the feed, may be null
 */
public record ChangeEvent(
        ChangeKind kind,
        EntityKind entityKind,
        String entityId,
        TrackedEntity before,
        TrackedEntity after,
        boolean beforeKnown,
        OffsetDateTime commitTimestamp
) {

    public ChangeEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(entityKind, "entityKind");
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        switch (kind) {
            case INSERT -> {
                if (after == null || before != null) {
                    throw new IllegalArgumentException("INSERT carries the new row only");
                }
            }
            case UPDATE -> {
                if (after == null) {
                    throw new IllegalArgumentException("UPDATE requires the new row");
                }
                if (before != null && !Objects.equals(before.getId(), after.getId())) {
                    throw new IllegalArgumentException("UPDATE before/after ids differ: "
                            + before.getId() + " != " + after.getId());
                }
            }
            case DELETE -> {
                if (after != null) {
                    throw new IllegalArgumentException("DELETE carries no new row");
                }
            }
        }
    }

    public static ChangeEvent insert(TrackedEntity after) {
        return new ChangeEvent(ChangeKind.INSERT, after.kind(), after.getId(), null, after, false, null);
    }

    public static ChangeEvent update(TrackedEntity before, TrackedEntity after) {
        return new ChangeEvent(ChangeKind.UPDATE, after.kind(), after.getId(), before, after, before != null, null);
    }

    /**
     * An update whose prior state is not known, e.g. a confirmed mutation response.
     */
    public static ChangeEvent updateOf(TrackedEntity after) {
        return new ChangeEvent(ChangeKind.UPDATE, after.kind(), after.getId(), null, after, false, null);
    }

    public static ChangeEvent delete(EntityKind entityKind, String id, TrackedEntity before) {
        return new ChangeEvent(ChangeKind.DELETE, entityKind, id, before, null, before != null, null);
    }

    public boolean isInsert() {
        return kind == ChangeKind.INSERT;
    }

    public boolean isUpdate() {
        return kind == ChangeKind.UPDATE;
    }

    public boolean isDelete() {
        return kind == ChangeKind.DELETE;
    }
}
