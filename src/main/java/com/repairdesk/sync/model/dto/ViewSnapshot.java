package com.repairdesk.sync.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;

import java.time.Instant;
import java.util.List;

/**
 * Immutable read-side copy of a viewer's collections for one entity kind.
 *
 * @param entityKind kind of the rows
 * @param all        every row, admin viewers only, otherwise null
 * @param mine       rows owned by the viewer
 * @param state      freshness of the data
 * @param version    increases with every applied change
 * @param syncedAt   time of the last installed full snapshot
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViewSnapshot(
        EntityKind entityKind,
        List<TrackedEntity> all,
        List<TrackedEntity> mine,
        ViewState state,
        long version,
        Instant syncedAt
) {

    public static ViewSnapshot empty(EntityKind entityKind, boolean admin) {
        return new ViewSnapshot(entityKind, admin ? List.of() : null, List.of(), ViewState.CONNECTING, 0L, null);
    }

    public boolean isStale() {
        return state == ViewState.STALE;
    }
}
