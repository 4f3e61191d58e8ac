package com.repairdesk.sync.service.view;

import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.ViewDelta;
import com.repairdesk.sync.model.dto.ViewDelta.Delta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies normalized changes to a viewer's {@link EntityViewStore}.
 *
 * Rows are always matched by id. Applying the same event twice leaves the store as
 * applying it once: a repeated insert replaces, a repeated delete finds nothing.
 */
@Slf4j
@Component
public class ViewReconciler {

    private static final Comparator<TrackedEntity> NEWEST_FIRST = Comparator.comparing(
            TrackedEntity::getCreatedAt, Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder()));

    public ViewDelta apply(EntityViewStore store, ChangeEvent event) {
        ViewScope scope = store.scope();
        ViewDelta delta = switch (event.kind()) {
            case INSERT -> applyInsert(store, event.after(), scope);
            case UPDATE -> applyUpdate(store, event.after(), scope);
            case DELETE -> applyDelete(store, event.entityId(), scope);
        };
        if (delta.changedAnything()) {
            store.publish();
        }
        return delta;
    }

    /**
     * Installs the result of a full fetch. Rows the viewer may not see are dropped and
     * the rest ordered newest first.
     */
    public void replaceAll(EntityViewStore store, List<? extends TrackedEntity> fetched) {
        ViewScope scope = store.scope();
        Map<String, TrackedEntity> byId = new LinkedHashMap<>();
        for (TrackedEntity entity : fetched) {
            if (entity.getId() != null && scope.canSee(entity)) {
                byId.put(entity.getId(), entity);
            }
        }
        List<TrackedEntity> rows = new ArrayList<>(byId.values());
        rows.sort(NEWEST_FIRST);
        store.install(rows);
        store.publish();
        log.debug("[RESYNC] Installed {} {} row(s) for {}", rows.size(), store.kind().getTable(), scope.viewerId());
    }

    private ViewDelta applyInsert(EntityViewStore store, TrackedEntity after, ViewScope scope) {
        if (!scope.canSee(after)) {
            log.debug("Insert of {} {} is outside the view of {}", after.kind().getTable(), after.getId(), scope.viewerId());
            return ViewDelta.none(scope.isAdmin());
        }
        TrackedEntity previous = store.get(after.getId());
        boolean inserted = store.putFront(after);
        Delta all = scope.isAdmin() ? (inserted ? Delta.INSERTED : Delta.REPLACED) : null;
        Delta mine;
        if (!scope.owns(after)) {
            mine = Delta.NONE;
        } else {
            mine = previous != null && scope.owns(previous) ? Delta.REPLACED : Delta.INSERTED;
        }
        return new ViewDelta(mine, all);
    }

    private ViewDelta applyUpdate(EntityViewStore store, TrackedEntity after, ViewScope scope) {
        TrackedEntity previous = store.get(after.getId());
        if (previous == null) {
            log.debug("Update of {} {} ignored, row not in the view of {}", after.kind().getTable(), after.getId(), scope.viewerId());
            return ViewDelta.none(scope.isAdmin());
        }
        if (!Objects.equals(previous.getOwnerId(), after.getOwnerId())) {
            log.warn("Owner of {} {} changed from {} to {}; owners are expected to be write-once",
                    after.kind().getTable(), after.getId(), previous.getOwnerId(), after.getOwnerId());
            if (!scope.canSee(after)) {
                store.remove(after.getId());
                return new ViewDelta(Delta.REMOVED, scope.isAdmin() ? Delta.REMOVED : null);
            }
        }
        store.replace(after);
        Delta all = scope.isAdmin() ? Delta.REPLACED : null;
        Delta mine;
        if (scope.owns(after)) {
            mine = scope.owns(previous) ? Delta.REPLACED : Delta.INSERTED;
        } else {
            mine = scope.owns(previous) ? Delta.REMOVED : Delta.NONE;
        }
        return new ViewDelta(mine, all);
    }

    private ViewDelta applyDelete(EntityViewStore store, String id, ViewScope scope) {
        TrackedEntity removed = store.remove(id);
        if (removed == null) {
            return ViewDelta.none(scope.isAdmin());
        }
        Delta all = scope.isAdmin() ? Delta.REMOVED : null;
        Delta mine = scope.owns(removed) ? Delta.REMOVED : Delta.NONE;
        return new ViewDelta(mine, all);
    }
}
