package com.repairdesk.sync.service.view;

import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.ViewSnapshot;
import com.repairdesk.sync.model.dto.ViewState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One viewer's rows of one entity kind, indexed by id and kept newest first.
 *
 * Only the owning consumer loop writes to it. Every write ends with {@link #publish()},
 * which swaps in an immutable copy that readers on other threads see through
 * {@link #snapshot()}. The "mine" collection is a projection of the same rows, so it can
 * never hold a row that "all" does not.
 */
public class EntityViewStore {

    private final EntityKind kind;
    private final ViewScope scope;

    private final Map<String, Slot> rows = new HashMap<>();
    private final TreeMap<Long, String> order = new TreeMap<>();
    private long nextPosition;
    private long version;

    private volatile Published published;
    private volatile ViewState state = ViewState.CONNECTING;
    private volatile Instant syncedAt;

    public EntityViewStore(EntityKind kind, ViewScope scope) {
        this.kind = kind;
        this.scope = scope;
        this.published = new Published(scope.isAdmin() ? List.of() : null, List.of(), 0L);
    }

    public EntityKind kind() {
        return kind;
    }

    public ViewScope scope() {
        return scope;
    }

    public boolean contains(String id) {
        return rows.containsKey(id);
    }

    public TrackedEntity get(String id) {
        Slot slot = rows.get(id);
        return slot != null ? slot.entity : null;
    }

    public int size() {
        return rows.size();
    }

    /**
     * Places a new row at the front, or replaces an existing one where it stands.
     *
     * @return true if the row was not present before
     */
    boolean putFront(TrackedEntity entity) {
        Slot existing = rows.get(entity.getId());
        if (existing != null) {
            existing.entity = entity;
            return false;
        }
        long position = ++nextPosition;
        rows.put(entity.getId(), new Slot(entity, position));
        order.put(position, entity.getId());
        return true;
    }

    /**
     * Replaces a present row by id, keeping its position.
     */
    boolean replace(TrackedEntity entity) {
        Slot existing = rows.get(entity.getId());
        if (existing == null) {
            return false;
        }
        existing.entity = entity;
        return true;
    }

    TrackedEntity remove(String id) {
        Slot removed = rows.remove(id);
        if (removed == null) {
            return null;
        }
        order.remove(removed.position);
        return removed.entity;
    }

    /**
     * Replaces all rows with {@code newestFirst}, which must already be ordered.
     */
    void install(List<TrackedEntity> newestFirst) {
        rows.clear();
        order.clear();
        long position = nextPosition + newestFirst.size();
        nextPosition = position;
        for (TrackedEntity entity : newestFirst) {
            rows.put(entity.getId(), new Slot(entity, position));
            order.put(position, entity.getId());
            position--;
        }
        syncedAt = Instant.now();
    }

    void publish() {
        List<TrackedEntity> all = new ArrayList<>(rows.size());
        List<TrackedEntity> mine = new ArrayList<>();
        for (String id : order.descendingMap().values()) {
            TrackedEntity entity = rows.get(id).entity;
            all.add(entity);
            if (scope.owns(entity)) {
                mine.add(entity);
            }
        }
        version++;
        published = new Published(scope.isAdmin() ? Collections.unmodifiableList(all) : null,
                Collections.unmodifiableList(scope.isAdmin() ? mine : all), version);
    }

    public void setState(ViewState state) {
        this.state = state;
    }

    public ViewState state() {
        return state;
    }

    public ViewSnapshot snapshot() {
        Published current = published;
        return new ViewSnapshot(kind, current.all, current.mine, state, current.version, syncedAt);
    }

    private static final class Slot {
        private TrackedEntity entity;
        private final long position;

        private Slot(TrackedEntity entity, long position) {
            this.entity = entity;
            this.position = position;
        }
    }

    private record Published(List<TrackedEntity> all, List<TrackedEntity> mine, long version) {
    }
}
