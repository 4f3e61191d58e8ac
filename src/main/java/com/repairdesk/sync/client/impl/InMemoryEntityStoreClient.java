package com.repairdesk.sync.client.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.exception.MutationRejectedException;
import com.repairdesk.sync.exception.ResyncFailureException;
import com.repairdesk.sync.model.domain.ChangeKind;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory stand-in for the backing store. Every write is echoed on the
 * {@link InMemoryChangeFeedClient} the way the store's realtime feed would report it,
 * with full prior images on updates and deletes.
 */
@Slf4j
@Service
@Profile("test | local")
public class InMemoryEntityStoreClient implements EntityStoreClient {

    private final ObjectMapper objectMapper;
    private final InMemoryChangeFeedClient feed;
    private final Map<EntityKind, Map<String, ObjectNode>> tables = new EnumMap<>(EntityKind.class);
    private final AtomicInteger failingFetches = new AtomicInteger();
    private final AtomicInteger failingMutations = new AtomicInteger();

    public InMemoryEntityStoreClient(ObjectMapper objectMapper, InMemoryChangeFeedClient feed) {
        this.objectMapper = objectMapper;
        this.feed = feed;
        for (EntityKind kind : EntityKind.values()) {
            tables.put(kind, new LinkedHashMap<>());
        }
    }

    @Override
    public synchronized List<TrackedEntity> fetchAll(EntityKind kind, ViewScope scope) {
        if (consume(failingFetches)) {
            log.info("MOCK - Failing fetch of {} for {}", kind.getTable(), scope.viewerId());
            throw new ResyncFailureException(kind, "Simulated fetch failure for " + kind.getTable(),
                    new IllegalStateException("store unavailable"));
        }
        List<ObjectNode> rows = tables.get(kind).values().stream()
                .filter(row -> isVisible(kind, row, scope))
                .sorted(Comparator.comparing(InMemoryEntityStoreClient::createdAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
        log.debug("MOCK - Fetched {} {} row(s) for {}", rows.size(), kind.getTable(), scope.viewerId());
        List<TrackedEntity> entities = new ArrayList<>(rows.size());
        for (ObjectNode row : rows) {
            entities.add(toEntity(kind, row));
        }
        return entities;
    }

    @Override
    public synchronized Optional<TrackedEntity> fetchOne(EntityKind kind, String id) {
        ObjectNode row = tables.get(kind).get(id);
        return row != null ? Optional.of(toEntity(kind, row)) : Optional.empty();
    }

    @Override
    public synchronized TrackedEntity mutate(EntityKind kind, String id, Map<String, Object> patch) {
        if (consume(failingMutations)) {
            throw new MutationRejectedException(kind, id, "Simulated store outage", true);
        }
        ObjectNode current = tables.get(kind).get(id);
        if (current == null) {
            throw new MutationRejectedException(kind, id, "No " + kind.getTable() + " row with id " + id, false);
        }
        ObjectNode before = current.deepCopy();
        ObjectNode after = current.deepCopy();
        after.setAll((ObjectNode) objectMapper.valueToTree(patch));
        after.put("id", id);
        TrackedEntity entity = toEntityOrReject(kind, id, after);
        tables.get(kind).put(id, after);
        feed.publishChange(ChangeKind.UPDATE, kind, after.deepCopy(), before);
        return entity;
    }

    @Override
    public synchronized TrackedEntity insert(EntityKind kind, Map<String, Object> row) {
        if (consume(failingMutations)) {
            throw new MutationRejectedException(kind, null, "Simulated store outage", true);
        }
        ObjectNode node = withDefaults(kind, objectMapper.valueToTree(row));
        String id = node.get("id").asText();
        if (tables.get(kind).containsKey(id)) {
            throw new MutationRejectedException(kind, id, "Duplicate key " + id, false);
        }
        TrackedEntity entity = toEntityOrReject(kind, id, node);
        tables.get(kind).put(id, node);
        feed.publishChange(ChangeKind.INSERT, kind, node.deepCopy(), null);
        return entity;
    }

    @Override
    public synchronized void bulkMarkRead(String conversationId, String excludeSenderId) {
        if (consume(failingMutations)) {
            throw new MutationRejectedException(EntityKind.CHAT_MESSAGE, conversationId, "Simulated store outage", true);
        }
        int marked = 0;
        for (ObjectNode row : tables.get(EntityKind.CHAT_MESSAGE).values()) {
            if (conversationId.equals(row.path("conversation_id").asText(null))
                    && !row.path("is_read").asBoolean(false)
                    && !row.path("sender_id").asText("").equals(excludeSenderId)) {
                ObjectNode before = row.deepCopy();
                row.put("is_read", true);
                feed.publishChange(ChangeKind.UPDATE, EntityKind.CHAT_MESSAGE, row.deepCopy(), before);
                marked++;
            }
        }
        log.debug("MOCK - Marked {} message(s) of conversation {} as read", marked, conversationId);
    }

    /**
     * Removes a row and reports the delete on the feed.
     */
    public synchronized boolean delete(EntityKind kind, String id) {
        ObjectNode removed = tables.get(kind).remove(id);
        if (removed == null) {
            return false;
        }
        feed.publishChange(ChangeKind.DELETE, kind, null, removed);
        return true;
    }

    /**
     * Stores a row without reporting it on the feed, for setting up state before a session starts.
     *
     * @return the stored row's id
     */
    public synchronized String seed(EntityKind kind, Map<String, Object> row) {
        ObjectNode node = withDefaults(kind, objectMapper.valueToTree(row));
        String id = node.get("id").asText();
        tables.get(kind).put(id, node);
        return id;
    }

    public synchronized Optional<JsonNode> rawRow(EntityKind kind, String id) {
        ObjectNode row = tables.get(kind).get(id);
        return Optional.ofNullable(row != null ? row.deepCopy() : null);
    }

    public void failNextFetches(int count) {
        failingFetches.set(count);
    }

    public void failNextMutations(int count) {
        failingMutations.set(count);
    }

    public synchronized void reset() {
        tables.values().forEach(Map::clear);
        failingFetches.set(0);
        failingMutations.set(0);
    }

    private boolean isVisible(EntityKind kind, ObjectNode row, ViewScope scope) {
        if (scope.isAdmin()) {
            return true;
        }
        if (kind == EntityKind.CHAT_MESSAGE) {
            return ownBookingIds(scope.viewerId()).contains(row.path("conversation_id").asText(null));
        }
        return scope.viewerId().equals(row.path("user_id").asText(null));
    }

    private Set<String> ownBookingIds(String viewerId) {
        return tables.get(EntityKind.BOOKING).values().stream()
                .filter(row -> viewerId.equals(row.path("user_id").asText(null)))
                .map(row -> row.get("id").asText())
                .collect(Collectors.toSet());
    }

    private ObjectNode withDefaults(EntityKind kind, ObjectNode node) {
        if (!node.hasNonNull("id")) {
            node.put("id", UUID.randomUUID().toString());
        }
        if (!node.hasNonNull("created_at")) {
            node.put("created_at", OffsetDateTime.now(ZoneOffset.UTC).toString());
        }
        if (kind == EntityKind.CHAT_MESSAGE) {
            if (!node.has("is_read")) {
                node.put("is_read", false);
            }
        } else if (!node.hasNonNull("status")) {
            node.put("status", "pending");
        }
        return node;
    }

    private TrackedEntity toEntityOrReject(EntityKind kind, String id, ObjectNode row) {
        try {
            return objectMapper.treeToValue(row, kind.getEntityClass());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MutationRejectedException(kind, id, "Invalid " + kind.getTable() + " row: " + e.getMessage(), false, e);
        }
    }

    private TrackedEntity toEntity(EntityKind kind, ObjectNode row) {
        try {
            return objectMapper.treeToValue(row, kind.getEntityClass());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored " + kind.getTable() + " row is unreadable", e);
        }
    }

    private static OffsetDateTime createdAt(ObjectNode row) {
        String value = row.path("created_at").asText(null);
        return value != null ? OffsetDateTime.parse(value) : null;
    }

    private static boolean consume(AtomicInteger counter) {
        return counter.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }
}
