package com.repairdesk.sync.client.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairdesk.sync.client.ChangeFeedClient;
import com.repairdesk.sync.exception.TransportException;
import com.repairdesk.sync.model.domain.ChangeKind;
import com.repairdesk.sync.model.domain.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process change feed for tests and local runs. Payloads are delivered synchronously on
 * the publishing thread to every open subscription of the kind.
 */
@Slf4j
@Service
@Profile("test | local")
public class InMemoryChangeFeedClient implements ChangeFeedClient {

    private final ObjectMapper objectMapper;
    private final Map<EntityKind, Set<InMemorySubscription>> subscriptions = new ConcurrentHashMap<>();
    private final AtomicInteger failingConnects = new AtomicInteger();

    public InMemoryChangeFeedClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public FeedSubscription subscribe(EntityKind kind, String subscriberId, FeedListener listener) {
        if (consume(failingConnects)) {
            log.info("MOCK - Refusing connect of {} to {}", subscriberId, kind.getTable());
            throw new TransportException(kind, "Simulated connect failure for " + kind.getTable());
        }
        InMemorySubscription subscription = new InMemorySubscription(kind, subscriberId, listener);
        subscriptions.computeIfAbsent(kind, k -> new CopyOnWriteArraySet<>()).add(subscription);
        log.debug("MOCK - {} subscribed to {}", subscriberId, kind.getTable());
        return subscription;
    }

    /**
     * Delivers a raw payload to every subscriber of the kind.
     *
     * @return the number of subscriptions it was delivered to
     */
    public int publish(EntityKind kind, String payload) {
        int delivered = 0;
        for (InMemorySubscription subscription : subscriptions.getOrDefault(kind, Set.of())) {
            if (subscription.deliver(payload)) {
                delivered++;
            }
        }
        log.debug("MOCK - Published to {} subscriber(s) of {}", delivered, kind.getTable());
        return delivered;
    }

    /**
     * Builds a payload in the store's wire format and publishes it.
     */
    public int publishChange(ChangeKind changeKind, EntityKind kind, JsonNode newRow, JsonNode oldRow) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("eventType", changeKind.name());
        payload.put("schema", "public");
        payload.put("table", kind.getTable());
        payload.put("commit_timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        payload.set("new", newRow != null ? newRow : objectMapper.createObjectNode());
        payload.set("old", oldRow != null ? oldRow : objectMapper.createObjectNode());
        try {
            return publish(kind, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize change payload", e);
        }
    }

    /**
     * Drops every open subscription of the kind, reporting a disconnect to each listener.
     */
    public void simulateDisconnect(EntityKind kind) {
        Set<InMemorySubscription> open = subscriptions.getOrDefault(kind, Set.of());
        log.info("MOCK - Dropping {} subscription(s) of {}", open.size(), kind.getTable());
        for (InMemorySubscription subscription : open) {
            subscription.drop(new TransportException(kind, "Simulated disconnect of " + kind.getTable()));
        }
    }

    public void failNextConnects(int count) {
        failingConnects.set(count);
    }

    public int activeSubscriptions(EntityKind kind) {
        return subscriptions.getOrDefault(kind, Set.of()).size();
    }

    public void reset() {
        subscriptions.values().forEach(set -> set.forEach(InMemorySubscription::close));
        subscriptions.clear();
        failingConnects.set(0);
    }

    private static boolean consume(AtomicInteger counter) {
        return counter.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }

    private final class InMemorySubscription implements FeedSubscription {

        private final EntityKind kind;
        private final String subscriberId;
        private final FeedListener listener;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private InMemorySubscription(EntityKind kind, String subscriberId, FeedListener listener) {
            this.kind = kind;
            this.subscriberId = subscriberId;
            this.listener = listener;
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        private boolean deliver(String payload) {
            if (!open.get()) {
                return false;
            }
            listener.onPayload(payload);
            return true;
        }

        private void drop(Throwable cause) {
            if (open.compareAndSet(true, false)) {
                remove();
                listener.onDisconnect(cause);
            }
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false)) {
                remove();
                log.debug("MOCK - {} unsubscribed from {}", subscriberId, kind.getTable());
            }
        }

        private void remove() {
            Set<InMemorySubscription> set = subscriptions.get(kind);
            if (set != null) {
                set.remove(this);
            }
        }
    }
}
