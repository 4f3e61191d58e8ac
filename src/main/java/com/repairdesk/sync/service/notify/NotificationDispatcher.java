package com.repairdesk.sync.service.notify;

import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.Notification;
import com.repairdesk.sync.model.dto.NotificationKey;
import com.repairdesk.sync.service.metrics.SyncMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Per-session notification fan-out with exactly-once delivery per
 * {@link NotificationKey}. Remembers the most recent keys only, evicting the least
 * recently seen one once full.
 */
@Slf4j
public class NotificationDispatcher {

    private final ViewScope scope;
    private final NotificationPolicy policy;
    private final SyncMetrics metrics;
    private final Map<NotificationKey, Boolean> seen;
    private final List<Consumer<Notification>> listeners = new CopyOnWriteArrayList<>();

    public NotificationDispatcher(ViewScope scope, NotificationPolicy policy, SyncMetrics metrics, int capacity) {
        this.scope = scope;
        this.policy = policy;
        this.metrics = metrics;
        this.seen = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<NotificationKey, Boolean> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Evaluates a change and hands the resulting notification to every listener, unless
     * the same key was already dispatched.
     *
     * @return the dispatched notification, empty when none applies or it was a repeat
     */
    public Optional<Notification> dispatch(ChangeEvent event, Predicate<String> conversationVisible) {
        Optional<Notification> candidate = policy.evaluate(event, scope, conversationVisible);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        Notification notification = candidate.get();
        if (!markSeen(notification.key())) {
            log.debug("[NOTIFY] Suppressed repeat {} for {}", notification.key(), scope.viewerId());
            metrics.recordDuplicateSuppressed();
            return Optional.empty();
        }
        log.info("[NOTIFY] {} -> {}: {}", notification.type(), scope.viewerId(), notification.description());
        metrics.recordNotification(notification.type().name());
        for (Consumer<Notification> listener : listeners) {
            try {
                listener.accept(notification);
            } catch (RuntimeException e) {
                log.warn("[NOTIFY] Listener failed for {}: {}", scope.viewerId(), e.getMessage());
            }
        }
        return candidate;
    }

    /**
     * @return a handle that removes the listener again
     */
    public Runnable addListener(Consumer<Notification> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void clearListeners() {
        listeners.clear();
    }

    private synchronized boolean markSeen(NotificationKey key) {
        return seen.put(key, Boolean.TRUE) == null;
    }
}
