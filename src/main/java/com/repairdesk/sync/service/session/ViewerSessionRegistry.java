package com.repairdesk.sync.service.session;

import com.repairdesk.sync.exception.SessionNotFoundException;
import com.repairdesk.sync.model.domain.ViewScope;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the active viewer sessions, at most one per viewer.
 */
@Slf4j
@Service
public class ViewerSessionRegistry {

    private final ViewerSessionFactory factory;
    private final Map<String, ViewerSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Object> viewerLocks = new ConcurrentHashMap<>();
    private final AtomicLong epochs = new AtomicLong();

    public ViewerSessionRegistry(ViewerSessionFactory factory, MeterRegistry meterRegistry) {
        this.factory = factory;
        meterRegistry.gauge("sync.sessions.active", sessions, Map::size);
    }

    /**
     * Starts a session for the scope. Starting the same scope again returns the running
     * session; a different role for the same viewer replaces it.
     */
    public ViewerSession start(ViewScope scope) {
        synchronized (viewerLocks.computeIfAbsent(scope.viewerId(), id -> new Object())) {
            ViewerSession existing = sessions.get(scope.viewerId());
            if (existing != null && existing.isActive()) {
                if (existing.scope().equals(scope)) {
                    log.debug("Session for {} already running", scope.viewerId());
                    return existing;
                }
                log.info("🔄 Role of {} changed from {} to {}; rebuilding session",
                        scope.viewerId(), existing.scope().role(), scope.role());
                existing.stop();
            }
            ViewerSession session = factory.create(scope, epochs.incrementAndGet());
            sessions.put(scope.viewerId(), session);
            try {
                session.start();
            } catch (RuntimeException e) {
                sessions.remove(scope.viewerId(), session);
                session.stop();
                throw e;
            }
            log.info("✅ Session {} started for {} ({})", session.epoch(), scope.viewerId(), scope.role());
            return session;
        }
    }

    public boolean stop(String viewerId) {
        synchronized (viewerLocks.computeIfAbsent(viewerId, id -> new Object())) {
            ViewerSession session = sessions.remove(viewerId);
            if (session == null) {
                return false;
            }
            session.stop();
            return true;
        }
    }

    public ViewerSession require(String viewerId) {
        return find(viewerId).orElseThrow(() -> new SessionNotFoundException(viewerId));
    }

    public Optional<ViewerSession> find(String viewerId) {
        ViewerSession session = sessions.get(viewerId);
        return session != null && session.isActive() ? Optional.of(session) : Optional.empty();
    }

    public Collection<ViewerSession> activeSessions() {
        return List.copyOf(sessions.values());
    }

    @PreDestroy
    public void shutdown() {
        List<String> viewers = new ArrayList<>(sessions.keySet());
        log.info("Stopping {} session(s)", viewers.size());
        viewers.forEach(this::stop);
    }

    /**
     * Logs a summary of session health. Runs every 5 minutes by default.
     */
    @Scheduled(fixedRateString = "${app.sync.stats-interval-ms:300000}")
    public void logStatistics() {
        long degraded = sessions.values().stream()
                .filter(session -> session.info().channels().values().stream().anyMatch(state -> state.isDegraded()))
                .count();
        log.info("=== SYNC STATISTICS === sessions: {}, with degraded views: {}", sessions.size(), degraded);
        if (degraded > 0) {
            sessions.values().forEach(session -> session.info().channels().forEach((kind, state) -> {
                if (state.isDegraded()) {
                    log.warn("⚠️ {} {} view is {}", session.scope().viewerId(), kind.getTable(), state);
                }
            }));
        }
    }
}
