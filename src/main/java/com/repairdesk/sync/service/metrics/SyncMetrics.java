package com.repairdesk.sync.service.metrics;

import com.repairdesk.sync.model.domain.EntityKind;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Micrometer counters for the sync pipeline, tagged by entity kind where it applies.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncMetrics {

    private final MeterRegistry meterRegistry;

    public void recordApplied(EntityKind kind) {
        meterRegistry.counter("sync.events.applied", "kind", kind.getTable()).increment();
    }

    public void recordMalformed(EntityKind kind) {
        meterRegistry.counter("sync.events.malformed", "kind", kind != null ? kind.getTable() : "unknown").increment();
    }

    public void recordNotification(String type) {
        meterRegistry.counter("sync.notifications.dispatched", "type", type).increment();
    }

    public void recordDuplicateSuppressed() {
        meterRegistry.counter("sync.notifications.suppressed").increment();
    }

    public void recordReconnect(EntityKind kind) {
        meterRegistry.counter("sync.feed.reconnects", "kind", kind.getTable()).increment();
    }

    public void recordResync(EntityKind kind) {
        meterRegistry.counter("sync.resync.completed", "kind", kind.getTable()).increment();
    }

    public void recordResyncFailure(EntityKind kind) {
        meterRegistry.counter("sync.resync.failures", "kind", kind.getTable()).increment();
        log.debug("Recorded resync failure metric for {}", kind.getTable());
    }

    public double count(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter != null ? counter.count() : 0d;
    }
}
