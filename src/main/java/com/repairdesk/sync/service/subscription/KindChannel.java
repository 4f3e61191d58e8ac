package com.repairdesk.sync.service.subscription;

import com.repairdesk.sync.client.ChangeFeedClient.FeedListener;
import com.repairdesk.sync.client.ChangeFeedClient.FeedSubscription;
import com.repairdesk.sync.exception.MalformedEventException;
import com.repairdesk.sync.exception.TransportException;
import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.ViewState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The logical subscription of one session to one entity kind.
 *
 * Lifecycle: connect, then fetch everything while buffering incoming events, then install
 * the fetch and replay the buffer, then apply events as they come. A dropped connection
 * goes back to the start after a backoff. Two counters guard against late work: the
 * connection generation discards payloads from a replaced connection, and the resync
 * generation discards a fetch that was overtaken by a newer one.
 */
@Slf4j
class KindChannel {

    private final EntityKind kind;
    private final ViewScope scope;
    private final String subscriberId;
    private final SessionEpoch epoch;
    private final ConsumerLoop loop;
    private final SubscriptionDependencies deps;
    private final ChannelSink sink;

    private final AtomicLong connection = new AtomicLong();
    private final AtomicLong resyncGeneration = new AtomicLong();
    private final Object lifecycle = new Object();
    private FeedSubscription subscription;
    private boolean closed;
    private volatile ViewState state = ViewState.CONNECTING;
    private volatile ScheduledFuture<?> pendingReconnect;
    private volatile ScheduledFuture<?> pendingResync;

    // confined to the consumer loop
    private boolean buffering;
    private boolean bufferOverflowed;
    private final Deque<ChangeEvent> buffer = new ArrayDeque<>();

    KindChannel(EntityKind kind, ViewScope scope, String subscriberId, SessionEpoch epoch,
                ConsumerLoop loop, SubscriptionDependencies deps, ChannelSink sink) {
        this.kind = kind;
        this.scope = scope;
        this.subscriberId = subscriberId;
        this.epoch = epoch;
        this.loop = loop;
        this.deps = deps;
        this.sink = sink;
    }

    /**
     * Blocks until the first connection attempt finishes. A failed attempt is retried in
     * the background; it is never reported to the caller.
     */
    void open() {
        sink.stateChanged(kind, ViewState.CONNECTING);
        if (!connect()) {
            setState(ViewState.RECONNECTING);
            scheduleReconnect(1);
        }
    }

    /**
     * Starts a full fetch on demand.
     *
     * @return false when no connection is up; the pending reconnect resyncs anyway
     */
    boolean refresh() {
        synchronized (lifecycle) {
            if (closed || subscription == null) {
                return false;
            }
        }
        log.info("[RESYNC] Manual refresh of {} for {}", kind.getTable(), scope.viewerId());
        beginResync();
        return true;
    }

    /**
     * Routes a locally produced event, such as a confirmed mutation, through the same path
     * as feed events.
     */
    void inject(ChangeEvent event) {
        loop.submit(() -> route(event));
    }

    ViewState state() {
        return state;
    }

    EntityKind kind() {
        return kind;
    }

    ConsumerLoop loop() {
        return loop;
    }

    void close() {
        FeedSubscription open;
        synchronized (lifecycle) {
            if (closed) {
                return;
            }
            closed = true;
            open = subscription;
            subscription = null;
        }
        connection.incrementAndGet();
        resyncGeneration.incrementAndGet();
        cancel(pendingReconnect);
        cancel(pendingResync);
        if (open != null) {
            open.close();
        }
        log.debug("[FEED] Closed {} channel of {}", kind.getTable(), scope.viewerId());
    }

    private boolean connect() {
        if (!isActive()) {
            return false;
        }
        long generation = connection.incrementAndGet();
        long resync = resyncGeneration.incrementAndGet();
        loop.submit(() -> startBuffering(resync));
        FeedSubscription opened;
        try {
            opened = deps.feed().subscribe(kind, subscriberId, new Listener(generation));
        } catch (TransportException e) {
            log.warn("[FEED] {} could not connect to {}: {}", scope.viewerId(), kind.getTable(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("[FEED] {} failed to connect to {}", scope.viewerId(), kind.getTable(), e);
            return false;
        }
        synchronized (lifecycle) {
            if (closed) {
                opened.close();
                return true;
            }
            subscription = opened;
        }
        fetchSnapshot(resync);
        return true;
    }

    private void beginResync() {
        long resync = resyncGeneration.incrementAndGet();
        loop.submit(() -> startBuffering(resync));
        fetchSnapshot(resync);
    }

    private void fetchSnapshot(long resync) {
        if (state != ViewState.CONNECTING) {
            setState(ViewState.RESYNCING);
        }
        fetchAsync(resync, 1);
    }

    private void fetchAsync(long resync, int attempt) {
        deps.resyncExecutor().execute(() -> fetch(resync, attempt));
    }

    private void fetch(long resync, int attempt) {
        if (!isCurrentResync(resync)) {
            return;
        }
        try {
            List<TrackedEntity> rows = deps.store().fetchAll(kind, scope);
            loop.submit(() -> install(resync, rows));
        } catch (RuntimeException e) {
            onFetchFailure(resync, attempt, e);
        }
    }

    private void onFetchFailure(long resync, int attempt, RuntimeException cause) {
        if (!isCurrentResync(resync)) {
            return;
        }
        deps.metrics().recordResyncFailure(kind);
        setState(ViewState.STALE);
        int next = attempt + 1;
        if (deps.resyncPolicy().allowsAttempt(next)) {
            Duration delay = deps.resyncPolicy().delayFor(attempt);
            log.warn("[RESYNC] Fetch of {} for {} failed (attempt {}), retrying in {} ms: {}",
                    kind.getTable(), scope.viewerId(), attempt, delay.toMillis(), cause.getMessage());
            pendingResync = schedule(() -> {
                if (isCurrentResync(resync)) {
                    fetchAsync(resync, next);
                }
            }, delay);
        } else {
            log.error("[RESYNC] Giving up on {} for {} after {} attempt(s); view stays stale until the next reconnect or refresh",
                    kind.getTable(), scope.viewerId(), attempt);
            loop.submit(() -> stopBuffering(resync));
        }
    }

    private void startBuffering(long resync) {
        if (resync != resyncGeneration.get()) {
            return;
        }
        buffering = true;
        bufferOverflowed = false;
        buffer.clear();
    }

    private void install(long resync, List<TrackedEntity> rows) {
        if (resync != resyncGeneration.get()) {
            log.debug("[RESYNC] Discarding overtaken fetch of {} for {}", kind.getTable(), scope.viewerId());
            return;
        }
        sink.install(kind, rows);
        int replayed = drainBuffer();
        setState(ViewState.LIVE);
        deps.metrics().recordResync(kind);
        log.info("[RESYNC] {} {} row(s) installed for {}, {} buffered event(s) replayed",
                rows.size(), kind.getTable(), scope.viewerId(), replayed);
        if (bufferOverflowed) {
            bufferOverflowed = false;
            log.warn("[RESYNC] Buffer for {} of {} overflowed during resync, fetching again", kind.getTable(), scope.viewerId());
            beginResync();
        }
    }

    private void stopBuffering(long resync) {
        if (resync != resyncGeneration.get()) {
            return;
        }
        drainBuffer();
    }

    private int drainBuffer() {
        int replayed = buffer.size();
        buffering = false;
        while (!buffer.isEmpty()) {
            sink.apply(buffer.pollFirst());
        }
        return replayed;
    }

    private void onPayload(long generation, String payload) {
        if (generation != connection.get()) {
            return;
        }
        ChangeEvent event;
        try {
            event = deps.normalizer().normalize(payload);
        } catch (MalformedEventException e) {
            log.warn("[FEED] Discarding malformed {} payload for {}: {}", kind.getTable(), scope.viewerId(), e.getMessage());
            deps.metrics().recordMalformed(kind);
            return;
        }
        if (event.entityKind() != kind) {
            log.warn("[FEED] {} event arrived on the {} channel, discarded", event.entityKind(), kind);
            deps.metrics().recordMalformed(kind);
            return;
        }
        route(event);
    }

    private void route(ChangeEvent event) {
        if (buffering) {
            if (buffer.size() < deps.bufferLimit()) {
                buffer.addLast(event);
            } else {
                bufferOverflowed = true;
            }
            return;
        }
        sink.apply(event);
        deps.metrics().recordApplied(kind);
    }

    private void onDisconnect(long generation, Throwable cause) {
        if (generation != connection.get() || !isActive()) {
            return;
        }
        synchronized (lifecycle) {
            if (closed) {
                return;
            }
            subscription = null;
        }
        resyncGeneration.incrementAndGet();
        cancel(pendingResync);
        deps.metrics().recordReconnect(kind);
        setState(ViewState.RECONNECTING);
        log.warn("[FEED] {} lost the {} feed: {}", scope.viewerId(), kind.getTable(),
                cause != null ? cause.getMessage() : "disconnected");
        scheduleReconnect(1);
    }

    private void scheduleReconnect(int attempt) {
        if (!isActive()) {
            return;
        }
        Duration delay = deps.reconnectPolicy().delayFor(attempt);
        log.info("[FEED] Reconnecting {} to {} in {} ms (attempt {})", scope.viewerId(), kind.getTable(), delay.toMillis(), attempt);
        pendingReconnect = schedule(() -> {
            if (!isActive()) {
                return;
            }
            if (connect()) {
                log.info("[FEED] {} reconnected to {}", scope.viewerId(), kind.getTable());
            } else {
                scheduleReconnect(attempt + 1);
            }
        }, delay);
    }

    private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return deps.scheduler().schedule(task, Instant.now().plus(delay));
    }

    private void setState(ViewState next) {
        state = next;
        sink.stateChanged(kind, next);
    }

    private boolean isActive() {
        synchronized (lifecycle) {
            return !closed && epoch.isActive();
        }
    }

    private boolean isCurrentResync(long resync) {
        return isActive() && resync == resyncGeneration.get();
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private final class Listener implements FeedListener {

        private final long generation;

        private Listener(long generation) {
            this.generation = generation;
        }

        @Override
        public void onPayload(String payload) {
            loop.submit(() -> KindChannel.this.onPayload(generation, payload));
        }

        @Override
        public void onDisconnect(Throwable cause) {
            KindChannel.this.onDisconnect(generation, cause);
        }
    }
}
