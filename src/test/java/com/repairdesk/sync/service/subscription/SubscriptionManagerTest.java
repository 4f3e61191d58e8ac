package com.repairdesk.sync.service.subscription;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairdesk.sync.client.ChangeFeedClient;
import com.repairdesk.sync.client.impl.InMemoryChangeFeedClient;
import com.repairdesk.sync.client.impl.InMemoryEntityStoreClient;
import com.repairdesk.sync.helper.TestEntities;
import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.ChangeKind;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.ViewState;
import com.repairdesk.sync.service.metrics.SyncMetrics;
import com.repairdesk.sync.service.normalize.ChangeEventNormalizer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static com.repairdesk.sync.helper.TestEntities.bookingRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("SubscriptionManager Tests")
class SubscriptionManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = TestEntities.objectMapper();
    private final Queue<Runnable> pendingFetches = new ConcurrentLinkedQueue<>();
    private final RecordingSink sink = new RecordingSink();

    private InMemoryChangeFeedClient feed;
    private InMemoryEntityStoreClient store;
    private SyncMetrics metrics;
    private ThreadPoolTaskScheduler scheduler;
    private SessionEpoch epoch;
    private SubscriptionManager manager;

    @BeforeEach
    void setUp() {
        feed = new InMemoryChangeFeedClient(objectMapper);
        store = new InMemoryEntityStoreClient(objectMapper, feed);
        metrics = new SyncMetrics(new SimpleMeterRegistry());
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        epoch = new SessionEpoch(7);
        manager = newManager(10);
    }

    @AfterEach
    void tearDown() {
        epoch.end();
        manager.closeAll();
        scheduler.shutdown();
    }

    private SubscriptionManager newManager(int bufferLimit) {
        return newManager(feed, bufferLimit);
    }

    private SubscriptionManager newManager(ChangeFeedClient feedClient, int bufferLimit) {
        SubscriptionDependencies deps = new SubscriptionDependencies(feedClient, store,
                new ChangeEventNormalizer(objectMapper),
                ReconnectPolicy.fixed("reconnect", Duration.ofMillis(100), 0),
                ReconnectPolicy.fixed("resync", Duration.ofMillis(20), 2),
                scheduler, pendingFetches::add, metrics, bufferLimit);
        return new SubscriptionManager(ViewScope.admin("admin-1"), epoch, deps, sink);
    }

    private void runPendingFetches() {
        Runnable task;
        while ((task = pendingFetches.poll()) != null) {
            task.run();
        }
    }

    private void awaitLoop() {
        assertThat(manager.loop(EntityKind.BOOKING).orElseThrow().awaitIdle(WAIT)).isTrue();
    }

    private void publishInsert(String id, String userId) {
        feed.publishChange(ChangeKind.INSERT, EntityKind.BOOKING,
                objectMapper.valueToTree(bookingRow(id, userId, "pending", "2025-03-01T10:00:00Z")), null);
    }

    @Nested
    @DisplayName("Initial sync")
    class InitialSync {

        @Test
        @DisplayName("Should install the fetch and then replay events that arrived meanwhile")
        void shouldReplayBufferedEventsAfterInstall() {
            store.seed(EntityKind.BOOKING, bookingRow("b1", "u1", "pending", "2025-03-01T09:00:00Z"));
            manager.open(EntityKind.BOOKING);
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.CONNECTING);

            publishInsert("b2", "u2");
            awaitLoop();
            assertThat(sink.applied).isEmpty();

            runPendingFetches();
            awaitLoop();

            assertThat(sink.installs).hasSize(1);
            assertThat(sink.installs.get(0)).extracting(TrackedEntity::getId).containsExactly("b1");
            assertThat(sink.applied).extracting(ChangeEvent::entityId).containsExactly("b2");
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.LIVE);
            assertThat(sink.states).startsWith(ViewState.CONNECTING).endsWith(ViewState.LIVE);
        }

        @Test
        @DisplayName("Opening the same kind twice should keep one subscription")
        void openIsIdempotent() {
            manager.open(EntityKind.BOOKING);
            manager.open(EntityKind.BOOKING);

            assertThat(feed.activeSubscriptions(EntityKind.BOOKING)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should resync again when the buffer overflows")
        void overflowTriggersAnotherResync() {
            epoch.end();
            manager.closeAll();
            epoch = new SessionEpoch(8);
            manager = newManager(1);
            store.seed(EntityKind.BOOKING, bookingRow("b1", "u1", "pending", "2025-03-01T10:00:00Z"));
            store.seed(EntityKind.BOOKING, bookingRow("b2", "u2", "pending", "2025-03-01T10:05:00Z"));
            manager.open(EntityKind.BOOKING);

            publishInsert("b1", "u1");
            publishInsert("b2", "u2");
            awaitLoop();
            runPendingFetches();
            awaitLoop();

            assertThat(sink.installs).hasSize(1);
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.RESYNCING);
            assertThat(pendingFetches).hasSize(1);

            runPendingFetches();
            awaitLoop();

            assertThat(sink.installs).hasSize(2);
            assertThat(sink.installs.get(1)).extracting(TrackedEntity::getId).containsExactly("b2", "b1");
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.LIVE);
        }
    }

    @Nested
    @DisplayName("Live stream")
    class LiveStream {

        @BeforeEach
        void goLive() {
            manager.open(EntityKind.BOOKING);
            runPendingFetches();
            awaitLoop();
        }

        @Test
        @DisplayName("Should apply events directly once live")
        void shouldApplyLiveEvents() {
            publishInsert("b1", "u1");
            awaitLoop();

            assertThat(sink.applied).extracting(ChangeEvent::entityId).containsExactly("b1");
            assertThat(metrics.count("sync.events.applied", "kind", "bookings")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should discard malformed payloads and keep going")
        void shouldSkipMalformedPayloads() {
            feed.publish(EntityKind.BOOKING, "{not json");
            feed.publish(EntityKind.BOOKING, """
                    {"eventType":"INSERT","table":"quote_requests","new":{"id":"q1","status":"pending"}}
                    """);
            publishInsert("b1", "u1");
            awaitLoop();

            assertThat(sink.applied).extracting(ChangeEvent::entityId).containsExactly("b1");
            assertThat(metrics.count("sync.events.malformed", "kind", "bookings")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should reconnect after a drop and resync to pick up missed rows")
        void shouldReconnectAndResync() {
            feed.simulateDisconnect(EntityKind.BOOKING);
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.RECONNECTING);

            store.seed(EntityKind.BOOKING, bookingRow("missed", "u3", "pending", "2025-03-01T11:00:00Z"));
            await().atMost(WAIT).until(() -> !pendingFetches.isEmpty());
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.RESYNCING);

            runPendingFetches();
            awaitLoop();

            assertThat(sink.installs).hasSize(2);
            assertThat(sink.installs.get(1)).extracting(TrackedEntity::getId).containsExactly("missed");
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.LIVE);
            assertThat(feed.activeSubscriptions(EntityKind.BOOKING)).isEqualTo(1);
            assertThat(metrics.count("sync.feed.reconnects", "kind", "bookings")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should go stale on a failed resync and recover on retry")
        void shouldRetryFailedResync() {
            store.failNextFetches(1);
            assertThat(manager.refresh(EntityKind.BOOKING)).isTrue();

            runPendingFetches();
            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.STALE);

            await().atMost(WAIT).until(() -> !pendingFetches.isEmpty());
            runPendingFetches();
            awaitLoop();

            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.LIVE);
            assertThat(metrics.count("sync.resync.failures", "kind", "bookings")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should give up after the last attempt and keep applying events")
        void shouldStayStaleAfterLastAttempt() {
            store.failNextFetches(2);
            manager.refresh(EntityKind.BOOKING);
            runPendingFetches();
            await().atMost(WAIT).until(() -> !pendingFetches.isEmpty());
            runPendingFetches();
            awaitLoop();

            publishInsert("b1", "u1");
            awaitLoop();

            assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.STALE);
            assertThat(pendingFetches).isEmpty();
            assertThat(sink.applied).extracting(ChangeEvent::entityId).containsExactly("b1");
        }

        @Test
        @DisplayName("Nothing should reach the sink once the session has ended")
        void nothingAppliedAfterEpochEnds() {
            epoch.end();
            publishInsert("b1", "u1");

            assertThat(sink.applied).isEmpty();
            assertThatThrownBy(() -> manager.open(EntityKind.CHAT_MESSAGE)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Closing should unsubscribe from the feed")
        void closeUnsubscribes() {
            manager.closeAll();

            assertThat(feed.activeSubscriptions(EntityKind.BOOKING)).isZero();
            assertThat(manager.isOpen(EntityKind.BOOKING)).isFalse();
            assertThat(manager.refresh(EntityKind.BOOKING)).isFalse();
        }
    }

    @Test
    @DisplayName("A failed first connect should be retried in the background")
    void failedConnectIsRetried() {
        feed.failNextConnects(1);

        manager.open(EntityKind.BOOKING);

        assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.RECONNECTING);
        await().atMost(WAIT).until(() -> !pendingFetches.isEmpty());
        assertThat(feed.activeSubscriptions(EntityKind.BOOKING)).isEqualTo(1);
        runPendingFetches();
        awaitLoop();
        assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.LIVE);
    }

    @Test
    @DisplayName("Unexpected connect errors should degrade to reconnecting and keep retrying")
    void unexpectedConnectErrorsAreRetried() {
        AtomicInteger attempts = new AtomicInteger();
        ChangeFeedClient flaky = (kind, subscriberId, listener) -> {
            if (attempts.incrementAndGet() <= 2) {
                throw new IllegalStateException("No message listener specified");
            }
            return feed.subscribe(kind, subscriberId, listener);
        };
        epoch.end();
        manager.closeAll();
        epoch = new SessionEpoch(9);
        manager = newManager(flaky, 10);

        manager.open(EntityKind.BOOKING);

        assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.RECONNECTING);
        await().atMost(WAIT).until(() -> !pendingFetches.isEmpty());
        assertThat(attempts).hasValue(3);
        runPendingFetches();
        awaitLoop();
        assertThat(manager.state(EntityKind.BOOKING)).isEqualTo(ViewState.LIVE);
    }

    private static final class RecordingSink implements ChannelSink {

        private final List<ChangeEvent> applied = new CopyOnWriteArrayList<>();
        private final List<List<TrackedEntity>> installs = new CopyOnWriteArrayList<>();
        private final List<ViewState> states = new CopyOnWriteArrayList<>();

        @Override
        public void apply(ChangeEvent event) {
            applied.add(event);
        }

        @Override
        public void install(EntityKind kind, List<TrackedEntity> rows) {
            installs.add(rows);
        }

        @Override
        public void stateChanged(EntityKind kind, ViewState state) {
            states.add(state);
        }
    }
}
