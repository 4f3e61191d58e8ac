package com.repairdesk.sync.service.session;

import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.exception.SessionNotFoundException;
import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.Notification;
import com.repairdesk.sync.model.dto.SessionInfo;
import com.repairdesk.sync.model.dto.ViewDelta;
import com.repairdesk.sync.model.dto.ViewDelta.Delta;
import com.repairdesk.sync.model.dto.ViewSnapshot;
import com.repairdesk.sync.model.dto.ViewState;
import com.repairdesk.sync.service.notify.NotificationDispatcher;
import com.repairdesk.sync.service.subscription.ChannelSink;
import com.repairdesk.sync.service.subscription.ConsumerLoop;
import com.repairdesk.sync.service.subscription.SessionEpoch;
import com.repairdesk.sync.service.subscription.SubscriptionManager;
import com.repairdesk.sync.service.unread.UnreadCounterAggregator;
import com.repairdesk.sync.service.view.EntityViewStore;
import com.repairdesk.sync.service.view.ViewReconciler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Everything the service holds for one signed-in viewer: a view store per row kind, the
 * unread counters, the notification dispatcher and the subscriptions feeding them.
 *
 * A session is bound to one {@link ViewScope} for its whole life. A role change means a
 * new session with empty collections rebuilt from a fresh fetch.
 */
@Slf4j
public class ViewerSession implements ChannelSink {

    private final ViewScope scope;
    private final SessionEpoch epoch;
    private final Instant startedAt = Instant.now();
    private final Map<EntityKind, EntityViewStore> stores = new EnumMap<>(EntityKind.class);
    private final UnreadCounterAggregator unread;
    private final NotificationDispatcher notifications;
    private final ViewReconciler reconciler;
    private final EntityStoreClient storeClient;
    private final Duration loopTimeout;
    private SubscriptionManager subscriptions;
    private volatile ViewState chatState = ViewState.CONNECTING;
    private volatile boolean bookingsInstalled;

    ViewerSession(ViewScope scope, SessionEpoch epoch, ViewReconciler reconciler, NotificationDispatcher notifications,
                  EntityStoreClient storeClient, Duration loopTimeout) {
        this.scope = scope;
        this.epoch = epoch;
        this.reconciler = reconciler;
        this.notifications = notifications;
        this.storeClient = storeClient;
        this.loopTimeout = loopTimeout;
        this.unread = new UnreadCounterAggregator(scope.viewerId(), this::tracksConversation);
        for (EntityKind kind : EntityKind.values()) {
            if (kind.hasRowView()) {
                stores.put(kind, new EntityViewStore(kind, scope));
            }
        }
    }

    void attach(SubscriptionManager subscriptions) {
        this.subscriptions = subscriptions;
    }

    /**
     * Subscribes to every kind. Bookings go first because chat visibility of standard
     * viewers is derived from their bookings.
     */
    public void start() {
        log.info("Starting session {} for {} ({})", epoch.value(), scope.viewerId(), scope.role());
        subscriptions.open(EntityKind.BOOKING);
        subscriptions.open(EntityKind.QUOTE_REQUEST);
        subscriptions.open(EntityKind.CHAT_MESSAGE);
    }

    public void stop() {
        if (!epoch.end()) {
            return;
        }
        subscriptions.closeAll();
        notifications.clearListeners();
        log.info("Stopped session {} for {}", epoch.value(), scope.viewerId());
    }

    public boolean isActive() {
        return epoch.isActive();
    }

    public ViewScope scope() {
        return scope;
    }

    public long epoch() {
        return epoch.value();
    }

    // ==================== CHANNEL SINK ====================

    @Override
    public void apply(ChangeEvent event) {
        if (event.entityKind().hasRowView()) {
            ViewDelta delta = reconciler.apply(stores.get(event.entityKind()), event);
            if (event.entityKind() == EntityKind.BOOKING && delta.mine() == Delta.REMOVED) {
                pruneUnread();
            }
        } else {
            unread.onMessageEvent(event);
        }
        notifications.dispatch(event, this::isConversationVisible);
    }

    @Override
    public void install(EntityKind kind, List<TrackedEntity> rows) {
        if (kind.hasRowView()) {
            reconciler.replaceAll(stores.get(kind), rows);
            if (kind == EntityKind.BOOKING) {
                bookingsInstalled = true;
                pruneUnread();
            }
        } else {
            unread.rebuild(rows);
        }
    }

    @Override
    public void stateChanged(EntityKind kind, ViewState state) {
        if (kind.hasRowView()) {
            stores.get(kind).setState(state);
        } else {
            chatState = state;
        }
        log.debug("{} {} view is now {}", scope.viewerId(), kind.getTable(), state);
    }

    // ==================== PRESENTATION OPERATIONS ====================

    /**
     * @throws IllegalArgumentException for kinds that are not kept as row views
     */
    public ViewSnapshot getView(EntityKind kind) {
        EntityViewStore store = stores.get(kind);
        if (store == null) {
            throw new IllegalArgumentException(kind.getTable() + " has no row view; use the unread counters");
        }
        return store.snapshot();
    }

    public int getUnreadCount(String conversationId) {
        return isConversationVisible(conversationId) ? unread.count(conversationId) : 0;
    }

    /**
     * Standard viewers get an entry for each of their bookings, zero included. Admins get
     * every conversation with unread messages.
     */
    public Map<String, Integer> getUnreadCounts() {
        Map<String, Integer> counts = unread.counts();
        if (scope.isAdmin()) {
            return counts;
        }
        Map<String, Integer> own = new LinkedHashMap<>();
        for (String bookingId : ownBookingIds()) {
            own.put(bookingId, counts.getOrDefault(bookingId, 0));
        }
        return own;
    }

    /**
     * Marks a conversation read in the store, then drops its counter to zero.
     *
     * @throws com.repairdesk.sync.exception.MutationRejectedException when the store write fails;
     *         the counter is left as it was
     */
    public int markRead(String conversationId) {
        storeClient.bulkMarkRead(conversationId, scope.viewerId());
        ConsumerLoop chatLoop = subscriptions.loop(EntityKind.CHAT_MESSAGE)
                .orElseThrow(() -> new SessionNotFoundException(scope.viewerId()));
        try {
            int cleared = chatLoop.call(() -> unread.reset(conversationId)).get(loopTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[UNREAD] {} marked conversation {} read ({} message(s))", scope.viewerId(), conversationId, cleared);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | CancellationException e) {
            log.warn("[UNREAD] Counter reset of {} for {} did not complete: {}", conversationId, scope.viewerId(), e.toString());
        }
        return getUnreadCount(conversationId);
    }

    public Runnable onNotification(Consumer<Notification> listener) {
        return notifications.addListener(listener);
    }

    public boolean refresh(EntityKind kind) {
        return subscriptions.refresh(kind);
    }

    /**
     * Applies a row confirmed by the store. Its prior state is unknown, so it never counts
     * as a status transition.
     */
    public void applyConfirmed(TrackedEntity row) {
        subscriptions.inject(ChangeEvent.updateOf(row));
    }

    public void applyConfirmedInsert(TrackedEntity row) {
        subscriptions.inject(ChangeEvent.insert(row));
    }

    /**
     * Waits until every queued event of the kind has been applied.
     */
    public boolean awaitIdle(EntityKind kind, Duration timeout) {
        return subscriptions.loop(kind).map(loop -> loop.awaitIdle(timeout)).orElse(false);
    }

    public SessionInfo info() {
        Map<EntityKind, ViewState> channels = new EnumMap<>(EntityKind.class);
        stores.forEach((kind, store) -> channels.put(kind, store.state()));
        channels.put(EntityKind.CHAT_MESSAGE, chatState);
        return new SessionInfo(scope.viewerId(), scope.role(), epoch.value(), startedAt, channels);
    }

    /**
     * Standard viewers index a conversation only once it is one of their bookings. Until the
     * first booking snapshot is in, every conversation is kept and pruned on install.
     */
    private boolean tracksConversation(String conversationId) {
        return scope.isAdmin() || !bookingsInstalled || ownBookingIds().contains(conversationId);
    }

    private void pruneUnread() {
        if (scope.isAdmin()) {
            return;
        }
        Set<String> visible = ownBookingIds();
        subscriptions.loop(EntityKind.CHAT_MESSAGE)
                .ifPresent(chatLoop -> chatLoop.submit(() -> unread.retainConversations(visible)));
    }

    private boolean isConversationVisible(String conversationId) {
        return conversationId != null && (scope.isAdmin() || ownBookingIds().contains(conversationId));
    }

    private Set<String> ownBookingIds() {
        return stores.get(EntityKind.BOOKING).snapshot().mine().stream()
                .map(TrackedEntity::getId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
