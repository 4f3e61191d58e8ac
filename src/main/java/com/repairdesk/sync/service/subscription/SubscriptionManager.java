package com.repairdesk.sync.service.subscription;

import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.ViewState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds at most one {@link KindChannel} per entity kind for one session, each with its own
 * {@link ConsumerLoop}.
 */
@Slf4j
public class SubscriptionManager {

    private final ViewScope scope;
    private final String subscriberId;
    private final SessionEpoch epoch;
    private final SubscriptionDependencies deps;
    private final ChannelSink sink;
    private final Map<EntityKind, KindChannel> channels = new EnumMap<>(EntityKind.class);

    public SubscriptionManager(ViewScope scope, SessionEpoch epoch, SubscriptionDependencies deps, ChannelSink sink) {
        this.scope = scope;
        this.subscriberId = scope.viewerId() + "-" + epoch.value();
        this.epoch = epoch;
        this.deps = deps;
        this.sink = sink;
    }

    /**
     * Subscribes to a kind unless already subscribed. Blocks until the transport connects
     * or the first attempt fails, in which case reconnecting continues in the background.
     */
    public synchronized void open(EntityKind kind) {
        if (!epoch.isActive()) {
            throw new IllegalStateException("Session of " + scope.viewerId() + " has ended");
        }
        if (channels.containsKey(kind)) {
            log.debug("[FEED] {} already subscribed to {}", scope.viewerId(), kind.getTable());
            return;
        }
        ConsumerLoop loop = new ConsumerLoop("sync-" + subscriberId + "-" + kind.getTable(), epoch);
        KindChannel channel = new KindChannel(kind, scope, subscriberId, epoch, loop, deps, sink);
        channels.put(kind, channel);
        channel.open();
        log.info("[FEED] {} opened {} ({})", scope.viewerId(), kind.getTable(), channel.state());
    }

    public synchronized void close(EntityKind kind) {
        KindChannel channel = channels.remove(kind);
        if (channel != null) {
            channel.close();
            channel.loop().shutdown();
        }
    }

    public void closeAll() {
        List<EntityKind> open;
        synchronized (this) {
            open = new ArrayList<>(channels.keySet());
        }
        open.forEach(this::close);
    }

    public synchronized boolean refresh(EntityKind kind) {
        KindChannel channel = channels.get(kind);
        return channel != null && channel.refresh();
    }

    public synchronized boolean inject(ChangeEvent event) {
        KindChannel channel = channels.get(event.entityKind());
        if (channel == null) {
            return false;
        }
        channel.inject(event);
        return true;
    }

    public synchronized Optional<ConsumerLoop> loop(EntityKind kind) {
        KindChannel channel = channels.get(kind);
        return channel != null ? Optional.of(channel.loop()) : Optional.empty();
    }

    public synchronized boolean isOpen(EntityKind kind) {
        return channels.containsKey(kind);
    }

    public synchronized ViewState state(EntityKind kind) {
        KindChannel channel = channels.get(kind);
        return channel != null ? channel.state() : null;
    }

    public synchronized Map<EntityKind, ViewState> states() {
        Map<EntityKind, ViewState> states = new EnumMap<>(EntityKind.class);
        channels.forEach((kind, channel) -> states.put(kind, channel.state()));
        return Collections.unmodifiableMap(states);
    }
}
