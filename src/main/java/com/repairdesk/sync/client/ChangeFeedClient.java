package com.repairdesk.sync.client;

import com.repairdesk.sync.model.domain.EntityKind;

/**
 * The store's row-level change feed. Delivery is at-least-once while connected; nothing
 * missed during a disconnect is replayed.
 */
public interface ChangeFeedClient {

    /**
     * Opens a channel for one entity kind. Blocks until the transport is connected.
     *
     * @param kind         the table to follow
     * @param subscriberId stable id of the subscribing session, used to isolate consumers
     * @param listener     receives raw payloads and the disconnect signal
     * @throws com.repairdesk.sync.exception.TransportException when the connection cannot be made
     */
    FeedSubscription subscribe(EntityKind kind, String subscriberId, FeedListener listener);

    interface FeedListener {

        void onPayload(String payload);

        /**
         * Called at most once per subscription when the transport drops.
         */
        void onDisconnect(Throwable cause);
    }

    interface FeedSubscription extends AutoCloseable {

        EntityKind kind();

        /**
         * Stops delivery. Idempotent; never reports a disconnect.
         */
        @Override
        void close();
    }
}
