package com.repairdesk.sync.client;

import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Interface for the relational store that owns bookings, chat messages and quote requests.
 * Allows swapping between the in-memory and production implementations.
 */
public interface EntityStoreClient {

    /**
     * Full read used on (re)connect. Standard viewers get their own rows only, newest first.
     * For chat messages a standard viewer gets the messages of their own bookings' conversations.
     *
     * @throws com.repairdesk.sync.exception.ResyncFailureException when the read fails
     */
    List<TrackedEntity> fetchAll(EntityKind kind, ViewScope scope);

    Optional<TrackedEntity> fetchOne(EntityKind kind, String id);

    /**
     * Applies a partial update and returns the row as stored afterwards.
     *
     * @throws com.repairdesk.sync.exception.MutationRejectedException when the write fails
     */
    TrackedEntity mutate(EntityKind kind, String id, Map<String, Object> patch);

    /**
     * Inserts a row and returns it as stored, with its generated id.
     *
     * @throws com.repairdesk.sync.exception.MutationRejectedException when the write fails
     */
    TrackedEntity insert(EntityKind kind, Map<String, Object> row);

    /**
     * Marks every message of a conversation as read, except those sent by
     * {@code excludeSenderId}.
     *
     * @throws com.repairdesk.sync.exception.MutationRejectedException when the write fails
     */
    void bulkMarkRead(String conversationId, String excludeSenderId);
}
