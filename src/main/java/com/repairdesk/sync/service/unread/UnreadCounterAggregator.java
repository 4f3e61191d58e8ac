package com.repairdesk.sync.service.unread;

import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.ChatMessage;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.dto.UnreadDelta;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Per-conversation unread counters for one viewer.
 *
 * A message counts while it is unread and was sent by someone else. The counters are sizes
 * of id sets, so a redelivered insert or an update without a prior image cannot push a
 * counter off. Messages of conversations the viewer cannot see are not indexed. Written by
 * the chat consumer loop only; readers get the last published copy.
 */
@Slf4j
public class UnreadCounterAggregator {

    private final String viewerId;
    private final Predicate<String> conversationVisible;
    private final Map<String, Set<String>> unreadByConversation = new HashMap<>();
    private final Map<String, String> conversationByMessage = new HashMap<>();
    private volatile Map<String, Integer> published = Map.of();

    public UnreadCounterAggregator(String viewerId) {
        this(viewerId, conversation -> true);
    }

    public UnreadCounterAggregator(String viewerId, Predicate<String> conversationVisible) {
        this.viewerId = viewerId;
        this.conversationVisible = conversationVisible;
    }

    public UnreadDelta onMessageEvent(ChangeEvent event) {
        if (event.entityKind() != EntityKind.CHAT_MESSAGE) {
            throw new IllegalArgumentException("Not a chat message event: " + event.entityKind());
        }
        if (event.isDelete()) {
            String conversationId = conversationByMessage.get(event.entityId());
            if (conversationId == null && event.before() instanceof ChatMessage before) {
                conversationId = before.getConversationId();
            }
            return change(conversationId, untrack(conversationId, event.entityId()) ? -1 : 0);
        }
        ChatMessage message = (ChatMessage) event.after();
        String conversationId = message.getConversationId();
        if (conversationId == null) {
            return UnreadDelta.none(null, 0);
        }
        if (message.isUnreadFor(viewerId)) {
            if (!conversationVisible.test(conversationId)) {
                return UnreadDelta.none(conversationId, 0);
            }
            boolean added = unreadByConversation.computeIfAbsent(conversationId, c -> new HashSet<>()).add(message.getId());
            conversationByMessage.put(message.getId(), conversationId);
            return change(conversationId, added ? 1 : 0);
        }
        return change(conversationId, untrack(conversationId, message.getId()) ? -1 : 0);
    }

    /**
     * Recomputes every counter from a full scan of messages.
     */
    public void rebuild(List<? extends TrackedEntity> messages) {
        unreadByConversation.clear();
        conversationByMessage.clear();
        for (TrackedEntity entity : messages) {
            if (entity instanceof ChatMessage message && message.getConversationId() != null
                    && message.isUnreadFor(viewerId) && conversationVisible.test(message.getConversationId())) {
                unreadByConversation.computeIfAbsent(message.getConversationId(), c -> new HashSet<>()).add(message.getId());
                conversationByMessage.put(message.getId(), message.getConversationId());
            }
        }
        publish();
        log.debug("[UNREAD] Rebuilt counters for {}: {}", viewerId, published);
    }

    /**
     * Drops every unread message of a conversation after it was marked read.
     *
     * @return the number of messages that stopped counting
     */
    public int reset(String conversationId) {
        Set<String> removed = unreadByConversation.remove(conversationId);
        if (removed == null) {
            return 0;
        }
        removed.forEach(conversationByMessage::remove);
        publish();
        return removed.size();
    }

    /**
     * Drops the counters of every conversation outside {@code visible}.
     *
     * @return the number of conversations dropped
     */
    public int retainConversations(Set<String> visible) {
        List<String> dropped = new ArrayList<>();
        unreadByConversation.forEach((conversation, ids) -> {
            if (!visible.contains(conversation)) {
                dropped.add(conversation);
            }
        });
        for (String conversation : dropped) {
            unreadByConversation.remove(conversation).forEach(conversationByMessage::remove);
        }
        if (!dropped.isEmpty()) {
            publish();
            log.debug("[UNREAD] {} no longer sees conversations {}", viewerId, dropped);
        }
        return dropped.size();
    }

    public int count(String conversationId) {
        return published.getOrDefault(conversationId, 0);
    }

    public Map<String, Integer> counts() {
        return published;
    }

    private boolean untrack(String conversationId, String messageId) {
        if (conversationId == null) {
            return false;
        }
        Set<String> unread = unreadByConversation.get(conversationId);
        if (unread == null || !unread.remove(messageId)) {
            return false;
        }
        conversationByMessage.remove(messageId);
        if (unread.isEmpty()) {
            unreadByConversation.remove(conversationId);
        }
        return true;
    }

    private UnreadDelta change(String conversationId, int delta) {
        if (delta != 0) {
            publish();
            log.debug("[UNREAD] {} conversation {} {} -> {}", viewerId, conversationId,
                    delta > 0 ? "+1" : "-1", count(conversationId));
        }
        return new UnreadDelta(conversationId, delta, conversationId != null ? count(conversationId) : 0);
    }

    private void publish() {
        Map<String, Integer> copy = new LinkedHashMap<>();
        unreadByConversation.forEach((conversation, ids) -> copy.put(conversation, ids.size()));
        published = Collections.unmodifiableMap(copy);
    }
}
