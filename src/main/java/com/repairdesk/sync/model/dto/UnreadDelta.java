package com.repairdesk.sync.model.dto;

/**
 * Change to one conversation's unread counter.
 *
 * @param conversationId the conversation, null when the event touched none
 * @param delta          signed change, 0 when nothing changed
 * @param count          counter value after the change
 */
public record UnreadDelta(String conversationId, int delta, int count) {

    public static UnreadDelta none(String conversationId, int count) {
        return new UnreadDelta(conversationId, 0, count);
    }
}
