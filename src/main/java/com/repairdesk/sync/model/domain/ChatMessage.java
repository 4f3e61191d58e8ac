package com.repairdesk.sync.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

/**
 * A message in a booking conversation. The conversation id is the id of the booking it
 * belongs to, and the acting user of a message is its sender.
 */
@Getter
@Setter
public class ChatMessage extends TrackedEntity {

    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("sender_id")
    private String senderId;

    @JsonProperty("message")
    private String message;

    @JsonProperty("message_type")
    private String messageType;

    @JsonProperty("is_read")
    private boolean read;

    @Override
    public String getOwnerId() {
        return senderId;
    }

    @Override
    public String statusValue() {
        return read ? "read" : "unread";
    }

    @Override
    public EntityKind kind() {
        return EntityKind.CHAT_MESSAGE;
    }

    public boolean isUnreadFor(String viewerId) {
        return !read && senderId != null && !senderId.equals(viewerId);
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "id='" + getId() + '\'' +
                ", conversationId='" + conversationId + '\'' +
                ", senderId='" + senderId + '\'' +
                ", read=" + read +
                '}';
    }
}
