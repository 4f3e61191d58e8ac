package com.repairdesk.sync.model.dto;

import com.repairdesk.sync.model.domain.EntityKind;

import java.time.Instant;

/**
 * A user-visible alert handed to the presentation layer.
 *
 * @param key         de-duplication key, see {@link NotificationKey}
 * @param type        what happened
 * @param entityKind  kind of the row that triggered it
 * @param entityId    id of the row that triggered it
 * @param title       short heading, e.g. "Booking Status Updated"
 * @param summary     machine-stable summary, e.g. "status changed to confirmed"
 * @param description customer-facing sentence
 * @param createdAt   when the notification was dispatched
 */
public record Notification(
        NotificationKey key,
        NotificationType type,
        EntityKind entityKind,
        String entityId,
        String title,
        String summary,
        String description,
        Instant createdAt
) {
}
