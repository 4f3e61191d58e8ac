package com.repairdesk.sync.service.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairdesk.sync.exception.MalformedEventException;
import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.ChangeKind;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.dto.RawChangePayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Turns raw feed payloads into {@link ChangeEvent}s.
 *
 * Stateless. Anything that cannot be classified is rejected with a
 * {@link MalformedEventException}; callers log and drop it so one bad payload never stops
 * a stream.
 *
 * Prior row images are only trusted when they carry more than the primary key. Feeds
 * running with a default replica identity send {@code "old": {"id": ...}} on updates, and
 * comparing against such an image would report transitions that never happened.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeEventNormalizer {

    private final ObjectMapper objectMapper;

    public ChangeEvent normalize(String rawPayload) {
        if (rawPayload == null || rawPayload.isBlank()) {
            throw new MalformedEventException("Empty payload");
        }
        RawChangePayload payload;
        try {
            payload = objectMapper.readValue(rawPayload, RawChangePayload.class);
        } catch (JsonProcessingException ex) {
            throw new MalformedEventException("Payload is not a change record: " + ex.getOriginalMessage(), ex);
        }
        return normalize(payload);
    }

    public ChangeEvent normalize(RawChangePayload payload) {
        ChangeKind kind = ChangeKind.fromWire(payload.getEventType());
        if (kind == null) {
            throw new MalformedEventException("Unrecognized change kind '" + payload.getEventType() + "'");
        }
        EntityKind entityKind = EntityKind.fromTable(payload.getTable());
        if (entityKind == null) {
            throw new MalformedEventException("Unrecognized table '" + payload.getTable() + "'");
        }

        TrackedEntity after = payload.hasNewRecord() ? readRow(entityKind, payload.getNewRecord()) : null;
        TrackedEntity before = payload.hasOldRecord() ? readRow(entityKind, payload.getOldRecord()) : null;
        boolean beforeKnown = before != null && isFullImage(payload.getOldRecord());
        OffsetDateTime committedAt = parseTimestamp(payload.getCommitTimestamp());

        return switch (kind) {
            case INSERT -> {
                requireRow(after, kind, entityKind);
                yield new ChangeEvent(kind, entityKind, after.getId(), null, after, false, committedAt);
            }
            case UPDATE -> {
                requireRow(after, kind, entityKind);
                if (before != null && before.getId() != null && !before.getId().equals(after.getId())) {
                    throw new MalformedEventException("UPDATE on " + entityKind.getTable()
                            + " changes the row id from " + before.getId() + " to " + after.getId());
                }
                if (!beforeKnown) {
                    log.debug("UPDATE {} {} arrived without a prior image; prior state treated as unknown",
                            entityKind.getTable(), after.getId());
                }
                yield new ChangeEvent(kind, entityKind, after.getId(), beforeKnown ? before : null, after,
                        beforeKnown, committedAt);
            }
            case DELETE -> {
                if (before == null || before.getId() == null) {
                    throw new MalformedEventException("DELETE on " + entityKind.getTable() + " carries no row id");
                }
                yield new ChangeEvent(kind, entityKind, before.getId(), before, null, beforeKnown, committedAt);
            }
        };
    }

    private TrackedEntity readRow(EntityKind entityKind, JsonNode row) {
        try {
            return objectMapper.treeToValue(row, entityKind.getEntityClass());
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new MalformedEventException("Row of " + entityKind.getTable() + " could not be read: "
                    + ex.getMessage(), ex);
        }
    }

    private static void requireRow(TrackedEntity row, ChangeKind kind, EntityKind entityKind) {
        if (row == null || row.getId() == null || row.getId().isBlank()) {
            throw new MalformedEventException(kind + " on " + entityKind.getTable() + " carries no new row id");
        }
    }

    private static boolean isFullImage(JsonNode row) {
        return row.size() > 1;
    }

    private static OffsetDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring unparseable commit timestamp '{}'", value);
            return null;
        }
    }
}
