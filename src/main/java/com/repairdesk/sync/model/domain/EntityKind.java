package com.repairdesk.sync.model.domain;

/**
 * The entity kinds tracked by a viewer session. Each kind maps to one table of the
 * backing store and to one channel of the change feed.
 */
public enum EntityKind {
    BOOKING("bookings", Booking.class),
    CHAT_MESSAGE("chat_messages", ChatMessage.class),
    QUOTE_REQUEST("quote_requests", QuoteRequest.class);

    private final String table;
    private final Class<? extends TrackedEntity> entityClass;

    EntityKind(String table, Class<? extends TrackedEntity> entityClass) {
        this.table = table;
        this.entityClass = entityClass;
    }

    public String getTable() {
        return table;
    }

    public Class<? extends TrackedEntity> getEntityClass() {
        return entityClass;
    }

    /**
     * Whether this kind is kept as a row view. Chat messages are only aggregated into
     * unread counters.
     */
    public boolean hasRowView() {
        return this != CHAT_MESSAGE;
    }

    public static EntityKind fromTable(String table) {
        if (table == null) {
            return null;
        }
        for (EntityKind kind : values()) {
            if (kind.table.equalsIgnoreCase(table)) {
                return kind;
            }
        }
        return null;
    }

    /**
     * Resolves a path segment such as {@code bookings} or {@code BOOKING}.
     */
    public static EntityKind fromPath(String segment) {
        EntityKind byTable = fromTable(segment);
        if (byTable != null) {
            return byTable;
        }
        try {
            return EntityKind.valueOf(segment.toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException | NullPointerException ex) {
            return null;
        }
    }
}
