package com.repairdesk.sync.model.dto;

/**
 * Freshness of a cached view as surfaced to the presentation layer.
 */
public enum ViewState {
    /** Initial subscription and fetch in progress. */
    CONNECTING,
    /** Snapshot installed, incremental events flowing. */
    LIVE,
    /** Connected again, full fetch in flight. */
    RESYNCING,
    /** Transport dropped, retrying. Data shown may be behind. */
    RECONNECTING,
    /** Full fetch failed. Data shown may be wrong. */
    STALE;

    public boolean isDegraded() {
        return this == RECONNECTING || this == STALE;
    }
}
