package com.repairdesk.sync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Row-level change payload as delivered by the store's realtime feed.
 *
 * <pre>
 * {"eventType":"UPDATE","schema":"public","table":"bookings",
 *  "commit_timestamp":"2025-03-02T10:15:00Z","new":{...},"old":{...}}
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawChangePayload {

    @JsonProperty("eventType")
    private String eventType;

    @JsonProperty("schema")
    private String schema;

    @JsonProperty("table")
    private String table;

    @JsonProperty("commit_timestamp")
    private String commitTimestamp;

    @JsonProperty("new")
    private JsonNode newRecord;

    @JsonProperty("old")
    private JsonNode oldRecord;

    /**
     * Some transports send {@code "old": {}} instead of omitting it.
     */
    public boolean hasOldRecord() {
        return oldRecord != null && !oldRecord.isNull() && !oldRecord.isMissingNode() && oldRecord.size() > 0;
    }

    public boolean hasNewRecord() {
        return newRecord != null && !newRecord.isNull() && !newRecord.isMissingNode() && newRecord.size() > 0;
    }
}
