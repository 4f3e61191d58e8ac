package com.repairdesk.sync.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * A store row synchronized into a viewer's cache.
 *
 * The owner of a row is write-once: the backing store never moves a row to another
 * owner, so routing decisions made on insert stay valid for the row's lifetime.
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TrackedEntity {

    @JsonProperty("id")
    private String id;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    /**
     * The acting user the row belongs to, or {@code null} for anonymous rows.
     */
    @JsonIgnore
    public abstract String getOwnerId();

    /**
     * Wire value of the row's status, used to detect status transitions.
     */
    public abstract String statusValue();

    public abstract EntityKind kind();

    public boolean isOwnedBy(String userId) {
        return userId != null && userId.equals(getOwnerId());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TrackedEntity that = (TrackedEntity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
