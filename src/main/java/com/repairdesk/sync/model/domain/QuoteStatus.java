package com.repairdesk.sync.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum QuoteStatus {
    PENDING("pending"),
    QUOTED("quoted"),
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String wireValue;

    QuoteStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static QuoteStatus fromWire(String value) {
        for (QuoteStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown quote status: " + value);
    }
}
