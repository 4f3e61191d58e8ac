package com.repairdesk.sync.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BookingStatus {
    PENDING("pending", "pending confirmation"),
    CONFIRMED("confirmed", "confirmed and scheduled"),
    IN_PROGRESS("in-progress", "being repaired"),
    COMPLETED("completed", "completed"),
    CANCELLED("cancelled", "cancelled");

    private final String wireValue;
    private final String customerPhrase;

    BookingStatus(String wireValue, String customerPhrase) {
        this.wireValue = wireValue;
        this.customerPhrase = customerPhrase;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Wording used in customer-facing notifications, e.g. "being repaired".
     */
    public String getCustomerPhrase() {
        return customerPhrase;
    }

    @JsonCreator
    public static BookingStatus fromWire(String value) {
        for (BookingStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown booking status: " + value);
    }
}
