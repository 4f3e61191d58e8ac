package com.repairdesk.sync.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * A repair booking made by a customer.
 */
@Getter
@Setter
public class Booking extends TrackedEntity {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("status")
    private BookingStatus status;

    @JsonProperty("device_type")
    private String deviceType;

    @JsonProperty("device_model")
    private String deviceModel;

    @JsonProperty("issue_description")
    private String issueDescription;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("customer_email")
    private String customerEmail;

    @JsonProperty("customer_phone")
    private String customerPhone;

    @JsonProperty("preferred_date")
    private String preferredDate;

    @JsonProperty("preferred_time")
    private String preferredTime;

    @JsonProperty("quoted_price")
    private BigDecimal quotedPrice;

    @JsonProperty("estimated_cost")
    private BigDecimal estimatedCost;

    @JsonProperty("actual_cost")
    private BigDecimal actualCost;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("quote_request_id")
    private String quoteRequestId;

    @Override
    public String getOwnerId() {
        return userId;
    }

    @Override
    public String statusValue() {
        return status != null ? status.getWireValue() : null;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.BOOKING;
    }

    /**
     * "iPhone 13 Pro" style label used in notifications.
     */
    public String deviceLabel() {
        String type = deviceType != null ? deviceType : "";
        String model = deviceModel != null ? deviceModel : "";
        return (type + " " + model).trim();
    }

    @Override
    public String toString() {
        return "Booking{" +
                "id='" + getId() + '\'' +
                ", userId='" + userId + '\'' +
                ", status=" + status +
                ", device='" + deviceLabel() + '\'' +
                '}';
    }
}
