package com.repairdesk.sync.model.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * A customer's request for a repair quote. Guest requests carry no owner.
 */
@Getter
@Setter
public class QuoteRequest extends TrackedEntity {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("status")
    private QuoteStatus status;

    @JsonProperty("quoted_price")
    private BigDecimal quotedPrice;

    @JsonProperty("admin_notes")
    private String adminNotes;

    @JsonProperty("quote_notes")
    private String quoteNotes;

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("customer_email")
    private String customerEmail;

    @JsonProperty("customer_phone")
    private String customerPhone;

    @JsonProperty("issue_description")
    private String issueDescription;

    @JsonProperty("custom_device_info")
    private String customDeviceInfo;

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
        return EntityKind.QUOTE_REQUEST;
    }

    @Override
    public String toString() {
        return "QuoteRequest{" +
                "id='" + getId() + '\'' +
                ", userId='" + userId + '\'' +
                ", status=" + status +
                ", quotedPrice=" + quotedPrice +
                '}';
    }
}
