package com.repairdesk.sync.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.repairdesk.sync.model.domain.QuoteStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields an administrator may change on a quote request. Null fields are left untouched.
 */
@Data
public class QuoteUpdateRequest {

    @JsonProperty("quoted_price")
    private BigDecimal quotedPrice;

    @JsonProperty("quote_notes")
    private String quoteNotes;

    @JsonProperty("admin_notes")
    private String adminNotes;

    @JsonProperty("status")
    private QuoteStatus status;

    public Map<String, Object> toPatch() {
        Map<String, Object> patch = new LinkedHashMap<>();
        if (quotedPrice != null) patch.put("quoted_price", quotedPrice);
        if (quoteNotes != null) patch.put("quote_notes", quoteNotes);
        if (adminNotes != null) patch.put("admin_notes", adminNotes);
        if (status != null) patch.put("status", status.getWireValue());
        return patch;
    }
}
