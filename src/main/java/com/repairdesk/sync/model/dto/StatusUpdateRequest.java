package com.repairdesk.sync.model.dto;

import com.repairdesk.sync.model.domain.BookingStatus;
import lombok.Data;

@Data
public class StatusUpdateRequest {
    private BookingStatus status;
}
