package com.repairdesk.sync.model.dto;

import com.repairdesk.sync.model.domain.ViewerRole;
import lombok.Data;

@Data
public class StartSessionRequest {
    private String viewerId;
    private ViewerRole role;
}
