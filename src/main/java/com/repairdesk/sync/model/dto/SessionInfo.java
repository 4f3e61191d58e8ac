package com.repairdesk.sync.model.dto;

import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.ViewerRole;

import java.time.Instant;
import java.util.Map;

public record SessionInfo(
        String viewerId,
        ViewerRole role,
        long epoch,
        Instant startedAt,
        Map<EntityKind, ViewState> channels
) {
}
