package com.repairdesk.sync.service.subscription;

import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.dto.ViewState;

import java.util.List;

/**
 * Receives what a channel produces. {@link #apply} and {@link #install} are always called
 * on the channel's consumer loop.
 */
public interface ChannelSink {

    void apply(ChangeEvent event);

    /**
     * Replaces everything known about the kind with a full fetch.
     */
    void install(EntityKind kind, List<TrackedEntity> rows);

    /**
     * May be called from any thread.
     */
    void stateChanged(EntityKind kind, ViewState state);
}
