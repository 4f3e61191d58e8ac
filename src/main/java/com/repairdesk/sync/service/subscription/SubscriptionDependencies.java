package com.repairdesk.sync.service.subscription;

import com.repairdesk.sync.client.ChangeFeedClient;
import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.service.metrics.SyncMetrics;
import com.repairdesk.sync.service.normalize.ChangeEventNormalizer;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.Executor;

/**
 * Shared collaborators of every channel.
 *
 * @param bufferLimit events held back while a resync is in flight before falling back to
 *                    another resync
 */
public record SubscriptionDependencies(
        ChangeFeedClient feed,
        EntityStoreClient store,
        ChangeEventNormalizer normalizer,
        ReconnectPolicy reconnectPolicy,
        ReconnectPolicy resyncPolicy,
        TaskScheduler scheduler,
        Executor resyncExecutor,
        SyncMetrics metrics,
        int bufferLimit
) {
}
