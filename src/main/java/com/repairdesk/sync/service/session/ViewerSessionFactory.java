package com.repairdesk.sync.service.session;

import com.repairdesk.sync.client.ChangeFeedClient;
import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.service.metrics.SyncMetrics;
import com.repairdesk.sync.service.normalize.ChangeEventNormalizer;
import com.repairdesk.sync.service.notify.NotificationDispatcher;
import com.repairdesk.sync.service.notify.NotificationPolicy;
import com.repairdesk.sync.service.subscription.ReconnectPolicy;
import com.repairdesk.sync.service.subscription.SessionEpoch;
import com.repairdesk.sync.service.subscription.SubscriptionDependencies;
import com.repairdesk.sync.service.subscription.SubscriptionManager;
import com.repairdesk.sync.service.view.ViewReconciler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Wires the per-session objects from the shared singletons.
 */
@Component
public class ViewerSessionFactory {

    private final SubscriptionDependencies dependencies;
    private final EntityStoreClient storeClient;
    private final ViewReconciler reconciler;
    private final NotificationPolicy notificationPolicy;
    private final SyncMetrics metrics;
    private final int dedupeCapacity;
    private final Duration loopTimeout;

    public ViewerSessionFactory(ChangeFeedClient feedClient,
                                EntityStoreClient storeClient,
                                ChangeEventNormalizer normalizer,
                                ViewReconciler reconciler,
                                NotificationPolicy notificationPolicy,
                                SyncMetrics metrics,
                                @Qualifier("reconnectPolicy") ReconnectPolicy reconnectPolicy,
                                @Qualifier("resyncPolicy") ReconnectPolicy resyncPolicy,
                                TaskScheduler syncScheduler,
                                @Qualifier("resyncExecutor") ThreadPoolTaskExecutor resyncExecutor,
                                @Value("${app.sync.resync.buffer-limit:10000}") int bufferLimit,
                                @Value("${app.sync.notifications.dedupe-capacity:5000}") int dedupeCapacity,
                                @Value("${app.sync.loop-timeout:5s}") Duration loopTimeout) {
        this.dependencies = new SubscriptionDependencies(feedClient, storeClient, normalizer, reconnectPolicy,
                resyncPolicy, syncScheduler, resyncExecutor, metrics, bufferLimit);
        this.storeClient = storeClient;
        this.reconciler = reconciler;
        this.notificationPolicy = notificationPolicy;
        this.metrics = metrics;
        this.dedupeCapacity = dedupeCapacity;
        this.loopTimeout = loopTimeout;
    }

    public ViewerSession create(ViewScope scope, long epochValue) {
        SessionEpoch epoch = new SessionEpoch(epochValue);
        NotificationDispatcher dispatcher = new NotificationDispatcher(scope, notificationPolicy, metrics, dedupeCapacity);
        ViewerSession session = new ViewerSession(scope, epoch, reconciler, dispatcher, storeClient, loopTimeout);
        session.attach(new SubscriptionManager(scope, epoch, dependencies, session));
        return session;
    }
}
