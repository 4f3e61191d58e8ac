package com.repairdesk.sync.client.impl.production;

import com.repairdesk.sync.client.ChangeFeedClient;
import com.repairdesk.sync.exception.TransportException;
import com.repairdesk.sync.model.domain.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.common.TopicPartition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collection;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Change feed backed by one Kafka topic per table ({@code <prefix>.<table>}).
 *
 * Each subscription runs its own listener container in a fresh consumer group starting at the
 * latest offset, so a reconnect never replays what was missed; the session resyncs instead.
 * The connection counts as established once partitions are assigned. A consumer that stops
 * abnormally, stops polling or loses its partitions is reported as a disconnect.
 */
@Slf4j
@Service
@Profile("!test & !local")
public class KafkaChangeFeedClient implements ChangeFeedClient {

    private final ConsumerFactory<String, String> consumerFactory;
    private final String topicPrefix;
    private final String groupPrefix;
    private final Duration connectTimeout;

    public KafkaChangeFeedClient(ConsumerFactory<String, String> consumerFactory,
                                 @Value("${app.feed.topic-prefix}") String topicPrefix,
                                 @Value("${app.feed.group-prefix:view-sync}") String groupPrefix,
                                 @Value("${app.feed.connect-timeout:15s}") Duration connectTimeout) {
        this.consumerFactory = consumerFactory;
        this.topicPrefix = topicPrefix;
        this.groupPrefix = groupPrefix;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public FeedSubscription subscribe(EntityKind kind, String subscriberId, FeedListener listener) {
        String topic = topicPrefix + "." + kind.getTable();
        String groupId = groupPrefix + "-" + subscriberId + "-" + kind.getTable() + "-" + UUID.randomUUID();
        CountDownLatch assigned = new CountDownLatch(1);

        KafkaFeedSubscription subscription = new KafkaFeedSubscription(kind, listener);
        ConcurrentMessageListenerContainer<String, String> container =
                createContainer(kind, topic, groupId, subscription, assigned);
        container.setBeanName("feed-" + subscriberId + "-" + kind.getTable());
        subscription.attach(container);

        log.info("[FEED] Connecting {} to topic {}", subscriberId, topic);
        container.start();
        try {
            if (!assigned.await(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                subscription.close();
                throw new TransportException(kind, "No partition assignment for " + topic + " within " + connectTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            throw new TransportException(kind, "Interrupted while connecting to " + topic, e);
        }
        log.info("[FEED] {} connected to topic {}", subscriberId, topic);
        return subscription;
    }

    /**
     * Builds the listener container for one subscription. The container copies {@code props}
     * when constructed, so both listeners are set first.
     */
    ConcurrentMessageListenerContainer<String, String> createContainer(EntityKind kind, String topic, String groupId,
                                                                      KafkaFeedSubscription subscription,
                                                                      CountDownLatch assigned) {
        ContainerProperties props = new ContainerProperties(topic);
        props.setGroupId(groupId);
        props.setMonitorInterval(10);
        props.setNoPollThreshold(3f);
        props.getKafkaConsumerProperties().setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.setMessageListener((MessageListener<String, String>) record -> subscription.deliver(record.value()));
        props.setConsumerRebalanceListener(new ConsumerRebalanceListener() {
            @Override
            public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                log.debug("[FEED] {} assigned {}", groupId, partitions);
                assigned.countDown();
            }

            @Override
            public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                log.debug("[FEED] {} revoked {}", groupId, partitions);
            }

            @Override
            public void onPartitionsLost(Collection<TopicPartition> partitions) {
                subscription.drop(new TransportException(kind, "Lost partitions " + partitions + " of " + topic));
            }
        });

        ConcurrentMessageListenerContainer<String, String> container =
                new ConcurrentMessageListenerContainer<>(consumerFactory, props);
        container.setApplicationEventPublisher(event -> {
            if (event instanceof ConsumerStoppedEvent stopped && stopped.getReason() != ConsumerStoppedEvent.Reason.NORMAL) {
                subscription.drop(new TransportException(kind, "Consumer of " + topic + " stopped: " + stopped.getReason()));
            } else if (event instanceof NonResponsiveConsumerEvent) {
                subscription.drop(new TransportException(kind, "Consumer of " + topic + " stopped polling"));
            }
        });
        return container;
    }

    static final class KafkaFeedSubscription implements FeedSubscription {

        private final EntityKind kind;
        private final FeedListener listener;
        private final AtomicBoolean open = new AtomicBoolean(true);
        private volatile ConcurrentMessageListenerContainer<String, String> container;

        KafkaFeedSubscription(EntityKind kind, FeedListener listener) {
            this.kind = kind;
            this.listener = listener;
        }

        private void attach(ConcurrentMessageListenerContainer<String, String> container) {
            this.container = container;
        }

        @Override
        public EntityKind kind() {
            return kind;
        }

        void deliver(String payload) {
            if (open.get() && payload != null) {
                listener.onPayload(payload);
            }
        }

        void drop(TransportException cause) {
            if (open.compareAndSet(true, false)) {
                log.warn("[FEED] {}", cause.getMessage());
                // container events arrive on the consumer thread, which cannot stop itself synchronously
                ConcurrentMessageListenerContainer<String, String> running = container;
                if (running != null) {
                    CompletableFuture.runAsync(running::stop);
                }
                listener.onDisconnect(cause);
            }
        }

        @Override
        public void close() {
            if (open.compareAndSet(true, false) && container != null) {
                container.stop();
                log.debug("[FEED] Closed subscription to {}", kind.getTable());
            }
        }
    }
}
