package com.repairdesk.sync.client.impl.production;

import com.repairdesk.sync.client.ChangeFeedClient.FeedListener;
import com.repairdesk.sync.exception.TransportException;
import com.repairdesk.sync.model.domain.EntityKind;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaChangeFeedClient Tests")
class KafkaChangeFeedClientTest {

    private static final String TOPIC = "store.bookings";
    private static final String GROUP = "view-sync-u1-bookings-1";

    @Mock
    private ConsumerFactory<String, String> consumerFactory;

    @Mock
    private FeedListener listener;

    private KafkaChangeFeedClient client;
    private KafkaChangeFeedClient.KafkaFeedSubscription subscription;
    private CountDownLatch assigned;
    private ConcurrentMessageListenerContainer<String, String> container;

    @BeforeEach
    void setUp() {
        client = new KafkaChangeFeedClient(consumerFactory, "store", "view-sync", Duration.ofSeconds(1));
        subscription = new KafkaChangeFeedClient.KafkaFeedSubscription(EntityKind.BOOKING, listener);
        assigned = new CountDownLatch(1);
        container = client.createContainer(EntityKind.BOOKING, TOPIC, GROUP, subscription, assigned);
    }

    @Test
    @DisplayName("The running container should carry the topic, group and latest offset reset")
    void containerCarriesConsumerSettings() {
        ContainerProperties props = container.getContainerProperties();

        assertThat(props.getTopics()).containsExactly(TOPIC);
        assertThat(props.getGroupId()).isEqualTo(GROUP);
        assertThat(props.getKafkaConsumerProperties().getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG))
                .isEqualTo("latest");
    }

    @Test
    @DisplayName("Records received by the container's listener should reach the feed listener")
    @SuppressWarnings("unchecked")
    void containerListenerDeliversPayloads() {
        Object messageListener = container.getContainerProperties().getMessageListener();
        assertThat(messageListener).isInstanceOf(MessageListener.class);

        ((MessageListener<String, String>) messageListener)
                .onMessage(new ConsumerRecord<>(TOPIC, 0, 0L, "b1", "{\"eventType\":\"INSERT\"}"));

        verify(listener).onPayload("{\"eventType\":\"INSERT\"}");
    }

    @Test
    @DisplayName("Partition assignment seen by the container should mark the subscription connected")
    void assignmentReleasesConnect() {
        container.getContainerProperties().getConsumerRebalanceListener()
                .onPartitionsAssigned(List.of(new TopicPartition(TOPIC, 0)));

        assertThat(assigned.getCount()).isZero();
    }

    @Test
    @DisplayName("Lost partitions should be reported once as a disconnect and stop delivery")
    void lostPartitionsDisconnect() {
        ConsumerRebalanceListener rebalance = container.getContainerProperties().getConsumerRebalanceListener();
        rebalance.onPartitionsLost(List.of(new TopicPartition(TOPIC, 0)));
        rebalance.onPartitionsLost(List.of(new TopicPartition(TOPIC, 0)));
        subscription.deliver("late");

        ArgumentCaptor<Throwable> cause = ArgumentCaptor.forClass(Throwable.class);
        verify(listener).onDisconnect(cause.capture());
        assertThat(cause.getValue()).isInstanceOf(TransportException.class).hasMessageContaining(TOPIC);
        verify(listener, never()).onPayload("late");
    }

    @Test
    @DisplayName("A closed subscription should not report a disconnect")
    void closeIsSilent() {
        subscription.close();
        subscription.close();

        verifyNoInteractions(listener);
    }
}
