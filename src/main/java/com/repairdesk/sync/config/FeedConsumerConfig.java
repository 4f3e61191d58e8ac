package com.repairdesk.sync.config;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

import java.util.Map;

/**
 * Consumer settings for the change-feed topics. Group ids are assigned per subscription,
 * so only connection and deserialization settings live here.
 */
@Configuration
@Profile("!test & !local")
public class FeedConsumerConfig {

    @Bean
    public ConsumerFactory<String, String> feedConsumerFactory(KafkaProperties kafkaProperties, SslBundles sslBundles) {
        Map<String, Object> props = kafkaProperties.buildConsumerProperties(sslBundles);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.remove(ConsumerConfig.GROUP_ID_CONFIG);
        return new DefaultKafkaConsumerFactory<>(props);
    }
}
