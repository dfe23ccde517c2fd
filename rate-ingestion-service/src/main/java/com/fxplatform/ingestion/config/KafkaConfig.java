package com.fxplatform.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxplatform.common.publisher.RateEventPublisher;
import com.fxplatform.ingestion.publisher.KafkaRateEventPublisher;
import com.fxplatform.ingestion.publisher.RateMessage;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka publishing of accepted rates. Active unless {@code fx.events.publisher=log}.
 */
@Configuration
@ConditionalOnProperty(name = "fx.events.publisher", havingValue = "kafka", matchIfMissing = true)
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${fx.events.topic:fx-rates}")
    private String ratesTopic;

    @Value("${fx.events.partitions:3}")
    private int partitions;

    @Bean
    public KafkaAdmin kafkaAdmin() {
        Map<String, Object> configs = new HashMap<>();
        configs.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        KafkaAdmin admin = new KafkaAdmin(configs);
        admin.setFatalIfBrokerNotAvailable(false);
        return admin;
    }

    @Bean
    public NewTopic ratesTopic() {
        return TopicBuilder.name(ratesTopic)
            .partitions(partitions)
            .replicas(1)
            .build();
    }

    @Bean
    public ProducerFactory<String, RateMessage> rateProducerFactory(ObjectMapper objectMapper) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, "1");

        JsonSerializer<RateMessage> jsonSerializer = new JsonSerializer<>(objectMapper);
        jsonSerializer.setAddTypeInfo(false);

        return new DefaultKafkaProducerFactory<>(configProps, new StringSerializer(), jsonSerializer);
    }

    @Bean
    public KafkaTemplate<String, RateMessage> rateKafkaTemplate(ProducerFactory<String, RateMessage> rateProducerFactory) {
        return new KafkaTemplate<>(rateProducerFactory);
    }

    @Bean
    public RateEventPublisher kafkaRateEventPublisher(KafkaTemplate<String, RateMessage> rateKafkaTemplate, Clock clock) {
        return new KafkaRateEventPublisher(rateKafkaTemplate, ratesTopic, clock);
    }
}
