package com.entigraph.ingest.kafka;

import com.entigraph.service.core.config.EngineProperties;
import java.util.HashMap;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;

/**
 * Telemetry consumer wiring, driven by {@code entigraph.ingest.kafka.*}. Values stay raw bytes so
 * that payloads the mapper rejects can be dead-lettered verbatim.
 */
@Configuration
@EnableKafka
@ConditionalOnProperty(prefix = "entigraph.ingest.kafka", name = "enabled", havingValue = "true")
public class KafkaIngestConfiguration {

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, byte[]> telemetryListenerFactory(EngineProperties properties) {
        EngineProperties.Kafka kafka = properties.getIngest().getKafka();
        ConcurrentKafkaListenerContainerFactory<String, byte[]> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(new DefaultKafkaConsumerFactory<>(consumerConfig(kafka)));
        factory.setConcurrency(Math.max(1, kafka.getConcurrency()));
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        return factory;
    }

    static Map<String, Object> consumerConfig(EngineProperties.Kafka kafka) {
        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        config.put(ConsumerConfig.GROUP_ID_CONFIG, kafka.getGroupId());
        config.put(ConsumerConfig.CLIENT_ID_CONFIG, kafka.getGroupId() + "-" + kafka.getTopic());
        config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Math.max(1, kafka.getMaxPollRecords()));
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        return config;
    }
}
