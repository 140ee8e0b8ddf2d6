package com.entigraph.ingest.kafka;

import com.entigraph.service.core.deadletter.DeadLetterSink;
import com.entigraph.service.core.ingest.TelemetryEventMapper;
import com.entigraph.service.core.pipeline.TelemetryPipeline;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.nio.charset.StandardCharsets;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Feeds each record through the pipeline on the consumer thread, so a partition is processed in
 * order. The offset always advances; payloads that cannot be mapped are dead-lettered.
 */
@Component
@ConditionalOnProperty(prefix = "entigraph.ingest.kafka", name = "enabled", havingValue = "true")
public class KafkaIngestListener {

    private static final Logger log = LoggerFactory.getLogger(KafkaIngestListener.class);

    private final TelemetryEventMapper eventMapper;
    private final TelemetryPipeline pipeline;
    private final DeadLetterSink deadLetters;

    public KafkaIngestListener(TelemetryEventMapper eventMapper, TelemetryPipeline pipeline, DeadLetterSink deadLetters) {
        this.eventMapper = eventMapper;
        this.pipeline = pipeline;
        this.deadLetters = deadLetters;
    }

    @KafkaListener(
            topics = "${entigraph.ingest.kafka.topic:entigraph.telemetry}",
            containerFactory = "telemetryListenerFactory")
    public void handle(ConsumerRecord<String, byte[]> record, Acknowledgment ack) {
        String raw = record.value() == null ? "" : new String(record.value(), StandardCharsets.UTF_8);
        try {
            TelemetryEvent event;
            try {
                event = eventMapper.fromJson(raw);
            } catch (IllegalArgumentException ex) {
                deadLetters.deadLetterRaw(raw, "kafka-unparseable", ex);
                log.warn("Kafka payload at {}-{}@{} dead-lettered: {}",
                        record.topic(), record.partition(), record.offset(), ex.getMessage());
                return;
            }
            pipeline.process(event);
        } finally {
            ack.acknowledge();
        }
    }
}
