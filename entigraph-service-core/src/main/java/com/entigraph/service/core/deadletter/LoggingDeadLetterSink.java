package com.entigraph.service.core.deadletter;

import com.entigraph.service.core.telemetry.EngineTelemetry;
import com.entigraph.telemetry.model.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes dead letters to the {@code entigraph.deadletter} logger. */
@Component
public class LoggingDeadLetterSink implements DeadLetterSink {

    private static final Logger DEAD_LETTERS = LoggerFactory.getLogger("entigraph.deadletter");
    private static final int MAX_PAYLOAD_CHARS = 4096;

    private final EngineTelemetry telemetry;

    public LoggingDeadLetterSink(EngineTelemetry telemetry) {
        this.telemetry = telemetry;
    }

    @Override
    public void deadLetter(TelemetryEvent event, String reason, Throwable cause) {
        telemetry.deadLettered(reason);
        DEAD_LETTERS.error(
                "Dead letter reason={} eventType={} observedAt={} cause={} attributes={}",
                reason,
                event == null ? null : event.getEventType(),
                event == null ? null : event.getObservedAt(),
                cause == null ? null : cause.toString(),
                event == null ? null : event.getAttributes());
    }

    @Override
    public void deadLetterRaw(String payload, String reason, Throwable cause) {
        telemetry.deadLettered(reason);
        String body = payload == null || payload.length() <= MAX_PAYLOAD_CHARS
                ? payload
                : payload.substring(0, MAX_PAYLOAD_CHARS) + "...";
        DEAD_LETTERS.error("Dead letter reason={} cause={} payload={}", reason, cause == null ? null : cause.toString(), body);
    }
}
