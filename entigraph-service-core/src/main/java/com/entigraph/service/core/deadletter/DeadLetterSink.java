package com.entigraph.service.core.deadletter;

import com.entigraph.telemetry.model.TelemetryEvent;

/** Destination for events the pipeline gave up on. */
public interface DeadLetterSink {

    void deadLetter(TelemetryEvent event, String reason, Throwable cause);

    /** Payloads that could not even be parsed into an event. */
    void deadLetterRaw(String payload, String reason, Throwable cause);
}
