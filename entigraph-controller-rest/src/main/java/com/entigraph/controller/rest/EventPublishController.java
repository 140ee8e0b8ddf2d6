package com.entigraph.controller.rest;

import com.entigraph.service.core.ingest.TelemetryEventMapper;
import com.entigraph.service.core.pipeline.ProcessingOutcome;
import com.entigraph.service.core.pipeline.TelemetryPipeline;
import com.entigraph.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Accepts flat telemetry events. A single event is processed inline and its outcome returned;
 * batches are validated as a whole and then queued. When the pipeline stops taking events part-way
 * through a batch the response is 503 with the number already queued; the caller resends the rest.
 */
@Validated
@RestController
@RequestMapping("/api/events")
public class EventPublishController {

    private final TelemetryPipeline pipeline;
    private final TelemetryEventMapper mapper;

    public EventPublishController(TelemetryPipeline pipeline, TelemetryEventMapper mapper) {
        this.pipeline = pipeline;
        this.mapper = mapper;
    }

    @PostMapping
    public ProcessingOutcome publishOne(@RequestBody JsonNode body) {
        return pipeline.process(mapper.fromJson(body));
    }

    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> publishBatch(@RequestBody @NotEmpty List<JsonNode> bodies) {
        List<TelemetryEvent> events = bodies.stream().map(mapper::fromJson).toList();
        int accepted = 0;
        for (TelemetryEvent event : events) {
            if (!pipeline.submit(event)) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(Map.of("accepted", accepted, "rejected", events.size() - accepted));
            }
            accepted++;
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", accepted));
    }
}
