package com.entigraph.service.core.ingest;

import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.telemetry.model.TelemetryEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Shared mapper that converts JSON telemetry payloads into flat {@link TelemetryEvent}s. Nested
 * objects are flattened to dotted keys; arrays and nulls are dropped.
 */
@Component
public class TelemetryEventMapper {

    static final String TIMESTAMP = "timestamp";

    private final ObjectMapper mapper;
    private final Clock clock;
    private final String eventTypeAttribute;

    public TelemetryEventMapper(ObjectMapper mapper, Clock clock, EngineProperties properties) {
        this.mapper = mapper;
        this.clock = clock;
        this.eventTypeAttribute = properties.getSynthesis().getEventTypeAttribute();
    }

    public TelemetryEvent fromJson(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("event body is required");
        }
        try {
            return fromJson(mapper.readTree(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed event JSON: " + e.getOriginalMessage(), e);
        }
    }

    public TelemetryEvent fromJson(JsonNode root) {
        Objects.requireNonNull(root, "event body is required");
        if (!root.isObject()) {
            throw new IllegalArgumentException("event body must be a JSON object");
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        flatten("", root, attributes);
        return fromMap(attributes);
    }

    /** Builds an event from already-flat attributes. */
    public TelemetryEvent fromMap(Map<String, Object> attributes) {
        Object type = attributes.get(eventTypeAttribute);
        Instant observedAt = parseInstant(attributes.get(TIMESTAMP));
        return TelemetryEvent.builder()
                .eventType(type == null ? null : type.toString())
                .observedAt(observedAt != null ? observedAt : clock.instant())
                .attributes(attributes)
                .build();
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Object> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flatten(key, value, out);
            } else if (value.isTextual()) {
                out.put(key, value.textValue());
            } else if (value.isIntegralNumber()) {
                out.put(key, value.canConvertToLong() ? (Object) value.longValue() : value.bigIntegerValue());
            } else if (value.isNumber()) {
                out.put(key, value.doubleValue());
            } else if (value.isBoolean()) {
                out.put(key, value.booleanValue());
            }
        }
    }

    static Instant parseInstant(Object raw) {
        if (raw == null) return null;
        if (raw instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        String s = raw.toString().trim();
        if (s.isEmpty()) return null;
        if (s.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(s));
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignored) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unparseable timestamp '" + s + "'", e);
            }
        }
    }
}
