package com.entigraph.telemetry.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single flat telemetry sample as seen by the synthesis pipeline.
 *
 * Attributes are scalar (String, Number, Boolean). The event type is the discriminator used to
 * select rule sets, e.g. {@code KafkaBrokerSample}; it is also kept in the attribute map so rule
 * conditions can test it like any other attribute.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TelemetryEvent {

    private final String eventType;
    private final Instant observedAt;
    private final Map<String, Object> attributes;

    private TelemetryEvent(Builder b) {
        this.eventType = b.eventType;
        this.observedAt = Objects.requireNonNull(b.observedAt, "observedAt");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TelemetryEvent of(String eventType, Instant observedAt, Map<String, ?> attributes) {
        return builder()
                .eventType(eventType)
                .observedAt(observedAt)
                .attributes(attributes)
                .build();
    }

    public static final class Builder {
        private String eventType;
        private Instant observedAt;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder eventType(String v) {
            this.eventType = v;
            return this;
        }

        public Builder observedAt(Instant v) {
            this.observedAt = v;
            return this;
        }

        public Builder attributes(Map<String, ?> v) {
            if (v != null) {
                v.forEach(this::attribute);
            }
            return this;
        }

        public Builder attribute(String name, Object value) {
            if (name != null && value != null) {
                this.attributes.put(name, value);
            }
            return this;
        }

        public TelemetryEvent build() {
            return new TelemetryEvent(this);
        }
    }

    public String getEventType() {
        return eventType;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object attribute(String name) {
        return name == null ? null : attributes.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryEvent that)) return false;
        return Objects.equals(eventType, that.eventType)
                && Objects.equals(observedAt, that.observedAt)
                && Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, observedAt, attributes);
    }

    @Override
    public String toString() {
        return "TelemetryEvent{" + "eventType='" + eventType + '\'' + ", observedAt=" + observedAt
                + ", attributes=" + attributes.size() + '}';
    }
}
