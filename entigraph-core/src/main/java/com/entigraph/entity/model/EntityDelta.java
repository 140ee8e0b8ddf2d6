package com.entigraph.entity.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a successful synthesis: everything a store needs to create or refresh one entity.
 *
 * @param expiresAfter the entity expiration time configured for the entity type
 */
public record EntityDelta(
        String guid,
        String domain,
        String type,
        String name,
        Map<String, TagValue> tags,
        Instant observedAt,
        Duration expiresAfter) {

    public EntityDelta {
        Objects.requireNonNull(guid, "guid");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(expiresAfter, "expiresAfter");
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public Instant expiresAt() {
        return observedAt.plus(expiresAfter);
    }
}
