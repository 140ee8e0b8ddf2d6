package com.entigraph.entity.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** A relationship observation produced by the relationship engine. */
public record RelationshipDelta(
        RelationshipType type, String sourceGuid, String targetGuid, Instant observedAt, Duration ttl) {

    public RelationshipDelta {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sourceGuid, "sourceGuid");
        Objects.requireNonNull(targetGuid, "targetGuid");
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(ttl, "ttl");
    }

    public RelationshipKey key() {
        return new RelationshipKey(type, sourceGuid, targetGuid);
    }

    public Instant expiresAt() {
        return observedAt.plus(ttl);
    }
}
