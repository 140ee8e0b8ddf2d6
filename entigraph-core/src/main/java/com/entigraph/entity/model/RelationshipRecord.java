package com.entigraph.entity.model;

import java.time.Instant;

/** Stored state of a relationship; one record per {@link RelationshipKey}. */
public record RelationshipRecord(
        RelationshipType type,
        String sourceGuid,
        String targetGuid,
        Instant firstSeenAt,
        Instant lastSeenAt,
        Instant expiresAt) {

    public static RelationshipRecord create(RelationshipDelta delta) {
        return new RelationshipRecord(
                delta.type(),
                delta.sourceGuid(),
                delta.targetGuid(),
                delta.observedAt(),
                delta.observedAt(),
                delta.expiresAt());
    }

    /** Re-observation extends the lifetime; a late, older observation never shortens it. */
    public RelationshipRecord refresh(RelationshipDelta delta) {
        Instant observed = delta.observedAt();
        Instant expiry = delta.expiresAt();
        return new RelationshipRecord(
                type,
                sourceGuid,
                targetGuid,
                observed.isBefore(firstSeenAt) ? observed : firstSeenAt,
                observed.isAfter(lastSeenAt) ? observed : lastSeenAt,
                expiry.isAfter(expiresAt) ? expiry : expiresAt);
    }

    public RelationshipKey key() {
        return new RelationshipKey(type, sourceGuid, targetGuid);
    }

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }
}
