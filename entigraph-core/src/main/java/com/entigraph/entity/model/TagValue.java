package com.entigraph.entity.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A tag value with the observation time it came from. Tags with an {@code expiresAt} age out on
 * their own, independently of the owning entity.
 */
public record TagValue(String value, Instant observedAt, Instant expiresAt) {

    public TagValue {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(observedAt, "observedAt");
    }

    public static TagValue of(String value, Instant observedAt, Duration ttl) {
        return new TagValue(value, observedAt, ttl == null ? null : observedAt.plus(ttl));
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
