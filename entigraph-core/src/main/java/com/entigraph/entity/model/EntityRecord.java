package com.entigraph.entity.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored state of an entity. Instances are immutable; {@link #apply(EntityDelta)} returns the
 * merged successor so stores can swap records atomically per GUID.
 */
public record EntityRecord(
        String guid,
        String domain,
        String type,
        String name,
        Map<String, TagValue> tags,
        Instant createdAt,
        Instant lastSeenAt,
        Instant expiresAt) {

    public EntityRecord {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static EntityRecord create(EntityDelta delta) {
        return new EntityRecord(
                delta.guid(),
                delta.domain(),
                delta.type(),
                delta.name(),
                delta.tags(),
                delta.observedAt(),
                delta.observedAt(),
                delta.expiresAt());
    }

    /**
     * Merges a delta into this record. Tags carried by the delta replace stored values unless the
     * stored value was observed later; tags the delta does not carry survive unless their own TTL
     * elapsed before the delta was observed. Timestamps never move backwards and domain/type are
     * never changed.
     */
    public EntityRecord apply(EntityDelta delta) {
        Instant observedAt = delta.observedAt();
        boolean newer = !observedAt.isBefore(lastSeenAt);

        Map<String, TagValue> merged = new LinkedHashMap<>();
        tags.forEach((key, value) -> {
            if (!value.isExpired(observedAt)) {
                merged.put(key, value);
            }
        });
        delta.tags().forEach((key, incoming) -> {
            TagValue existing = merged.get(key);
            if (existing == null || !existing.observedAt().isAfter(incoming.observedAt())) {
                merged.put(key, incoming);
            }
        });

        Instant deltaExpiry = delta.expiresAt();
        return new EntityRecord(
                guid,
                domain,
                type,
                newer && delta.name() != null ? delta.name() : name,
                merged,
                observedAt.isBefore(createdAt) ? observedAt : createdAt,
                newer ? observedAt : lastSeenAt,
                deltaExpiry.isAfter(expiresAt) ? deltaExpiry : expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    public boolean hasExpiredTags(Instant now) {
        for (TagValue value : tags.values()) {
            if (value.isExpired(now)) {
                return true;
            }
        }
        return false;
    }

    public EntityRecord withoutExpiredTags(Instant now) {
        if (!hasExpiredTags(now)) {
            return this;
        }
        Map<String, TagValue> live = new LinkedHashMap<>();
        tags.forEach((key, value) -> {
            if (!value.isExpired(now)) {
                live.put(key, value);
            }
        });
        return new EntityRecord(guid, domain, type, name, live, createdAt, lastSeenAt, expiresAt);
    }

    /** Current value of a tag, or {@code null}. */
    public String tag(String key) {
        TagValue value = tags.get(key);
        return value == null ? null : value.value();
    }
}
