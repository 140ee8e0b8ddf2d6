package com.entigraph.controller.rest;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.model.EntityIdentity;
import com.entigraph.entity.model.EntityRecord;
import com.entigraph.entity.model.TagValue;
import java.time.Instant;
import java.util.Map;

/** Read model of a stored entity, with its decoded identity. */
public record EntityView(
        String guid,
        EntityIdentity identity,
        String name,
        Map<String, TagValue> tags,
        Instant createdAt,
        Instant lastSeenAt,
        Instant expiresAt) {

    static EntityView of(EntityRecord record) {
        return new EntityView(
                record.guid(),
                GuidCodec.decode(record.guid()),
                record.name(),
                record.tags(),
                record.createdAt(),
                record.lastSeenAt(),
                record.expiresAt());
    }
}
