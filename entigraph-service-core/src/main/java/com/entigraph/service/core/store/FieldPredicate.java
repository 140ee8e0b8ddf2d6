package com.entigraph.service.core.store;

import com.entigraph.entity.model.EntityRecord;
import com.entigraph.entity.model.TagValue;
import java.time.Instant;
import java.util.Objects;

/**
 * Equality test on one entity field: {@code guid}, {@code name} or {@code tags.<tag>}. Expired tag
 * values never match.
 */
public record FieldPredicate(String field, String value) {

    public static final String TAG_PREFIX = "tags.";

    public FieldPredicate {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
    }

    public boolean test(EntityRecord entity, Instant now) {
        if ("guid".equals(field)) {
            return value.equals(entity.guid());
        }
        if ("name".equals(field)) {
            return value.equals(entity.name());
        }
        if (field.startsWith(TAG_PREFIX)) {
            TagValue tag = entity.tags().get(field.substring(TAG_PREFIX.length()));
            return tag != null && !tag.isExpired(now) && value.equals(tag.value());
        }
        throw new IllegalArgumentException("Unsupported lookup field '" + field + "'");
    }
}
