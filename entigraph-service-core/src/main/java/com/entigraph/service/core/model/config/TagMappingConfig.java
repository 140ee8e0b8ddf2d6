package com.entigraph.service.core.model.config;

import java.util.List;

/** Target tag for a source attribute, tried attributes after it, and an optional per-tag TTL. */
public record TagMappingConfig(String targetTag, List<String> fallbackAttributes, String ttl) {

    public static TagMappingConfig to(String targetTag) {
        return new TagMappingConfig(targetTag, List.of(), null);
    }
}
