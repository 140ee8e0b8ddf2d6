package com.entigraph.service.core.config;

import java.time.Duration;
import java.util.List;

/**
 * @param attributeChain the source attribute followed by its fallbacks, tried in order
 * @param ttl optional tag lifetime, {@code null} when the tag lives as long as the entity
 */
public record TagMappingDefinition(String targetTag, List<String> attributeChain, Duration ttl) {}
