package com.entigraph.service.core.model.config;

import java.util.List;
import java.util.Map;

/**
 * Entity synthesis rule. {@code entityName} defaults to the identifier; {@code tags} maps a source
 * attribute to its tag mapping and keeps declaration order.
 */
public record SynthesisRuleConfig(
        String name,
        List<String> eventTypes,
        String domain,
        String type,
        IdentifierConfig identifier,
        IdentifierConfig entityName,
        AccountConfig account,
        List<ConditionConfig> conditions,
        Map<String, TagMappingConfig> tags,
        String entityExpirationTime) {}
