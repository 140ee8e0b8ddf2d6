package com.entigraph.service.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Materialized synthesis rule.
 *
 * @param id {@code ruleSet/name}, used in logs and counters
 * @param eventTypes lower-cased discriminator values this rule applies to
 * @param entityName optional name expression; {@code null} means "use the identifier"
 */
public record SynthesisRuleDefinition(
        String id,
        String ruleSet,
        Set<String> eventTypes,
        String domain,
        String type,
        IdentifierExpression identifier,
        IdentifierExpression entityName,
        AccountSource account,
        List<ConditionDefinition> conditions,
        List<TagMappingDefinition> tags,
        Duration entityExpiration) {}
