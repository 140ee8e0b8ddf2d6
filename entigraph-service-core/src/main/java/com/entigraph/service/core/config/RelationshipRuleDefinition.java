package com.entigraph.service.core.config;

import com.entigraph.entity.model.RelationshipType;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Materialized relationship rule.
 *
 * @param origins lower-cased origin values; empty means any origin
 */
public record RelationshipRuleDefinition(
        String id,
        String ruleSet,
        Set<String> eventTypes,
        Set<String> origins,
        List<ConditionDefinition> conditions,
        RelationshipType type,
        Duration ttl,
        EndpointDefinition source,
        EndpointDefinition target) {}
