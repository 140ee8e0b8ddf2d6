package com.entigraph.service.core.model.config;

import java.util.List;

public record RelationshipRuleConfig(
        String name,
        List<String> eventTypes,
        List<String> origins,
        List<ConditionConfig> conditions,
        String relationshipType,
        String expires,
        EndpointConfig source,
        EndpointConfig target) {}
