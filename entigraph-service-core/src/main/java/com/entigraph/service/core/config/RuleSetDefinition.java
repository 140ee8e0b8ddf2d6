package com.entigraph.service.core.config;

import java.util.List;

public record RuleSetDefinition(
        String name,
        String provider,
        List<SynthesisRuleDefinition> synthesisRules,
        List<RelationshipRuleDefinition> relationshipRules) {}
