package com.entigraph.service.core.model.config;

import java.util.List;
import java.util.Map;

/**
 * Declarative rule set as read from a YAML/JSON rule file. One rule set usually covers one
 * provider flavour (self-managed, AWS MSK, Confluent Cloud) of the same entity shapes.
 *
 * @param eventTypes default event types for rules that do not declare their own
 * @param aliases named fragment lists that identifier fragments can reference with {@code alias}
 */
public record RuleSetConfig(
        String ruleSet,
        String provider,
        String accountAttribute,
        List<String> eventTypes,
        Map<String, List<FragmentConfig>> aliases,
        List<SynthesisRuleConfig> synthesis,
        List<RelationshipRuleConfig> relationships) {

    public static RuleSetConfig of(String ruleSet, List<SynthesisRuleConfig> synthesis) {
        return new RuleSetConfig(ruleSet, null, null, List.of(), Map.of(), synthesis, List.of());
    }

    public static RuleSetConfig of(
            String ruleSet, List<SynthesisRuleConfig> synthesis, List<RelationshipRuleConfig> relationships) {
        return new RuleSetConfig(ruleSet, null, null, List.of(), Map.of(), synthesis, relationships);
    }
}
