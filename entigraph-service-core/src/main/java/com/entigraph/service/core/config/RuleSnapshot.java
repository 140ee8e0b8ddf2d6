package com.entigraph.service.core.config;

import com.entigraph.service.core.model.config.RuleSetConfig;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, fully-materialized view of all rule sets, indexed by lower-cased event type.
 * Index lists keep rule-set load order followed by declaration order, which is the priority order.
 */
public record RuleSnapshot(
        List<RuleSetDefinition> ruleSets,
        Map<String, List<SynthesisRuleDefinition>> synthesisByEventType,
        Map<String, List<RelationshipRuleDefinition>> relationshipsByEventType,
        List<RuleSetConfig> sources,
        String fingerprint,
        long version,
        Instant loadedAt) {

    public static RuleSnapshot empty() {
        return new RuleSnapshot(List.of(), Map.of(), Map.of(), List.of(), "", 0L, Instant.EPOCH);
    }

    public static RuleSnapshot of(
            List<RuleSetDefinition> ruleSets,
            List<RuleSetConfig> sources,
            String fingerprint,
            long version,
            Instant loadedAt) {
        Map<String, List<SynthesisRuleDefinition>> synthesis = new LinkedHashMap<>();
        Map<String, List<RelationshipRuleDefinition>> relationships = new LinkedHashMap<>();
        for (RuleSetDefinition ruleSet : ruleSets) {
            for (SynthesisRuleDefinition rule : ruleSet.synthesisRules()) {
                for (String eventType : rule.eventTypes()) {
                    synthesis.computeIfAbsent(eventType, k -> new ArrayList<>()).add(rule);
                }
            }
            for (RelationshipRuleDefinition rule : ruleSet.relationshipRules()) {
                for (String eventType : rule.eventTypes()) {
                    relationships.computeIfAbsent(eventType, k -> new ArrayList<>()).add(rule);
                }
            }
        }
        return new RuleSnapshot(
                List.copyOf(ruleSets),
                freeze(synthesis),
                freeze(relationships),
                List.copyOf(sources),
                fingerprint,
                version,
                loadedAt);
    }

    public int synthesisRuleCount() {
        return ruleSets.stream().mapToInt(r -> r.synthesisRules().size()).sum();
    }

    public int relationshipRuleCount() {
        return ruleSets.stream().mapToInt(r -> r.relationshipRules().size()).sum();
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> index) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        index.forEach((key, rules) -> copy.put(key, List.copyOf(rules)));
        return Map.copyOf(copy);
    }
}
