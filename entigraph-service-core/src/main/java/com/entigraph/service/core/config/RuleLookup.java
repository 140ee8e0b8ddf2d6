package com.entigraph.service.core.config;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/**
 * Convenience reader API over the active snapshot for callers that need the rules of one event type.
 */
@Service
public class RuleLookup {
    private final RuleRegistry registry;

    public RuleLookup(RuleRegistry registry) {
        this.registry = registry;
    }

    public List<SynthesisRuleDefinition> synthesisRules(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            return List.of();
        }
        return registry.current().synthesisByEventType().getOrDefault(normalize(eventType), List.of());
    }

    public List<RelationshipRuleDefinition> relationshipRules(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            return List.of();
        }
        return registry.current().relationshipsByEventType().getOrDefault(normalize(eventType), List.of());
    }

    public RuleSnapshot snapshot() {
        return registry.current();
    }

    static String normalize(String eventType) {
        return eventType.trim().toLowerCase(Locale.ROOT);
    }
}
