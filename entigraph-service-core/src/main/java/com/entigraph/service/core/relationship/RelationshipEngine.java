package com.entigraph.service.core.relationship;

import com.entigraph.entity.model.RelationshipDelta;
import com.entigraph.service.core.config.EngineProperties;
import com.entigraph.service.core.config.RelationshipRuleDefinition;
import com.entigraph.service.core.config.RuleLookup;
import com.entigraph.service.core.relationship.EndpointResolution.Failure;
import com.entigraph.service.core.resolve.ConditionEvaluator;
import com.entigraph.service.core.support.AttributeValues;
import com.entigraph.service.core.telemetry.EngineTelemetry;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Discovers relationships carried by an event. Every applicable rule is evaluated independently;
 * a rule whose endpoints do not both resolve to exactly one GUID is skipped.
 */
@Slf4j
@Service
public class RelationshipEngine {

    private final RuleLookup rules;
    private final ConditionEvaluator conditions;
    private final EndpointResolver endpoints;
    private final EngineTelemetry telemetry;
    private final String originAttribute;

    public RelationshipEngine(
            RuleLookup rules,
            ConditionEvaluator conditions,
            EndpointResolver endpoints,
            EngineTelemetry telemetry,
            EngineProperties properties) {
        this.rules = rules;
        this.conditions = conditions;
        this.endpoints = endpoints;
        this.telemetry = telemetry;
        this.originAttribute = properties.getRelationships().getOriginAttribute();
    }

    public List<RelationshipDelta> discover(TelemetryEvent event) {
        if (event == null || event.getEventType() == null || event.getEventType().isBlank()) {
            return List.of();
        }
        List<RelationshipRuleDefinition> candidates = rules.relationshipRules(event.getEventType());
        if (candidates.isEmpty()) {
            return List.of();
        }
        Optional<String> origin = AttributeValues.stringValue(event, originAttribute)
                .map(v -> v.trim().toLowerCase(Locale.ROOT));

        List<RelationshipDelta> out = new ArrayList<>();
        for (RelationshipRuleDefinition rule : candidates) {
            if (!rule.origins().isEmpty() && (origin.isEmpty() || !rule.origins().contains(origin.get()))) {
                continue;
            }
            try {
                evaluate(rule, event).ifPresent(out::add);
            } catch (RuntimeException ex) {
                log.warn("Relationship rule {} failed for eventType={}: {}", rule.id(), event.getEventType(), ex.toString());
                telemetry.endpointUnresolved(rule.id(), "EVALUATION_ERROR");
            }
        }
        return out;
    }

    private Optional<RelationshipDelta> evaluate(RelationshipRuleDefinition rule, TelemetryEvent event) {
        if (!conditions.matchesAll(event, rule.conditions())) {
            return Optional.empty();
        }
        EndpointResolution source = endpoints.resolve(event, rule.source());
        if (!source.isResolved()) {
            return skip(rule, "source", source);
        }
        EndpointResolution target = endpoints.resolve(event, rule.target());
        if (!target.isResolved()) {
            return skip(rule, "target", target);
        }
        if (source.guid().equals(target.guid())) {
            log.debug("Relationship rule {} resolved both endpoints to {}; skipped", rule.id(), source.guid());
            return Optional.empty();
        }
        telemetry.relationshipDiscovered(rule.id());
        return Optional.of(new RelationshipDelta(
                rule.type(), source.guid(), target.guid(), event.getObservedAt(), rule.ttl()));
    }

    private Optional<RelationshipDelta> skip(RelationshipRuleDefinition rule, String side, EndpointResolution failed) {
        Failure failure = failed.failure();
        if (failure == Failure.LOOKUP_NONE || failure == Failure.LOOKUP_AMBIGUOUS) {
            telemetry.lookupFailed(rule.id(), failure.name());
        } else {
            telemetry.endpointUnresolved(rule.id(), failure.name());
        }
        if (failure == Failure.STORE_UNAVAILABLE) {
            log.warn("Relationship rule {} {} lookup failed: store unavailable ({})", rule.id(), side, failed.detail());
        } else if (log.isDebugEnabled()) {
            log.debug("Relationship rule {} skipped: {} {} ({})", rule.id(), side, failure, failed.detail());
        }
        return Optional.empty();
    }
}
