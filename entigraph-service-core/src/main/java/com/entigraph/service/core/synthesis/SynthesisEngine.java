package com.entigraph.service.core.synthesis;

import com.entigraph.entity.guid.GuidCodec;
import com.entigraph.entity.model.EntityDelta;
import com.entigraph.entity.model.TagValue;
import com.entigraph.service.core.config.RuleLookup;
import com.entigraph.service.core.config.SynthesisRuleDefinition;
import com.entigraph.service.core.config.TagMappingDefinition;
import com.entigraph.service.core.resolve.ConditionEvaluator;
import com.entigraph.service.core.resolve.IdentifierResolver;
import com.entigraph.service.core.telemetry.EngineTelemetry;
import com.entigraph.telemetry.model.TelemetryEvent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a telemetry event into an entity delta using the first matching synthesis rule for its
 * event type. Pure with respect to the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SynthesisEngine {

    private final RuleLookup rules;
    private final IdentifierResolver resolver;
    private final ConditionEvaluator conditions;
    private final EngineTelemetry telemetry;

    public SynthesisResult synthesize(TelemetryEvent event) {
        SynthesisResult result = evaluate(event);
        if (result.isMatch()) {
            telemetry.entitySynthesized(result.ruleId());
        } else {
            telemetry.noMatch(result.reason().name());
            if (log.isDebugEnabled()) {
                log.debug(
                        "No entity for eventType={} reason={} rule={} {}",
                        event == null ? null : event.getEventType(),
                        result.reason(),
                        result.ruleId(),
                        result.detail() == null ? "" : result.detail());
            }
        }
        return result;
    }

    private SynthesisResult evaluate(TelemetryEvent event) {
        if (event == null || event.getEventType() == null || event.getEventType().isBlank()) {
            return SynthesisResult.noMatch(NoMatchReason.MISSING_EVENT_TYPE, null, null);
        }
        List<SynthesisRuleDefinition> candidates = rules.synthesisRules(event.getEventType());
        if (candidates.isEmpty()) {
            return SynthesisResult.noMatch(NoMatchReason.NO_RULES, null, null);
        }
        SynthesisRuleDefinition rule = null;
        try {
            for (SynthesisRuleDefinition candidate : candidates) {
                if (conditions.matchesAll(event, candidate.conditions())) {
                    rule = candidate;
                    break;
                }
            }
            if (rule == null) {
                return SynthesisResult.noMatch(NoMatchReason.CONDITIONS_NOT_MET, null, null);
            }
            return apply(rule, event);
        } catch (RuntimeException ex) {
            String ruleId = rule == null ? null : rule.id();
            log.warn("Synthesis failed for eventType={} rule={}: {}", event.getEventType(), ruleId, ex.toString());
            return SynthesisResult.noMatch(NoMatchReason.EVALUATION_ERROR, ruleId, ex.getMessage());
        }
    }

    private SynthesisResult apply(SynthesisRuleDefinition rule, TelemetryEvent event) {
        Optional<String> identifier = resolver.resolve(event, rule.identifier());
        if (identifier.isEmpty()) {
            return SynthesisResult.noMatch(
                    NoMatchReason.IDENTIFIER_UNRESOLVED, rule.id(), "needs " + rule.identifier().attributes());
        }
        OptionalLong account = resolver.resolveAccount(event, rule.account());
        if (account.isEmpty()) {
            return SynthesisResult.noMatch(
                    NoMatchReason.ACCOUNT_UNRESOLVED, rule.id(), "account attribute " + rule.account().attribute());
        }
        String guid = GuidCodec.encode(account.getAsLong(), rule.domain(), rule.type(), identifier.get());
        String name = rule.entityName() == null
                ? identifier.get()
                : resolver.resolve(event, rule.entityName()).orElse(identifier.get());

        Map<String, TagValue> tags = new LinkedHashMap<>();
        for (TagMappingDefinition mapping : rule.tags()) {
            resolver.resolveFirst(event, mapping.attributeChain())
                    .ifPresent(value ->
                            tags.put(mapping.targetTag(), TagValue.of(value, event.getObservedAt(), mapping.ttl())));
        }
        EntityDelta delta = new EntityDelta(
                guid, rule.domain(), rule.type(), name, tags, event.getObservedAt(), rule.entityExpiration());
        return SynthesisResult.matched(delta, rule.id());
    }
}
