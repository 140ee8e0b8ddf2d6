package com.entigraph.service.core.config;

import com.entigraph.service.core.model.config.RuleSetConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies a single rule set to the in-memory registry, replacing any rule set with the same name.
 * The whole resulting snapshot is re-materialized, so an invalid update leaves the active rules untouched.
 */
@Slf4j
@Service
public class RuleIngestService {

    private final RuleRegistry registry;
    private final RuleMaterializer materializer;
    private final Clock clock;

    public RuleIngestService(RuleRegistry registry, ObjectMapper mapper, EngineProperties properties, Clock clock) {
        this.registry = registry;
        this.materializer = new RuleMaterializer(
                mapper,
                properties.getSynthesis().getDefaultEntityExpiration(),
                properties.getSynthesis().getAccountAttribute());
        this.clock = clock;
    }

    public RuleSetSummary applyRuleSet(RuleSetConfig request) {
        if (request == null || request.ruleSet() == null || request.ruleSet().isBlank()) {
            throw new InvalidRuleDefinitionException(null, null, "ruleSet name must be provided");
        }
        String name = request.ruleSet().trim();
        RuleSnapshot next = registry.update(current -> {
            List<RuleSetConfig> sources = new ArrayList<>();
            boolean replaced = false;
            for (RuleSetConfig existing : current.sources()) {
                if (existing.ruleSet() != null && existing.ruleSet().trim().equals(name)) {
                    sources.add(request);
                    replaced = true;
                } else {
                    sources.add(existing);
                }
            }
            if (!replaced) {
                sources.add(request);
            }
            return materializer.materialize(sources, current.version() + 1, clock.instant());
        });

        RuleSetDefinition applied = next.ruleSets().stream()
                .filter(r -> r.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Rule set " + name + " missing after apply"));
        log.info(
                "RuleIngest: applied rule set={} synthesisRules={} relationshipRules={} version={}",
                name,
                applied.synthesisRules().size(),
                applied.relationshipRules().size(),
                next.version());
        return new RuleSetSummary(
                name, applied.synthesisRules().size(), applied.relationshipRules().size(), next.version());
    }

    public record RuleSetSummary(String ruleSet, int synthesisRules, int relationshipRules, long version) {}
}
