package com.entigraph.controller.rest;

import com.entigraph.service.core.config.RelationshipRuleDefinition;
import com.entigraph.service.core.config.RuleIngestService;
import com.entigraph.service.core.config.RuleIngestService.RuleSetSummary;
import com.entigraph.service.core.config.RuleLookup;
import com.entigraph.service.core.config.RuleSetDefinition;
import com.entigraph.service.core.config.RuleSnapshot;
import com.entigraph.service.core.config.SynthesisRuleDefinition;
import com.entigraph.service.core.config.init.RuleInitCoordinator;
import com.entigraph.service.core.config.init.RuleInitCoordinator.ReloadResult;
import com.entigraph.service.core.model.config.RuleSetConfig;
import java.time.Instant;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Inspects and replaces the active rule snapshot. */
@RestController
@RequestMapping("/api/admin/rules")
public class RuleAdminController {

    private final RuleLookup rules;
    private final RuleInitCoordinator coordinator;
    private final RuleIngestService ingest;

    public RuleAdminController(RuleLookup rules, RuleInitCoordinator coordinator, RuleIngestService ingest) {
        this.rules = rules;
        this.coordinator = coordinator;
        this.ingest = ingest;
    }

    @GetMapping
    public RulesView describe() {
        RuleSnapshot snapshot = rules.snapshot();
        List<RuleSetView> ruleSets = snapshot.ruleSets().stream().map(RuleSetView::of).toList();
        return new RulesView(snapshot.version(), snapshot.fingerprint(), snapshot.loadedAt(), ruleSets);
    }

    @PostMapping("/reload")
    public ReloadResult reload() {
        return coordinator.reload();
    }

    @PostMapping
    public RuleSetSummary apply(@RequestBody RuleSetConfig ruleSet) {
        return ingest.applyRuleSet(ruleSet);
    }

    public record RulesView(long version, String fingerprint, Instant loadedAt, List<RuleSetView> ruleSets) {}

    public record RuleSetView(
            String name, String provider, List<String> synthesisRules, List<String> relationshipRules) {

        static RuleSetView of(RuleSetDefinition def) {
            return new RuleSetView(
                    def.name(),
                    def.provider(),
                    def.synthesisRules().stream().map(SynthesisRuleDefinition::id).toList(),
                    def.relationshipRules().stream().map(RelationshipRuleDefinition::id).toList());
        }
    }
}
